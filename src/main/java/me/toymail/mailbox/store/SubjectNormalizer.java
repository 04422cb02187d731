package me.toymail.mailbox.store;

import java.util.regex.Pattern;

/**
 * Reduces a raw subject to the key used for threading by subject.
 * Implementations must be pure functions of their input.
 */
@FunctionalInterface
public interface SubjectNormalizer {

    String normalize(String subject);

    /** Strips any run of leading Re:/Fwd:/Fw: decorations and surrounding blanks. */
    SubjectNormalizer DEFAULT = new SubjectNormalizer() {
        private final Pattern prefix = Pattern.compile("^(?i)((re|fwd?)(\\[\\d+\\])?:\\s*)+");

        @Override
        public String normalize(String subject) {
            if (subject == null) return "";
            return prefix.matcher(subject.trim()).replaceFirst("").trim();
        }
    };
}
