package me.toymail.mailbox.backend.maildir;

import me.toymail.mailbox.store.EmailFlag;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A maildir message filename: {@code <base>[:2,<info>]}.
 *
 * <p>The base is opaque and never changes once delivered. The info part holds
 * one letter per flag in ASCII order: D (draft), F (flagged), R (replied),
 * S (seen), T (trashed). Letters without an email flag (D and keywords) are
 * carried through unchanged.
 */
public final class MaildirFilename {
    private static final String INFO_SEPARATOR = ":2,";
    private static final String PID = String.valueOf(ProcessHandle.current().pid());
    private static final AtomicLong COUNTER = new AtomicLong(0);

    private final String base;
    private final Set<EmailFlag> flags;
    private final String otherLetters;

    private MaildirFilename(String base, Set<EmailFlag> flags, String otherLetters) {
        this.base = base;
        this.flags = flags.isEmpty() ? EnumSet.noneOf(EmailFlag.class) : EnumSet.copyOf(flags);
        this.otherLetters = otherLetters;
    }

    /**
     * @throws IllegalArgumentException for an empty name or one starting with a dot
     */
    public static MaildirFilename parse(String filename) {
        if (filename == null || filename.isEmpty() || filename.charAt(0) == '.') {
            throw new IllegalArgumentException("Not a maildir message filename: " + filename);
        }
        int info = filename.indexOf(INFO_SEPARATOR);
        if (info < 0) {
            return new MaildirFilename(filename, EnumSet.noneOf(EmailFlag.class), "");
        }
        String base = filename.substring(0, info);
        if (base.isEmpty()) {
            throw new IllegalArgumentException("Not a maildir message filename: " + filename);
        }
        Set<EmailFlag> flags = EnumSet.noneOf(EmailFlag.class);
        StringBuilder other = new StringBuilder();
        for (char c : filename.substring(info + INFO_SEPARATOR.length()).toCharArray()) {
            switch (c) {
                case 'F': flags.add(EmailFlag.FLAGGED); break;
                case 'R': flags.add(EmailFlag.REPLIED); break;
                case 'S': flags.add(EmailFlag.SEEN); break;
                case 'T': flags.add(EmailFlag.DELETED); break;
                default:
                    if (other.indexOf(String.valueOf(c)) < 0) other.append(c);
                    break;
            }
        }
        return new MaildirFilename(base, flags, other.toString());
    }

    /**
     * A fresh unique base for a message being delivered by this process.
     */
    public static MaildirFilename generate() {
        String base = System.currentTimeMillis() + "." + PID + "_" + COUNTER.incrementAndGet() + ".toymail";
        return new MaildirFilename(base, EnumSet.noneOf(EmailFlag.class), "");
    }

    public String base() {
        return base;
    }

    /**
     * @return the flags this name records; NEW and TAGGED are never part of it
     */
    public Set<EmailFlag> flags() {
        return flags.isEmpty() ? EnumSet.noneOf(EmailFlag.class) : EnumSet.copyOf(flags);
    }

    /**
     * Same base with the given flags. Flags maildir cannot store are ignored.
     */
    public MaildirFilename withFlags(Set<EmailFlag> newFlags) {
        Set<EmailFlag> kept = EnumSet.noneOf(EmailFlag.class);
        for (EmailFlag f : newFlags) {
            if (f != EmailFlag.NEW && f != EmailFlag.TAGGED) kept.add(f);
        }
        return new MaildirFilename(base, kept, otherLetters);
    }

    /**
     * Name for a file in cur/, always with an info part.
     */
    @Override
    public String toString() {
        StringBuilder letters = new StringBuilder(otherLetters);
        if (flags.contains(EmailFlag.FLAGGED)) letters.append('F');
        if (flags.contains(EmailFlag.REPLIED)) letters.append('R');
        if (flags.contains(EmailFlag.SEEN)) letters.append('S');
        if (flags.contains(EmailFlag.DELETED)) letters.append('T');
        char[] sorted = letters.toString().toCharArray();
        Arrays.sort(sorted);
        return base + INFO_SEPARATOR + new String(sorted);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MaildirFilename)) return false;
        MaildirFilename that = (MaildirFilename) o;
        return toString().equals(that.toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }
}
