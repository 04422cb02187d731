package me.toymail.mailbox.store;

import java.util.Comparator;

/**
 * The orders a virtual view can be sorted in. Ties are broken by the
 * mailbox using the real index, so every order is stable.
 */
public enum SortOrder {
    ORDER(Comparator.comparingInt(Email::getIndex)),
    DATE(Comparator.comparing(Email::getReceived, Comparator.nullsFirst(Comparator.naturalOrder()))),
    SUBJECT(Comparator.comparing((Email e) -> SubjectNormalizer.DEFAULT.normalize(e.getSubject()),
            String.CASE_INSENSITIVE_ORDER)),
    ID(Comparator.comparing(Email::getMessageId, Comparator.nullsLast(Comparator.naturalOrder()))),
    SIZE(Comparator.comparingLong(Email::getSize)),
    FLAGGED(Comparator.comparing((Email e) -> !e.has(EmailFlag.FLAGGED))),
    READ(Comparator.comparing((Email e) -> e.has(EmailFlag.SEEN)));

    private final Comparator<Email> comparator;

    SortOrder(Comparator<Email> comparator) {
        this.comparator = comparator;
    }

    public Comparator<Email> comparator() {
        return comparator;
    }

    public Comparator<Email> comparator(boolean reverse) {
        return reverse ? comparator.reversed() : comparator;
    }
}
