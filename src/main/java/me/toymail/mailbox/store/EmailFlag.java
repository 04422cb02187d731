package me.toymail.mailbox.store;

/**
 * Per-message state bits used by the counters and by the access checks.
 */
public enum EmailFlag {
    SEEN(AclRight.SEEN, true),
    NEW(AclRight.SEEN, false),
    DELETED(AclRight.DELETE, true),
    FLAGGED(AclRight.WRITE, true),
    REPLIED(AclRight.WRITE, false),
    TAGGED(null, false);

    private final AclRight requiredRight;
    private final boolean affectsSort;

    EmailFlag(AclRight requiredRight, boolean affectsSort) {
        this.requiredRight = requiredRight;
        this.affectsSort = affectsSort;
    }

    /**
     * @return the right needed to change this flag, or null when it is local state only
     */
    public AclRight requiredRight() {
        return requiredRight;
    }

    public boolean affectsSort() {
        return affectsSort;
    }
}
