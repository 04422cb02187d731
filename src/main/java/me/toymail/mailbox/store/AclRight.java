package me.toymail.mailbox.store;

/**
 * A single access right on a mailbox. Each right owns one bit of an {@link AclRights} mask.
 */
public enum AclRight {
    ADMIN(1 << 0, "administer the account"),
    CREATE(1 << 1, "create a mailbox"),
    DELETE(1 << 2, "delete a message"),
    DELMX(1 << 3, "delete a mailbox"),
    EXPUNGE(1 << 4, "expunge messages"),
    INSERT(1 << 5, "add or copy into the mailbox"),
    LOOKUP(1 << 6, "look up the mailbox"),
    POST(1 << 7, "post to the mailbox"),
    READ(1 << 8, "read the mailbox"),
    SEEN(1 << 9, "change the seen status of a message"),
    WRITE(1 << 10, "write to a message");

    private final int bit;
    private final String description;

    AclRight(int bit, String description) {
        this.bit = bit;
        this.description = description;
    }

    public int bit() {
        return bit;
    }

    public String description() {
        return description;
    }
}
