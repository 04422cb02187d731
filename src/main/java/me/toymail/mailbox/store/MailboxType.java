package me.toymail.mailbox.store;

/**
 * Physical format of a mailbox. Each bindable type has at most one backend.
 */
public enum MailboxType {
    ANY,        // matches any type in queries
    ERROR,      // the path could not be examined
    UNKNOWN,    // not recognised
    MBOX,
    MMDF,
    MH,
    MAILDIR,
    NNTP,
    IMAP,
    NOTMUCH,
    POP,
    COMPRESSED;

    /**
     * @return true for real formats a mailbox can be bound to
     */
    public boolean isBindable() {
        return this != ANY && this != ERROR && this != UNKNOWN;
    }
}
