package me.toymail.mailbox.store;

/**
 * Base class for failures reported by mailbox operations.
 */
public class MailboxException extends Exception {
    private final String mailboxPath;
    private final String operation;

    public MailboxException(String message) {
        this(message, null, null, null);
    }

    public MailboxException(String message, String mailboxPath, String operation, Throwable cause) {
        super(message, cause);
        this.mailboxPath = mailboxPath;
        this.operation = operation;
    }

    /**
     * @return the path of the mailbox involved, or null if not tied to one
     */
    public String getMailboxPath() {
        return mailboxPath;
    }

    /**
     * @return the name of the failed operation, or null
     */
    public String getOperation() {
        return operation;
    }
}
