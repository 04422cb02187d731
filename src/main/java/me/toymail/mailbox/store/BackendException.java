package me.toymail.mailbox.store;

/**
 * Failure reported by a mailbox backend, tagged with the mailbox and the operation.
 */
public class BackendException extends MailboxException {

    public BackendException(String mailboxPath, String operation, String detail) {
        this(mailboxPath, operation, detail, null);
    }

    public BackendException(String mailboxPath, String operation, Throwable cause) {
        this(mailboxPath, operation, cause.getMessage(), cause);
    }

    public BackendException(String mailboxPath, String operation, String detail, Throwable cause) {
        super(operation + " failed on " + mailboxPath + ": " + detail, mailboxPath, operation, cause);
    }
}
