package me.toymail.mailbox.store;

/**
 * The rights mask, or the read-only state of the mailbox, forbids the operation.
 * Nothing was changed.
 */
public class PermissionDeniedException extends MailboxException {
    private final AclRight missingRight;

    public PermissionDeniedException(String mailboxPath, String operation, AclRight missingRight) {
        super(buildMessage(mailboxPath, operation, missingRight), mailboxPath, operation, null);
        this.missingRight = missingRight;
    }

    private static String buildMessage(String mailboxPath, String operation, AclRight missingRight) {
        if (missingRight == null) {
            return "Mailbox is read-only: " + operation + " refused on " + mailboxPath;
        }
        return "Not allowed to " + missingRight.description() + ": " + operation + " refused on " + mailboxPath;
    }

    /**
     * @return the right that was missing, or null when the mailbox is read-only
     */
    public AclRight getMissingRight() {
        return missingRight;
    }
}
