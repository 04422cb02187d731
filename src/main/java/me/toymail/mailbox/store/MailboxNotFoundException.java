package me.toymail.mailbox.store;

public class MailboxNotFoundException extends MailboxException {

    public MailboxNotFoundException(String message, String mailboxPath) {
        super(message, mailboxPath, null, null);
    }
}
