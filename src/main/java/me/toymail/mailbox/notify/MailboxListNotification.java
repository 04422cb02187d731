package me.toymail.mailbox.notify;

/**
 * Changes to the set of known mailboxes.
 */
public enum MailboxListNotification {
    ADD,     // a mailbox was registered
    REMOVE   // a mailbox is about to be disposed
}
