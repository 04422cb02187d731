package me.toymail.mailbox.notify;

/**
 * What changed in a mailbox.
 */
public enum MailboxNotification {
    CLOSED,   // the mailbox was closed
    INVALID,  // the email list changed, views and indices were rebuilt
    RESORT,   // the email list needs resorting
    UPDATE,   // internal tables need updating
    UNTAG     // clear any pointer to the last tagged email
}
