package me.toymail.mailbox.backend;

/**
 * Backend-private state attached to a mailbox. The mailbox never looks inside;
 * it only hands the data back to the backend and calls {@link #free()} exactly
 * once when it lets go of it.
 */
public interface MailboxData {

    /**
     * Releases whatever the backend allocated. Must not throw.
     */
    void free();
}
