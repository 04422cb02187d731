package me.toymail.mailbox.backend;

import me.toymail.mailbox.store.Email;
import me.toymail.mailbox.store.Mailbox;
import me.toymail.mailbox.store.MailboxType;

/**
 * Operations one physical mailbox format provides.
 *
 * <p>A backend instance is shared by every mailbox of its type and keeps no
 * per-mailbox state of its own: whatever it needs goes into the mailbox via
 * {@link Mailbox#setData(MailboxData)}. Failures are reported by throwing; the
 * mailbox wraps them into a {@link me.toymail.mailbox.store.BackendException}
 * naming the mailbox and the operation.
 *
 * <p>Calls may block. The mailbox serializes them; backends need not.
 */
public interface MailboxBackend {

    MailboxType type();

    /**
     * Tells whether a path is a mailbox of this backend's format.
     *
     * @return {@link #type()} if it is, {@link MailboxType#UNKNOWN} otherwise
     */
    MailboxType probe(String path);

    /**
     * Opens the mailbox and appends one email per message to it.
     * On failure any data already attached is released by the mailbox.
     */
    void open(Mailbox mailbox) throws Exception;

    /**
     * Looks for changes made by someone else since open or the last check.
     */
    CheckResult check(Mailbox mailbox) throws Exception;

    /**
     * Writes flag changes back. With {@code expunge} deleted messages are also
     * removed from storage and the mailbox purges its own records afterwards;
     * without it they stay in storage as they are.
     */
    void sync(Mailbox mailbox, boolean expunge) throws Exception;

    /**
     * Closes the mailbox. Must cope with an open that failed half way,
     * i.e. with missing or partial data.
     */
    void close(Mailbox mailbox) throws Exception;

    MessageHandle openMessage(Mailbox mailbox, Email email) throws Exception;

    /**
     * Starts writing a new message into the mailbox.
     */
    default MessageHandle openNewMessage(Mailbox mailbox, Email template) throws Exception {
        throw new UnsupportedOperationException(type() + " mailboxes do not accept new messages");
    }

    /**
     * Finishes a message started with {@link #openNewMessage} and appends it.
     *
     * @return the email now in the mailbox
     */
    default Email commitMessage(Mailbox mailbox, MessageHandle handle) throws Exception {
        throw new UnsupportedOperationException(type() + " mailboxes do not accept new messages");
    }
}
