package me.toymail.mailbox.backend.imap;

import jakarta.mail.MessagingException;
import jakarta.mail.Store;

/**
 * Opens a connected mail store for a remote folder location.
 */
@FunctionalInterface
public interface StoreConnector {
    Store connect(ImapUrl url) throws MessagingException;
}
