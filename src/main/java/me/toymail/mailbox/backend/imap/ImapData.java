package me.toymail.mailbox.backend.imap;

import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Store;
import me.toymail.mailbox.backend.MailboxData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Per-mailbox state of the IMAP backend: the connection, the open folder and
 * the messages by UID.
 */
final class ImapData implements MailboxData {
    private static final Logger log = LoggerFactory.getLogger(ImapData.class);

    private final Store store;
    private Folder folder;
    private final Map<Long, Message> byUid = new HashMap<>();

    ImapData(Store store) {
        this.store = store;
    }

    Store store() {
        return store;
    }

    Folder folder() {
        return folder;
    }

    void folder(Folder folder) {
        this.folder = folder;
    }

    Map<Long, Message> byUid() {
        return byUid;
    }

    /**
     * Closes whatever is still open, without expunging.
     */
    @Override
    public void free() {
        byUid.clear();
        try {
            if (folder != null && folder.isOpen()) folder.close(false);
        } catch (MessagingException e) {
            log.warn("Could not close folder {}: {}", folder.getFullName(), e.getMessage());
        }
        try {
            if (store.isConnected()) store.close();
        } catch (MessagingException e) {
            log.warn("Could not close store: {}", e.getMessage());
        }
    }
}
