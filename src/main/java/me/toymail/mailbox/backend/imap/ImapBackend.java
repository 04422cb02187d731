package me.toymail.mailbox.backend.imap;

import jakarta.mail.FetchProfile;
import jakarta.mail.Flags;
import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Store;
import jakarta.mail.UIDFolder;
import jakarta.mail.internet.MimeUtility;
import me.toymail.mailbox.backend.CheckResult;
import me.toymail.mailbox.backend.MailboxBackend;
import me.toymail.mailbox.backend.MessageHandle;
import me.toymail.mailbox.store.AclRight;
import me.toymail.mailbox.store.Email;
import me.toymail.mailbox.store.EmailFlag;
import me.toymail.mailbox.store.Mailbox;
import me.toymail.mailbox.store.MailboxType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UnsupportedEncodingException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Remote folders over IMAP. The backend key of an email is its UID.
 */
public final class ImapBackend implements MailboxBackend {
    private static final Logger log = LoggerFactory.getLogger(ImapBackend.class);

    private static final AclRight[] WRITE_RIGHTS = {
            AclRight.WRITE, AclRight.SEEN, AclRight.DELETE, AclRight.EXPUNGE, AclRight.INSERT, AclRight.CREATE
    };

    private final StoreConnector connector;

    public ImapBackend(StoreConnector connector) {
        this.connector = connector;
    }

    @Override
    public MailboxType type() {
        return MailboxType.IMAP;
    }

    @Override
    public MailboxType probe(String path) {
        return ImapUrl.matches(path) ? MailboxType.IMAP : MailboxType.UNKNOWN;
    }

    @Override
    public void open(Mailbox mailbox) throws MessagingException {
        ImapUrl url = ImapUrl.parse(mailbox.getPath());
        Store store = connector.connect(url);
        ImapData data = new ImapData(store);
        mailbox.setData(data);

        Folder folder = store.getFolder(url.folder());
        if (!(folder instanceof UIDFolder)) {
            throw new MessagingException("Folder does not support UIDFolder; cannot use stable UIDs.");
        }
        boolean readOnly = mailbox.flags().isReadOnly();
        folder.open(readOnly ? Folder.READ_ONLY : Folder.READ_WRITE);
        data.folder(folder);
        if (folder.getMode() == Folder.READ_ONLY) {
            mailbox.flags().setReadOnly(true);
            mailbox.setRights(mailbox.getRights().revoke(WRITE_RIGHTS));
        }

        int total = folder.getMessageCount();
        if (total > 0) {
            fetchInto(mailbox, data, folder.getMessages(1, total));
        }
        log.info("Opened {} with {} messages", url.folder(), total);
    }

    /**
     * Reconciles the mailbox with the folder by UID. Counts alone cannot tell
     * "one expunged, one arrived" from "nothing happened".
     */
    @Override
    public CheckResult check(Mailbox mailbox) throws MessagingException {
        ImapData data = requireData(mailbox);
        Folder folder = data.folder();
        UIDFolder uids = (UIDFolder) folder;
        int total = folder.getMessageCount();
        Message[] msgs = total > 0 ? folder.getMessages(1, total) : new Message[0];
        FetchProfile fp = new FetchProfile();
        fp.add(UIDFolder.FetchProfileItem.UID);
        fp.add(FetchProfile.Item.FLAGS);
        folder.fetch(msgs, fp);

        Map<Long, Message> present = new HashMap<>();
        List<Message> arrived = new ArrayList<>();
        for (Message m : msgs) {
            long uid = uids.getUID(m);
            present.put(uid, m);
            if (!data.byUid().containsKey(uid)) {
                arrived.add(m);
            }
        }

        int known = data.byUid().size();
        data.byUid().keySet().retainAll(present.keySet());
        int gone = known - data.byUid().size();
        data.byUid().replaceAll((uid, old) -> present.get(uid));
        if (gone > 0) {
            mailbox.purge(e -> !present.containsKey((Long) e.getBackendKey()));
            log.info("{} messages expunged elsewhere from {}", gone, folder.getFullName());
        }

        boolean flagsChanged = refreshFlags(mailbox, data);
        if (!arrived.isEmpty()) {
            fetchInto(mailbox, data, arrived.toArray(new Message[0]));
            log.debug("{} new messages in {}", arrived.size(), folder.getFullName());
        }

        if (gone > 0) {
            return CheckResult.REOPENED;
        }
        if (!arrived.isEmpty()) {
            return CheckResult.NEW_MAIL;
        }
        return flagsChanged ? CheckResult.FLAGS : CheckResult.NO_CHANGE;
    }

    private static boolean refreshFlags(Mailbox mailbox, ImapData data) throws MessagingException {
        boolean changed = false;
        for (Email e : mailbox.emails()) {
            Message m = data.byUid().get((Long) e.getBackendKey());
            if (m == null) continue;
            changed |= mailbox.refreshFlag(e, EmailFlag.SEEN, m.isSet(Flags.Flag.SEEN));
            changed |= mailbox.refreshFlag(e, EmailFlag.FLAGGED, m.isSet(Flags.Flag.FLAGGED));
            changed |= mailbox.refreshFlag(e, EmailFlag.REPLIED, m.isSet(Flags.Flag.ANSWERED));
            changed |= mailbox.refreshFlag(e, EmailFlag.DELETED, m.isSet(Flags.Flag.DELETED));
        }
        return changed;
    }

    /**
     * Pushes local flags to the server. With {@code expunge} deleted messages
     * are marked and expunged; without it their DELETED flag is left as the
     * server has it.
     */
    @Override
    public void sync(Mailbox mailbox, boolean expunge) throws MessagingException {
        ImapData data = requireData(mailbox);
        int deleted = 0;
        for (Email e : mailbox.emails()) {
            Message m = data.byUid().get((Long) e.getBackendKey());
            if (m == null) {
                log.debug("No server message for UID {}", e.getBackendKey());
                continue;
            }
            push(m, Flags.Flag.SEEN, e.has(EmailFlag.SEEN));
            push(m, Flags.Flag.FLAGGED, e.has(EmailFlag.FLAGGED));
            push(m, Flags.Flag.ANSWERED, e.has(EmailFlag.REPLIED));
            if (expunge) {
                push(m, Flags.Flag.DELETED, e.isDeleted());
                if (e.isDeleted()) {
                    data.byUid().remove((Long) e.getBackendKey());
                    deleted++;
                }
            }
        }
        if (deleted > 0) {
            data.folder().expunge();
        }
        log.debug("IMAP sync of {}: {} expunged", mailbox.getPath(), deleted);
    }

    private static void push(Message m, Flags.Flag flag, boolean on) throws MessagingException {
        if (m.isSet(flag) != on) {
            m.setFlag(flag, on);
        }
    }

    @Override
    public void close(Mailbox mailbox) throws MessagingException {
        ImapData data = mailbox.getData(ImapData.class);
        if (data == null) return;
        Folder folder = data.folder();
        if (folder != null && folder.isOpen()) folder.close(false);
        if (data.store().isConnected()) data.store().close();
    }

    @Override
    public MessageHandle openMessage(Mailbox mailbox, Email email) throws MessagingException, IOException {
        ImapData data = requireData(mailbox);
        Message m = data.byUid().get((Long) email.getBackendKey());
        if (m == null) {
            throw new MessagingException("No message found for UID=" + email.getBackendKey());
        }
        ByteArrayOutputStream raw = new ByteArrayOutputStream();
        m.writeTo(raw);
        return MessageHandle.forReading(email, new ByteArrayInputStream(raw.toByteArray()));
    }

    private static ImapData requireData(Mailbox mailbox) throws MessagingException {
        ImapData data = mailbox.getData(ImapData.class);
        if (data == null || data.folder() == null) {
            throw new MessagingException("IMAP folder " + mailbox.getPath() + " is not open");
        }
        return data;
    }

    private void fetchInto(Mailbox mailbox, ImapData data, Message[] msgs) throws MessagingException {
        Folder folder = data.folder();
        FetchProfile fp = new FetchProfile();
        fp.add(FetchProfile.Item.ENVELOPE);
        fp.add(FetchProfile.Item.FLAGS);
        fp.add(FetchProfile.Item.SIZE);
        fp.add(UIDFolder.FetchProfileItem.UID);
        fp.add("X-Label");
        folder.fetch(msgs, fp);

        UIDFolder uids = (UIDFolder) folder;
        for (Message m : msgs) {
            long uid = uids.getUID(m);
            mailbox.append(toEmail(m, uid));
            data.byUid().put(uid, m);
        }
    }

    static Email toEmail(Message m, long uid) throws MessagingException {
        Email.Builder b = Email.builder()
                .messageId(first(m.getHeader("Message-ID")))
                .subject(m.getSubject())
                .label(decode(first(m.getHeader("X-Label"))))
                .size(Math.max(0, m.getSize()))
                .received(toInstant(m.getReceivedDate() != null ? m.getReceivedDate() : m.getSentDate()))
                .backendKey(uid);
        if (m.isSet(Flags.Flag.SEEN)) b.flag(EmailFlag.SEEN);
        if (m.isSet(Flags.Flag.FLAGGED)) b.flag(EmailFlag.FLAGGED);
        if (m.isSet(Flags.Flag.ANSWERED)) b.flag(EmailFlag.REPLIED);
        if (m.isSet(Flags.Flag.DELETED)) b.flag(EmailFlag.DELETED);
        if (m.isSet(Flags.Flag.RECENT)) b.flag(EmailFlag.NEW);
        return b.build();
    }

    private static String first(String[] values) {
        return values != null && values.length > 0 ? values[0] : null;
    }

    private static Instant toInstant(Date date) {
        return date != null ? date.toInstant() : Instant.EPOCH;
    }

    private static String decode(String raw) {
        if (raw == null) return null;
        try {
            return MimeUtility.decodeText(raw);
        } catch (UnsupportedEncodingException e) {
            log.debug("Cannot decode header '{}': {}", raw, e.getMessage());
            return raw;
        }
    }
}
