package me.toymail.mailbox.backend.maildir;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.InternetHeaders;
import jakarta.mail.internet.MimeUtility;
import me.toymail.mailbox.backend.CheckResult;
import me.toymail.mailbox.backend.MailboxBackend;
import me.toymail.mailbox.backend.MessageHandle;
import me.toymail.mailbox.store.Email;
import me.toymail.mailbox.store.EmailFlag;
import me.toymail.mailbox.store.Mailbox;
import me.toymail.mailbox.store.MailboxType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UnsupportedEncodingException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maildir directories: one file per message under {@code new/} (not yet seen by
 * a mail client) or {@code cur/}, with flags encoded in the filename.
 *
 * <p>The backend key of an email is its file path relative to the maildir,
 * e.g. {@code cur/1700000000.123_1.host:2,S}.
 */
public final class MaildirBackend implements MailboxBackend {
    private static final Logger log = LoggerFactory.getLogger(MaildirBackend.class);

    static final String NEW = "new";
    static final String CUR = "cur";
    static final String TMP = "tmp";

    private static final EmailFlag[] STORED_FLAGS = {
            EmailFlag.SEEN, EmailFlag.FLAGGED, EmailFlag.REPLIED, EmailFlag.DELETED
    };

    @Override
    public MailboxType type() {
        return MailboxType.MAILDIR;
    }

    @Override
    public MailboxType probe(String path) {
        if (path == null || path.contains("://")) {
            return MailboxType.UNKNOWN;
        }
        Path root = Paths.get(path);
        if (Files.isDirectory(root.resolve(CUR)) && Files.isDirectory(root.resolve(NEW))
                && Files.isDirectory(root.resolve(TMP))) {
            return MailboxType.MAILDIR;
        }
        return MailboxType.UNKNOWN;
    }

    /**
     * Creates an empty maildir at the path.
     */
    public static Path create(Path root) throws IOException {
        Files.createDirectories(root.resolve(CUR));
        Files.createDirectories(root.resolve(NEW));
        Files.createDirectories(root.resolve(TMP));
        return root;
    }

    @Override
    public void open(Mailbox mailbox) throws IOException {
        Path root = Paths.get(mailbox.getPath());
        if (probe(mailbox.getPath()) != MailboxType.MAILDIR) {
            throw new IOException("Not a maildir: " + root);
        }
        MaildirData data = new MaildirData(root);
        mailbox.setData(data);

        for (String key : scan(root)) {
            Email email = readEmail(root, key);
            if (email != null) {
                mailbox.append(email);
                data.byBase().put(baseOf(key), email);
            }
        }
        mailbox.setMtime(Files.getLastModifiedTime(root.resolve(CUR)).toInstant());
        log.debug("Read {} messages from maildir {}", data.byBase().size(), root);
    }

    @Override
    public CheckResult check(Mailbox mailbox) throws IOException {
        MaildirData data = requireData(mailbox);
        Path root = data.root();

        Map<String, String> onDisk = new HashMap<>();
        for (String key : scan(root)) {
            onDisk.put(baseOf(key), key);
        }

        Set<Email> vanished = new HashSet<>();
        boolean flagsChanged = false;
        for (Map.Entry<String, Email> entry : data.byBase().entrySet()) {
            Email email = entry.getValue();
            String key = onDisk.remove(entry.getKey());
            if (key == null) {
                vanished.add(email);
            } else if (!key.equals(email.getBackendKey())) {
                email.setBackendKey(key);
                flagsChanged |= refreshFlags(mailbox, email, key);
            }
        }

        boolean newMail = false;
        List<String> delivered = new ArrayList<>(onDisk.values());
        delivered.sort(null);
        for (String key : delivered) {
            Email email = readEmail(root, key);
            if (email != null) {
                mailbox.append(email);
                data.byBase().put(baseOf(key), email);
                newMail = true;
            }
        }

        if (!vanished.isEmpty()) {
            data.byBase().values().removeIf(vanished::contains);
            mailbox.purge(vanished::contains);
            log.info("{} messages vanished from {}", vanished.size(), root);
            return CheckResult.REOPENED;
        }
        if (newMail) {
            return CheckResult.NEW_MAIL;
        }
        return flagsChanged ? CheckResult.FLAGS : CheckResult.NO_CHANGE;
    }

    private static boolean refreshFlags(Mailbox mailbox, Email email, String key) {
        Set<EmailFlag> stored = MaildirFilename.parse(fileName(key)).flags();
        boolean changed = false;
        for (EmailFlag f : STORED_FLAGS) {
            changed |= mailbox.refreshFlag(email, f, stored.contains(f));
        }
        changed |= mailbox.refreshFlag(email, EmailFlag.NEW, key.startsWith(NEW + "/"));
        return changed;
    }

    /**
     * Renames files whose flags changed and, with {@code expunge}, deletes the
     * files of deleted emails. Emails that are no longer new move from new/ to
     * cur/. Without {@code expunge} the trashed letter keeps its stored state.
     */
    @Override
    public void sync(Mailbox mailbox, boolean expunge) throws IOException {
        MaildirData data = requireData(mailbox);
        Path root = data.root();
        int removed = 0;
        int renamed = 0;
        for (Email email : mailbox.emails()) {
            String key = (String) email.getBackendKey();
            if (expunge && email.isDeleted()) {
                Files.deleteIfExists(root.resolve(key));
                data.byBase().remove(baseOf(key));
                removed++;
                continue;
            }
            String target = targetKey(email, key, expunge);
            if (!target.equals(key)) {
                Files.move(root.resolve(key), root.resolve(target));
                email.setBackendKey(target);
                renamed++;
            }
        }
        log.debug("Maildir sync of {}: {} removed, {} renamed", root, removed, renamed);
    }

    static String targetKey(Email email, String key, boolean expunge) {
        if (email.has(EmailFlag.NEW) && key.startsWith(NEW + "/")) {
            return key;
        }
        MaildirFilename name = MaildirFilename.parse(fileName(key));
        Set<EmailFlag> flags = EnumSet.noneOf(EmailFlag.class);
        flags.addAll(email.getFlags());
        if (!expunge) {
            flags.remove(EmailFlag.DELETED);
            if (name.flags().contains(EmailFlag.DELETED)) flags.add(EmailFlag.DELETED);
        }
        return CUR + "/" + name.withFlags(flags);
    }

    @Override
    public void close(Mailbox mailbox) {
        MaildirData data = mailbox.getData(MaildirData.class);
        if (data != null && data.pendingCount() > 0) {
            log.warn("Closing {} with {} uncommitted messages", mailbox.getPath(), data.pendingCount());
        }
    }

    @Override
    public MessageHandle openMessage(Mailbox mailbox, Email email) throws IOException {
        MaildirData data = requireData(mailbox);
        Path file = data.root().resolve((String) email.getBackendKey());
        return MessageHandle.forReading(email, Files.newInputStream(file));
    }

    @Override
    public MessageHandle openNewMessage(Mailbox mailbox, Email template) throws IOException {
        MaildirData data = requireData(mailbox);
        Path tmp = data.root().resolve(TMP).resolve(MaildirFilename.generate().base());
        OutputStream out = Files.newOutputStream(tmp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        data.startWriting(tmp);
        return MessageHandle.forWriting(template, out, tmp);
    }

    /**
     * Moves the written file into cur/ when the template says it is seen,
     * otherwise into new/, and appends the email read back from it.
     */
    @Override
    public Email commitMessage(Mailbox mailbox, MessageHandle handle) throws IOException {
        MaildirData data = requireData(mailbox);
        handle.close();
        Path tmp = (Path) handle.backendKey();
        if (!data.finishWriting(tmp)) {
            throw new IOException("Not a message being written to " + data.root() + ": " + tmp);
        }
        Set<EmailFlag> flags = EnumSet.noneOf(EmailFlag.class);
        if (handle.email() != null) {
            flags.addAll(handle.email().getFlags());
        }
        MaildirFilename name = MaildirFilename.parse(tmp.getFileName().toString());
        String key = flags.contains(EmailFlag.SEEN)
                ? CUR + "/" + name.withFlags(flags)
                : NEW + "/" + name.base();
        Files.move(tmp, data.root().resolve(key));

        Email email = readEmail(data.root(), key);
        if (email == null) {
            throw new IOException("Committed message is unreadable: " + key);
        }
        mailbox.append(email);
        if (flags.contains(EmailFlag.TAGGED)) {
            mailbox.refreshFlag(email, EmailFlag.TAGGED, true);
        }
        data.byBase().put(name.base(), email);
        log.debug("Delivered {} to {}", key, data.root());
        return email;
    }

    private static MaildirData requireData(Mailbox mailbox) throws IOException {
        MaildirData data = mailbox.getData(MaildirData.class);
        if (data == null) {
            throw new IOException("Maildir " + mailbox.getPath() + " is not open");
        }
        return data;
    }

    /**
     * Message keys in new/ then cur/, each in filename order.
     */
    static List<String> scan(Path root) throws IOException {
        List<String> keys = new ArrayList<>();
        for (String sub : new String[] { NEW, CUR }) {
            List<String> names = new ArrayList<>();
            try (DirectoryStream<Path> dir = Files.newDirectoryStream(root.resolve(sub))) {
                for (Path p : dir) {
                    String name = p.getFileName().toString();
                    if (!name.startsWith(".") && !name.startsWith(":") && Files.isRegularFile(p)) {
                        names.add(name);
                    }
                }
            }
            names.sort(null);
            for (String name : names) {
                keys.add(sub + "/" + name);
            }
        }
        return keys;
    }

    /**
     * Builds the email for one message file, or null if the file went away
     * or cannot be read.
     */
    static Email readEmail(Path root, String key) {
        Path file = root.resolve(key);
        MaildirFilename name = MaildirFilename.parse(fileName(key));
        InternetHeaders headers;
        try (InputStream in = Files.newInputStream(file)) {
            headers = new InternetHeaders(in);
        } catch (IOException | MessagingException e) {
            log.warn("Skipping unreadable message {}: {}", file, e.getMessage());
            return null;
        }
        try {
            Email.Builder b = Email.builder()
                    .messageId(headers.getHeader("Message-ID", null))
                    .subject(decode(headers.getHeader("Subject", null)))
                    .label(decode(headers.getHeader("X-Label", null)))
                    .size(Files.size(file))
                    .received(Files.getLastModifiedTime(file).toInstant())
                    .flags(name.flags())
                    .backendKey(key);
            if (key.startsWith(NEW + "/")) {
                b.flag(EmailFlag.NEW);
            }
            return b.build();
        } catch (IOException e) {
            log.warn("Skipping message {}: {}", file, e.getMessage());
            return null;
        }
    }

    private static String decode(String raw) {
        if (raw == null) return null;
        try {
            return MimeUtility.decodeText(MimeUtility.unfold(raw));
        } catch (UnsupportedEncodingException e) {
            log.debug("Cannot decode header '{}': {}", raw, e.getMessage());
            return raw;
        }
    }

    static String fileName(String key) {
        return key.substring(key.indexOf('/') + 1);
    }

    static String baseOf(String key) {
        return MaildirFilename.parse(fileName(key)).base();
    }
}
