package me.toymail.mailbox.backend.maildir;

import me.toymail.mailbox.backend.MailboxData;
import me.toymail.mailbox.store.Email;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Per-mailbox state of the maildir backend: the directory, the emails by
 * filename base, and tmp/ files of messages being written.
 */
final class MaildirData implements MailboxData {
    private static final Logger log = LoggerFactory.getLogger(MaildirData.class);

    private final Path root;
    private final Map<String, Email> byBase = new LinkedHashMap<>();
    private final Set<Path> pending = new HashSet<>();

    MaildirData(Path root) {
        this.root = root;
    }

    Path root() {
        return root;
    }

    Map<String, Email> byBase() {
        return byBase;
    }

    void startWriting(Path tmpFile) {
        pending.add(tmpFile);
    }

    boolean finishWriting(Path tmpFile) {
        return pending.remove(tmpFile);
    }

    int pendingCount() {
        return pending.size();
    }

    /**
     * Drops the tracked emails and deletes tmp/ files that were never committed.
     */
    @Override
    public void free() {
        for (Path tmp : pending) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException e) {
                log.warn("Could not remove unfinished message {}: {}", tmp, e.getMessage());
            }
        }
        pending.clear();
        byBase.clear();
    }
}
