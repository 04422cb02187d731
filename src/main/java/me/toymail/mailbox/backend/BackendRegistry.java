package me.toymail.mailbox.backend;

import me.toymail.mailbox.store.MailboxType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One backend per mailbox type, consulted in registration order when probing.
 */
public final class BackendRegistry {
    private static final Logger log = LoggerFactory.getLogger(BackendRegistry.class);

    private final Map<MailboxType, MailboxBackend> backends = new LinkedHashMap<>();

    public BackendRegistry register(MailboxBackend backend) {
        MailboxType type = backend.type();
        if (!type.isBindable()) {
            throw new IllegalArgumentException("Cannot register a backend for " + type);
        }
        if (backends.containsKey(type)) {
            throw new IllegalStateException("Backend already registered for " + type);
        }
        backends.put(type, backend);
        log.debug("Registered {} backend {}", type, backend.getClass().getSimpleName());
        return this;
    }

    /**
     * @return the backend for the type, or null if none is registered
     */
    public MailboxBackend forType(MailboxType type) {
        return backends.get(type);
    }

    /**
     * Finds the format of a path. Returns {@link MailboxType#UNKNOWN} when no
     * backend recognises it.
     */
    public MailboxType probe(String path) {
        for (MailboxBackend backend : backends.values()) {
            MailboxType found = backend.probe(path);
            if (found != MailboxType.UNKNOWN) {
                log.debug("Probed {} as {}", path, found);
                return found;
            }
        }
        return MailboxType.UNKNOWN;
    }

    public List<MailboxType> types() {
        return new ArrayList<>(backends.keySet());
    }
}
