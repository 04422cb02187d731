package me.toymail.mailbox.store;

import me.toymail.mailbox.backend.BackendRegistry;
import me.toymail.mailbox.backend.MailboxBackend;
import me.toymail.mailbox.notify.MailboxListEvent;
import me.toymail.mailbox.notify.MailboxListNotification;
import me.toymail.mailbox.notify.Notifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * The mailboxes an application knows about. Duplicates are detected by
 * canonical path, so one physical mailbox is only ever represented once.
 */
public final class MailboxRegistry {
    private static final Logger log = LoggerFactory.getLogger(MailboxRegistry.class);

    private final List<Mailbox> mailboxes = new ArrayList<>();
    private final Notifier<MailboxListEvent> notifier = new Notifier<>();

    public Notifier<MailboxListEvent> notifier() {
        return notifier;
    }

    /**
     * Registers a mailbox and announces it with ADD.
     *
     * @throws IllegalStateException if a mailbox with the same real path is registered
     */
    public void add(Mailbox mailbox) {
        if (findByPath(mailbox.getRealPath()).isPresent()) {
            throw new IllegalStateException("Mailbox already registered: " + mailbox.getRealPath());
        }
        mailboxes.add(mailbox);
        log.debug("Registered mailbox {}", mailbox.getPath());
        notifier.notify(new MailboxListEvent(mailbox, MailboxListNotification.ADD));
    }

    /**
     * Unregisters a mailbox, announces REMOVE, then disposes it.
     *
     * @return false if the mailbox was not registered
     */
    public boolean remove(Mailbox mailbox) {
        if (!mailboxes.remove(mailbox)) {
            return false;
        }
        notifier.notify(new MailboxListEvent(mailbox, MailboxListNotification.REMOVE));
        mailbox.dispose();
        log.debug("Removed mailbox {}", mailbox.getPath());
        return true;
    }

    public Optional<Mailbox> findByPath(String path) {
        if (path == null || path.isBlank()) {
            return Optional.empty();
        }
        String real = Mailbox.canonicalPath(path);
        for (Mailbox m : mailboxes) {
            if (m.getRealPath().equals(real)) {
                return Optional.of(m);
            }
        }
        return Optional.empty();
    }

    public Optional<Mailbox> findByDescription(String description) {
        if (description == null) {
            return Optional.empty();
        }
        for (Mailbox m : mailboxes) {
            if (description.equals(m.getDescription())) {
                return Optional.of(m);
            }
        }
        return Optional.empty();
    }

    public List<Mailbox> list() {
        return Collections.unmodifiableList(new ArrayList<>(mailboxes));
    }

    public int size() {
        return mailboxes.size();
    }

    /**
     * Opens the mailbox at a path. A registered mailbox is opened again (nested
     * open); otherwise the format is probed, a new mailbox is bound to its
     * backend, registered and opened. A new mailbox that fails to open is
     * unregistered again.
     *
     * <p>A nested open keeps the access mode of the first one: asking for write
     * access to a mailbox that is open read-only is refused.
     *
     * @throws MailboxNotFoundException if no backend recognises the path
     * @throws PermissionDeniedException on a read-write open of a mailbox open read-only
     */
    public Mailbox openMailbox(String path, boolean readOnly, BackendRegistry backends) throws MailboxException {
        return openMailbox(path, readOnly, backends, m -> { });
    }

    /**
     * Like {@link #openMailbox(String, boolean, BackendRegistry)}, letting the
     * caller adjust a newly created mailbox before its first open.
     */
    public Mailbox openMailbox(String path, boolean readOnly, BackendRegistry backends,
                               Consumer<Mailbox> setup) throws MailboxException {
        Optional<Mailbox> existing = findByPath(path);
        if (existing.isPresent()) {
            Mailbox m = existing.get();
            if (m.getBackend() != null) {
                if (!m.isOpen()) {
                    m.flags().setReadOnly(readOnly);
                } else if (!readOnly && m.flags().isReadOnly()) {
                    throw new PermissionDeniedException(m.getPath(), "open read-write", null);
                }
                m.open();
                return m;
            }
            remove(m);
        }

        MailboxType type = backends.probe(path);
        MailboxBackend backend = backends.forType(type);
        if (backend == null) {
            throw new MailboxNotFoundException("No mailbox found at " + path, path);
        }

        Mailbox mailbox = new Mailbox(path);
        mailbox.attach(backend);
        mailbox.flags().setReadOnly(readOnly);
        setup.accept(mailbox);
        add(mailbox);
        try {
            mailbox.open();
        } catch (BackendException | RuntimeException e) {
            remove(mailbox);
            throw e;
        }
        return mailbox;
    }

    /**
     * Removes and disposes every mailbox.
     */
    public void clear() {
        for (Mailbox m : list()) {
            remove(m);
        }
    }
}
