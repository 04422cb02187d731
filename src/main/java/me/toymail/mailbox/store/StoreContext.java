package me.toymail.mailbox.store;

import me.toymail.mailbox.PasswordResolver;
import me.toymail.mailbox.backend.BackendRegistry;
import me.toymail.mailbox.backend.imap.ImapBackend;
import me.toymail.mailbox.backend.imap.SessionStoreConnector;
import me.toymail.mailbox.backend.maildir.MaildirBackend;
import me.toymail.mailbox.config.MailboxConfig;
import me.toymail.mailbox.config.MailboxConfigStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Everything a command needs: configuration, the known mailboxes, the
 * backends and the credentials for remote ones.
 */
public final class StoreContext implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StoreContext.class);

    private final MailboxConfigStore configStore;
    private final CredentialStore credentialStore;
    private final PasswordResolver passwordResolver;
    private final BackendRegistry backends;
    private final MailboxRegistry mailboxes = new MailboxRegistry();
    private SessionStoreConnector sessionConnector;

    public StoreContext(MailboxConfigStore configStore, CredentialStore credentialStore, BackendRegistry backends) {
        this.configStore = configStore;
        this.credentialStore = credentialStore;
        this.passwordResolver = new PasswordResolver(credentialStore);
        this.backends = backends;
    }

    public static StoreContext initialize() {
        BackendRegistry backends = new BackendRegistry();
        StoreContext context = new StoreContext(new MailboxConfigStore(), CredentialStore.system(), backends);
        context.sessionConnector = new SessionStoreConnector(context.passwordResolver());
        backends.register(new MaildirBackend())
                .register(new ImapBackend(context.sessionConnector));
        return context;
    }

    /**
     * Password for remote mailboxes opened from now on, overriding the keyring.
     */
    public void usePassword(String password) {
        if (sessionConnector != null) {
            sessionConnector.setExplicitPassword(password);
        }
    }

    public MailboxConfigStore configStore() {
        return configStore;
    }

    /**
     * Current configuration; defaults when the file is missing or unreadable.
     */
    public MailboxConfig config() {
        try {
            return configStore.read();
        } catch (IOException e) {
            log.warn("Could not read {}: {} - using defaults", configStore.path(), e.getMessage());
            return new MailboxConfig();
        }
    }

    public MailboxRegistry mailboxes() {
        return mailboxes;
    }

    public BackendRegistry backends() {
        return backends;
    }

    public CredentialStore credentials() {
        return credentialStore;
    }

    public PasswordResolver passwordResolver() {
        return passwordResolver;
    }

    @Override
    public void close() {
        mailboxes.clear();
    }
}
