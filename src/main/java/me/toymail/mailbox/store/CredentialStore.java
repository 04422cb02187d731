package me.toymail.mailbox.store;

import com.github.javakeyring.BackendNotSupportedException;
import com.github.javakeyring.Keyring;
import com.github.javakeyring.PasswordAccessException;
import jakarta.mail.PasswordAuthentication;
import me.toymail.mailbox.backend.imap.ImapUrl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * IMAP logins kept in the system keychain.
 *
 * <p>Entries are per server login, not per folder: every folder of
 * {@code imaps://alice@host} shares the entry {@code alice@host}. A port other
 * than the scheme's default is part of the key.
 */
public final class CredentialStore {
    private static final Logger log = LoggerFactory.getLogger(CredentialStore.class);
    private static final String SERVICE_NAME = "toymail";

    private final Keyring keyring;

    CredentialStore(Keyring keyring) {
        this.keyring = keyring;
    }

    /**
     * Store backed by the platform keychain, or an unavailable one when the
     * platform has none.
     */
    public static CredentialStore system() {
        try {
            Keyring kr = Keyring.create();
            log.debug("System keyring initialized successfully");
            return new CredentialStore(kr);
        } catch (BackendNotSupportedException e) {
            log.debug("System keyring not available: {}", e.getMessage());
            return new CredentialStore(null);
        }
    }

    /**
     * Keychain entry name for the login in an IMAP URL.
     *
     * @throws IllegalArgumentException if the URL names no user
     */
    public static String entryName(ImapUrl url) {
        if (url.username() == null) {
            throw new IllegalArgumentException("No user name in " + url.protocol() + "://" + url.host());
        }
        int defaultPort = url.ssl() ? ImapUrl.IMAPS_PORT : ImapUrl.IMAP_PORT;
        String server = url.port() == defaultPort ? url.host() : url.host() + ":" + url.port();
        return url.username() + "@" + server;
    }

    public boolean isAvailable() {
        return keyring != null;
    }

    /**
     * The saved login for a remote mailbox, ready for the mail store.
     */
    public Optional<PasswordAuthentication> lookup(ImapUrl url) {
        if (keyring == null) {
            return Optional.empty();
        }
        String entry = entryName(url);
        try {
            String password = keyring.getPassword(SERVICE_NAME, entry);
            if (password == null) {
                return Optional.empty();
            }
            log.debug("Retrieved password from keyring for {}", entry);
            return Optional.of(new PasswordAuthentication(url.username(), password));
        } catch (PasswordAccessException e) {
            log.debug("No keyring password for {}: {}", entry, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * @return false if there is no keychain or it refused the entry
     */
    public boolean save(ImapUrl url, String password) {
        if (keyring == null) {
            return false;
        }
        String entry = entryName(url);
        try {
            keyring.setPassword(SERVICE_NAME, entry, password);
            log.debug("Saved password to keyring for {}", entry);
            return true;
        } catch (PasswordAccessException e) {
            log.warn("Failed to save password to keyring for {}: {}", entry, e.getMessage());
            return false;
        }
    }

    /**
     * @return false if nothing was stored for this login
     */
    public boolean forget(ImapUrl url) {
        if (keyring == null) {
            return false;
        }
        String entry = entryName(url);
        try {
            keyring.deletePassword(SERVICE_NAME, entry);
            log.debug("Deleted password from keyring for {}", entry);
            return true;
        } catch (PasswordAccessException e) {
            log.debug("Nothing to delete in keyring for {}: {}", entry, e.getMessage());
            return false;
        }
    }
}
