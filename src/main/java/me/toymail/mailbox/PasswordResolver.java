package me.toymail.mailbox;

import jakarta.mail.PasswordAuthentication;
import me.toymail.mailbox.backend.imap.ImapUrl;
import me.toymail.mailbox.store.CredentialStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Console;
import java.util.Optional;

/**
 * Finds the login for a remote mailbox: explicit password, then the
 * keyring, then an interactive prompt. The user always comes from the URL.
 */
public final class PasswordResolver {
    private static final Logger log = LoggerFactory.getLogger(PasswordResolver.class);

    private final CredentialStore credentialStore;

    public PasswordResolver(CredentialStore credentialStore) {
        this.credentialStore = credentialStore;
    }

    /**
     * @param url              mailbox location, with a user name
     * @param explicitPassword password given on the command line (may be null)
     * @param console          console for the prompt (null when not interactive)
     * @throws IllegalStateException if there is no password and no console to ask on
     */
    public PasswordAuthentication resolve(ImapUrl url, String explicitPassword, Console console) {
        String entry = CredentialStore.entryName(url);
        if (explicitPassword != null && !explicitPassword.isBlank()) {
            log.debug("Using explicit password for {}", entry);
            return new PasswordAuthentication(url.username(), explicitPassword);
        }

        Optional<PasswordAuthentication> stored = credentialStore.lookup(url);
        if (stored.isPresent()) {
            log.debug("Using password from keyring for {}", entry);
            return stored.get();
        }

        if (console == null) {
            throw new IllegalStateException(
                "No password available for " + entry + " and no console for interactive input. " +
                "Use --password or 'mbx credential save'."
            );
        }

        log.debug("Prompting for password for {}", entry);
        char[] pw = console.readPassword("Password for %s: ", entry);
        if (pw == null) {
            throw new IllegalStateException("Password input cancelled");
        }
        return new PasswordAuthentication(url.username(), new String(pw));
    }
}
