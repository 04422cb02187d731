package me.toymail.mailbox.commands;

import me.toymail.mailbox.backend.imap.ImapUrl;
import me.toymail.mailbox.store.CredentialStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.io.Console;

@Command(name = "credential", description = "Manage IMAP passwords in the system keychain",
         subcommands = {CredentialCmd.Status.class, CredentialCmd.Save.class, CredentialCmd.Delete.class},
         footer = {
             "",
             "Commands:",
             "  mbx credential status imaps://you@imap.example.com/INBOX",
             "  mbx credential save   imaps://you@imap.example.com",
             "  mbx credential delete imaps://you@imap.example.com",
             "",
             "One password serves every folder of the same login, so the",
             "folder part of the URL may be left out. A saved password is used",
             "whenever such a mailbox is opened without --password."
         })
public class CredentialCmd implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(CredentialCmd.class);
    private final CredentialStore credentials;

    public CredentialCmd(CredentialStore credentials) {
        this.credentials = credentials;
    }

    CredentialStore credentials() {
        return credentials;
    }

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    /**
     * Turns the URL argument into an {@link ImapUrl}, so a bad URL is a usage error.
     */
    public static final class UrlConverter implements ITypeConverter<ImapUrl> {
        @Override
        public ImapUrl convert(String value) {
            ImapUrl url = ImapUrl.parse(value);
            if (url.username() == null) {
                throw new TypeConversionException("No user name in " + value);
            }
            return url;
        }
    }

    /**
     * Yields the keychain, or null after saying it is missing.
     */
    private static CredentialStore keychain(CredentialCmd parent) {
        CredentialStore credentials = parent.credentials();
        if (!credentials.isAvailable()) {
            log.info("System keychain is not available on this system.");
            return null;
        }
        return credentials;
    }

    @Command(name = "status", description = "Check if a password is stored for a mailbox login")
    public static class Status implements Runnable {
        @ParentCommand
        private CredentialCmd parent;

        @Parameters(index = "0", paramLabel = "<imap-url>", converter = UrlConverter.class)
        ImapUrl url;

        @Override
        public void run() {
            CredentialStore credentials = keychain(parent);
            if (credentials == null) return;
            boolean hasPassword = credentials.lookup(url).isPresent();
            log.info("Password stored in system keychain: {}", hasPassword ? "Yes" : "No");
            log.info("Login: {}", CredentialStore.entryName(url));
        }
    }

    @Command(name = "save", description = "Store the password for a mailbox login")
    public static class Save implements Runnable {
        @ParentCommand
        private CredentialCmd parent;

        @Parameters(index = "0", paramLabel = "<imap-url>", converter = UrlConverter.class)
        ImapUrl url;

        @Option(names = "--password", paramLabel = "<password>",
                description = "Password to store (prompted for when omitted)")
        String password;

        @Override
        public void run() {
            CredentialStore credentials = keychain(parent);
            if (credentials == null) return;
            String entry = CredentialStore.entryName(url);
            String pw = password;
            if (pw == null) {
                Console console = System.console();
                if (console == null) {
                    log.error("credential save failed: no console, use --password");
                    return;
                }
                char[] typed = console.readPassword("Password for %s: ", entry);
                if (typed == null) {
                    log.error("credential save failed: input cancelled");
                    return;
                }
                pw = new String(typed);
            }
            if (credentials.save(url, pw)) {
                log.info("Password saved to system keychain for {}", entry);
            } else {
                log.error("credential save failed: keychain refused the password for {}", entry);
            }
        }
    }

    @Command(name = "delete", description = "Remove the stored password for a mailbox login")
    public static class Delete implements Runnable {
        @ParentCommand
        private CredentialCmd parent;

        @Parameters(index = "0", paramLabel = "<imap-url>", converter = UrlConverter.class)
        ImapUrl url;

        @Override
        public void run() {
            CredentialStore credentials = keychain(parent);
            if (credentials == null) return;
            String entry = CredentialStore.entryName(url);
            if (credentials.forget(url)) {
                log.info("Password removed from system keychain for {}", entry);
            } else {
                log.info("No password stored for {}", entry);
            }
        }
    }
}
