package me.toymail.mailbox.commands;

import me.toymail.mailbox.store.StoreContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;

@Command(
        name = "mbx",
        mixinStandardHelpOptions = true,
        description = "Inspect and tidy maildir and IMAP mailboxes",
        footer = {
                "",
                "Mailbox paths:",
                "  ~/Maildir                          A local maildir (cur/ new/ tmp/)",
                "  imaps://you@imap.example.com/INBOX A remote IMAP folder",
                "",
                "Common Commands:",
                "  ls          List messages",
                "  stats       Show message counters",
                "  del         Delete messages by Message-ID or subject",
                "  quad        Show or change confirmation settings",
                "  credential  Manage IMAP passwords in the system keychain",
                "",
                "Use 'mbx <command> --help' for more information on a command."
        },
        subcommands = {
                LsCmd.class,
                StatsCmd.class,
                DelCmd.class,
                QuadCmd.class,
                CredentialCmd.class
        }
)
public final class RootCmd implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(RootCmd.class);
    private final StoreContext context;

    public RootCmd(StoreContext context) {
        this.context = context;
    }

    @Override public void run() {
        String folder = context.config().folder;
        if (folder != null) {
            log.info("Default mailbox: {}", folder);
        }
        log.info("Use --help. Example: mbx ls --help");
    }
}
