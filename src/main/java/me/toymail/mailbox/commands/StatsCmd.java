package me.toymail.mailbox.commands;

import me.toymail.mailbox.service.MailboxService;
import me.toymail.mailbox.store.Mailbox;
import me.toymail.mailbox.store.StoreContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "stats", description = "Show the message counters of a mailbox",
        footer = {
            "",
            "Example:",
            "  mbx stats ~/Maildir"
        })
public final class StatsCmd implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(StatsCmd.class);
    private final StoreContext context;

    public StatsCmd(StoreContext context) {
        this.context = context;
    }

    @Parameters(index = "0", arity = "0..1", paramLabel = "<mailbox>",
            description = "Mailbox path or IMAP URL (default: folder from config.json)")
    String path;

    @Option(names = "--password", paramLabel = "<password>",
            description = "IMAP password (optional if saved to keychain)")
    String password;

    @Override
    public void run() {
        String target = path != null ? path : context.config().folder;
        if (target == null) {
            log.error("No mailbox given and no default folder in config.json");
            return;
        }
        context.usePassword(password);
        MailboxService service = new MailboxService(context);
        try {
            Mailbox mailbox = service.open(target, true);
            try {
                log.info("Mailbox:  {} ({})", mailbox.getDescription(), mailbox.getType());
                log.info("Messages: {}", mailbox.getMessageCount());
                log.info("Unread:   {}", mailbox.getUnreadCount());
                log.info("New:      {}", mailbox.getNewCount());
                log.info("Flagged:  {}", mailbox.getFlaggedCount());
                log.info("Deleted:  {}", mailbox.getDeletedCount());
                log.info("Size:     {} bytes", mailbox.getSize());
            } finally {
                service.close(mailbox, null);
            }
        } catch (Exception e) {
            log.error("stats failed: {} - {}", e.getClass().getSimpleName(), e.getMessage());
        }
    }
}
