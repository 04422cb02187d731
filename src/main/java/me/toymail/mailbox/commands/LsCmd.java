package me.toymail.mailbox.commands;

import me.toymail.mailbox.service.MailboxService;
import me.toymail.mailbox.store.Email;
import me.toymail.mailbox.store.EmailFlag;
import me.toymail.mailbox.store.Mailbox;
import me.toymail.mailbox.store.SortOrder;
import me.toymail.mailbox.store.StoreContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;

@Command(name = "ls", description = "List the messages of a mailbox",
        footer = {
            "",
            "Examples:",
            "  mbx ls ~/Maildir                   List the first 20 messages",
            "  mbx ls ~/Maildir --sort DATE -r    Newest first",
            "  mbx ls ~/Maildir --unread --limit 0",
            "                                     All unread messages",
            "",
            "Output format:",
            "  <n> | <status> | <date> | <size> | <subject>",
            "  status letters: N new, O old unread, D deleted, ! flagged, r replied, * tagged"
        })
public final class LsCmd implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(LsCmd.class);
    private final StoreContext context;

    public LsCmd(StoreContext context) {
        this.context = context;
    }

    @Parameters(index = "0", arity = "0..1", paramLabel = "<mailbox>",
            description = "Mailbox path or IMAP URL (default: folder from config.json)")
    String path;

    @Option(names = "--sort", paramLabel = "<order>",
            description = "Sort order: ${COMPLETION-CANDIDATES}")
    SortOrder sort;

    @Option(names = {"-r", "--reverse"}, description = "Reverse the sort order")
    boolean reverse;

    @Option(names = "--limit", defaultValue = "20", paramLabel = "<n>",
            description = "Maximum messages to show, 0 for all (default: ${DEFAULT-VALUE})")
    int limit;

    @Option(names = "--unread", description = "Only show unread messages")
    boolean unread;

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
                if (unread) {
                    service.filter(mailbox, e -> !e.has(EmailFlag.SEEN));
                }
                if (sort != null) {
                    service.resort(mailbox, sort, reverse);
                }
                List<Email> shown = service.list(mailbox, limit);
                for (Email e : shown) {
                    log.info("{}", EmailLine.format(e));
                }
                log.info("{} of {} messages shown", shown.size(), mailbox.getMessageCount());
            } finally {
                service.close(mailbox, null);
            }
        } catch (Exception e) {
            log.error("ls failed: {} - {}", e.getClass().getSimpleName(), e.getMessage());
        }
    }
}
