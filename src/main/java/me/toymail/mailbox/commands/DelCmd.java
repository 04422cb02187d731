package me.toymail.mailbox.commands;

import me.toymail.mailbox.config.ConsolePrompter;
import me.toymail.mailbox.config.Prompter;
import me.toymail.mailbox.config.QuadOption;
import me.toymail.mailbox.service.MailboxService;
import me.toymail.mailbox.store.Email;
import me.toymail.mailbox.store.Mailbox;
import me.toymail.mailbox.store.StoreContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

@Command(name = "del", description = "Delete messages by Message-ID or subject",
        footer = {
            "",
            "Examples:",
            "  mbx del ~/Maildir --id '<abc@example.com>'",
            "  mbx del ~/Maildir --subject 'Weekly report' --yes",
            "",
            "Subjects match after dropping Re:/Fwd: prefixes, so a whole thread",
            "goes at once. Whether to purge is asked according to the 'delete'",
            "setting (see 'mbx quad'); --yes answers the question."
        })
public final class DelCmd implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(DelCmd.class);
    private final StoreContext context;

    public DelCmd(StoreContext context) {
        this.context = context;
    }

    @Parameters(index = "0", paramLabel = "<mailbox>", description = "Mailbox path or IMAP URL")
    String path;

    @ArgGroup(exclusive = true, multiplicity = "1")
    Selector selector;

    static final class Selector {
        @Option(names = "--id", paramLabel = "<message-id>", description = "Message-ID to delete (repeatable)")
        List<String> ids;

        @Option(names = "--subject", paramLabel = "<text>", description = "Delete every message in this thread")
        String subject;
    }

    @Option(names = {"-y", "--yes"}, description = "Purge without asking")
    boolean yes;

    @Option(names = "--password", paramLabel = "<password>",
            description = "IMAP password (optional if saved to keychain)")
    String password;

    @Override
    public void run() {
        context.usePassword(password);
        MailboxService service = new MailboxService(context);
        Prompter prompter = yes ? (q, d) -> QuadOption.YES : new ConsolePrompter(System.console());
        try {
            Mailbox mailbox = service.open(path, false);
            int marked;
            try {
                marked = service.deleteMatching(mailbox, matcher(mailbox));
            } catch (Exception e) {
                service.close(mailbox, (q, d) -> QuadOption.NO);
                throw e;
            }
            log.info("Marked {} message{} deleted", marked, marked == 1 ? "" : "s");

            switch (service.close(mailbox, prompter)) {
                case SYNCED:
                    log.info("Purged deleted messages from {}", mailbox.getDescription());
                    break;
                case KEPT_OPEN:
                    log.info("Aborted, nothing purged");
                    service.close(mailbox, (q, d) -> QuadOption.NO);
                    break;
                default:
                    if (marked > 0) {
                        log.info("Nothing purged");
                    }
                    break;
            }
        } catch (Exception e) {
            log.error("del failed: {} - {}", e.getClass().getSimpleName(), e.getMessage());
        }
    }

    private Predicate<Email> matcher(Mailbox mailbox) {
        Set<Email> hits = new HashSet<>();
        if (selector.ids != null) {
            for (String id : selector.ids) {
                mailbox.findById(id).ifPresentOrElse(hits::add, () -> log.info("No message with id {}", id));
            }
        } else {
            hits.addAll(mailbox.findBySubject(selector.subject));
        }
        return hits::contains;
    }
}
