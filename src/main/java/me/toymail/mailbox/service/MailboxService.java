package me.toymail.mailbox.service;

import me.toymail.mailbox.config.MailboxConfig;
import me.toymail.mailbox.config.Prompter;
import me.toymail.mailbox.config.QuadOption;
import me.toymail.mailbox.store.Email;
import me.toymail.mailbox.store.EmailFlag;
import me.toymail.mailbox.store.Mailbox;
import me.toymail.mailbox.store.MailboxException;
import me.toymail.mailbox.store.PermissionDeniedException;
import me.toymail.mailbox.store.SortOrder;
import me.toymail.mailbox.store.StoreContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Predicate;

/**
 * Mailbox operations as the command line uses them, with the user's
 * configuration applied.
 */
public final class MailboxService {
    private static final Logger log = LoggerFactory.getLogger(MailboxService.class);

    public enum CloseOutcome {
        /** Closed without purging; flag changes, if any, were still written. */
        CLOSED,
        /** Changes were written and deleted messages purged before closing. */
        SYNCED,
        /** The user aborted; the mailbox is still open. */
        KEPT_OPEN
    }

    private final StoreContext context;

    public MailboxService(StoreContext context) {
        this.context = context;
    }

    /**
     * Opens a mailbox and sorts its view by the configured order.
     */
    public Mailbox open(String path, boolean readOnly) throws MailboxException {
        MailboxConfig cfg = context.config();
        Mailbox mailbox = context.mailboxes().openMailbox(path, readOnly, context.backends(),
                m -> m.setCheckStats(cfg.checkStats));
        mailbox.sort(cfg.sort, cfg.sortReverse);
        return mailbox;
    }

    /**
     * The first {@code limit} emails of the view; all of them when limit is not positive.
     */
    public List<Email> list(Mailbox mailbox, int limit) {
        List<Email> view = mailbox.view();
        if (limit <= 0 || limit >= view.size()) {
            return view;
        }
        return view.subList(0, limit);
    }

    public void resort(Mailbox mailbox, SortOrder order, boolean reverse) {
        mailbox.sort(order, reverse);
    }

    /**
     * Narrows the view to matching emails, keeping the configured order.
     */
    public void filter(Mailbox mailbox, Predicate<Email> filter) {
        MailboxConfig cfg = context.config();
        mailbox.rebuildView(filter, cfg.sort.comparator(cfg.sortReverse));
    }

    /**
     * Marks every matching email as deleted.
     *
     * @return how many emails were newly marked
     */
    public int deleteMatching(Mailbox mailbox, Predicate<Email> match) throws PermissionDeniedException {
        return flagMatching(mailbox, match, EmailFlag.DELETED);
    }

    public int tagMatching(Mailbox mailbox, Predicate<Email> match) throws PermissionDeniedException {
        return flagMatching(mailbox, match, EmailFlag.TAGGED);
    }

    private int flagMatching(Mailbox mailbox, Predicate<Email> match, EmailFlag flag) throws PermissionDeniedException {
        int n = 0;
        for (Email e : mailbox.emails()) {
            if (match.test(e) && mailbox.setFlag(e, flag, true)) {
                n++;
            }
        }
        log.debug("Set {} on {} emails in {}", flag, n, mailbox.getPath());
        return n;
    }

    /**
     * Closes a mailbox opened through this service. When deleted emails are
     * waiting the {@code delete} setting decides: YES syncs and purges, NO writes
     * flag changes but keeps the deleted messages, ABORT leaves the mailbox
     * open. Other pending changes are written without asking.
     */
    public CloseOutcome close(Mailbox mailbox, Prompter prompter) throws MailboxException {
        if (!mailbox.isOpen()) {
            return CloseOutcome.CLOSED;
        }
        CloseOutcome outcome = CloseOutcome.CLOSED;
        if (mailbox.getOpenCount() == 1 && !mailbox.flags().isReadOnly()) {
            int deleted = mailbox.getDeletedCount();
            QuadOption answer = QuadOption.YES;
            if (deleted > 0) {
                String question = String.format("Purge %d deleted message%s from %s?",
                        deleted, deleted == 1 ? "" : "s", mailbox.getDescription());
                answer = context.config().delete.resolve(prompter, question);
            }
            if (answer == QuadOption.ABORT) {
                log.info("Kept {} open", mailbox.getPath());
                return CloseOutcome.KEPT_OPEN;
            }
            if (answer == QuadOption.YES && (deleted > 0 || mailbox.flags().isChanged())) {
                int purged = mailbox.sync();
                if (purged > 0) {
                    log.info("Purged {} messages from {}", purged, mailbox.getDescription());
                }
                outcome = CloseOutcome.SYNCED;
            } else if (answer == QuadOption.NO && mailbox.flags().isChanged()) {
                mailbox.sync(false);
            }
        }
        if (mailbox.close()) {
            context.mailboxes().remove(mailbox);
        }
        return outcome;
    }
}
