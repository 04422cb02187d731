package me.toymail.mailbox.service;

import me.toymail.mailbox.backend.BackendRegistry;
import me.toymail.mailbox.config.MailboxConfig;
import me.toymail.mailbox.config.MailboxConfigStore;
import me.toymail.mailbox.config.QuadOption;
import me.toymail.mailbox.config.QuadSetting;
import me.toymail.mailbox.store.CredentialStore;
import me.toymail.mailbox.store.Email;
import me.toymail.mailbox.store.EmailFlag;
import me.toymail.mailbox.store.FakeBackend;
import me.toymail.mailbox.store.Mailbox;
import me.toymail.mailbox.store.SortOrder;
import me.toymail.mailbox.store.StoreContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static me.toymail.mailbox.store.FakeBackend.email;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class MailboxServiceTest {

    @TempDir
    Path tempDir;

    private FakeBackend backend;
    private MailboxConfigStore configStore;
    private StoreContext context;
    private MailboxService service;

    @BeforeEach
    void setUp() {
        backend = new FakeBackend();
        backend.messages.add(email("<1@x>", "banana"));
        backend.messages.add(email("<2@x>", "Apple"));
        backend.messages.add(email("<3@x>", "Re: banana"));
        configStore = new MailboxConfigStore(tempDir.resolve("config.json"));
        context = new StoreContext(configStore, mock(CredentialStore.class), new BackendRegistry().register(backend));
        service = new MailboxService(context);
    }

    private static List<String> ids(List<Email> emails) {
        return emails.stream().map(Email::getMessageId).collect(Collectors.toList());
    }

    @Test
    public void testOpen_AppliesConfiguredSort() throws Exception {
        MailboxConfig cfg = new MailboxConfig();
        cfg.sort = SortOrder.SUBJECT;
        cfg.checkStats = false;
        configStore.write(cfg);

        Mailbox mailbox = service.open("fake:inbox", true);

        assertEquals(List.of("<2@x>", "<1@x>", "<3@x>"), ids(service.list(mailbox, 0)));
        assertTrue(mailbox.flags().isReadOnly());
        assertFalse(mailbox.isStatsDone());
        assertSame(mailbox, context.mailboxes().findByPath("fake:inbox").orElseThrow());
    }

    @Test
    public void testList_Limit() throws Exception {
        Mailbox mailbox = service.open("fake:inbox", true);

        assertEquals(2, service.list(mailbox, 2).size());
        assertEquals(3, service.list(mailbox, 10).size());
        assertEquals(3, service.list(mailbox, -1).size());
    }

    @Test
    public void testFilterAndResort() throws Exception {
        Mailbox mailbox = service.open("fake:inbox", true);

        service.filter(mailbox, e -> e.getSubject().contains("banana"));
        assertEquals(List.of("<1@x>", "<3@x>"), ids(service.list(mailbox, 0)));

        service.resort(mailbox, SortOrder.ORDER, true);
        assertEquals(List.of("<3@x>", "<1@x>"), ids(service.list(mailbox, 0)));
    }

    @Test
    public void testDeleteMatching_CountsNewlyMarked() throws Exception {
        Mailbox mailbox = service.open("fake:inbox", false);

        assertEquals(2, service.deleteMatching(mailbox, e -> e.getSubject().contains("banana")));
        assertEquals(0, service.deleteMatching(mailbox, e -> e.getSubject().contains("banana")));
        assertEquals(2, mailbox.getDeletedCount());
    }

    @Test
    public void testTagMatching_AllowedOnReadOnly() throws Exception {
        Mailbox mailbox = service.open("fake:inbox", true);

        assertEquals(1, service.tagMatching(mailbox, e -> e.getSubject().equals("Apple")));
        assertTrue(mailbox.findById("<2@x>").orElseThrow().has(EmailFlag.TAGGED));
    }

    @Test
    public void testClose_YesPurges() throws Exception {
        Mailbox mailbox = service.open("fake:inbox", false);
        service.deleteMatching(mailbox, e -> e.getMessageId().equals("<1@x>"));

        assertEquals(MailboxService.CloseOutcome.SYNCED, service.close(mailbox, (q, d) -> QuadOption.YES));

        assertEquals(1, backend.syncs);
        assertFalse(mailbox.isOpen());
        assertEquals(0, context.mailboxes().size());
    }

    @Test
    public void testClose_NoLeavesDeletedUnwritten() throws Exception {
        Mailbox mailbox = service.open("fake:inbox", false);
        service.deleteMatching(mailbox, e -> true);

        assertEquals(MailboxService.CloseOutcome.CLOSED, service.close(mailbox, (q, d) -> QuadOption.NO));

        assertEquals(1, backend.syncs);
        assertEquals(Boolean.FALSE, backend.lastExpunge);
        assertFalse(mailbox.isOpen());
    }

    @Test
    public void testClose_NoStillWritesOtherFlags() throws Exception {
        Mailbox mailbox = service.open("fake:inbox", false);
        service.deleteMatching(mailbox, e -> e.getMessageId().equals("<1@x>"));
        mailbox.setFlag(mailbox.findById("<2@x>").orElseThrow(), EmailFlag.SEEN, true);

        assertEquals(MailboxService.CloseOutcome.CLOSED, service.close(mailbox, (q, d) -> QuadOption.NO));

        assertEquals(1, backend.syncs);
        assertEquals(Boolean.FALSE, backend.lastExpunge);
        assertEquals(List.of("<2@x>"), backend.seenAtSync);
        assertFalse(mailbox.isOpen());
    }

    @Test
    public void testClose_NothingChangedSkipsSync() throws Exception {
        Mailbox mailbox = service.open("fake:inbox", false);

        assertEquals(MailboxService.CloseOutcome.CLOSED, service.close(mailbox, (q, d) -> QuadOption.NO));

        assertEquals(0, backend.syncs);
    }

    @Test
    public void testClose_AbortKeepsOpen() throws Exception {
        Mailbox mailbox = service.open("fake:inbox", false);
        service.deleteMatching(mailbox, e -> true);

        assertEquals(MailboxService.CloseOutcome.KEPT_OPEN, service.close(mailbox, (q, d) -> QuadOption.ABORT));

        assertTrue(mailbox.isOpen());
        assertEquals(1, context.mailboxes().size());
    }

    @Test
    public void testClose_FixedSettingDoesNotPrompt() throws Exception {
        MailboxConfig cfg = new MailboxConfig();
        cfg.delete = QuadSetting.of(QuadOption.YES);
        configStore.write(cfg);
        Mailbox mailbox = service.open("fake:inbox", false);
        service.deleteMatching(mailbox, e -> true);
        AtomicInteger asked = new AtomicInteger();

        service.close(mailbox, (q, d) -> {
            asked.incrementAndGet();
            return QuadOption.NO;
        });

        assertEquals(0, asked.get());
        assertEquals(1, backend.syncs);
    }

    @Test
    public void testClose_QuestionNamesCount() throws Exception {
        Mailbox mailbox = service.open("fake:inbox", false);
        service.deleteMatching(mailbox, e -> e.getSubject().contains("banana"));
        String[] question = new String[1];

        service.close(mailbox, (q, d) -> {
            question[0] = q;
            assertEquals(QuadOption.YES, d);
            return QuadOption.NO;
        });

        assertTrue(question[0].startsWith("Purge 2 deleted messages"));
    }

    @Test
    public void testClose_ReadOnlyNeverSyncs() throws Exception {
        Mailbox mailbox = service.open("fake:inbox", true);

        assertEquals(MailboxService.CloseOutcome.CLOSED, service.close(mailbox, null));
        assertEquals(0, backend.syncs);
        assertEquals(1, backend.closes);
    }

    @Test
    public void testClose_NestedOpenOnlyDecrements() throws Exception {
        Mailbox mailbox = service.open("fake:inbox", false);
        service.open("fake:inbox", false);

        service.close(mailbox, null);

        assertTrue(mailbox.isOpen());
        assertEquals(0, backend.closes);
        assertEquals(1, context.mailboxes().size());
    }

    @Test
    public void testClose_AlreadyClosed() throws Exception {
        Mailbox mailbox = service.open("fake:inbox", true);
        service.close(mailbox, null);

        assertEquals(MailboxService.CloseOutcome.CLOSED, service.close(mailbox, null));
        assertEquals(1, backend.closes);
    }
}
