package me.toymail.mailbox.config;

import me.toymail.mailbox.store.SortOrder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MailboxConfigStoreTest {

    @TempDir
    Path tempDir;

    @Test
    public void testRead_MissingFileGivesDefaults() throws Exception {
        MailboxConfigStore store = new MailboxConfigStore(tempDir.resolve("config.json"));

        MailboxConfig cfg = store.read();

        assertFalse(store.exists());
        assertEquals(QuadOption.ASK_YES, cfg.delete.value);
        assertEquals(QuadOption.ASK_NO, cfg.move.value);
        assertEquals(QuadOption.YES, cfg.quit.value);
        assertEquals(SortOrder.ORDER, cfg.sort);
        assertTrue(cfg.checkStats);
        assertEquals(993, cfg.imap.port);
    }

    @Test
    public void testWriteRead_KeepsSettings() throws Exception {
        MailboxConfigStore store = new MailboxConfigStore(tempDir.resolve("sub").resolve("config.json"));
        MailboxConfig cfg = new MailboxConfig();
        cfg.folder = "/var/mail/me";
        cfg.delete = QuadSetting.locked(QuadOption.NO);
        cfg.sort = SortOrder.DATE;
        cfg.sortReverse = true;
        store.write(cfg);

        MailboxConfig read = store.read();

        assertEquals("/var/mail/me", read.folder);
        assertEquals(QuadOption.NO, read.delete.value);
        assertTrue(read.delete.locked);
        assertEquals(SortOrder.DATE, read.sort);
        assertTrue(read.sortReverse);
        String json = Files.readString(store.path());
        assertTrue(json.contains("\"no\""), json);
    }

    @Test
    public void testRead_AcceptsHandWrittenValues() throws Exception {
        Path file = tempDir.resolve("config.json");
        Files.writeString(file, "{ \"delete\": { \"value\": \"ASK_NO\", \"locked\": true }, \"unknownKey\": 1 }");

        MailboxConfig cfg = new MailboxConfigStore(file).read();

        assertEquals(QuadOption.ASK_NO, cfg.delete.value);
        assertTrue(cfg.delete.locked);
    }

    @Test
    public void testToggle_Persists() throws Exception {
        MailboxConfigStore store = new MailboxConfigStore(tempDir.resolve("config.json"));

        assertEquals(QuadOption.ASK_NO, store.toggle("delete"));
        assertEquals(QuadOption.ASK_NO, store.read().delete.value);
    }

    @Test
    public void testToggle_LockedSettingUnchanged() throws Exception {
        MailboxConfigStore store = new MailboxConfigStore(tempDir.resolve("config.json"));
        MailboxConfig cfg = new MailboxConfig();
        cfg.quit = QuadSetting.locked(QuadOption.YES);
        store.write(cfg);

        assertThrows(ImmutablePolicyException.class, () -> store.toggle("quit"));
        assertEquals(QuadOption.YES, store.read().quit.value);
    }

    @Test
    public void testToggle_UnknownName() {
        MailboxConfigStore store = new MailboxConfigStore(tempDir.resolve("config.json"));
        assertThrows(IllegalArgumentException.class, () -> store.toggle("bogus"));
    }

    @Test
    public void testSet_Persists() throws Exception {
        MailboxConfigStore store = new MailboxConfigStore(tempDir.resolve("config.json"));

        store.set("move", QuadOption.YES);

        assertEquals(QuadOption.YES, store.read().move.value);
    }
}
