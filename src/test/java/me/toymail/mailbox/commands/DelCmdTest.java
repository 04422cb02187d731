package me.toymail.mailbox.commands;

import me.toymail.mailbox.config.MailboxConfig;
import me.toymail.mailbox.config.QuadOption;
import me.toymail.mailbox.config.QuadSetting;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class DelCmdTest extends CommandTestBase {

    private Path inbox;

    @BeforeEach
    void createInbox() throws Exception {
        inbox = maildir("inbox");
        writeMessage(inbox.resolve("cur/100.a:2,S"), "<a@x>", "Weekly report");
        writeMessage(inbox.resolve("cur/200.b:2,S"), "<b@x>", "Lunch?");
        writeMessage(inbox.resolve("new/300.c"), "<c@x>", "Re: Weekly report");
    }

    @Test
    public void testDel_ByIdWithYes() {
        ByteArrayOutputStream outContent = captureOut();

        int code = executeCommand(new DelCmd(context), inbox.toString(), "--id", "<b@x>", "--yes");

        String output = outContent.toString();
        assertEquals(0, code);
        assertTrue(output.contains("Marked 1 message deleted"), output);
        assertTrue(output.contains("Purged deleted messages"), output);
        assertFalse(Files.exists(inbox.resolve("cur/200.b:2,S")));
        assertTrue(Files.exists(inbox.resolve("cur/100.a:2,S")));
    }

    @Test
    public void testDel_SubjectTakesWholeThread() {
        ByteArrayOutputStream outContent = captureOut();

        executeCommand(new DelCmd(context), inbox.toString(), "--subject", "weekly report", "-y");

        assertTrue(outContent.toString().contains("Marked 2 messages deleted"));
        assertFalse(Files.exists(inbox.resolve("cur/100.a:2,S")));
        assertFalse(Files.exists(inbox.resolve("new/300.c")));
        assertTrue(Files.exists(inbox.resolve("cur/200.b:2,S")));
    }

    @Test
    public void testDel_RepeatedIds() {
        captureOut();

        executeCommand(new DelCmd(context), inbox.toString(), "--id", "<a@x>", "--id", "<c@x>", "--yes");

        assertTrue(Files.exists(inbox.resolve("cur/200.b:2,S")));
        assertFalse(Files.exists(inbox.resolve("cur/100.a:2,S")));
        assertFalse(Files.exists(inbox.resolve("new/300.c")));
    }

    @Test
    public void testDel_DeleteSettingNoKeepsFiles() throws Exception {
        MailboxConfig cfg = new MailboxConfig();
        cfg.delete = QuadSetting.of(QuadOption.NO);
        context.configStore().write(cfg);
        ByteArrayOutputStream outContent = captureOut();

        executeCommand(new DelCmd(context), inbox.toString(), "--id", "<a@x>");

        assertTrue(outContent.toString().contains("Nothing purged"));
        assertTrue(Files.exists(inbox.resolve("cur/100.a:2,S")));
        assertEquals(0, context.mailboxes().size());
    }

    @Test
    public void testDel_DeleteSettingYesDoesNotAsk() throws Exception {
        MailboxConfig cfg = new MailboxConfig();
        cfg.delete = QuadSetting.of(QuadOption.YES);
        context.configStore().write(cfg);
        captureOut();

        executeCommand(new DelCmd(context), inbox.toString(), "--id", "<a@x>");

        assertFalse(Files.exists(inbox.resolve("cur/100.a:2,S")));
    }

    @Test
    public void testDel_UnknownId() {
        ByteArrayOutputStream outContent = captureOut();

        executeCommand(new DelCmd(context), inbox.toString(), "--id", "<zzz@x>", "--yes");

        String output = outContent.toString();
        assertTrue(output.contains("No message with id <zzz@x>"), output);
        assertTrue(output.contains("Marked 0 messages deleted"), output);
    }

    @Test
    public void testDel_RequiresSelector() {
        captureOut();

        int code = executeCommand(new DelCmd(context), inbox.toString());

        assertNotEquals(0, code);
    }

    @Test
    public void testDel_SelectorsAreExclusive() {
        captureOut();

        int code = executeCommand(new DelCmd(context), inbox.toString(), "--id", "<a@x>", "--subject", "Lunch?");

        assertNotEquals(0, code);
        assertTrue(Files.exists(inbox.resolve("cur/100.a:2,S")));
    }

    @Test
    public void testDel_NotAMailbox() {
        ByteArrayOutputStream outContent = captureOut();

        executeCommand(new DelCmd(context), tempDir.resolve("nowhere").toString(), "--id", "<a@x>");

        assertTrue(outContent.toString().contains("del failed: MailboxNotFoundException"));
    }
}
