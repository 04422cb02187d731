package me.toymail.mailbox.commands;

import me.toymail.mailbox.config.MailboxConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class LsCmdTest extends CommandTestBase {

    private Path inbox;

    @BeforeEach
    void createInbox() throws Exception {
        inbox = maildir("inbox");
        writeMessage(inbox.resolve("cur/100.a:2,S"), "<a@x>", "Weekly report");
        writeMessage(inbox.resolve("cur/200.b:2,FS"), "<b@x>", "Another thing");
        writeMessage(inbox.resolve("new/300.c"), "<c@x>", "Re: Weekly report");
    }

    @Test
    public void testLs_ListsAllMessages() {
        ByteArrayOutputStream outContent = captureOut();

        executeCommand(new LsCmd(context), inbox.toString());

        String output = outContent.toString();
        assertTrue(output.contains("Weekly report"), output);
        assertTrue(output.contains("Another thing"), output);
        assertTrue(output.contains("3 of 3 messages shown"), output);
    }

    @Test
    public void testLs_StatusLetters() {
        ByteArrayOutputStream outContent = captureOut();

        executeCommand(new LsCmd(context), inbox.toString());

        String output = outContent.toString();
        assertTrue(output.contains("| N    |"), output);
        assertTrue(output.contains("|  !   |"), output);
    }

    @Test
    public void testLs_Limit() {
        ByteArrayOutputStream outContent = captureOut();

        executeCommand(new LsCmd(context), inbox.toString(), "--limit", "1");

        assertTrue(outContent.toString().contains("1 of 3 messages shown"));
    }

    @Test
    public void testLs_UnreadOnly() {
        ByteArrayOutputStream outContent = captureOut();

        executeCommand(new LsCmd(context), inbox.toString(), "--unread");

        String output = outContent.toString();
        assertTrue(output.contains("1 of 3 messages shown"), output);
        assertFalse(output.contains("Another thing"), output);
    }

    @Test
    public void testLs_SortBySubject() {
        ByteArrayOutputStream outContent = captureOut();

        executeCommand(new LsCmd(context), inbox.toString(), "--sort", "SUBJECT");

        String output = outContent.toString();
        assertTrue(output.indexOf("Another thing") < output.indexOf("Weekly report"), output);
    }

    @Test
    public void testLs_SortReverse() {
        ByteArrayOutputStream outContent = captureOut();

        executeCommand(new LsCmd(context), inbox.toString(), "--sort", "SUBJECT", "-r");

        String output = outContent.toString();
        assertTrue(output.indexOf("Another thing") > output.indexOf("Weekly report"), output);
    }

    @Test
    public void testLs_LeavesMaildirUntouched() throws Exception {
        captureOut();

        executeCommand(new LsCmd(context), inbox.toString());

        assertTrue(Files.exists(inbox.resolve("new/300.c")));
        assertTrue(Files.exists(inbox.resolve("cur/200.b:2,FS")));
        assertEquals(0, context.mailboxes().size());
    }

    @Test
    public void testLs_DefaultFolderFromConfig() throws Exception {
        MailboxConfig cfg = new MailboxConfig();
        cfg.folder = inbox.toString();
        context.configStore().write(cfg);
        ByteArrayOutputStream outContent = captureOut();

        executeCommand(new LsCmd(context));

        assertTrue(outContent.toString().contains("3 of 3 messages shown"));
    }

    @Test
    public void testLs_NoMailboxAndNoDefault() {
        ByteArrayOutputStream outContent = captureOut();

        executeCommand(new LsCmd(context));

        assertTrue(outContent.toString().contains("No mailbox given"));
    }

    @Test
    public void testLs_UnknownMailbox() {
        ByteArrayOutputStream outContent = captureOut();

        executeCommand(new LsCmd(context), tempDir.resolve("nowhere").toString());

        assertTrue(outContent.toString().contains("ls failed: MailboxNotFoundException"));
    }
}
