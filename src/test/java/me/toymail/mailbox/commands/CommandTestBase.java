package me.toymail.mailbox.commands;

import me.toymail.mailbox.backend.maildir.MaildirBackend;
import me.toymail.mailbox.store.StoreContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class CommandTestBase {

    @TempDir
    protected Path tempDir;

    protected StoreContext context;

    private String originalUserHome;
    private PrintStream originalOut;

    @BeforeEach
    public void setUp() {
        originalUserHome = System.getProperty("user.home");
        originalOut = System.out;
        System.setProperty("user.home", tempDir.toAbsolutePath().toString());
        context = StoreContext.initialize();
    }

    @AfterEach
    public void tearDown() {
        context.close();
        System.setOut(originalOut);
        if (originalUserHome != null) {
            System.setProperty("user.home", originalUserHome);
        }
    }

    /**
     * Re-initialize context after keyring or config changes
     */
    protected void reinitializeContext() {
        context.close();
        context = StoreContext.initialize();
    }

    /**
     * Execute a command using picocli with proper DI
     */
    protected int executeCommand(Object command, String... args) {
        CommandLine.IFactory factory = new CommandFactory(context);
        return new CommandLine(command, factory).execute(args);
    }

    protected ByteArrayOutputStream captureOut() {
        ByteArrayOutputStream outContent = new ByteArrayOutputStream();
        System.setOut(new PrintStream(outContent));
        return outContent;
    }

    protected Path maildir(String name) throws IOException {
        return MaildirBackend.create(tempDir.resolve(name));
    }

    protected static void writeMessage(Path file, String id, String subject) throws IOException {
        String text = "Message-ID: " + id + "\r\n"
                + "Subject: " + subject + "\r\n"
                + "\r\n"
                + "Hello\r\n";
        Files.write(file, text.getBytes(StandardCharsets.US_ASCII));
    }
}
