package me.toymail.mailbox.logging;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Prepares the log directory for logback.xml.
 * Must run before the first SLF4J logger is created.
 */
public final class LoggingConfig {

    public static final String LOG_DIR_PROPERTY = "toymail.log.dir";
    private static boolean initialized = false;

    private LoggingConfig() {}

    /**
     * Creates ~/.toymail/logs and exports it as {@value #LOG_DIR_PROPERTY}.
     * Only the first call does anything.
     */
    public static void init() {
        if (initialized) return;

        Path logDir = Path.of(System.getProperty("user.home"), ".toymail", "logs");
        try {
            Files.createDirectories(logDir);
        } catch (IOException e) {
            System.err.println("Warning: Could not create log directory: " + logDir);
        }

        System.setProperty(LOG_DIR_PROPERTY, logDir.toString());
        initialized = true;
    }
}
