package me.toymail.mailbox.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Console;
import java.util.Locale;

/**
 * Prompts on the system console. Without a console the default answer is used.
 */
public final class ConsolePrompter implements Prompter {
    private static final Logger log = LoggerFactory.getLogger(ConsolePrompter.class);

    private final Console console;

    public ConsolePrompter(Console console) {
        this.console = console;
    }

    @Override
    public QuadOption confirm(String question, QuadOption defaultAnswer) {
        if (console == null) {
            log.debug("No console, answering '{}' with default {}", question, defaultAnswer);
            return defaultAnswer;
        }
        String hint = defaultAnswer == QuadOption.YES ? "([yes]/no): " : "(yes/[no]): ";
        String line = console.readLine("%s %s", question, hint);
        if (line == null) {
            return QuadOption.ABORT;
        }
        String answer = line.trim().toLowerCase(Locale.ROOT);
        if (answer.isEmpty()) {
            return defaultAnswer;
        }
        if (answer.startsWith("y")) {
            return QuadOption.YES;
        }
        if (answer.startsWith("n")) {
            return QuadOption.NO;
        }
        return QuadOption.ABORT;
    }
}
