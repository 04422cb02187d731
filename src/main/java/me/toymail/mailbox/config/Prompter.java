package me.toymail.mailbox.config;

/**
 * Asks the user a yes/no question.
 * Implementations return YES, NO or ABORT; never an ASK_* value.
 */
@FunctionalInterface
public interface Prompter {

    QuadOption confirm(String question, QuadOption defaultAnswer);
}
