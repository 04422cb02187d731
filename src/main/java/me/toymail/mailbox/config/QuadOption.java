package me.toymail.mailbox.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * A yes/no answer that may itself be configured to ask the user.
 *
 * ASK_NO and ASK_YES mean "prompt, with NO (or YES) as the default answer".
 * ABORT is only ever produced by a prompt; it cannot be toggled.
 */
public enum QuadOption {
    ABORT("abort"),
    NO("no"),
    YES("yes"),
    ASK_NO("ask-no"),
    ASK_YES("ask-yes");

    private final String configName;

    QuadOption(String configName) {
        this.configName = configName;
    }

    @JsonValue
    public String configName() {
        return configName;
    }

    public boolean isAsk() {
        return this == ASK_NO || this == ASK_YES;
    }

    /**
     * Flips the affirmative part of the value, keeping whether it asks.
     *
     * @throws ImmutablePolicyException for ABORT
     */
    public QuadOption toggle() {
        switch (this) {
            case NO: return YES;
            case YES: return NO;
            case ASK_NO: return ASK_YES;
            case ASK_YES: return ASK_NO;
            default:
                throw new ImmutablePolicyException("Cannot toggle quad option value: " + configName);
        }
    }

    /**
     * Reduces this value to a concrete YES, NO or ABORT.
     * Fixed values are returned unchanged, ASK_* values are handed to the prompter.
     */
    public QuadOption resolve(Prompter prompter, String question) {
        if (!isAsk()) {
            return this;
        }
        QuadOption def = this == ASK_YES ? YES : NO;
        if (prompter == null) {
            return def;
        }
        QuadOption answer = prompter.confirm(question, def);
        if (answer == null || answer.isAsk()) {
            throw new IllegalStateException("Prompter returned an unresolved answer: " + answer);
        }
        return answer;
    }

    @JsonCreator
    public static QuadOption parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Quad option value is null");
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (QuadOption q : values()) {
            if (q.configName.equals(normalized)) {
                return q;
            }
        }
        throw new IllegalArgumentException("Invalid quad option value: " + text);
    }

    @Override
    public String toString() {
        return configName;
    }
}
