package me.toymail.mailbox.config;

/**
 * A configured quad option. A locked setting is fixed by policy and
 * refuses interactive changes.
 */
public final class QuadSetting {
    public QuadOption value = QuadOption.ASK_YES;
    public boolean locked;

    public QuadSetting() {}

    public QuadSetting(QuadOption value, boolean locked) {
        if (value == null || value == QuadOption.ABORT) {
            throw new IllegalArgumentException("Quad setting needs one of no, yes, ask-no, ask-yes");
        }
        this.value = value;
        this.locked = locked;
    }

    public static QuadSetting of(QuadOption value) {
        return new QuadSetting(value, false);
    }

    public static QuadSetting locked(QuadOption value) {
        return new QuadSetting(value, true);
    }

    /**
     * Toggles the value in place.
     *
     * @return the new value
     * @throws ImmutablePolicyException if the setting is locked
     */
    public QuadOption toggle() {
        if (locked) {
            throw new ImmutablePolicyException("Setting is locked by policy: " + value);
        }
        value = value.toggle();
        return value;
    }

    /**
     * @throws ImmutablePolicyException if the setting is locked
     */
    public void set(QuadOption newValue) {
        if (newValue == null || newValue == QuadOption.ABORT) {
            throw new IllegalArgumentException("Quad setting needs one of no, yes, ask-no, ask-yes");
        }
        if (locked) {
            throw new ImmutablePolicyException("Setting is locked by policy: " + value);
        }
        value = newValue;
    }

    public QuadOption resolve(Prompter prompter, String question) {
        return value.resolve(prompter, question);
    }

    @Override
    public String toString() {
        return locked ? value + " (locked)" : value.toString();
    }
}
