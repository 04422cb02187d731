package me.toymail.mailbox.store;

/**
 * An internal invariant of a mailbox was violated. Always a defect.
 */
public class InconsistentStateException extends IllegalStateException {

    public InconsistentStateException(String message) {
        super(message);
    }

    public InconsistentStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
