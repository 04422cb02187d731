package me.toymail.mailbox.config;

/**
 * Thrown when a confirmation value is changed interactively but the
 * value (or the policy holding it) does not allow that.
 */
public class ImmutablePolicyException extends UnsupportedOperationException {

    public ImmutablePolicyException(String message) {
        super(message);
    }
}
