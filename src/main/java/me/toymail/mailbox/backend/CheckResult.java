package me.toymail.mailbox.backend;

/**
 * Outcome of asking a backend whether its mailbox changed underneath us.
 */
public enum CheckResult {
    NO_CHANGE,
    NEW_MAIL,   // emails were appended
    REOPENED,   // emails disappeared, the mailbox was purged and rebuilt
    FLAGS       // flags changed on existing emails
}
