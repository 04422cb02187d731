package me.toymail.mailbox.commands;

import me.toymail.mailbox.store.Email;
import me.toymail.mailbox.store.EmailFlag;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * One-line rendering of an email for command output.
 */
final class EmailLine {
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm")
            .withZone(ZoneId.systemDefault());

    private EmailLine() {}

    /**
     * Status letters as mail clients show them: N new, O old unread, D deleted,
     * ! flagged, r replied, * tagged.
     */
    static String status(Email e) {
        StringBuilder sb = new StringBuilder();
        if (e.isDeleted()) sb.append('D');
        else if (e.has(EmailFlag.NEW)) sb.append('N');
        else if (!e.has(EmailFlag.SEEN)) sb.append('O');
        else sb.append(' ');
        sb.append(e.has(EmailFlag.FLAGGED) ? '!' : ' ');
        sb.append(e.has(EmailFlag.REPLIED) ? 'r' : ' ');
        sb.append(e.has(EmailFlag.TAGGED) ? '*' : ' ');
        return sb.toString();
    }

    static String format(Email e) {
        String date = e.getReceived() != null ? DATE.format(e.getReceived()) : "----------------";
        String subject = e.getSubject() == null || e.getSubject().isEmpty() ? "(no subject)" : e.getSubject();
        return String.format("%4d | %s | %s | %7d | %s", e.getVnum() + 1, status(e), date, e.getSize(), subject);
    }
}
