package me.toymail.mailbox.notify;

import me.toymail.mailbox.store.Mailbox;

public record MailboxListEvent(Mailbox mailbox, MailboxListNotification type) {}
