package me.toymail.mailbox.notify;

import me.toymail.mailbox.store.Mailbox;

public record MailboxEvent(Mailbox mailbox, MailboxNotification type) {}
