package me.toymail.mailbox.store;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Summary of one message: the fields the mailbox needs for its counters,
 * indices and sorting. The message body stays with the backend.
 */
public final class Email {
    private final String messageId;
    private final String subject;
    private final String label;
    private final long size;
    private final Instant received;
    private final EnumSet<EmailFlag> flags;

    private Object backendKey;
    private int index = -1;   // real slot, set by the owning mailbox
    private int vnum = -1;    // position in the virtual view, -1 if not visible

    private Email(Builder b) {
        this.messageId = b.messageId;
        this.subject = b.subject != null ? b.subject : "";
        this.label = b.label;
        this.size = b.size;
        this.received = b.received != null ? b.received : Instant.EPOCH;
        this.flags = b.flags.isEmpty() ? EnumSet.noneOf(EmailFlag.class) : EnumSet.copyOf(b.flags);
        this.backendKey = b.backendKey;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getMessageId() { return messageId; }
    public String getSubject() { return subject; }
    public String getLabel() { return label; }
    public long getSize() { return size; }
    public Instant getReceived() { return received; }

    public boolean has(EmailFlag flag) {
        return flags.contains(flag);
    }

    public Set<EmailFlag> getFlags() {
        return Collections.unmodifiableSet(flags);
    }

    public boolean isDeleted() {
        return flags.contains(EmailFlag.DELETED);
    }

    /**
     * Changes a flag without any access check. Mailbox code goes through
     * {@link Mailbox#setFlag(Email, EmailFlag, boolean)} instead.
     *
     * @return true if the flag changed
     */
    boolean applyFlag(EmailFlag flag, boolean on) {
        return on ? flags.add(flag) : flags.remove(flag);
    }

    /**
     * Opaque per-message key owned by the backend (a file name, a UID).
     */
    public Object getBackendKey() { return backendKey; }
    public void setBackendKey(Object backendKey) { this.backendKey = backendKey; }

    public int getIndex() { return index; }
    void setIndex(int index) { this.index = index; }

    public int getVnum() { return vnum; }
    void setVnum(int vnum) { this.vnum = vnum; }

    @Override
    public String toString() {
        return "Email[" + index + ", " + messageId + ", '" + subject + "', " + flags + "]";
    }

    public static final class Builder {
        private String messageId;
        private String subject;
        private String label;
        private long size;
        private Instant received;
        private final EnumSet<EmailFlag> flags = EnumSet.noneOf(EmailFlag.class);
        private Object backendKey;

        public Builder messageId(String messageId) { this.messageId = messageId; return this; }
        public Builder subject(String subject) { this.subject = subject; return this; }
        public Builder label(String label) { this.label = label; return this; }
        public Builder size(long size) { this.size = size; return this; }
        public Builder received(Instant received) { this.received = received; return this; }
        public Builder flag(EmailFlag flag) { this.flags.add(flag); return this; }
        public Builder flags(Set<EmailFlag> flags) { this.flags.addAll(flags); return this; }
        public Builder backendKey(Object backendKey) { this.backendKey = backendKey; return this; }

        public Email build() {
            return new Email(this);
        }
    }
}
