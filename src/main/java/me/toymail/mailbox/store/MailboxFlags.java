package me.toymail.mailbox.store;

/**
 * Independently settable state flags of an open mailbox.
 */
public final class MailboxFlags {
    private boolean append;       // opened for appending only
    private boolean changed;      // modified since the last sync
    private boolean dontWrite;    // do not write back on close
    private boolean peekOnly;     // just a glance, restore access time
    private boolean quiet;        // no status messages
    private boolean readOnly;
    private boolean newlyCreated; // popped into existence on open

    public boolean isAppend() { return append; }
    public void setAppend(boolean append) { this.append = append; }

    public boolean isChanged() { return changed; }
    public void setChanged(boolean changed) { this.changed = changed; }

    public boolean isDontWrite() { return dontWrite; }
    public void setDontWrite(boolean dontWrite) { this.dontWrite = dontWrite; }

    public boolean isPeekOnly() { return peekOnly; }
    public void setPeekOnly(boolean peekOnly) { this.peekOnly = peekOnly; }

    public boolean isQuiet() { return quiet; }
    public void setQuiet(boolean quiet) { this.quiet = quiet; }

    public boolean isReadOnly() { return readOnly; }
    public void setReadOnly(boolean readOnly) { this.readOnly = readOnly; }

    public boolean isNewlyCreated() { return newlyCreated; }
    public void setNewlyCreated(boolean newlyCreated) { this.newlyCreated = newlyCreated; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        if (append) sb.append("append ");
        if (changed) sb.append("changed ");
        if (dontWrite) sb.append("dontwrite ");
        if (peekOnly) sb.append("peekonly ");
        if (quiet) sb.append("quiet ");
        if (readOnly) sb.append("readonly ");
        if (newlyCreated) sb.append("new ");
        if (sb.length() > 1) sb.setLength(sb.length() - 1);
        return sb.append(']').toString();
    }
}
