package me.toymail.mailbox.backend;

import me.toymail.mailbox.store.Email;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * An open message: either the content of an existing email, or a new message
 * being written that becomes an email once committed.
 */
public final class MessageHandle implements Closeable {
    private final Email email;
    private final InputStream in;
    private final OutputStream out;
    private final Object backendKey;
    private boolean closed;

    private MessageHandle(Email email, InputStream in, OutputStream out, Object backendKey) {
        this.email = email;
        this.in = in;
        this.out = out;
        this.backendKey = backendKey;
    }

    public static MessageHandle forReading(Email email, InputStream in) {
        return new MessageHandle(email, in, null, email.getBackendKey());
    }

    /**
     * @param template   flags and label the committed email should carry, may be null
     * @param backendKey where the backend is writing, e.g. a temporary file
     */
    public static MessageHandle forWriting(Email template, OutputStream out, Object backendKey) {
        return new MessageHandle(template, null, out, backendKey);
    }

    public boolean isWritable() {
        return out != null;
    }

    /**
     * @return the email being read, or the template of a new message
     */
    public Email email() {
        return email;
    }

    public InputStream content() {
        if (in == null) {
            throw new IllegalStateException("Message handle is not readable");
        }
        return in;
    }

    public OutputStream output() {
        if (out == null) {
            throw new IllegalStateException("Message handle is not writable");
        }
        return out;
    }

    public Object backendKey() {
        return backendKey;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() throws IOException {
        if (closed) return;
        closed = true;
        if (in != null) in.close();
        if (out != null) out.close();
    }
}
