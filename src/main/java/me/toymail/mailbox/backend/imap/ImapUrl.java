package me.toymail.mailbox.backend.imap;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Location of a remote folder: {@code imap[s]://[user@]host[:port][/folder]}.
 */
public record ImapUrl(boolean ssl, String username, String host, int port, String folder) {

    public static final int IMAP_PORT = 143;
    public static final int IMAPS_PORT = 993;

    public static boolean matches(String path) {
        return path != null && (path.startsWith("imap://") || path.startsWith("imaps://"));
    }

    /**
     * @throws IllegalArgumentException if the path is not an IMAP URL
     */
    public static ImapUrl parse(String path) {
        if (!matches(path)) {
            throw new IllegalArgumentException("Not an IMAP URL: " + path);
        }
        URI uri;
        try {
            uri = new URI(path);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Malformed IMAP URL: " + path, e);
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("IMAP URL has no host: " + path);
        }
        boolean ssl = "imaps".equals(uri.getScheme());
        int port = uri.getPort() > 0 ? uri.getPort() : (ssl ? IMAPS_PORT : IMAP_PORT);
        String folder = uri.getPath();
        if (folder == null || folder.isEmpty() || "/".equals(folder)) {
            folder = "INBOX";
        } else {
            folder = folder.substring(1);
        }
        return new ImapUrl(ssl, uri.getUserInfo(), uri.getHost(), port, folder);
    }

    public String protocol() {
        return ssl ? "imaps" : "imap";
    }
}
