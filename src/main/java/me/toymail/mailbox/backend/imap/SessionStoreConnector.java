package me.toymail.mailbox.backend.imap;

import jakarta.mail.MessagingException;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import jakarta.mail.Store;
import me.toymail.mailbox.PasswordResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Properties;

/**
 * Connects through a Jakarta Mail session, with the password taken from the
 * resolver (explicit, keyring, then console).
 */
public final class SessionStoreConnector implements StoreConnector {
    private static final Logger log = LoggerFactory.getLogger(SessionStoreConnector.class);

    private final PasswordResolver passwordResolver;
    private String explicitPassword;

    public SessionStoreConnector(PasswordResolver passwordResolver) {
        this.passwordResolver = passwordResolver;
    }

    /**
     * Password to use instead of the keyring, e.g. from a --password option.
     */
    public void setExplicitPassword(String explicitPassword) {
        this.explicitPassword = explicitPassword;
    }

    static Properties sessionProperties(ImapUrl url) {
        Properties props = new Properties();
        props.put("mail.store.protocol", url.protocol());

        props.put("mail.imaps.ssl.enable", String.valueOf(url.ssl()));
        props.put("mail.imaps.ssl.checkserveridentity", "true");
        props.put("mail.imaps.connectiontimeout", "15000");
        props.put("mail.imaps.timeout", "120000");
        props.put("mail.imaps.writetimeout", "60000");

        props.put("mail.imap.connectiontimeout", "15000");
        props.put("mail.imap.timeout", "120000");
        props.put("mail.imap.writetimeout", "60000");
        return props;
    }

    @Override
    public Store connect(ImapUrl url) throws MessagingException {
        if (url.username() == null) {
            throw new MessagingException("No user name in " + url.protocol() + "://" + url.host());
        }
        PasswordAuthentication login = passwordResolver.resolve(url, explicitPassword, System.console());

        Session session = Session.getInstance(sessionProperties(url));
        Store store = session.getStore(url.protocol());
        store.connect(url.host(), url.port(), login.getUserName(), login.getPassword());
        log.info("Store connected: {} {}", store.getClass().getSimpleName(), url.host());
        return store;
    }
}
