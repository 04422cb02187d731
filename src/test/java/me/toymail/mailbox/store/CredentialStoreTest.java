package me.toymail.mailbox.store;

import com.github.javakeyring.BackendNotSupportedException;
import com.github.javakeyring.Keyring;
import com.github.javakeyring.PasswordAccessException;
import jakarta.mail.PasswordAuthentication;
import me.toymail.mailbox.backend.imap.ImapUrl;
import org.junit.jupiter.api.Test;
import org.mockito.MockedStatic;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class CredentialStoreTest {

    private static final ImapUrl INBOX = ImapUrl.parse("imaps://me@host/INBOX");

    @Test
    public void testEntryName_SharedAcrossFolders() {
        assertEquals("me@host", CredentialStore.entryName(INBOX));
        assertEquals("me@host", CredentialStore.entryName(ImapUrl.parse("imaps://me@host/Archive/2023")));
        assertEquals("me@host", CredentialStore.entryName(ImapUrl.parse("imap://me@host")));
    }

    @Test
    public void testEntryName_NonDefaultPortIsPartOfKey() {
        assertEquals("me@host:1993", CredentialStore.entryName(ImapUrl.parse("imaps://me@host:1993/INBOX")));
        assertEquals("me@host:993", CredentialStore.entryName(ImapUrl.parse("imap://me@host:993")));
    }

    @Test
    public void testEntryName_RequiresUser() {
        assertThrows(IllegalArgumentException.class,
                () -> CredentialStore.entryName(ImapUrl.parse("imaps://host/INBOX")));
    }

    @Test
    public void testKeyringNotAvailable() {
        try (MockedStatic<Keyring> mockedKeyring = mockStatic(Keyring.class)) {
            mockedKeyring.when(Keyring::create).thenThrow(new BackendNotSupportedException("No backend"));

            CredentialStore store = CredentialStore.system();

            assertFalse(store.isAvailable());
            assertEquals(Optional.empty(), store.lookup(INBOX));
            assertFalse(store.save(INBOX, "pw"));
            assertFalse(store.forget(INBOX));
        }
    }

    @Test
    public void testLookup_ReturnsLoginForUrlUser() throws Exception {
        Keyring keyring = mock(Keyring.class);
        when(keyring.getPassword("toymail", "me@host")).thenReturn("secret");

        PasswordAuthentication login = new CredentialStore(keyring).lookup(INBOX).orElseThrow();

        assertEquals("me", login.getUserName());
        assertEquals("secret", login.getPassword());
    }

    @Test
    public void testLookup_NothingStored() throws Exception {
        Keyring keyring = mock(Keyring.class);
        when(keyring.getPassword("toymail", "me@host")).thenReturn(null);

        assertEquals(Optional.empty(), new CredentialStore(keyring).lookup(INBOX));
    }

    @Test
    public void testLookup_AccessErrorIsEmpty() throws Exception {
        Keyring keyring = mock(Keyring.class);
        when(keyring.getPassword("toymail", "me@host")).thenThrow(new PasswordAccessException("locked"));

        assertEquals(Optional.empty(), new CredentialStore(keyring).lookup(INBOX));
    }

    @Test
    public void testSaveAndForget() throws Exception {
        Keyring keyring = mock(Keyring.class);
        CredentialStore store = new CredentialStore(keyring);

        assertTrue(store.save(INBOX, "pw"));
        assertTrue(store.forget(ImapUrl.parse("imaps://me@host/Sent")));

        verify(keyring).setPassword("toymail", "me@host", "pw");
        verify(keyring).deletePassword("toymail", "me@host");
    }

    @Test
    public void testSave_Failure() throws Exception {
        Keyring keyring = mock(Keyring.class);
        doThrow(new PasswordAccessException("denied")).when(keyring).setPassword("toymail", "me@host", "pw");

        assertFalse(new CredentialStore(keyring).save(INBOX, "pw"));
    }
}
