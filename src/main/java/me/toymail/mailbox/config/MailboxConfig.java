package me.toymail.mailbox.config;

import me.toymail.mailbox.store.SortOrder;

public final class MailboxConfig {
    public String folder;                                   // default mailbox path
    public QuadSetting delete = QuadSetting.of(QuadOption.ASK_YES);
    public QuadSetting move = QuadSetting.of(QuadOption.ASK_NO);
    public QuadSetting quit = QuadSetting.of(QuadOption.YES);
    public SortOrder sort = SortOrder.ORDER;
    public boolean sortReverse;
    public boolean checkStats = true;
    public Imap imap = new Imap();

    public static final class Imap {
        public String host;
        public int port = 993;
        public boolean ssl = true;
        public String username;
        public String folder = "INBOX";
    }

    /**
     * Looks up a quad setting by its config name.
     *
     * @return the setting, or null if there is none with that name
     */
    public QuadSetting quad(String name) {
        if (name == null) return null;
        switch (name) {
            case "delete": return delete;
            case "move": return move;
            case "quit": return quit;
            default: return null;
        }
    }
}
