package me.toymail.mailbox;

import me.toymail.mailbox.commands.CommandFactory;
import me.toymail.mailbox.logging.LoggingConfig;
import me.toymail.mailbox.store.StoreContext;

public final class CliMain {
    public static void main(String[] args) {
        LoggingConfig.init();
        int code;
        try (StoreContext context = StoreContext.initialize()) {
            code = CommandFactory.commandLine(context).execute(args);
        }
        System.exit(code);
    }
}
