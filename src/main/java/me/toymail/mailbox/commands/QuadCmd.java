package me.toymail.mailbox.commands;

import me.toymail.mailbox.config.MailboxConfig;
import me.toymail.mailbox.config.QuadOption;
import me.toymail.mailbox.config.QuadSetting;
import me.toymail.mailbox.store.StoreContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "quad", description = "Show or change confirmation settings",
        footer = {
            "",
            "Settings: delete, move, quit",
            "Values:   yes, no, ask-yes, ask-no",
            "",
            "Examples:",
            "  mbx quad                     Show all settings",
            "  mbx quad delete --toggle     yes <-> no, ask-yes <-> ask-no",
            "  mbx quad delete --set ask-no",
            "",
            "Settings marked locked in config.json cannot be changed here."
        })
public final class QuadCmd implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(QuadCmd.class);
    private static final String[] NAMES = { "delete", "move", "quit" };
    private final StoreContext context;

    public QuadCmd(StoreContext context) {
        this.context = context;
    }

    @Parameters(index = "0", arity = "0..1", paramLabel = "<name>", description = "Setting name")
    String name;

    @Option(names = "--toggle", description = "Toggle the setting")
    boolean toggle;

    @Option(names = "--set", paramLabel = "<value>", description = "New value")
    String value;

    @Override
    public void run() {
        try {
            if (name == null) {
                if (toggle || value != null) {
                    log.error("quad failed: a setting name is required to change it");
                    return;
                }
                MailboxConfig cfg = context.config();
                for (String n : NAMES) {
                    log.info("{} = {}", n, cfg.quad(n));
                }
                return;
            }
            if (toggle) {
                QuadOption now = context.configStore().toggle(name);
                log.info("{} = {}", name, now);
            } else if (value != null) {
                context.configStore().set(name, QuadOption.parse(value));
                log.info("{} = {}", name, context.config().quad(name));
            } else {
                QuadSetting setting = context.config().quad(name);
                if (setting == null) {
                    log.error("quad failed: unknown setting '{}'", name);
                    return;
                }
                log.info("{} = {}", name, setting);
            }
        } catch (Exception e) {
            log.error("quad failed: {} - {}", e.getClass().getSimpleName(), e.getMessage());
        }
    }
}
