package me.toymail.mailbox.commands;

import me.toymail.mailbox.store.StoreContext;
import picocli.CommandLine;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Builds the mbx commands over one store context. Mailbox commands get the
 * context, {@code credential} gets only the keychain; nested subcommands,
 * converters and the like are left to picocli.
 */
public final class CommandFactory implements CommandLine.IFactory {
    private final Map<Class<?>, Supplier<Object>> commands = new HashMap<>();
    private final CommandLine.IFactory fallback = CommandLine.defaultFactory();

    public CommandFactory(StoreContext context) {
        commands.put(RootCmd.class, () -> new RootCmd(context));
        commands.put(LsCmd.class, () -> new LsCmd(context));
        commands.put(StatsCmd.class, () -> new StatsCmd(context));
        commands.put(DelCmd.class, () -> new DelCmd(context));
        commands.put(QuadCmd.class, () -> new QuadCmd(context));
        commands.put(CredentialCmd.class, () -> new CredentialCmd(context.credentials()));
    }

    /**
     * The full {@code mbx} command line.
     */
    public static CommandLine commandLine(StoreContext context) {
        CommandFactory factory = new CommandFactory(context);
        return new CommandLine(RootCmd.class, factory);
    }

    @Override
    public <K> K create(Class<K> cls) throws Exception {
        Supplier<Object> command = commands.get(cls);
        if (command != null) {
            return cls.cast(command.get());
        }
        return fallback.create(cls);
    }
}
