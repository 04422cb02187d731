package me.toymail.mailbox.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Reads and writes ~/.toymail/config.json.
 */
public final class MailboxConfigStore {
    private static final ObjectMapper M = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    private final Path configPath;

    public MailboxConfigStore() {
        String home = System.getProperty("user.home");
        this.configPath = Paths.get(home, ".toymail", "config.json");
    }

    public MailboxConfigStore(Path configPath) {
        this.configPath = configPath;
    }

    public MailboxConfig read() throws IOException {
        if (!Files.exists(configPath)) {
            return new MailboxConfig();
        }
        return M.readValue(configPath.toFile(), MailboxConfig.class);
    }

    public void write(MailboxConfig config) throws IOException {
        Files.createDirectories(configPath.getParent());
        M.writeValue(configPath.toFile(), config);
    }

    /**
     * Toggles a quad setting and persists the result.
     *
     * @throws IllegalArgumentException if there is no setting with that name
     * @throws ImmutablePolicyException if the setting is locked
     */
    public QuadOption toggle(String name) throws IOException {
        MailboxConfig config = read();
        QuadSetting setting = config.quad(name);
        if (setting == null) {
            throw new IllegalArgumentException("Unknown quad option: " + name);
        }
        QuadOption value = setting.toggle();
        write(config);
        return value;
    }

    /**
     * Sets a quad setting and persists the result.
     *
     * @throws IllegalArgumentException if there is no setting with that name
     * @throws ImmutablePolicyException if the setting is locked
     */
    public void set(String name, QuadOption value) throws IOException {
        MailboxConfig config = read();
        QuadSetting setting = config.quad(name);
        if (setting == null) {
            throw new IllegalArgumentException("Unknown quad option: " + name);
        }
        setting.set(value);
        write(config);
    }

    public boolean exists() {
        return Files.exists(configPath);
    }

    public Path path() {
        return configPath;
    }
}
