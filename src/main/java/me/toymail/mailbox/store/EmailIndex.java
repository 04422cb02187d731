package me.toymail.mailbox.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Hash index from a normalized string key to the emails carrying it.
 *
 * Each key keeps its emails in insertion order; {@link #find(String)} returns
 * the first one. References are non-owning: the mailbox removes an email from
 * every index before it drops the email from its slots.
 */
public final class EmailIndex {
    private final String name;
    private final Function<Email, String> keyExtractor;
    private final Map<String, List<Email>> table = new HashMap<>();
    private int size;

    /**
     * @param name         used in diagnostics
     * @param keyExtractor maps an email to its normalized key, or null if it has none
     */
    public EmailIndex(String name, Function<Email, String> keyExtractor) {
        this.name = name;
        this.keyExtractor = keyExtractor;
    }

    public static EmailIndex byMessageId() {
        return new EmailIndex("message-id", e -> normalizeId(e.getMessageId()));
    }

    public static EmailIndex bySubject(SubjectNormalizer normalizer) {
        return new EmailIndex("subject", e -> normalizer.normalize(e.getSubject()));
    }

    public static EmailIndex byLabel() {
        return new EmailIndex("label", e -> {
            String label = e.getLabel();
            return label == null || label.isBlank() ? null : label.trim();
        });
    }

    static String normalizeId(String id) {
        if (id == null) return null;
        String trimmed = id.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public String name() {
        return name;
    }

    /**
     * Computes the key for an email, or null if the email is not indexed here.
     */
    public String keyOf(Email email) {
        return keyExtractor.apply(email);
    }

    public void add(Email email) {
        String key = keyOf(email);
        if (key == null) return;
        table.computeIfAbsent(key, k -> new ArrayList<>(1)).add(email);
        size++;
    }

    public boolean remove(Email email) {
        String key = keyOf(email);
        if (key == null) return false;
        List<Email> chain = table.get(key);
        if (chain == null) return false;
        for (int i = 0; i < chain.size(); i++) {
            if (chain.get(i) == email) {
                chain.remove(i);
                size--;
                if (chain.isEmpty()) {
                    table.remove(key);
                }
                return true;
            }
        }
        return false;
    }

    /**
     * Looks up an already-normalized key; the first email inserted under it wins.
     */
    public Optional<Email> find(String key) {
        List<Email> chain = table.get(key);
        return chain == null ? Optional.empty() : Optional.of(chain.get(0));
    }

    public List<Email> findAll(String key) {
        List<Email> chain = table.get(key);
        return chain == null ? List.of() : Collections.unmodifiableList(chain);
    }

    public boolean contains(Email email) {
        String key = keyOf(email);
        return key != null && findAll(key).contains(email);
    }

    public int size() {
        return size;
    }

    public int keyCount() {
        return table.size();
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public void clear() {
        table.clear();
        size = 0;
    }

    @Override
    public String toString() {
        return "EmailIndex[" + name + ", keys=" + table.size() + ", entries=" + size + "]";
    }
}
