package com.templateweaver.core.node;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An insertion-ordered mapping of unique string keys to nodes.
 *
 * <p>Key uniqueness is guaranteed by construction: the parsers reject duplicate keys
 * before a mapping is built.
 *
 * @param entries the entries, in document order
 */
public record MappingNode(Map<String, DocumentNode> entries) implements DocumentNode {

    private static final MappingNode EMPTY = new MappingNode(Map.of());

    /**
     * Compact constructor with validation.
     */
    public MappingNode {
        if (entries == null) {
            entries = Map.of();
        } else {
            entries.forEach((key, value) -> {
                Objects.requireNonNull(key, "mapping key must not be null");
                Objects.requireNonNull(value, "mapping value must not be null for key " + key);
            });
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }
    }

    public static MappingNode empty() {
        return EMPTY;
    }

    /**
     * Creates a single-entry mapping.
     *
     * @param key entry key
     * @param value entry value
     * @return mapping with one entry
     */
    public static MappingNode of(String key, DocumentNode value) {
        Map<String, DocumentNode> entries = new LinkedHashMap<>();
        entries.put(key, value);
        return new MappingNode(entries);
    }

    public Optional<DocumentNode> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public String describe() {
        return "mapping";
    }
}
