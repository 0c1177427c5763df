package com.templateweaver.core.parser;

import java.util.Locale;
import java.util.Optional;

/**
 * Source formats a template may be written in.
 */
public enum TemplateFormat {

    /** YAML, including the shorthand directive tags */
    YAML,

    /** JSON, long-form directives only */
    JSON;

    /**
     * Detects the format of a document: a document whose first non-whitespace character
     * is {@code {} is JSON, anything else is treated as YAML.
     *
     * @param text document text
     * @return detected format
     */
    public static TemplateFormat sniff(CharSequence text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\uFEFF' || Character.isWhitespace(c)) {
                continue;
            }
            return c == '{' ? JSON : YAML;
        }
        return YAML;
    }

    /**
     * Parses a configured format name. {@code auto}, blank and {@code null} mean
     * "detect from content" and yield an empty result.
     *
     * @param name format name, case-insensitive
     * @return the format, or empty for auto-detection
     * @throws IllegalArgumentException if the name is not a known format
     */
    public static Optional<TemplateFormat> fromName(String name) {
        String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty() || normalized.equals("auto")) {
            return Optional.empty();
        }
        return switch (normalized) {
            case "yaml", "yml" -> Optional.of(YAML);
            case "json" -> Optional.of(JSON);
            default -> throw new IllegalArgumentException("Unknown template format: " + name);
        };
    }
}
