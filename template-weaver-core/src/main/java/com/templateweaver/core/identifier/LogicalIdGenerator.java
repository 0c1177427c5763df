package com.templateweaver.core.identifier;

import com.templateweaver.core.node.MappingNode;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Derives deterministic logical ids: the same inputs always produce the same id.
 *
 * <p>Plain ids are the concatenated parts with every character outside {@code [A-Za-z0-9]}
 * dropped, an {@code R} prepended when the result would start with a digit, and the
 * configured prefix in front. They are truncated to leave room for a
 * {@link ContentHash#SHORT_LENGTH}-character hash suffix, so hashed ids never exceed
 * {@value #MAX_LENGTH} characters.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * LogicalIdGenerator ids = new LogicalIdGenerator();
 * ids.generate("MyFunc", "Role");            // "MyFuncRole"
 * ids.deploymentId("MyApi", openApiBody);    // "MyApiDeployment" + 8 hex characters
 * }</pre>
 *
 * @since 1.0.0
 */
public class LogicalIdGenerator {

    /** Maximum length of a logical id. */
    public static final int MAX_LENGTH = 255;

    /** Maximum length of the non-hash part of a generated id. */
    public static final int MAX_BASE_LENGTH = MAX_LENGTH - ContentHash.SHORT_LENGTH;

    private static final Pattern VALID = Pattern.compile("[A-Za-z][A-Za-z0-9]*");

    private final String prefix;

    public LogicalIdGenerator() {
        this("");
    }

    /**
     * Creates a generator that prepends a prefix to every id.
     *
     * @param prefix id prefix; sanitized the same way as the parts
     */
    public LogicalIdGenerator(String prefix) {
        this.prefix = prefix == null ? "" : sanitize(prefix);
    }

    public String getPrefix() {
        return prefix;
    }

    /**
     * Generates an id from the concatenation of the parts.
     *
     * @param parts id parts, at least one
     * @return sanitized id; empty when no part contains a letter or digit and there is no prefix
     * @throws IllegalArgumentException if no parts are given
     */
    public String generate(String... parts) {
        if (parts == null || parts.length == 0) {
            throw new IllegalArgumentException("At least one part required");
        }
        StringBuilder combined = new StringBuilder();
        for (String part : parts) {
            combined.append(Objects.requireNonNull(part, "parts must not contain null"));
        }
        String id = leadingLetter(prefix + sanitize(combined));
        return id.length() > MAX_BASE_LENGTH ? id.substring(0, MAX_BASE_LENGTH) : id;
    }

    /**
     * Generates an id from the parts followed by the hash of {@code data}, so the id changes
     * whenever {@code data} changes.
     *
     * @param data hashed content
     * @param parts id parts, at least one
     * @return hashed id
     */
    public String generateHashed(String data, String... parts) {
        return leadingLetter(generate(parts) + ContentHash.shortHash(data));
    }

    /**
     * Generates the id of a deployment whose identity follows its API definition body.
     *
     * @param name logical id of the owning resource
     * @param spec API definition body
     * @return {@code <name>Deployment} followed by the hash of {@code spec}
     */
    public String deploymentId(String name, String spec) {
        Objects.requireNonNull(name, "name must not be null");
        return generateHashed(spec, name + "Deployment");
    }

    /**
     * Generates a hashed id from a mapping. Key order does not affect the result.
     *
     * @param idPrefix id parts preceding the hash
     * @param mapping hashed mapping
     * @return hashed id
     */
    public String generateFromMapping(String idPrefix, MappingNode mapping) {
        Objects.requireNonNull(mapping, "mapping must not be null");
        return generateHashed(CanonicalEncoder.encode(mapping), idPrefix);
    }

    public static boolean isValid(String id) {
        return id != null && !id.isEmpty() && id.length() <= MAX_LENGTH && VALID.matcher(id).matches();
    }

    /**
     * Returns {@code id} unchanged when it is already a valid logical id, otherwise its
     * sanitized form.
     *
     * @param id candidate id
     * @return a valid id, or an empty string when nothing can be salvaged
     */
    public static String makeSafe(String id) {
        if (isValid(id)) {
            return id;
        }
        String safe = leadingLetter(sanitize(id == null ? "" : id));
        return safe.length() > MAX_LENGTH ? safe.substring(0, MAX_LENGTH) : safe;
    }

    static String sanitize(CharSequence text) {
        StringBuilder result = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if ((c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')) {
                result.append(c);
            }
        }
        return result.toString();
    }

    static String leadingLetter(String id) {
        return !id.isEmpty() && Character.isDigit(id.charAt(0)) ? "R" + id : id;
    }
}
