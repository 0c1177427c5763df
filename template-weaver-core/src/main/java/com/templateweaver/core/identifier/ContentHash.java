package com.templateweaver.core.identifier;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Content hashing used to derive identifiers.
 *
 * <p>This is a compatibility contract: identifiers derived from it are persisted in
 * deployed templates, so changing any of the following renames deployed resources.
 * <ul>
 *   <li>Algorithm: SHA-256 over the UTF-8 bytes of the input.</li>
 *   <li>Encoding: lowercase hexadecimal.</li>
 *   <li>Identifier suffixes use the first {@value #SHORT_LENGTH} hex characters, the suffix
 *       length earlier releases of the translator emitted, so deployment ids such as
 *       {@code MyApiDeployment} + 8 hex characters stay identical across versions.</li>
 *   <li>Keyed hashes hash {@code key}, the unit separator {@code U+001F}, then {@code data}.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class ContentHash {

    /** Number of hex characters used in identifier suffixes. */
    public static final int SHORT_LENGTH = 8;

    static final char KEY_SEPARATOR = '\u001F';

    private static final HexFormat HEX = HexFormat.of();

    private ContentHash() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Returns the full 64-character SHA-256 hex digest of the input.
     *
     * @param data input text
     * @return lowercase hex digest
     */
    public static String fullHash(String data) {
        Objects.requireNonNull(data, "data must not be null");
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HEX.formatHex(digest.digest(data.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * Returns the identifier suffix for the input.
     *
     * @param data input text
     * @return first {@value #SHORT_LENGTH} hex characters of the digest
     */
    public static String shortHash(String data) {
        return fullHash(data).substring(0, SHORT_LENGTH);
    }

    /**
     * Returns the identifier suffix for data scoped to a key.
     *
     * @param key scoping key
     * @param data input text
     * @return first {@value #SHORT_LENGTH} hex characters of the keyed digest
     */
    public static String keyedHash(String key, String data) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(data, "data must not be null");
        return shortHash(key + KEY_SEPARATOR + data);
    }
}
