package com.templateweaver.core.identifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Verifies synthesized logical ids and tracks the ones already issued.
 *
 * <p>An id is accepted when it is non-empty, at most {@value LogicalIdGenerator#MAX_LENGTH}
 * characters, alphanumeric starting with a letter, does not start with a reserved prefix
 * (case-sensitive) and has not been registered before. The registry lives as long as the
 * verifier and is emptied only by {@link #clear()}.
 *
 * <p>Not thread-safe. Each translation pass owns its own verifier.
 *
 * @since 1.0.0
 */
public class IdentifierVerifier {

    private static final Logger log = LoggerFactory.getLogger(IdentifierVerifier.class);

    /** Prefixes reserved by default. */
    public static final List<String> DEFAULT_RESERVED_PREFIXES = List.of("AWS", "Custom");

    private static final Pattern LOGICAL_ID = Pattern.compile("[A-Za-z][A-Za-z0-9]*");

    private final Set<String> knownIds = new HashSet<>();
    private final List<String> reservedPrefixes = new ArrayList<>(DEFAULT_RESERVED_PREFIXES);

    public IdentifierVerifier() {
    }

    /**
     * Creates a verifier reserving extra prefixes in addition to the defaults.
     *
     * @param extraReservedPrefixes prefixes to reserve
     */
    public IdentifierVerifier(Collection<String> extraReservedPrefixes) {
        if (extraReservedPrefixes != null) {
            extraReservedPrefixes.forEach(this::addReservedPrefix);
        }
    }

    /**
     * Verifies an id and registers it.
     *
     * @param id candidate id
     * @throws IdentifierException if the id is invalid, reserved or already registered
     */
    public void verify(String id) {
        verifyWithoutTracking(id);
        if (knownIds.contains(id)) {
            log.debug("Rejected duplicate logical id: {}", id);
            throw new IdentifierException(IdentifierErrorKind.DUPLICATE, id, "duplicate logical id");
        }
        knownIds.add(id);
        log.debug("Registered logical id: {}", id);
    }

    /**
     * Verifies an id without registering it and without duplicate detection.
     *
     * @param id candidate id
     * @throws IdentifierException if the id is invalid or reserved
     */
    public void verifyWithoutTracking(String id) {
        if (id == null || id.isEmpty()) {
            throw new IdentifierException(IdentifierErrorKind.EMPTY, id, "logical id must not be empty");
        }
        if (id.length() > LogicalIdGenerator.MAX_LENGTH) {
            throw new IdentifierException(IdentifierErrorKind.TOO_LONG, id,
                "logical id exceeds maximum length of " + LogicalIdGenerator.MAX_LENGTH + " characters");
        }
        if (!LOGICAL_ID.matcher(id).matches()) {
            throw new IdentifierException(IdentifierErrorKind.MALFORMED, id,
                "logical id must be alphanumeric and start with a letter");
        }
        for (String prefix : reservedPrefixes) {
            if (id.startsWith(prefix)) {
                log.debug("Rejected logical id {} with reserved prefix {}", id, prefix);
                throw new IdentifierException(IdentifierErrorKind.RESERVED_PREFIX, id,
                    "logical id must not start with reserved prefix '" + prefix + "'");
            }
        }
    }

    /**
     * Registers an id without verifying it, e.g. an id already present in the template.
     *
     * @param id id to register
     * @return {@code true} if the id was not registered before
     */
    public boolean register(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return knownIds.add(id);
    }

    public boolean unregister(String id) {
        return knownIds.remove(id);
    }

    public boolean isKnown(String id) {
        return knownIds.contains(id);
    }

    /**
     * Returns the registered ids, sorted.
     *
     * @return sorted snapshot of the registry
     */
    public List<String> knownIds() {
        return knownIds.stream().sorted().toList();
    }

    /**
     * Empties the registry. Reserved prefixes are kept.
     */
    public void clear() {
        knownIds.clear();
    }

    public void addReservedPrefix(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("Reserved prefix must not be null or blank");
        }
        if (!reservedPrefixes.contains(prefix)) {
            reservedPrefixes.add(prefix);
        }
    }

    public List<String> reservedPrefixes() {
        return List.copyOf(reservedPrefixes);
    }
}
