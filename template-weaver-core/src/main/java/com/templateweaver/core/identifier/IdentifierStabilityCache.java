package com.templateweaver.core.identifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Memoizes derived identifiers so that repeated derivations within a translation pass
 * return identical ids.
 *
 * <p>Plain, hashed and deployment ids are cached in separate namespaces; a key used for
 * one kind never collides with the same key used for another. Once a key has an id it
 * keeps it until {@link #clear()}.
 *
 * <p>Not thread-safe. Each translation pass owns its own cache.
 *
 * @since 1.0.0
 */
public class IdentifierStabilityCache {

    private static final Logger log = LoggerFactory.getLogger(IdentifierStabilityCache.class);

    private final LogicalIdGenerator generator;
    private final Map<String, String> plainIds = new HashMap<>();
    private final Map<String, String> hashedIds = new HashMap<>();
    private final Map<String, String> deploymentIds = new HashMap<>();

    public IdentifierStabilityCache() {
        this(new LogicalIdGenerator());
    }

    public IdentifierStabilityCache(LogicalIdGenerator generator) {
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
    }

    /**
     * Returns the id for {@code key}, deriving it from {@code parts} on the first call.
     * Later calls return the cached id whatever parts they pass.
     *
     * @param key stable key
     * @param parts id parts used on the first call
     * @return the id for the key
     */
    public String checkStability(String key, String... parts) {
        requireKey(key);
        return plainIds.computeIfAbsent(key, k -> derived(k, generator.generate(parts)));
    }

    /**
     * Returns the hashed id for {@code key}: the sanitized prefix followed by the keyed
     * hash of {@code data}, with an {@code R} in front when the id would start with a digit.
     * Identical data and prefix under different keys give different ids.
     *
     * @param key stable key, also part of the hash input
     * @param data hashed content
     * @param prefix id prefix
     * @return the hashed id for the key
     */
    public String checkHashedStability(String key, String data, String prefix) {
        requireKey(key);
        Objects.requireNonNull(data, "data must not be null");
        return hashedIds.computeIfAbsent(key, k -> derived(k,
            LogicalIdGenerator.leadingLetter(generator.generate(prefix) + ContentHash.keyedHash(k, data))));
    }

    /**
     * Returns the deployment id for a resource and its API definition body. The id changes
     * exactly when the body changes.
     *
     * @param name logical id of the owning resource
     * @param specText API definition body
     * @return deployment id
     */
    public String checkDeploymentIdStability(String name, String specText) {
        requireKey(name);
        Objects.requireNonNull(specText, "specText must not be null");
        String cacheKey = name + ContentHash.KEY_SEPARATOR + ContentHash.fullHash(specText);
        return deploymentIds.computeIfAbsent(cacheKey, k -> derived(name, generator.deploymentId(name, specText)));
    }

    /**
     * Checks that the deployment id follows the API definition body.
     *
     * @param name logical id of the owning resource
     * @param oldSpec previous API definition body
     * @param newSpec new API definition body
     * @return {@link IdChange#CHANGED} when the bodies differ, otherwise {@link IdChange#UNCHANGED}
     * @throws StabilityViolationException if the ids do not follow the bodies
     */
    public IdChange verifyIdChanges(String name, String oldSpec, String newSpec) {
        String oldId = checkDeploymentIdStability(name, oldSpec);
        String newId = checkDeploymentIdStability(name, newSpec);
        boolean specChanged = !oldSpec.equals(newSpec);
        boolean idChanged = !oldId.equals(newId);
        if (specChanged && !idChanged) {
            throw new StabilityViolationException("Deployment id " + oldId + " of " + name + " did not change when its API definition changed");
        }
        if (!specChanged && idChanged) {
            throw new StabilityViolationException("Deployment id of " + name + " changed from " + oldId + " to " + newId
                + " although its API definition did not change");
        }
        return specChanged ? IdChange.CHANGED : IdChange.UNCHANGED;
    }

    public void clear() {
        plainIds.clear();
        hashedIds.clear();
        deploymentIds.clear();
    }

    /**
     * Returns the number of cached ids across all namespaces.
     *
     * @return cache size
     */
    public int size() {
        return plainIds.size() + hashedIds.size() + deploymentIds.size();
    }

    private static String derived(String key, String id) {
        log.debug("Derived id {} for key {}", id, key);
        return id;
    }

    private static void requireKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Key must not be null or empty");
        }
    }
}
