package com.templateweaver.core;

import com.templateweaver.core.config.WeaverConfig;
import com.templateweaver.core.identifier.IdentifierStabilityCache;
import com.templateweaver.core.identifier.IdentifierVerifier;
import com.templateweaver.core.identifier.LogicalIdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * State of one translation pass: the identifier registry and the stability cache.
 *
 * <p>Expansion logic mints every synthesized logical id through {@link #mintLogicalId}, so
 * that ids are both deterministic (same key, same id) and unique (an id is accepted only
 * once per pass). Passes share nothing; call {@link #reset()} to reuse an instance.
 *
 * <p>Not thread-safe. Use one pass per thread.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * TranslationPass pass = new TranslationPass(config);
 * String roleId = pass.mintLogicalId("MyFunc/role", "MyFunc", "Role");  // "MyFuncRole"
 * }</pre>
 */
public class TranslationPass {

    private static final Logger log = LoggerFactory.getLogger(TranslationPass.class);

    private final IdentifierVerifier verifier;
    private final IdentifierStabilityCache stabilityCache;

    public TranslationPass() {
        this(WeaverConfig.defaults());
    }

    /**
     * Creates a pass using the identifier settings of a configuration.
     *
     * @param config configuration supplying reserved prefixes and the id prefix
     */
    public TranslationPass(WeaverConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        this.verifier = new IdentifierVerifier(config.identifiers().reservedPrefixes());
        this.stabilityCache = new IdentifierStabilityCache(new LogicalIdGenerator(config.identifiers().idPrefix()));
    }

    /**
     * Derives the id for {@code key} and registers it.
     *
     * @param key stable key identifying the synthesized entity
     * @param parts id parts
     * @return the verified id
     * @throws com.templateweaver.core.identifier.IdentifierException if the id is invalid,
     *         reserved, or was already minted in this pass
     */
    public String mintLogicalId(String key, String... parts) {
        String id = stabilityCache.checkStability(key, parts);
        verifier.verify(id);
        return id;
    }

    public IdentifierVerifier verifier() {
        return verifier;
    }

    public IdentifierStabilityCache stabilityCache() {
        return stabilityCache;
    }

    /**
     * Empties the registry and the cache so the instance can run another pass.
     */
    public void reset() {
        log.debug("Resetting translation pass ({} ids known, {} cached)", verifier.knownIds().size(), stabilityCache.size());
        verifier.clear();
        stabilityCache.clear();
    }
}
