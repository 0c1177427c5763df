package com.templateweaver.core.node;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Source locations keyed by node path.
 *
 * <p>Paths are dotted for mapping keys and bracketed for sequence indexes, for example
 * {@code Resources.MyFunc.Properties.Role.Fn::GetAtt} or {@code Outputs.Arn.Value[0]}.
 * The root has the empty path. A table built without location tracking stays empty and
 * every lookup misses.
 */
public final class LocationTable {

    private static final LocationTable EMPTY = new LocationTable(Map.of());

    private final Map<String, SourceLocation> locations;

    private LocationTable(Map<String, SourceLocation> locations) {
        this.locations = locations;
    }

    public static LocationTable empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<SourceLocation> get(String path) {
        return Optional.ofNullable(locations.get(path));
    }

    public boolean isEmpty() {
        return locations.isEmpty();
    }

    public int size() {
        return locations.size();
    }

    /**
     * Returns an unmodifiable view of all tracked paths.
     *
     * @return path to location map, in tracking order
     */
    public Map<String, SourceLocation> asMap() {
        return locations;
    }

    // ==================== Path Helpers ====================

    /**
     * Extends a path by a mapping key.
     *
     * @param parent parent path, empty for the root
     * @param key mapping key or directive name
     * @return child path
     */
    public static String child(String parent, String key) {
        return parent.isEmpty() ? key : parent + "." + key;
    }

    /**
     * Extends a path by a sequence index.
     *
     * @param parent parent path
     * @param index element index
     * @return element path
     */
    public static String element(String parent, int index) {
        return parent + "[" + index + "]";
    }

    /**
     * Mutable builder used while a document is being normalized.
     */
    public static final class Builder {

        private final Map<String, SourceLocation> locations = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Records a location. The first location recorded for a path wins.
         *
         * @param path node path
         * @param location source location
         * @return this builder
         */
        public Builder track(String path, SourceLocation location) {
            Objects.requireNonNull(path, "path must not be null");
            Objects.requireNonNull(location, "location must not be null");
            locations.putIfAbsent(path, location);
            return this;
        }

        public LocationTable build() {
            return locations.isEmpty() ? EMPTY : new LocationTable(Collections.unmodifiableMap(new LinkedHashMap<>(locations)));
        }
    }
}
