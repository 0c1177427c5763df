package com.templateweaver.core.parser;

import com.templateweaver.core.node.DocumentNode;
import com.templateweaver.core.node.LocationTable;

import java.util.Objects;

/**
 * The result of normalizing a template: the canonical tree and, when location tracking
 * was enabled, the source position of every path.
 *
 * @param root canonical document tree
 * @param format format the document was parsed from
 * @param locations location table, empty when tracking was disabled
 */
public record NormalizedDocument(DocumentNode root, TemplateFormat format, LocationTable locations) {

    /**
     * Compact constructor with validation.
     */
    public NormalizedDocument {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(format, "format must not be null");
        if (locations == null) {
            locations = LocationTable.empty();
        }
    }

    public boolean tracksLocations() {
        return !locations.isEmpty();
    }
}
