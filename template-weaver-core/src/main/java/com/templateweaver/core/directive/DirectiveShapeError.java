package com.templateweaver.core.directive;

import com.templateweaver.core.node.SourceLocation;

import java.util.Objects;

/**
 * A directive whose value does not have the shape its rule requires.
 *
 * <p>Shape errors are collected, not thrown: a validation run reports all of them and the
 * caller decides whether any is fatal.
 *
 * @param directive the offending directive
 * @param path path of the directive node
 * @param location source location, or {@code null} when locations were not tracked
 * @param message what was expected and what was found
 */
public record DirectiveShapeError(
    Directive directive,
    String path,
    SourceLocation location,
    String message
) {
    /**
     * Compact constructor with validation.
     */
    public DirectiveShapeError {
        Objects.requireNonNull(directive, "directive must not be null");
        Objects.requireNonNull(message, "message must not be null");
        if (path == null) {
            path = "";
        }
    }

    @Override
    public String toString() {
        String where = path.isEmpty() ? directive.canonicalName() : path;
        return location == null
            ? where + ": " + message
            : where + ": " + message + " (" + location + ")";
    }
}
