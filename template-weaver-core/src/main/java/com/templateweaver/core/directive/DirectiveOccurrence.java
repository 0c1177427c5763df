package com.templateweaver.core.directive;

import com.templateweaver.core.node.DocumentNode;

import java.util.List;
import java.util.Objects;

/**
 * A directive found in a normalized tree, with the directives nested in its value.
 *
 * @param directive the directive
 * @param path path of the node holding the directive
 * @param value the directive's value
 * @param nested directives found inside {@code value}
 */
public record DirectiveOccurrence(
    Directive directive,
    String path,
    DocumentNode value,
    List<DirectiveOccurrence> nested
) {
    /**
     * Compact constructor with validation.
     */
    public DirectiveOccurrence {
        Objects.requireNonNull(directive, "directive must not be null");
        Objects.requireNonNull(value, "value must not be null");
        nested = nested == null ? List.of() : List.copyOf(nested);
    }

    /**
     * Counts this occurrence and every occurrence nested below it.
     *
     * @return total number of directives in this subtree
     */
    public int totalCount() {
        return 1 + nested.stream().mapToInt(DirectiveOccurrence::totalCount).sum();
    }
}
