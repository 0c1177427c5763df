package com.templateweaver.core.node;

import com.templateweaver.core.directive.Directive;

import java.util.Objects;

/**
 * A directive in canonical form, {@code {name: value}}.
 *
 * <p>The value is itself a normalized node and may contain further directives at any depth.
 *
 * @param directive the directive
 * @param value the directive's argument
 */
public record DirectiveNode(Directive directive, DocumentNode value) implements DocumentNode {

    /**
     * Compact constructor with validation.
     */
    public DirectiveNode {
        Objects.requireNonNull(directive, "directive must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    /**
     * Returns the canonical name, for example {@code Fn::GetAtt}.
     *
     * @return canonical directive name
     */
    public String name() {
        return directive.canonicalName();
    }

    @Override
    public String describe() {
        return "directive " + directive.canonicalName();
    }
}
