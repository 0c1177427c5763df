package com.templateweaver.core.parser;

import com.templateweaver.core.directive.Directive;
import com.templateweaver.core.node.DirectiveNode;
import com.templateweaver.core.node.DocumentNode;
import com.templateweaver.core.node.MappingNode;
import com.templateweaver.core.node.ScalarNode;
import com.templateweaver.core.node.SequenceNode;

import java.util.Map;
import java.util.Optional;

/**
 * Construction rules shared by the format-specific normalizers.
 */
final class CanonicalForms {

    private CanonicalForms() {
        // Utility class
    }

    /**
     * Builds the node for a mapping. A mapping whose only key is a canonical directive
     * name is the long form of that directive.
     *
     * @param entries normalized entries, in document order
     * @return a {@link DirectiveNode} for a long-form directive, otherwise a {@link MappingNode}
     */
    static DocumentNode mapping(Map<String, DocumentNode> entries) {
        if (entries.size() == 1) {
            Map.Entry<String, DocumentNode> only = entries.entrySet().iterator().next();
            Optional<Directive> directive = Directive.fromCanonicalName(only.getKey());
            if (directive.isPresent()) {
                return new DirectiveNode(directive.get(), only.getValue());
            }
        }
        return new MappingNode(entries);
    }

    /**
     * Expands the scalar shorthand of an attribute lookup. {@code Owner.Attribute} splits on
     * the first dot into {@code [Owner, Attribute]}; text without a dot is kept whole.
     *
     * @param text scalar text
     * @return two-element sequence, or the unchanged string scalar
     */
    static DocumentNode attributeLookup(String text) {
        int dot = text.indexOf('.');
        if (dot < 0) {
            return ScalarNode.of(text);
        }
        return SequenceNode.ofStrings(text.substring(0, dot), text.substring(dot + 1));
    }
}
