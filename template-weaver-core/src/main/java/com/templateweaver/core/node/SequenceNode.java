package com.templateweaver.core.node;

import java.util.Arrays;
import java.util.List;

/**
 * An ordered list of nodes.
 *
 * @param elements the elements, in document order
 */
public record SequenceNode(List<DocumentNode> elements) implements DocumentNode {

    /**
     * Compact constructor with validation.
     */
    public SequenceNode {
        elements = elements == null ? List.of() : List.copyOf(elements);
    }

    public static SequenceNode of(DocumentNode... elements) {
        return new SequenceNode(List.of(elements));
    }

    /**
     * Builds a sequence of string scalars.
     *
     * @param values string values
     * @return sequence of {@link ScalarNode}s
     */
    public static SequenceNode ofStrings(String... values) {
        return new SequenceNode(Arrays.stream(values).<DocumentNode>map(ScalarNode::of).toList());
    }

    public int size() {
        return elements.size();
    }

    public DocumentNode get(int index) {
        return elements.get(index);
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    @Override
    public String describe() {
        return elements.size() + "-element sequence";
    }
}
