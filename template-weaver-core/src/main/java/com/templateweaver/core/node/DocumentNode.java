package com.templateweaver.core.node;

/**
 * A node of a normalized template document.
 *
 * <p>The hierarchy is closed: a node is a {@link ScalarNode}, a {@link SequenceNode},
 * a {@link MappingNode} or a {@link DirectiveNode}. Every shorthand directive spelling
 * found in the source has already been rewritten into a {@link DirectiveNode} by the
 * time a tree of these nodes exists, and every node is immutable.
 *
 * <p>Code that walks a tree branches over the four permitted types:
 * <pre>{@code
 * if (node instanceof DirectiveNode directive) {
 *     visit(directive.value());
 * } else if (node instanceof MappingNode mapping) {
 *     mapping.entries().values().forEach(this::visit);
 * } else if (node instanceof SequenceNode sequence) {
 *     sequence.elements().forEach(this::visit);
 * }
 * }</pre>
 *
 * @see com.templateweaver.core.parser.TemplateNormalizer
 * @since 1.0.0
 */
public sealed interface DocumentNode permits ScalarNode, SequenceNode, MappingNode, DirectiveNode {

    /**
     * Describes the shape of this node for error messages, for example
     * {@code "string"}, {@code "3-element sequence"} or {@code "directive Fn::If"}.
     *
     * @return short shape description
     */
    String describe();
}
