package com.templateweaver.core.directive;

import com.templateweaver.core.node.DirectiveNode;
import com.templateweaver.core.node.DocumentNode;
import com.templateweaver.core.node.LocationTable;
import com.templateweaver.core.node.MappingNode;
import com.templateweaver.core.node.SequenceNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds directives in a normalized tree.
 */
public final class DirectiveLocator {

    private DirectiveLocator() {
        // Utility class
    }

    /**
     * Lists the outermost directives in a tree. Directives inside a directive's value are
     * reported through {@link DirectiveOccurrence#nested()}.
     *
     * @param root normalized tree
     * @return outermost occurrences in document order
     */
    public static List<DirectiveOccurrence> find(DocumentNode root) {
        return find(root, "");
    }

    /**
     * Lists the outermost directives below a node, with paths relative to {@code path}.
     *
     * @param node normalized subtree
     * @param path path of {@code node}
     * @return outermost occurrences in document order
     */
    public static List<DirectiveOccurrence> find(DocumentNode node, String path) {
        List<DirectiveOccurrence> found = new ArrayList<>();
        collect(node, path, found);
        return List.copyOf(found);
    }

    public static boolean contains(DocumentNode root) {
        if (root instanceof DirectiveNode) {
            return true;
        }
        if (root instanceof MappingNode mapping) {
            return mapping.entries().values().stream().anyMatch(DirectiveLocator::contains);
        }
        if (root instanceof SequenceNode sequence) {
            return sequence.elements().stream().anyMatch(DirectiveLocator::contains);
        }
        return false;
    }

    /**
     * Counts the outermost directives in a tree; nested directives are not counted.
     *
     * @param root normalized tree
     * @return number of outermost directives
     */
    public static int count(DocumentNode root) {
        return find(root).size();
    }

    private static void collect(DocumentNode node, String path, List<DirectiveOccurrence> found) {
        if (node instanceof DirectiveNode directive) {
            String directivePath = LocationTable.child(path, directive.name());
            found.add(new DirectiveOccurrence(
                directive.directive(),
                path,
                directive.value(),
                find(directive.value(), directivePath)));
        } else if (node instanceof MappingNode mapping) {
            mapping.entries().forEach((key, value) -> collect(value, LocationTable.child(path, key), found));
        } else if (node instanceof SequenceNode sequence) {
            for (int i = 0; i < sequence.size(); i++) {
                collect(sequence.get(i), LocationTable.element(path, i), found);
            }
        }
    }
}
