package com.templateweaver.core.directive;

import com.templateweaver.core.node.DirectiveNode;
import com.templateweaver.core.node.DocumentNode;
import com.templateweaver.core.node.LocationTable;
import com.templateweaver.core.node.MappingNode;
import com.templateweaver.core.node.ScalarNode;
import com.templateweaver.core.node.SequenceNode;
import com.templateweaver.core.parser.NormalizedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks the arity and type shape of every directive in a normalized tree.
 *
 * <p>Each directive with a rule is checked against a fixed table:
 * <ul>
 *   <li>{@code Ref}: string</li>
 *   <li>{@code Fn::GetAtt}: string, or 2-element sequence</li>
 *   <li>{@code Fn::Sub}: string, or 2-element sequence [template-string, variable-mapping]</li>
 *   <li>{@code Fn::Join}: 2-element sequence [delimiter-string, list]</li>
 *   <li>{@code Fn::If}: 3-element sequence [condition-name-string, true-value, false-value]</li>
 *   <li>{@code Fn::Select}: 2-element sequence</li>
 *   <li>{@code Fn::FindInMap}: 3-element sequence</li>
 *   <li>{@code Fn::Base64}, {@code Fn::GetAZs}: string or nested directive</li>
 *   <li>{@code Fn::Cidr}: 3-element sequence</li>
 *   <li>{@code Fn::And}, {@code Fn::Or}: sequence of 2 to 10 elements</li>
 *   <li>{@code Fn::Equals}: 2-element sequence</li>
 *   <li>{@code Fn::Not}: 1-element sequence</li>
 * </ul>
 * The remaining directives have no rule.
 *
 * <p>A validation run collects every violation, including violations nested inside
 * other directives' values, instead of stopping at the first. Instances are stateless
 * and may be shared.
 */
public class DirectiveShapeValidator {

    private static final Logger log = LoggerFactory.getLogger(DirectiveShapeValidator.class);

    private static final int MIN_BOOLEAN_OPERANDS = 2;
    private static final int MAX_BOOLEAN_OPERANDS = 10;

    @FunctionalInterface
    private interface ShapeRule {
        /**
         * @return violation message, or empty when the value conforms
         */
        Optional<String> check(DocumentNode value);
    }

    private static final Map<Directive, ShapeRule> RULES = rules();

    /**
     * Validates a single directive value.
     *
     * @param directive the directive
     * @param value its normalized value
     * @return the violation, or empty when the value conforms
     */
    public Optional<DirectiveShapeError> validate(Directive directive, DocumentNode value) {
        return checkShape(directive, value)
            .map(message -> new DirectiveShapeError(directive, directive.canonicalName(), null, message));
    }

    /**
     * Validates every directive in a tree.
     *
     * @param root normalized tree
     * @return all violations in document order; empty when the tree is valid
     */
    public List<DirectiveShapeError> validate(DocumentNode root) {
        return validate(root, LocationTable.empty());
    }

    /**
     * Validates every directive in a normalized document, attaching source locations
     * when the document tracked them.
     *
     * @param document normalized document
     * @return all violations in document order
     */
    public List<DirectiveShapeError> validate(NormalizedDocument document) {
        return validate(document.root(), document.locations());
    }

    /**
     * Validates every directive in a tree, resolving locations from the given table.
     *
     * @param root normalized tree
     * @param locations location table, possibly empty
     * @return all violations in document order
     */
    public List<DirectiveShapeError> validate(DocumentNode root, LocationTable locations) {
        List<DirectiveShapeError> errors = new ArrayList<>();
        walk(root, "", locations, errors);
        if (!errors.isEmpty()) {
            log.debug("Found {} directive shape error(s)", errors.size());
        }
        return Collections.unmodifiableList(errors);
    }

    /**
     * Validates a tree and fails on the first run that reports any violation.
     *
     * @param root normalized tree
     * @throws DirectiveShapeException carrying every violation found
     */
    public void requireValid(DocumentNode root) {
        List<DirectiveShapeError> errors = validate(root);
        if (!errors.isEmpty()) {
            throw new DirectiveShapeException(errors);
        }
    }

    /**
     * Validates a document and fails if any violation is found.
     *
     * @param document normalized document
     * @throws DirectiveShapeException carrying every violation found
     */
    public void requireValid(NormalizedDocument document) {
        List<DirectiveShapeError> errors = validate(document);
        if (!errors.isEmpty()) {
            throw new DirectiveShapeException(errors);
        }
    }

    private void walk(DocumentNode node, String path, LocationTable locations, List<DirectiveShapeError> errors) {
        if (node instanceof DirectiveNode directiveNode) {
            String directivePath = LocationTable.child(path, directiveNode.name());
            checkShape(directiveNode.directive(), directiveNode.value()).ifPresent(message ->
                errors.add(new DirectiveShapeError(
                    directiveNode.directive(),
                    directivePath,
                    locations.get(directivePath).or(() -> locations.get(path)).orElse(null),
                    message)));
            walk(directiveNode.value(), directivePath, locations, errors);
        } else if (node instanceof MappingNode mapping) {
            mapping.entries().forEach((key, value) ->
                walk(value, LocationTable.child(path, key), locations, errors));
        } else if (node instanceof SequenceNode sequence) {
            for (int i = 0; i < sequence.size(); i++) {
                walk(sequence.get(i), LocationTable.element(path, i), locations, errors);
            }
        }
    }

    private static Optional<String> checkShape(Directive directive, DocumentNode value) {
        ShapeRule rule = RULES.get(directive);
        if (rule == null) {
            return Optional.empty();
        }
        return rule.check(value).map(expected ->
            directive.canonicalName() + " requires " + expected + ", got " + value.describe());
    }

    // ==================== Rule Table ====================

    private static Map<Directive, ShapeRule> rules() {
        Map<Directive, ShapeRule> rules = new EnumMap<>(Directive.class);
        rules.put(Directive.REF, value -> isString(value) ? Optional.empty() : Optional.of("a string"));
        rules.put(Directive.GET_ATT, value -> isString(value) || hasSize(value, 2)
            ? Optional.empty()
            : Optional.of("a string or a 2-element sequence"));
        rules.put(Directive.SUB, DirectiveShapeValidator::checkSub);
        rules.put(Directive.JOIN, DirectiveShapeValidator::checkJoin);
        rules.put(Directive.IF, DirectiveShapeValidator::checkIf);
        rules.put(Directive.SELECT, value -> exactly(value, 2, "a 2-element sequence [index, list]"));
        rules.put(Directive.FIND_IN_MAP, value ->
            exactly(value, 3, "a 3-element sequence [map-name, top-level-key, second-level-key]"));
        rules.put(Directive.BASE64, value -> stringOrDirective(value));
        rules.put(Directive.CIDR, value -> exactly(value, 3, "a 3-element sequence [ip-block, count, cidr-bits]"));
        rules.put(Directive.GET_AZS, value -> stringOrDirective(value));
        rules.put(Directive.AND, DirectiveShapeValidator::checkBooleanOperands);
        rules.put(Directive.OR, DirectiveShapeValidator::checkBooleanOperands);
        rules.put(Directive.EQUALS, value -> exactly(value, 2, "a 2-element sequence"));
        rules.put(Directive.NOT, value -> exactly(value, 1, "a 1-element sequence"));
        return Collections.unmodifiableMap(rules);
    }

    private static Optional<String> checkSub(DocumentNode value) {
        if (isString(value)) {
            return Optional.empty();
        }
        String expected = "a string or a 2-element sequence [template-string, variable-mapping]";
        if (!hasSize(value, 2)) {
            return Optional.of(expected);
        }
        SequenceNode sequence = (SequenceNode) value;
        if (!isString(sequence.get(0)) || !(sequence.get(1) instanceof MappingNode)) {
            return Optional.of(expected);
        }
        return Optional.empty();
    }

    private static Optional<String> checkJoin(DocumentNode value) {
        String expected = "a 2-element sequence [delimiter-string, list-of-values]";
        if (!hasSize(value, 2)) {
            return Optional.of(expected);
        }
        SequenceNode sequence = (SequenceNode) value;
        if (!isString(sequence.get(0)) || !(sequence.get(1) instanceof SequenceNode)) {
            return Optional.of(expected);
        }
        return Optional.empty();
    }

    private static Optional<String> checkIf(DocumentNode value) {
        String expected = "a 3-element sequence [condition-name-string, true-value, false-value]";
        if (!hasSize(value, 3)) {
            return Optional.of(expected);
        }
        if (!isString(((SequenceNode) value).get(0))) {
            return Optional.of(expected);
        }
        return Optional.empty();
    }

    private static Optional<String> checkBooleanOperands(DocumentNode value) {
        if (value instanceof SequenceNode sequence
            && sequence.size() >= MIN_BOOLEAN_OPERANDS
            && sequence.size() <= MAX_BOOLEAN_OPERANDS) {
            return Optional.empty();
        }
        return Optional.of("a sequence of " + MIN_BOOLEAN_OPERANDS + " to " + MAX_BOOLEAN_OPERANDS + " elements");
    }

    private static Optional<String> exactly(DocumentNode value, int size, String expected) {
        return hasSize(value, size) ? Optional.empty() : Optional.of(expected);
    }

    private static Optional<String> stringOrDirective(DocumentNode value) {
        return isString(value) || value instanceof DirectiveNode
            ? Optional.empty()
            : Optional.of("a string or a nested directive");
    }

    private static boolean isString(DocumentNode value) {
        return value instanceof ScalarNode scalar && scalar.isString();
    }

    private static boolean hasSize(DocumentNode value, int size) {
        return value instanceof SequenceNode sequence && sequence.size() == size;
    }
}
