package com.templateweaver.core.parser;

import com.templateweaver.core.directive.Directive;
import com.templateweaver.core.node.DocumentNode;
import com.templateweaver.core.node.DirectiveNode;
import com.templateweaver.core.node.LocationTable;
import com.templateweaver.core.node.ScalarNode;
import com.templateweaver.core.node.SequenceNode;
import com.templateweaver.core.node.SourceLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeId;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.resolver.Resolver;

import java.io.StringReader;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Normalizes YAML templates.
 *
 * <p>The document is composed into a SnakeYAML node graph (tags, positions and resolved
 * aliases, without constructing Java objects) and then walked once:
 * <ul>
 *   <li>a node tagged with a shorthand directive such as {@code !Sub} becomes a
 *       {@link DirectiveNode} whose value is normalized recursively</li>
 *   <li>{@code !GetAtt Owner.Attribute} becomes {@code [Owner, Attribute]}</li>
 *   <li>a mapping whose only key is a canonical directive name becomes a {@link DirectiveNode}</li>
 *   <li>any other local tag is rejected with {@link UnrecognizedDirectiveException}</li>
 *   <li>plain scalars are typed with the YAML 1.1 resolver; timestamps stay strings</li>
 * </ul>
 *
 * <p>Instances are stateless and may be shared.
 */
public class YamlNormalizer implements FormatNormalizer {

    private static final Logger log = LoggerFactory.getLogger(YamlNormalizer.class);

    private final Resolver resolver = new Resolver();

    @Override
    public TemplateFormat format() {
        return TemplateFormat.YAML;
    }

    @Override
    public NormalizedDocument normalize(String text, boolean trackLocations) {
        Node root;
        try {
            root = new Yaml(new LoaderOptions()).compose(new StringReader(text));
        } catch (MarkedYAMLException e) {
            throw new DocumentParseException("malformed YAML: " + describe(e), toLocation(e.getProblemMark()), e);
        } catch (YAMLException e) {
            throw new DocumentParseException("malformed YAML: " + e.getMessage(), null, e);
        }
        if (root == null) {
            throw new DocumentParseException("document is empty", "", null);
        }
        return normalize(root, trackLocations);
    }

    /**
     * Normalizes an already composed SnakeYAML node graph.
     *
     * @param root composed root node
     * @param trackLocations whether to record the source location of every path
     * @return normalized document
     */
    public NormalizedDocument normalize(Node root, boolean trackLocations) {
        Walk walk = new Walk(trackLocations ? LocationTable.builder() : null);
        DocumentNode normalized = walk.visit(root, "");
        LocationTable locations = walk.locations == null ? LocationTable.empty() : walk.locations.build();
        log.debug("Normalized YAML document ({} locations tracked)", locations.size());
        return new NormalizedDocument(normalized, TemplateFormat.YAML, locations);
    }

    /**
     * State of one normalization run: the location builder and the nodes on the current
     * descent path, used to detect recursive aliases.
     */
    private final class Walk {

        private final LocationTable.Builder locations;
        private final Set<Node> ancestors = Collections.newSetFromMap(new IdentityHashMap<>());

        private Walk(LocationTable.Builder locations) {
            this.locations = locations;
        }

        DocumentNode visit(Node node, String path) {
            SourceLocation location = toLocation(node.getStartMark());
            if (!ancestors.add(node)) {
                throw new DocumentParseException("recursive alias", path, location);
            }
            try {
                track(path, location);
                Optional<Directive> directive = Directive.fromTag(node.getTag().getValue());
                if (directive.isPresent()) {
                    return shorthand(directive.get(), node, path, location);
                }
                if (!node.getTag().getValue().startsWith(Tag.PREFIX)) {
                    throw new UnrecognizedDirectiveException(node.getTag().getValue(), path, location);
                }
                return visitUntagged(node, path);
            } finally {
                ancestors.remove(node);
            }
        }

        private DocumentNode shorthand(Directive directive, Node node, String path, SourceLocation location) {
            String directivePath = LocationTable.child(path, directive.canonicalName());
            track(directivePath, location);

            DocumentNode value;
            if (node.getNodeId() == NodeId.scalar) {
                org.yaml.snakeyaml.nodes.ScalarNode scalar = (org.yaml.snakeyaml.nodes.ScalarNode) node;
                value = directive == Directive.GET_ATT
                    ? CanonicalForms.attributeLookup(scalar.getValue())
                    : typedScalar(scalar, implicitTag(scalar));
            } else {
                value = visitUntagged(node, directivePath);
            }
            return new DirectiveNode(directive, value);
        }

        private DocumentNode visitUntagged(Node node, String path) {
            return switch (node.getNodeId()) {
                case mapping -> mapping((org.yaml.snakeyaml.nodes.MappingNode) node, path);
                case sequence -> sequence((org.yaml.snakeyaml.nodes.SequenceNode) node, path);
                case scalar -> {
                    org.yaml.snakeyaml.nodes.ScalarNode scalar = (org.yaml.snakeyaml.nodes.ScalarNode) node;
                    yield typedScalar(scalar, scalar.getTag());
                }
                default -> throw new DocumentParseException(
                    "unsupported YAML node " + node.getNodeId(), path, toLocation(node.getStartMark()));
            };
        }

        private DocumentNode mapping(org.yaml.snakeyaml.nodes.MappingNode node, String path) {
            Map<String, DocumentNode> entries = new LinkedHashMap<>();
            for (NodeTuple tuple : node.getValue()) {
                Node keyNode = tuple.getKeyNode();
                if (keyNode.getNodeId() != NodeId.scalar) {
                    throw new DocumentParseException("mapping keys must be scalars", path, toLocation(keyNode.getStartMark()));
                }
                String key = ((org.yaml.snakeyaml.nodes.ScalarNode) keyNode).getValue();
                checkKeyTag(keyNode, LocationTable.child(path, key));
                if (entries.containsKey(key)) {
                    throw new DocumentParseException("duplicate mapping key '" + key + "'", path, toLocation(keyNode.getStartMark()));
                }
                entries.put(key, visit(tuple.getValueNode(), LocationTable.child(path, key)));
            }
            return CanonicalForms.mapping(entries);
        }

        /**
         * Keys are plain strings in the canonical tree, so a key may only carry a standard tag.
         */
        private void checkKeyTag(Node keyNode, String keyPath) {
            String tag = keyNode.getTag().getValue();
            if (tag.startsWith(Tag.PREFIX)) {
                return;
            }
            SourceLocation location = toLocation(keyNode.getStartMark());
            if (Directive.fromTag(tag).isPresent()) {
                throw new DocumentParseException("directive " + tag + " cannot be used as a mapping key", keyPath, location);
            }
            throw new UnrecognizedDirectiveException(tag, keyPath, location);
        }

        private SequenceNode sequence(org.yaml.snakeyaml.nodes.SequenceNode node, String path) {
            List<Node> items = node.getValue();
            List<DocumentNode> elements = new ArrayList<>(items.size());
            for (int i = 0; i < items.size(); i++) {
                elements.add(visit(items.get(i), LocationTable.element(path, i)));
            }
            return new SequenceNode(elements);
        }

        private void track(String path, SourceLocation location) {
            if (locations != null && location != null) {
                locations.track(path, location);
            }
        }
    }

    // ==================== Scalar Typing ====================

    private Tag implicitTag(org.yaml.snakeyaml.nodes.ScalarNode scalar) {
        boolean plain = scalar.getScalarStyle() == DumperOptions.ScalarStyle.PLAIN;
        return resolver.resolve(NodeId.scalar, scalar.getValue(), plain);
    }

    private static ScalarNode typedScalar(org.yaml.snakeyaml.nodes.ScalarNode scalar, Tag tag) {
        String text = scalar.getValue();
        if (Tag.NULL.equals(tag)) {
            return ScalarNode.nullValue();
        }
        if (Tag.BOOL.equals(tag)) {
            String lower = text.toLowerCase(Locale.ROOT);
            return ScalarNode.of(lower.equals("true") || lower.equals("yes") || lower.equals("on") || lower.equals("y"));
        }
        if (Tag.INT.equals(tag)) {
            return parseInteger(text);
        }
        if (Tag.FLOAT.equals(tag)) {
            return parseFloat(text);
        }
        return ScalarNode.of(text);
    }

    /**
     * Parses YAML 1.1 integer notation (decimal, {@code 0x}, {@code 0b}, leading-zero octal,
     * underscores). Sexagesimal and other exotic forms stay strings.
     */
    private static ScalarNode parseInteger(String text) {
        String digits = text.replace("_", "");
        boolean negative = digits.startsWith("-");
        if (negative || digits.startsWith("+")) {
            digits = digits.substring(1);
        }
        int radix = 10;
        if (digits.startsWith("0x")) {
            radix = 16;
            digits = digits.substring(2);
        } else if (digits.startsWith("0b")) {
            radix = 2;
            digits = digits.substring(2);
        } else if (digits.length() > 1 && digits.startsWith("0")) {
            radix = 8;
            digits = digits.substring(1);
        }
        if (digits.isEmpty() || !isDigits(digits, radix)) {
            return ScalarNode.of(text);
        }
        BigInteger value = new BigInteger(digits, radix);
        if (negative) {
            value = value.negate();
        }
        return value.bitLength() < Long.SIZE ? ScalarNode.of(value.longValue()) : new ScalarNode(value);
    }

    private static ScalarNode parseFloat(String text) {
        String lower = text.replace("_", "").toLowerCase(Locale.ROOT);
        switch (lower) {
            case ".inf", "+.inf" -> {
                return ScalarNode.of(Double.POSITIVE_INFINITY);
            }
            case "-.inf" -> {
                return ScalarNode.of(Double.NEGATIVE_INFINITY);
            }
            case ".nan" -> {
                return ScalarNode.of(Double.NaN);
            }
            default -> {
                if (lower.indexOf(':') >= 0) {
                    return ScalarNode.of(text);
                }
                return ScalarNode.of(Double.parseDouble(lower));
            }
        }
    }

    private static boolean isDigits(String digits, int radix) {
        for (int i = 0; i < digits.length(); i++) {
            if (Character.digit(digits.charAt(i), radix) < 0) {
                return false;
            }
        }
        return true;
    }

    // ==================== Locations ====================

    private static SourceLocation toLocation(Mark mark) {
        return mark == null ? null : new SourceLocation(mark.getLine() + 1, mark.getColumn() + 1);
    }

    private static String describe(MarkedYAMLException e) {
        String problem = e.getProblem();
        return problem != null ? problem : e.getMessage();
    }
}
