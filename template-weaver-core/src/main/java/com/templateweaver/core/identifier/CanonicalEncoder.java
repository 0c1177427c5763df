package com.templateweaver.core.identifier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.templateweaver.core.node.DirectiveNode;
import com.templateweaver.core.node.DocumentNode;
import com.templateweaver.core.node.MappingNode;
import com.templateweaver.core.node.ScalarNode;
import com.templateweaver.core.node.SequenceNode;

import java.math.BigInteger;
import java.util.Map;
import java.util.TreeMap;

/**
 * Encodes a node tree as compact JSON with mapping keys sorted, so that trees that differ
 * only in key order encode, and therefore hash, identically. Directives encode as their
 * long form {@code {"Fn::Name": value}}.
 */
public final class CanonicalEncoder {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private CanonicalEncoder() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static String encode(DocumentNode node) {
        try {
            return MAPPER.writeValueAsString(toJson(node));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode node tree", e);
        }
    }

    private static JsonNode toJson(DocumentNode node) {
        if (node instanceof MappingNode mapping) {
            ObjectNode object = NODES.objectNode();
            for (Map.Entry<String, DocumentNode> entry : new TreeMap<>(mapping.entries()).entrySet()) {
                object.set(entry.getKey(), toJson(entry.getValue()));
            }
            return object;
        }
        if (node instanceof SequenceNode sequence) {
            ArrayNode array = NODES.arrayNode(sequence.size());
            sequence.elements().forEach(element -> array.add(toJson(element)));
            return array;
        }
        if (node instanceof DirectiveNode directive) {
            ObjectNode object = NODES.objectNode();
            object.set(directive.name(), toJson(directive.value()));
            return object;
        }
        Object value = ((ScalarNode) node).value();
        if (value == null) {
            return NODES.nullNode();
        }
        if (value instanceof String text) {
            return NODES.textNode(text);
        }
        if (value instanceof Boolean bool) {
            return NODES.booleanNode(bool);
        }
        if (value instanceof Long number) {
            return NODES.numberNode(number);
        }
        if (value instanceof BigInteger number) {
            return NODES.numberNode(number);
        }
        return NODES.numberNode((Double) value);
    }
}
