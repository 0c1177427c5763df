package com.templateweaver.core.parser;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.templateweaver.core.node.DocumentNode;
import com.templateweaver.core.node.LocationTable;
import com.templateweaver.core.node.ScalarNode;
import com.templateweaver.core.node.SequenceNode;
import com.templateweaver.core.node.SourceLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalizes JSON templates.
 *
 * <p>JSON has no shorthand tags, so normalization turns every object whose only key is a
 * canonical directive name into a {@link com.templateweaver.core.node.DirectiveNode}.
 * The document is read with a Jackson streaming parser so that every path can be tied to
 * the line and column of its first token. Duplicate keys and trailing content are
 * rejected.
 *
 * <p>Instances are stateless and may be shared.
 */
public class JsonNormalizer implements FormatNormalizer {

    private static final Logger log = LoggerFactory.getLogger(JsonNormalizer.class);

    private final JsonFactory jsonFactory = JsonFactory.builder()
        .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
        .build();

    @Override
    public TemplateFormat format() {
        return TemplateFormat.JSON;
    }

    @Override
    public NormalizedDocument normalize(String text, boolean trackLocations) {
        LocationTable.Builder locations = trackLocations ? LocationTable.builder() : null;
        try (JsonParser parser = jsonFactory.createParser(text)) {
            if (parser.nextToken() == null) {
                throw new DocumentParseException("document is empty", "", null);
            }
            DocumentNode root = read(parser, "", locations);
            if (parser.nextToken() != null) {
                throw new DocumentParseException("unexpected content after the root value", "",
                    toLocation(parser.currentTokenLocation()));
            }
            LocationTable table = locations == null ? LocationTable.empty() : locations.build();
            log.debug("Normalized JSON document ({} locations tracked)", table.size());
            return new NormalizedDocument(root, TemplateFormat.JSON, table);
        } catch (JsonProcessingException e) {
            throw new DocumentParseException("malformed JSON: " + e.getOriginalMessage(), toLocation(e.getLocation()), e);
        } catch (IOException e) {
            throw new DocumentParseException("unable to read JSON: " + e.getMessage(), null, e);
        }
    }

    /**
     * Normalizes a JSON tree that has already been parsed with Jackson. No locations are
     * available for such a tree.
     *
     * @param tree parsed JSON tree
     * @return normalized document with an empty location table
     */
    public NormalizedDocument normalize(JsonNode tree) {
        return new NormalizedDocument(convert(tree), TemplateFormat.JSON, LocationTable.empty());
    }

    private DocumentNode read(JsonParser parser, String path, LocationTable.Builder locations) throws IOException {
        if (locations != null) {
            SourceLocation location = toLocation(parser.currentTokenLocation());
            if (location != null) {
                locations.track(path, location);
            }
        }
        JsonToken token = parser.currentToken();
        switch (token) {
            case START_OBJECT -> {
                Map<String, DocumentNode> entries = new LinkedHashMap<>();
                while (parser.nextToken() == JsonToken.FIELD_NAME) {
                    String key = parser.currentName();
                    parser.nextToken();
                    entries.put(key, read(parser, LocationTable.child(path, key), locations));
                }
                return CanonicalForms.mapping(entries);
            }
            case START_ARRAY -> {
                List<DocumentNode> elements = new ArrayList<>();
                while (parser.nextToken() != JsonToken.END_ARRAY) {
                    elements.add(read(parser, LocationTable.element(path, elements.size()), locations));
                }
                return new SequenceNode(elements);
            }
            case VALUE_STRING -> {
                return ScalarNode.of(parser.getText());
            }
            case VALUE_NUMBER_INT -> {
                JsonParser.NumberType type = parser.getNumberType();
                return type == JsonParser.NumberType.BIG_INTEGER
                    ? new ScalarNode(parser.getBigIntegerValue())
                    : ScalarNode.of(parser.getLongValue());
            }
            case VALUE_NUMBER_FLOAT -> {
                return ScalarNode.of(parser.getDoubleValue());
            }
            case VALUE_TRUE -> {
                return ScalarNode.of(true);
            }
            case VALUE_FALSE -> {
                return ScalarNode.of(false);
            }
            case VALUE_NULL -> {
                return ScalarNode.nullValue();
            }
            default -> throw new DocumentParseException("unexpected token " + token, path,
                toLocation(parser.currentTokenLocation()));
        }
    }

    private static DocumentNode convert(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return ScalarNode.nullValue();
        }
        if (node.isObject()) {
            Map<String, DocumentNode> entries = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                entries.put(field.getKey(), convert(field.getValue()));
            }
            return CanonicalForms.mapping(entries);
        }
        if (node.isArray()) {
            List<DocumentNode> elements = new ArrayList<>(node.size());
            node.forEach(element -> elements.add(convert(element)));
            return new SequenceNode(elements);
        }
        if (node.isBoolean()) {
            return ScalarNode.of(node.booleanValue());
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToLong() ? ScalarNode.of(node.longValue()) : new ScalarNode(node.bigIntegerValue());
        }
        if (node.isNumber()) {
            return ScalarNode.of(node.doubleValue());
        }
        return ScalarNode.of(node.asText());
    }

    private static SourceLocation toLocation(JsonLocation location) {
        if (location == null || location.getLineNr() < 1 || location.getColumnNr() < 1) {
            return null;
        }
        return new SourceLocation(location.getLineNr(), location.getColumnNr());
    }
}
