package com.templateweaver.core.mapping;

import com.templateweaver.core.model.Export;
import com.templateweaver.core.model.Output;
import com.templateweaver.core.model.Parameter;
import com.templateweaver.core.model.Resource;
import com.templateweaver.core.model.Template;
import com.templateweaver.core.node.DocumentNode;
import com.templateweaver.core.node.LocationTable;
import com.templateweaver.core.node.MappingNode;
import com.templateweaver.core.node.ScalarNode;
import com.templateweaver.core.node.SequenceNode;
import com.templateweaver.core.node.SourceLocation;
import com.templateweaver.core.parser.NormalizedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Projects a normalized document tree into the typed {@link Template} model.
 *
 * <p>Only what the model cannot do without is enforced: the root must be a mapping,
 * {@code Resources} must exist as a mapping, and every resource must declare a non-empty
 * {@code Type}. The first violation is thrown, located when the document tracked locations.
 * Every other field is copied through; a field whose node kind the model cannot hold, such
 * as a list where a description is expected, is left out and logged at debug level.
 * Checking directive values is the job of
 * {@link com.templateweaver.core.directive.DirectiveShapeValidator}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * NormalizedDocument document = new TemplateNormalizer(true).normalize(bytes);
 * Template template = new TemplateMapper().map(document);
 * }</pre>
 *
 * @since 1.0.0
 */
public class TemplateMapper {

    private static final Logger log = LoggerFactory.getLogger(TemplateMapper.class);

    static final String FORMAT_VERSION = "AWSTemplateFormatVersion";
    static final String TRANSFORM = "Transform";
    static final String DESCRIPTION = "Description";
    static final String METADATA = "Metadata";
    static final String PARAMETERS = "Parameters";
    static final String MAPPINGS = "Mappings";
    static final String CONDITIONS = "Conditions";
    static final String RESOURCES = "Resources";
    static final String OUTPUTS = "Outputs";
    static final String GLOBALS = "Globals";

    /**
     * Maps a normalized document, using its location table to locate errors.
     *
     * @param document normalized document
     * @return template model
     * @throws MissingRequiredFieldException if {@code Resources} or a resource {@code Type} is absent
     * @throws TemplateStructureException if the root or {@code Resources} is not a mapping
     */
    public Template map(NormalizedDocument document) {
        Objects.requireNonNull(document, "document must not be null");
        return map(document.root(), document.locations());
    }

    /**
     * Maps a normalized tree without location information.
     *
     * @param root normalized root node
     * @return template model
     */
    public Template map(DocumentNode root) {
        return map(root, LocationTable.empty());
    }

    private Template map(DocumentNode root, LocationTable locations) {
        Objects.requireNonNull(root, "root must not be null");
        Mapping mapping = new Mapping(locations);
        if (!(root instanceof MappingNode top)) {
            throw new TemplateStructureException("template root must be a mapping, got " + root.describe(),
                "", locations.get("").orElse(null));
        }

        DocumentNode resourcesNode = top.get(RESOURCES).orElseThrow(() ->
            new MissingRequiredFieldException("template has no Resources section", RESOURCES, locations.get("").orElse(null)));

        Template template = new Template(
            mapping.optionalString(top, "", FORMAT_VERSION),
            top.get(TRANSFORM).orElse(null),
            mapping.optionalString(top, "", DESCRIPTION),
            mapping.optionalMapping(top, "", METADATA),
            mapping.parameters(top),
            mapping.optionalMapping(top, "", MAPPINGS),
            mapping.optionalMapping(top, "", CONDITIONS),
            mapping.resources(resourcesNode),
            mapping.outputs(top),
            mapping.optionalMapping(top, "", GLOBALS)
        );
        log.debug("Mapped template: {} resources, {} parameters, {} outputs",
            template.resources().size(), template.parameters().size(), template.outputs().size());
        return template;
    }

    // ==================== Section mapping ====================

    private static final class Mapping {

        private final LocationTable locations;

        Mapping(LocationTable locations) {
            this.locations = locations;
        }

        Map<String, Parameter> parameters(MappingNode top) {
            MappingNode section = optionalMapping(top, "", PARAMETERS);
            Map<String, Parameter> parameters = new LinkedHashMap<>();
            section.entries().forEach((name, node) -> {
                String path = LocationTable.child(PARAMETERS, name);
                if (!(node instanceof MappingNode entry)) {
                    skipped(path, node);
                    return;
                }
                String type = optionalString(entry, path, "Type");
                parameters.put(name, new Parameter(
                    type == null ? "String" : type,
                    entry.get("Default").orElse(null),
                    optionalString(entry, path, "Description"),
                    optionalList(entry, path, "AllowedValues"),
                    optionalString(entry, path, "AllowedPattern"),
                    optionalString(entry, path, "ConstraintDescription"),
                    optionalLong(entry, path, "MinLength"),
                    optionalLong(entry, path, "MaxLength"),
                    optionalDouble(entry, path, "MinValue"),
                    optionalDouble(entry, path, "MaxValue"),
                    optionalBoolean(entry, path, "NoEcho")
                ));
            });
            return parameters;
        }

        Map<String, Resource> resources(DocumentNode node) {
            if (!(node instanceof MappingNode section)) {
                throw new TemplateStructureException("Resources section must be a mapping, got " + node.describe(),
                    RESOURCES, locate(RESOURCES));
            }
            Map<String, Resource> resources = new LinkedHashMap<>();
            section.entries().forEach((logicalId, value) -> {
                String path = LocationTable.child(RESOURCES, logicalId);
                MappingNode entry = value instanceof MappingNode mapping ? mapping : MappingNode.empty();
                resources.put(logicalId, new Resource(
                    requireType(entry, path),
                    optionalMapping(entry, path, "Properties"),
                    optionalMapping(entry, path, "Metadata"),
                    dependsOn(entry, path),
                    optionalString(entry, path, "Condition"),
                    entry.get("DeletionPolicy").orElse(null),
                    entry.get("UpdateReplacePolicy").orElse(null),
                    optionalMapping(entry, path, "UpdatePolicy")
                ));
            });
            return resources;
        }

        Map<String, Output> outputs(MappingNode top) {
            MappingNode section = optionalMapping(top, "", OUTPUTS);
            Map<String, Output> outputs = new LinkedHashMap<>();
            section.entries().forEach((name, node) -> {
                String path = LocationTable.child(OUTPUTS, name);
                if (!(node instanceof MappingNode entry)) {
                    skipped(path, node);
                    return;
                }
                Export export = null;
                DocumentNode exportNode = entry.get("Export").orElse(null);
                if (exportNode instanceof MappingNode exportMapping) {
                    export = new Export(exportMapping.get("Name").orElse(null));
                } else if (exportNode != null) {
                    skipped(LocationTable.child(path, "Export"), exportNode);
                }
                outputs.put(name, new Output(
                    optionalString(entry, path, "Description"),
                    entry.get("Value").orElse(null),
                    optionalString(entry, path, "Condition"),
                    export
                ));
            });
            return outputs;
        }

        // ==================== Field helpers ====================

        String requireType(MappingNode entry, String path) {
            String typePath = LocationTable.child(path, "Type");
            DocumentNode type = entry.get("Type").orElse(null);
            if (type == null) {
                throw new MissingRequiredFieldException("resource has no Type", typePath, locate(path));
            }
            if (!(type instanceof ScalarNode scalar) || !scalar.isString() || scalar.asText().isBlank()) {
                throw new MissingRequiredFieldException("resource Type must be a non-empty string, got " + type.describe(),
                    typePath, locate(typePath));
            }
            return scalar.asText();
        }

        /**
         * Reads {@code DependsOn} as a single id or a list of ids. Entries that are not
         * strings are left out.
         */
        List<String> dependsOn(MappingNode entry, String path) {
            DocumentNode node = entry.get("DependsOn").orElse(null);
            if (node == null) {
                return List.of();
            }
            String fieldPath = LocationTable.child(path, "DependsOn");
            if (node instanceof ScalarNode scalar && scalar.isString()) {
                return List.of(scalar.asText());
            }
            if (node instanceof SequenceNode sequence) {
                List<String> ids = new ArrayList<>(sequence.size());
                for (int i = 0; i < sequence.size(); i++) {
                    if (sequence.get(i) instanceof ScalarNode scalar && scalar.isString()) {
                        ids.add(scalar.asText());
                    } else {
                        skipped(LocationTable.element(fieldPath, i), sequence.get(i));
                    }
                }
                return ids;
            }
            skipped(fieldPath, node);
            return List.of();
        }

        MappingNode optionalMapping(MappingNode parent, String parentPath, String key) {
            DocumentNode node = parent.get(key).orElse(null);
            if (node instanceof MappingNode mapping) {
                return mapping;
            }
            if (node != null) {
                skipped(LocationTable.child(parentPath, key), node);
            }
            return MappingNode.empty();
        }

        String optionalString(MappingNode parent, String parentPath, String key) {
            DocumentNode node = parent.get(key).orElse(null);
            if (node == null) {
                return null;
            }
            if (node instanceof ScalarNode scalar && !scalar.isNull()) {
                return scalar.asText();
            }
            skipped(LocationTable.child(parentPath, key), node);
            return null;
        }

        List<DocumentNode> optionalList(MappingNode parent, String parentPath, String key) {
            DocumentNode node = parent.get(key).orElse(null);
            if (node instanceof SequenceNode sequence) {
                return sequence.elements();
            }
            if (node != null) {
                skipped(LocationTable.child(parentPath, key), node);
            }
            return List.of();
        }

        Long optionalLong(MappingNode parent, String parentPath, String key) {
            Double value = optionalDouble(parent, parentPath, key);
            return value == null ? null : value.longValue();
        }

        /**
         * Reads a number given either as a number or as a numeric string.
         */
        Double optionalDouble(MappingNode parent, String parentPath, String key) {
            DocumentNode node = parent.get(key).orElse(null);
            if (node == null) {
                return null;
            }
            if (node instanceof ScalarNode scalar) {
                if (scalar.isNumber()) {
                    return ((Number) scalar.value()).doubleValue();
                }
                if (scalar.isString()) {
                    try {
                        return Double.valueOf(scalar.asText().trim());
                    } catch (NumberFormatException e) {
                        log.debug("Ignoring non-numeric {} '{}'", LocationTable.child(parentPath, key), scalar.asText());
                        return null;
                    }
                }
            }
            skipped(LocationTable.child(parentPath, key), node);
            return null;
        }

        boolean optionalBoolean(MappingNode parent, String parentPath, String key) {
            DocumentNode node = parent.get(key).orElse(null);
            if (node == null) {
                return false;
            }
            if (node instanceof ScalarNode scalar) {
                if (scalar.isBoolean()) {
                    return (Boolean) scalar.value();
                }
                if (scalar.isString()) {
                    return Boolean.parseBoolean(scalar.asText().trim());
                }
            }
            skipped(LocationTable.child(parentPath, key), node);
            return false;
        }

        void skipped(String path, DocumentNode node) {
            log.debug("Ignoring {} at {}", node.describe(), path);
        }

        SourceLocation locate(String path) {
            return locations.get(path).orElse(null);
        }
    }
}
