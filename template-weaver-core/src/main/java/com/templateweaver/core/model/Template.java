package com.templateweaver.core.model;

import com.templateweaver.core.node.DocumentNode;
import com.templateweaver.core.node.MappingNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed view of an infrastructure template.
 *
 * <p>Only {@code resources} is guaranteed to be populated. Optional sections that are absent
 * from the document are {@code null} for scalar fields, empty mappings for free-form
 * sections, and empty maps for parameters and outputs. Section maps keep document order.
 *
 * @param formatVersion template format version, or {@code null}
 * @param transform transform declaration (a string or a list of strings), or {@code null}
 * @param description template description, or {@code null}
 * @param metadata free-form template metadata
 * @param parameters declared parameters by name
 * @param mappings lookup tables used by {@code Fn::FindInMap}
 * @param conditions named conditions
 * @param resources resources by logical id (never empty in a mapped template)
 * @param outputs declared outputs by name
 * @param globals serverless global defaults
 */
public record Template(
    String formatVersion,
    DocumentNode transform,
    String description,
    MappingNode metadata,
    Map<String, Parameter> parameters,
    MappingNode mappings,
    MappingNode conditions,
    Map<String, Resource> resources,
    Map<String, Output> outputs,
    MappingNode globals
) {
    /**
     * Compact constructor with validation.
     */
    public Template {
        Objects.requireNonNull(resources, "resources must not be null");
        metadata = metadata == null ? MappingNode.empty() : metadata;
        mappings = mappings == null ? MappingNode.empty() : mappings;
        conditions = conditions == null ? MappingNode.empty() : conditions;
        globals = globals == null ? MappingNode.empty() : globals;
        parameters = ordered(parameters);
        resources = ordered(resources);
        outputs = ordered(outputs);
    }

    public Optional<Resource> resource(String logicalId) {
        return Optional.ofNullable(resources.get(logicalId));
    }

    public Optional<Parameter> parameter(String name) {
        return Optional.ofNullable(parameters.get(name));
    }

    public Optional<Output> output(String name) {
        return Optional.ofNullable(outputs.get(name));
    }

    private static <V> Map<String, V> ordered(Map<String, V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
