package com.templateweaver.core.model;

import com.templateweaver.core.node.DocumentNode;
import com.templateweaver.core.node.MappingNode;

import java.util.List;
import java.util.Objects;

/**
 * A template resource.
 *
 * @param type resource type, never blank
 * @param properties resource properties
 * @param metadata resource metadata
 * @param dependsOn logical ids this resource depends on
 * @param condition name of the condition guarding the resource, or {@code null}
 * @param deletionPolicy deletion policy, a string or a directive such as {@code Fn::If}, or {@code null}
 * @param updateReplacePolicy update-replace policy, a string or a directive, or {@code null}
 * @param updatePolicy update policy
 */
public record Resource(
    String type,
    MappingNode properties,
    MappingNode metadata,
    List<String> dependsOn,
    String condition,
    DocumentNode deletionPolicy,
    DocumentNode updateReplacePolicy,
    MappingNode updatePolicy
) {
    /**
     * Compact constructor with validation.
     */
    public Resource {
        Objects.requireNonNull(type, "type must not be null");
        if (type.isBlank()) {
            throw new IllegalArgumentException("type must not be blank");
        }
        properties = properties == null ? MappingNode.empty() : properties;
        metadata = metadata == null ? MappingNode.empty() : metadata;
        updatePolicy = updatePolicy == null ? MappingNode.empty() : updatePolicy;
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }

    public Resource(String type, MappingNode properties) {
        this(type, properties, null, null, null, null, null, null);
    }
}
