package com.templateweaver.core.model;

import com.templateweaver.core.node.DocumentNode;

import java.util.List;
import java.util.Objects;

/**
 * A template parameter declaration.
 *
 * @param type parameter type, e.g. {@code String} or {@code Number}
 * @param defaultValue default value, or {@code null}
 * @param description description, or {@code null}
 * @param allowedValues permitted values (empty when unrestricted)
 * @param allowedPattern regular expression the value must match, or {@code null}
 * @param constraintDescription message shown when a constraint fails, or {@code null}
 * @param minLength minimum string length, or {@code null}
 * @param maxLength maximum string length, or {@code null}
 * @param minValue minimum numeric value, or {@code null}
 * @param maxValue maximum numeric value, or {@code null}
 * @param noEcho whether the value is masked
 */
public record Parameter(
    String type,
    DocumentNode defaultValue,
    String description,
    List<DocumentNode> allowedValues,
    String allowedPattern,
    String constraintDescription,
    Long minLength,
    Long maxLength,
    Double minValue,
    Double maxValue,
    boolean noEcho
) {
    /**
     * Compact constructor with validation.
     */
    public Parameter {
        Objects.requireNonNull(type, "type must not be null");
        allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
    }
}
