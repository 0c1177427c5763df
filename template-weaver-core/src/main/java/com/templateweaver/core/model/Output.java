package com.templateweaver.core.model;

import com.templateweaver.core.node.DocumentNode;

/**
 * A template output.
 *
 * @param description description, or {@code null}
 * @param value output value, may contain directives; {@code null} when the document omits it
 * @param condition guarding condition name, or {@code null}
 * @param export export declaration, or {@code null}
 */
public record Output(String description, DocumentNode value, String condition, Export export) {
}
