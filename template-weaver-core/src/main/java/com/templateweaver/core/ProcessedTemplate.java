package com.templateweaver.core;

import com.templateweaver.core.directive.DirectiveShapeError;
import com.templateweaver.core.model.Template;
import com.templateweaver.core.parser.NormalizedDocument;

import java.util.List;
import java.util.Objects;

/**
 * Result of processing one template.
 *
 * @param document normalized document
 * @param template mapped template model
 * @param directiveErrors directive shape violations, empty when every directive is well-formed
 */
public record ProcessedTemplate(NormalizedDocument document, Template template, List<DirectiveShapeError> directiveErrors) {

    /**
     * Compact constructor with validation.
     */
    public ProcessedTemplate {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(template, "template must not be null");
        directiveErrors = directiveErrors == null ? List.of() : List.copyOf(directiveErrors);
    }

    public boolean hasDirectiveErrors() {
        return !directiveErrors.isEmpty();
    }
}
