package com.templateweaver.core.directive;

import com.templateweaver.core.TemplateException;

import java.util.List;

/**
 * Raised when a caller treats directive shape errors as fatal.
 *
 * @see DirectiveShapeValidator#requireValid(com.templateweaver.core.node.DocumentNode)
 */
public class DirectiveShapeException extends TemplateException {

    private final transient List<DirectiveShapeError> errors;

    public DirectiveShapeException(List<DirectiveShapeError> errors) {
        super(summarize(errors), errors.isEmpty() ? "" : errors.get(0).path(),
            errors.isEmpty() ? null : errors.get(0).location());
        this.errors = List.copyOf(errors);
    }

    public List<DirectiveShapeError> getErrors() {
        return errors;
    }

    private static String summarize(List<DirectiveShapeError> errors) {
        if (errors.isEmpty()) {
            return "directive shape errors";
        }
        if (errors.size() == 1) {
            return errors.get(0).message();
        }
        return errors.size() + " directive shape errors, first: " + errors.get(0).message();
    }
}
