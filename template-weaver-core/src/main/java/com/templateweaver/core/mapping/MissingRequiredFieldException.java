package com.templateweaver.core.mapping;

import com.templateweaver.core.TemplateException;
import com.templateweaver.core.node.SourceLocation;

/**
 * A required section or field is absent: the {@code Resources} section or a resource's
 * {@code Type}.
 */
public class MissingRequiredFieldException extends TemplateException {

    public MissingRequiredFieldException(String detail, String path, SourceLocation location) {
        super(detail, path, location);
    }
}
