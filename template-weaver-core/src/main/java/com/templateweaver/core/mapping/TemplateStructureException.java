package com.templateweaver.core.mapping;

import com.templateweaver.core.TemplateException;
import com.templateweaver.core.node.SourceLocation;

/**
 * A section or entry has the wrong node kind, e.g. a {@code Parameters} section that is a
 * list instead of a mapping.
 */
public class TemplateStructureException extends TemplateException {

    public TemplateStructureException(String detail, String path, SourceLocation location) {
        super(detail, path, location);
    }
}
