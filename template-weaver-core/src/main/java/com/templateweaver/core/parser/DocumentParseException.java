package com.templateweaver.core.parser;

import com.templateweaver.core.TemplateException;
import com.templateweaver.core.node.SourceLocation;

/**
 * The input bytes are not a well-formed document. Parsing stops at the first such error
 * and no partial tree is returned.
 */
public class DocumentParseException extends TemplateException {

    public DocumentParseException(String detail, String path, SourceLocation location) {
        super(detail, path, location);
    }

    public DocumentParseException(String detail, SourceLocation location, Throwable cause) {
        super(detail, "", location, cause);
    }
}
