package com.templateweaver.core.parser;

import com.templateweaver.core.TemplateException;
import com.templateweaver.core.node.SourceLocation;

/**
 * A YAML node carries a local tag that is not in the directive tag table.
 */
public class UnrecognizedDirectiveException extends TemplateException {

    private final String tag;

    public UnrecognizedDirectiveException(String tag, String path, SourceLocation location) {
        super("unrecognized directive tag '" + tag + "'", path, location);
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
