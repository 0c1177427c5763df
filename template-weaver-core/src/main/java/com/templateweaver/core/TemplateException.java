package com.templateweaver.core;

import com.templateweaver.core.node.SourceLocation;

import java.util.Optional;

/**
 * Base class for fatal errors raised while normalizing or mapping a template.
 *
 * <p>Every error carries the path of the offending node and, when location tracking
 * was enabled, its line and column, so that it can be acted on without a separate
 * diagnostic pass. The message renders as {@code <path>: <detail> (line L, column C)}.
 */
public abstract class TemplateException extends RuntimeException {

    private final String detail;
    private final String path;
    private final transient SourceLocation location;

    protected TemplateException(String detail, String path, SourceLocation location) {
        this(detail, path, location, null);
    }

    protected TemplateException(String detail, String path, SourceLocation location, Throwable cause) {
        super(render(detail, path, location), cause);
        this.detail = detail;
        this.path = path == null ? "" : path;
        this.location = location;
    }

    /**
     * Returns the message without path and location decoration.
     *
     * @return error detail
     */
    public String getDetail() {
        return detail;
    }

    /**
     * Returns the dotted/bracketed path of the offending node; empty for the document root.
     *
     * @return node path
     */
    public String getPath() {
        return path;
    }

    public Optional<SourceLocation> getLocation() {
        return Optional.ofNullable(location);
    }

    private static String render(String detail, String path, SourceLocation location) {
        StringBuilder message = new StringBuilder();
        if (path != null && !path.isEmpty()) {
            message.append(path).append(": ");
        }
        message.append(detail);
        if (location != null) {
            message.append(" (").append(location).append(')');
        }
        return message.toString();
    }
}
