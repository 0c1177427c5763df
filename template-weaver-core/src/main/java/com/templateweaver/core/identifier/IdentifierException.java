package com.templateweaver.core.identifier;

/**
 * A synthesized identifier or resource name failed verification.
 */
public class IdentifierException extends RuntimeException {

    private final IdentifierErrorKind kind;
    private final String identifier;

    public IdentifierException(IdentifierErrorKind kind, String identifier, String detail) {
        super("invalid identifier '" + identifier + "': " + detail);
        this.kind = kind;
        this.identifier = identifier;
    }

    public IdentifierErrorKind getKind() {
        return kind;
    }

    /**
     * Returns the rejected identifier; may be {@code null} for {@link IdentifierErrorKind#EMPTY}.
     *
     * @return the offending identifier
     */
    public String getIdentifier() {
        return identifier;
    }
}
