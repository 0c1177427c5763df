package com.templateweaver.core.identifier;

/**
 * Reason an identifier was rejected.
 */
public enum IdentifierErrorKind {
    /** Null or empty identifier. */
    EMPTY,
    /** Longer than the permitted maximum. */
    TOO_LONG,
    /** Contains characters outside the permitted alphabet or starts with a non-letter. */
    MALFORMED,
    /** Starts with a reserved prefix. */
    RESERVED_PREFIX,
    /** Already registered in the current pass. */
    DUPLICATE
}
