package com.templateweaver.core.arn;

/**
 * Reason an ARN was rejected.
 */
public enum ArnErrorKind {
    EMPTY,
    MALFORMED,
    UNSUPPORTED_PARTITION,
    /** A segment differs from the expected value. */
    FIELD_MISMATCH
}
