package com.templateweaver.core.identifier;

/**
 * Outcome of comparing the deployment ids derived from two API definition bodies.
 */
public enum IdChange {
    CHANGED,
    UNCHANGED
}
