package com.templateweaver.core.identifier;

import java.util.regex.Pattern;

/**
 * Validation of physical resource names and stack names: 1 to {@value #MAX_LENGTH}
 * characters, starting with a letter, containing only letters, digits and hyphens.
 */
public final class ResourceNames {

    public static final int MAX_LENGTH = 128;

    private static final Pattern NAME = Pattern.compile("[a-zA-Z][-a-zA-Z0-9]*");

    private ResourceNames() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @throws IdentifierException if the name is invalid
     */
    public static void validateResourceName(String name) {
        validate(name, "resource name");
    }

    /**
     * @throws IdentifierException if the name is invalid
     */
    public static void validateStackName(String name) {
        validate(name, "stack name");
    }

    private static void validate(String name, String what) {
        if (name == null || name.isEmpty()) {
            throw new IdentifierException(IdentifierErrorKind.EMPTY, name, what + " must not be empty");
        }
        if (name.length() > MAX_LENGTH) {
            throw new IdentifierException(IdentifierErrorKind.TOO_LONG, name,
                what + " exceeds maximum length of " + MAX_LENGTH + " characters");
        }
        if (!NAME.matcher(name).matches()) {
            throw new IdentifierException(IdentifierErrorKind.MALFORMED, name,
                what + " must start with a letter and contain only letters, digits and hyphens");
        }
    }
}
