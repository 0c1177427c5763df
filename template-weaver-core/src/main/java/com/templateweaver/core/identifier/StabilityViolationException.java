package com.templateweaver.core.identifier;

/**
 * Derived ids did not follow their inputs: the id stayed the same although the input
 * changed, or changed although the input did not.
 */
public class StabilityViolationException extends RuntimeException {

    public StabilityViolationException(String message) {
        super(message);
    }
}
