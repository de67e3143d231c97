package org.wordscope.core.error;

/**
 * A request was rejected before any I/O because its arguments are invalid.
 */
public class ValidationException extends IllegalArgumentException {
    public ValidationException(String message) {
        super(message);
    }
}
