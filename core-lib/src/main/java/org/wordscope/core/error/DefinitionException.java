package org.wordscope.core.error;

/**
 * The external definition source failed or answered with a malformed payload.
 */
public class DefinitionException extends AdapterException {
    public DefinitionException(String message) {
        super(message);
    }

    public DefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
