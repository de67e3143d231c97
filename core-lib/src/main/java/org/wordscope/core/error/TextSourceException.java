package org.wordscope.core.error;

/**
 * The external passage source returned no usable text.
 */
public class TextSourceException extends AdapterException {
    public TextSourceException(String message) {
        super(message);
    }

    public TextSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
