package org.wordscope.core.error;

/**
 * The search index could not index or query documents.
 */
public class IndexException extends AdapterException {
    public IndexException(String message) {
        super(message);
    }

    public IndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
