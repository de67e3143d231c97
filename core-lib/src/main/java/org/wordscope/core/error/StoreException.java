package org.wordscope.core.error;

/**
 * The durable store (system of record) could not complete an operation.
 */
public class StoreException extends AdapterException {
    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
