package org.wordscope.core.error;

/**
 * The cache store is unreachable or rejected an operation. Callers treat it as a miss.
 */
public class CacheException extends AdapterException {
    public CacheException(String message) {
        super(message);
    }

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
