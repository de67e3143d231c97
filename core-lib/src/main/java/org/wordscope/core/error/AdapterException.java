package org.wordscope.core.error;

import java.io.IOException;

/**
 * Failure of an external collaborator (durable store, cache, search index, remote HTTP source).
 *
 * <p>Checked on purpose: every call site has to decide whether the failure is fatal for its
 * operation or only degrades the answer.</p>
 */
public class AdapterException extends IOException {
    public AdapterException(String message) {
        super(message);
    }

    public AdapterException(String message, Throwable cause) {
        super(message, cause);
    }
}
