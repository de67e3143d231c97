package org.wordscope.core.model;

import org.jetbrains.annotations.NotNull;

import java.io.Serial;
import java.io.Serializable;
import java.time.Instant;

/**
 * A stored text passage. Immutable once the durable store has assigned its id.
 */
public record Passage(
        long id,
        String content,
        Instant createdAt
) implements Serializable {

    @NotNull
    @Override
    public String toString() {
        return String.format("Passage{id=%d, length=%d, createdAt=%s}",
                id, content == null ? 0 : content.length(), createdAt);
    }

    @Serial
    private static final long serialVersionUID = 1L;
}
