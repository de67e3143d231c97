package org.wordscope.core.model;

import java.io.Serial;
import java.io.Serializable;

public record WordFrequency(
        String word,
        long count
) implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;
}
