package org.wordscope.core.model;

import org.wordscope.core.error.ValidationException;

import java.util.Locale;

/**
 * How the clauses of a multi-term search are combined.
 */
public enum SearchOperator {
    /** Every word must match the same passage. */
    AND,
    /** At least one word must match. */
    OR;

    /**
     * Parses an operator name, ignoring case and surrounding whitespace.
     *
     * @throws ValidationException if the value is not {@code and} or {@code or}
     */
    public static SearchOperator parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Operator is required. Must be one of: and, or.");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "and" -> AND;
            case "or" -> OR;
            default -> throw new ValidationException("Invalid operator '" + value + "'. Must be one of: and, or.");
        };
    }
}
