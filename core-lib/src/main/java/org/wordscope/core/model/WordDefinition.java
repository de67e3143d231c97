package org.wordscope.core.model;

/**
 * One row of the dictionary view: a frequent word, its definition and how often it was seen.
 */
public record WordDefinition(
        String word,
        String definition,
        long frequency
) {}
