package org.wordscope.core.cache;

import org.wordscope.core.model.WordFrequency;

import java.time.Instant;
import java.util.List;

/**
 * Cached copy of the top rows of the frequency table.
 *
 * @param limit how many rows were requested from the store when the snapshot was taken
 * @param words the rows returned, already ordered by count descending, word ascending
 * @param computedAt when the rows were read from the store
 */
public record RankingSnapshot(
        int limit,
        List<WordFrequency> words,
        Instant computedAt
) {
    public RankingSnapshot {
        words = words == null ? null : List.copyOf(words);
    }

    /**
     * True when this snapshot can answer a top-{@code n} request on its own. A snapshot holding fewer
     * rows than it asked for is complete: the store had no more words at that time.
     */
    public boolean covers(int n) {
        return words.size() >= n || limit >= n;
    }

    public List<WordFrequency> top(int n) {
        return words.size() <= n ? words : words.subList(0, n);
    }
}
