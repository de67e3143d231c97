package org.wordscope.search.model;

import org.wordscope.core.model.Passage;

import java.util.List;

/**
 * One page of matching passages in index relevance order.
 *
 * @param total number of passages matching the query, which may exceed the page
 */
public record SearchResult(
		List<Passage> passages,
		long total
) {}
