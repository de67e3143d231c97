package org.wordscope.core.port;

import org.wordscope.core.model.Passage;

import java.util.List;

/**
 * Ranked page of index matches plus the total number of matching documents.
 */
public record IndexHits(List<Hit> hits, long total) {

	public record Hit(Passage passage, float score) {}

	public static IndexHits empty() {
		return new IndexHits(List.of(), 0);
	}
}
