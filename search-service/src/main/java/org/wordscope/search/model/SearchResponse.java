package org.wordscope.search.model;

import java.util.List;

public record SearchResponse(
		List<ParagraphResponse> paragraphs,
		long total
) {
	public static SearchResponse from(SearchResult result) {
		return new SearchResponse(result.passages().stream().map(ParagraphResponse::from).toList(), result.total());
	}
}
