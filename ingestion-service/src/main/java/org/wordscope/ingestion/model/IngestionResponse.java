package org.wordscope.ingestion.model;

import org.wordscope.core.model.Passage;

import java.time.Instant;

public record IngestionResponse(
		Long id,
		String content,
		Instant createdAt,
		String status,
		String message
) {
	public static IngestionResponse success(Passage passage) {
		return new IngestionResponse(passage.id(), passage.content(), passage.createdAt(), "ingested", null);
	}

	public static IngestionResponse failure(String message) {
		return new IngestionResponse(null, null, null, "failed", message);
	}
}
