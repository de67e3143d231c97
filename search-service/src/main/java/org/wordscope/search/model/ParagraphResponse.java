package org.wordscope.search.model;

import com.google.gson.annotations.SerializedName;
import org.wordscope.core.model.Passage;

import java.time.Instant;

public record ParagraphResponse(
		long id,
		String content,
		@SerializedName("created_at") Instant createdAt
) {
	public static ParagraphResponse from(Passage passage) {
		return new ParagraphResponse(passage.id(), passage.content(), passage.createdAt());
	}
}
