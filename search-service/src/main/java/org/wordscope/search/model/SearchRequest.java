package org.wordscope.search.model;

import java.util.List;

public record SearchRequest(
		List<String> words,
		String operator
) {}
