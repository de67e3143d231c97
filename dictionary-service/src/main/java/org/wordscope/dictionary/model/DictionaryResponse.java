package org.wordscope.dictionary.model;

import org.wordscope.core.model.WordDefinition;

import java.util.List;

public record DictionaryResponse(
		List<WordDefinition> definitions
) {}
