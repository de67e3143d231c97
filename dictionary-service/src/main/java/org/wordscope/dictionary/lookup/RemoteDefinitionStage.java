package org.wordscope.dictionary.lookup;

import org.wordscope.core.cache.DefinitionCache;
import org.wordscope.core.error.CacheException;
import org.wordscope.core.error.DefinitionException;
import org.wordscope.core.lookup.Lookup;
import org.wordscope.core.lookup.LookupStage;
import org.wordscope.core.port.DefinitionSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Asks the external definition source and writes found definitions through to the cache.
 */
public class RemoteDefinitionStage implements LookupStage<String, String> {
	private static final Logger logger = LoggerFactory.getLogger(RemoteDefinitionStage.class);

	private final DefinitionSource source;
	private final DefinitionCache definitionCache;

	public RemoteDefinitionStage(DefinitionSource source, DefinitionCache definitionCache) {
		this.source = source;
		this.definitionCache = definitionCache;
	}

	@Override
	public String name() {
		return "definition-source";
	}

	@Override
	public Lookup<String> lookup(String word) {
		Optional<String> definition;
		try {
			definition = source.lookup(word);
		} catch (DefinitionException e) {
			return Lookup.error(e);
		}

		if (definition.isEmpty() || definition.get().isBlank()) {
			return Lookup.miss();
		}

		try {
			definitionCache.put(word, definition.get());
		} catch (CacheException e) {
			logger.warn("Could not cache definition of '{}': {}", word, e.getMessage());
		}
		return Lookup.hit(definition.get());
	}
}
