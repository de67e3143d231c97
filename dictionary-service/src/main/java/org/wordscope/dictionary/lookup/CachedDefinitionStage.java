package org.wordscope.dictionary.lookup;

import org.wordscope.core.cache.DefinitionCache;
import org.wordscope.core.error.CacheException;
import org.wordscope.core.lookup.Lookup;
import org.wordscope.core.lookup.LookupStage;

public class CachedDefinitionStage implements LookupStage<String, String> {
	private final DefinitionCache definitionCache;

	public CachedDefinitionStage(DefinitionCache definitionCache) {
		this.definitionCache = definitionCache;
	}

	@Override
	public String name() {
		return "definition-cache";
	}

	@Override
	public Lookup<String> lookup(String word) {
		try {
			return definitionCache.get(word).map(Lookup::hit).orElseGet(Lookup::miss);
		} catch (CacheException e) {
			return Lookup.error(e);
		}
	}
}
