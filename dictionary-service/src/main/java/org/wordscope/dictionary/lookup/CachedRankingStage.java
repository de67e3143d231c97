package org.wordscope.dictionary.lookup;

import org.wordscope.core.cache.RankingCache;
import org.wordscope.core.cache.RankingSnapshot;
import org.wordscope.core.error.CacheException;
import org.wordscope.core.lookup.Lookup;
import org.wordscope.core.lookup.LookupStage;
import org.wordscope.core.model.WordFrequency;

import java.util.List;
import java.util.Optional;

/**
 * Hits only when the cached snapshot is non-empty and holds at least the requested number of rows
 * (or every row the store had).
 */
public class CachedRankingStage implements LookupStage<Integer, List<WordFrequency>> {
	private final RankingCache rankingCache;

	public CachedRankingStage(RankingCache rankingCache) {
		this.rankingCache = rankingCache;
	}

	@Override
	public String name() {
		return "ranking-cache";
	}

	@Override
	public Lookup<List<WordFrequency>> lookup(Integer n) {
		try {
			Optional<RankingSnapshot> snapshot = rankingCache.read();
			if (snapshot.isEmpty() || snapshot.get().words().isEmpty() || !snapshot.get().covers(n)) {
				return Lookup.miss();
			}
			return Lookup.hit(snapshot.get().top(n));
		} catch (CacheException e) {
			return Lookup.error(e);
		}
	}
}
