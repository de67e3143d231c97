package org.wordscope.dictionary.lookup;

import org.wordscope.core.cache.RankingCache;
import org.wordscope.core.cache.RankingSnapshot;
import org.wordscope.core.error.CacheException;
import org.wordscope.core.error.StoreException;
import org.wordscope.core.lookup.Lookup;
import org.wordscope.core.lookup.LookupStage;
import org.wordscope.core.model.WordFrequency;
import org.wordscope.core.port.WordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Reads the ranking from the durable store and puts it back into the cache on the way out.
 * An empty frequency table is a miss.
 */
public class StoreRankingStage implements LookupStage<Integer, List<WordFrequency>> {
	private static final Logger logger = LoggerFactory.getLogger(StoreRankingStage.class);

	private final WordStore store;
	private final RankingCache rankingCache;

	public StoreRankingStage(WordStore store, RankingCache rankingCache) {
		this.store = store;
		this.rankingCache = rankingCache;
	}

	@Override
	public String name() {
		return "word-store";
	}

	@Override
	public Lookup<List<WordFrequency>> lookup(Integer n) {
		RankingSnapshot snapshot;
		try {
			snapshot = rankingCache.snapshotFrom(store, n);
		} catch (StoreException e) {
			return Lookup.error(e);
		}

		if (snapshot.words().isEmpty()) {
			return Lookup.miss();
		}

		try {
			rankingCache.write(snapshot);
		} catch (CacheException e) {
			logger.warn("Could not repopulate ranking cache: {}", e.getMessage());
		}
		return Lookup.hit(snapshot.top(n));
	}
}
