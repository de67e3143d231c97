package org.wordscope.ingestion.service;

import org.wordscope.core.cache.RankingCache;
import org.wordscope.core.error.CacheException;
import org.wordscope.core.error.IndexException;
import org.wordscope.core.error.StoreException;
import org.wordscope.core.error.TextSourceException;
import org.wordscope.core.error.ValidationException;
import org.wordscope.core.model.Passage;
import org.wordscope.core.port.SearchIndex;
import org.wordscope.core.port.TextSource;
import org.wordscope.core.port.WordStore;
import org.wordscope.core.text.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Takes one passage through persist, count, index and ranking refresh, in that order.
 *
 * <p>The durable store is the system of record: a failure to persist the passage or to apply its
 * word counts fails the ingestion. The search index and the ranking cache are projections; their
 * failures are logged and the passage still counts as ingested.</p>
 */
public class IngestionPipeline {
	private static final Logger logger = LoggerFactory.getLogger(IngestionPipeline.class);

	private final WordStore store;
	private final SearchIndex index;
	private final RankingCache rankingCache;
	private final TextNormalizer normalizer;
	private final TextSource textSource;

	public IngestionPipeline(WordStore store, SearchIndex index, RankingCache rankingCache,
							 TextNormalizer normalizer, TextSource textSource) {
		this.store = store;
		this.index = index;
		this.rankingCache = rankingCache;
		this.normalizer = normalizer;
		this.textSource = textSource;
	}

	/**
	 * Pull one passage from the text source and ingest it
	 */
	public Passage fetchAndIngest() throws IngestionFailedException {
		String text;
		try {
			text = textSource.fetchPassage();
		} catch (TextSourceException e) {
			logger.error("Failed to fetch passage: {}", e.getMessage());
			throw new IngestionFailedException("Text source failed: " + e.getMessage(), e);
		}

		if (text == null || text.isBlank()) {
			throw new IngestionFailedException("Text source returned an empty passage");
		}
		return ingest(text);
	}

	public Passage ingest(String content) throws IngestionFailedException {
		if (content == null || content.isBlank()) {
			throw new ValidationException("Passage content must not be empty");
		}

		Passage passage;
		try {
			passage = store.createPassage(content);
		} catch (StoreException e) {
			logger.error("Failed to persist passage: {}", e.getMessage());
			throw new IngestionFailedException("Failed to persist passage: " + e.getMessage(), e);
		}
		logger.info("Persisted passage {} ({} chars)", passage.id(), content.length());

		Map<String, Integer> occurrences = normalizer.countOccurrences(content);
		try {
			store.incrementWords(occurrences);
		} catch (StoreException e) {
			// The passage row stays; its words are simply not counted
			logger.error("Failed to count words of passage {}: {}", passage.id(), e.getMessage());
			throw new IngestionFailedException(
					"Passage " + passage.id() + " stored but word counts failed: " + e.getMessage(), e);
		}
		logger.debug("Counted {} distinct words for passage {}", occurrences.size(), passage.id());

		indexPassage(passage);
		refreshRanking();

		logger.info("Ingested passage {}: {} distinct words", passage.id(), occurrences.size());
		return passage;
	}

	private void indexPassage(Passage passage) {
		try {
			index.indexDocument(passage);
		} catch (IndexException e) {
			logger.warn("Passage {} not indexed, it will be missing from search results: {}", passage.id(), e.getMessage());
		}
	}

	private void refreshRanking() {
		try {
			rankingCache.refreshFrom(store);
		} catch (StoreException e) {
			logger.warn("Could not read ranking for cache refresh, dropping cached ranking: {}", e.getMessage());
			invalidateRanking();
		} catch (CacheException e) {
			logger.warn("Ranking cache refresh failed: {}", e.getMessage());
		}
	}

	private void invalidateRanking() {
		try {
			rankingCache.invalidate();
		} catch (CacheException e) {
			logger.warn("Ranking cache invalidation failed, entry expires with its TTL: {}", e.getMessage());
		}
	}
}
