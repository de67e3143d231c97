package org.wordscope.dictionary.service;

import org.wordscope.core.cache.DefinitionCache;
import org.wordscope.core.cache.RankingCache;
import org.wordscope.core.cache.RankingSnapshot;
import org.wordscope.core.error.CacheException;
import org.wordscope.core.error.StoreException;
import org.wordscope.core.error.ValidationException;
import org.wordscope.core.lookup.Lookup;
import org.wordscope.core.lookup.LookupChain;
import org.wordscope.core.model.WordDefinition;
import org.wordscope.core.model.WordFrequency;
import org.wordscope.core.port.DefinitionSource;
import org.wordscope.core.port.WordStore;
import org.wordscope.dictionary.lookup.CachedDefinitionStage;
import org.wordscope.dictionary.lookup.CachedRankingStage;
import org.wordscope.dictionary.lookup.RemoteDefinitionStage;
import org.wordscope.dictionary.lookup.StoreRankingStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Serves the most frequent words together with a definition for each.
 *
 * <p>The ranking is resolved cache first, then from the durable store. Definitions are resolved per
 * word, cache first, then from the external source. A word whose definition cannot be found keeps its
 * place in the ranking with {@link #PLACEHOLDER} as definition.</p>
 */
public class DictionaryResolver {
	private static final Logger logger = LoggerFactory.getLogger(DictionaryResolver.class);

	public static final String PLACEHOLDER = "Definition not found";

	private final WordStore store;
	private final RankingCache rankingCache;
	private final LookupChain<Integer, List<WordFrequency>> rankingChain;
	private final LookupChain<String, String> definitionChain;
	private final int defaultTop;
	private final int maxTop;

	public DictionaryResolver(WordStore store, RankingCache rankingCache, DefinitionCache definitionCache,
							  DefinitionSource definitionSource, int defaultTop, int maxTop) {
		if (maxTop < 1 || defaultTop < 1 || defaultTop > maxTop) {
			throw new IllegalArgumentException("Invalid dictionary limits: default " + defaultTop + ", max " + maxTop);
		}
		this.store = store;
		this.rankingCache = rankingCache;
		this.rankingChain = new LookupChain<>("ranking", List.of(
				new CachedRankingStage(rankingCache),
				new StoreRankingStage(store, rankingCache)));
		this.definitionChain = new LookupChain<>("definition", List.of(
				new CachedDefinitionStage(definitionCache),
				new RemoteDefinitionStage(definitionSource, definitionCache)));
		this.defaultTop = defaultTop;
		this.maxTop = maxTop;
	}

	public List<WordDefinition> topDefinitions() throws DictionaryUnavailableException, EmptyDictionaryException {
		return topDefinitions(defaultTop);
	}

	/**
	 * @param n how many words to return, between 1 and the configured maximum
	 * @return at most {@code n} words, most frequent first
	 * @throws ValidationException if {@code n} is out of range
	 * @throws DictionaryUnavailableException if neither the cache nor the store can provide the ranking
	 * @throws EmptyDictionaryException if no word has been counted yet
	 */
	public List<WordDefinition> topDefinitions(int n) throws DictionaryUnavailableException, EmptyDictionaryException {
		if (n < 1 || n > maxTop) {
			throw new ValidationException("top must be between 1 and " + maxTop + ", got " + n);
		}

		Lookup<List<WordFrequency>> ranking = rankingChain.resolve(n);
		if (ranking.isError()) {
			Exception cause = ranking.error().orElse(null);
			logger.error("Frequency ranking unavailable: {}", cause == null ? "unknown" : cause.getMessage());
			throw new DictionaryUnavailableException("Word frequencies are unavailable", cause);
		}
		if (!ranking.isHit()) {
			throw new EmptyDictionaryException("No words have been ingested yet");
		}

		List<WordFrequency> words = ranking.value();
		List<WordDefinition> definitions = new ArrayList<>(words.size());
		for (WordFrequency word : words.subList(0, Math.min(n, words.size()))) {
			definitions.add(new WordDefinition(word.word(), define(word.word()), word.count()));
		}

		logger.info("Resolved {} dictionary entries (requested {})", definitions.size(), n);
		return definitions;
	}

	private String define(String word) {
		Lookup<String> definition = definitionChain.resolve(word);
		return definition.isHit() ? definition.value() : PLACEHOLDER;
	}

	/**
	 * Load the ranking from the store into the cache. Failures are logged; the first dictionary request
	 * repopulates the cache anyway.
	 *
	 * @return true if the cache now holds a fresh ranking
	 */
	public boolean warmUp() {
		try {
			RankingSnapshot snapshot = rankingCache.refreshFrom(store);
			logger.info("Ranking cache warmed with {} words", snapshot.words().size());
			return true;
		} catch (StoreException | CacheException e) {
			logger.warn("Ranking cache warm-up skipped: {}", e.getMessage());
			return false;
		}
	}

	public int defaultTop() {
		return defaultTop;
	}

	public int maxTop() {
		return maxTop;
	}
}
