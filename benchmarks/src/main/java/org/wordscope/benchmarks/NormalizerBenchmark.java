package org.wordscope.benchmarks;

import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.wordscope.core.cache.RankingCache;
import org.wordscope.core.cache.RankingSnapshot;
import org.wordscope.core.error.CacheException;
import org.wordscope.core.error.StoreException;
import org.wordscope.core.text.TextNormalizer;
import org.wordscope.testkit.InMemoryCacheStore;
import org.wordscope.testkit.InMemoryWordStore;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Benchmarks for pure in-process work on the ingestion and dictionary paths (no I/O)
 * Tests: normalization, occurrence counting, ranking snapshot encode/decode
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class NormalizerBenchmark {

	@Param({"50", "500", "5000"})
	private int passageWords;

	@Param({"10", "100"})
	private int rankingSize;

	private TextNormalizer normalizer;
	private String passage;
	private RankingCache rankingCache;
	private InMemoryWordStore store;

	@Setup(Level.Trial)
	public void setup() throws StoreException, CacheException {
		normalizer = TextNormalizer.withDefaults();
		passage = BenchmarkText.passage(passageWords, 42L);

		store = new InMemoryWordStore();
		for (int i = 0; i < rankingSize * 2; i++) {
			store.put("word" + i, 10_000L - i);
		}
		rankingCache = new RankingCache(new InMemoryCacheStore(), 600, rankingSize);
		rankingCache.refreshFrom(store);
	}

	/**
	 * Benchmark: Normalize one passage into its word list
	 */
	@Benchmark
	public void normalizePassage(Blackhole blackhole) {
		blackhole.consume(normalizer.normalize(passage));
	}

	/**
	 * Benchmark: Count occurrences, the input of the store increments
	 */
	@Benchmark
	public void countOccurrences(Blackhole blackhole) {
		blackhole.consume(normalizer.countOccurrences(passage));
	}

	/**
	 * Benchmark: Decode the cached ranking, the dictionary fast path
	 */
	@Benchmark
	public void readRankingSnapshot(Blackhole blackhole) throws CacheException {
		Optional<RankingSnapshot> snapshot = rankingCache.read();
		blackhole.consume(snapshot);
	}

	/**
	 * Benchmark: Read the store and rewrite the cached ranking, the post-ingestion refresh
	 */
	@Benchmark
	public void refreshRankingSnapshot(Blackhole blackhole) throws StoreException, CacheException {
		blackhole.consume(rankingCache.refreshFrom(store));
	}
}
