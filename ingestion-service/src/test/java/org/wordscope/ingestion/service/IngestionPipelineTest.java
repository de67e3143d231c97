package org.wordscope.ingestion.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.wordscope.core.cache.RankingCache;
import org.wordscope.core.cache.RankingSnapshot;
import org.wordscope.core.error.ValidationException;
import org.wordscope.core.model.Passage;
import org.wordscope.core.model.WordFrequency;
import org.wordscope.core.text.TextNormalizer;
import org.wordscope.testkit.InMemoryCacheStore;
import org.wordscope.testkit.InMemorySearchIndex;
import org.wordscope.testkit.InMemoryWordStore;
import org.wordscope.testkit.StubTextSource;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class IngestionPipelineTest {

	private InMemoryWordStore store;
	private InMemorySearchIndex index;
	private InMemoryCacheStore cache;
	private RankingCache rankingCache;

	@BeforeEach
	public void setUp() {
		store = new InMemoryWordStore();
		index = new InMemorySearchIndex();
		cache = new InMemoryCacheStore();
		rankingCache = new RankingCache(cache, 600, 10);
	}

	private IngestionPipeline pipeline(String... fetched) {
		return new IngestionPipeline(store, index, rankingCache, TextNormalizer.withDefaults(), new StubTextSource(fetched));
	}

	@Test
	public void testCountsEveryOccurrenceExactlyOnce() throws Exception {
		store.put("river", 5);

		pipeline().ingest("River, river and another river bend");

		assertEquals(8, store.count("river"));
		assertEquals(1, store.count("bend"));
		assertEquals(1, store.count("another"));
		assertEquals(0, store.count("and"), "stopwords and short tokens are not counted");
	}

	@Test
	public void testPassagePersistedAndIndexed() throws Exception {
		Passage passage = pipeline().ingest("The quick brown fox jumps over the lazy dog");

		assertEquals(List.of(passage), store.passages());
		assertEquals(List.of(passage), index.documents());
	}

	@Test
	public void testRankingCacheRefreshedAfterIngest() throws Exception {
		pipeline().ingest("lighthouse lighthouse keeper");

		Optional<RankingSnapshot> snapshot = rankingCache.read();
		assertTrue(snapshot.isPresent());
		assertEquals(List.of(new WordFrequency("lighthouse", 2), new WordFrequency("keeper", 1)), snapshot.get().words());
	}

	@Test
	public void testStoreDownFailsBeforeAnythingElse() {
		store.setAvailable(false);

		assertThrows(IngestionFailedException.class, () -> pipeline().ingest("lighthouse keeper"));
		assertTrue(index.documents().isEmpty());
		assertFalse(cache.contains(RankingCache.KEY));
	}

	@Test
	public void testIncrementFailureIsFatalButPassageStays() {
		store.setIncrementsAvailable(false);

		IngestionFailedException e = assertThrows(IngestionFailedException.class,
				() -> pipeline().ingest("lighthouse keeper"));

		assertTrue(e.getMessage().contains("word counts failed"));
		assertEquals(1, store.passages().size());
		assertTrue(index.documents().isEmpty());
	}

	@Test
	public void testIndexFailureIsSwallowed() throws Exception {
		index.setAvailable(false);

		Passage passage = pipeline().ingest("lighthouse keeper");

		assertEquals(1, store.count("lighthouse"));
		assertEquals(1, passage.id());
		assertTrue(cache.contains(RankingCache.KEY));
	}

	@Test
	public void testCacheFailureIsSwallowed() throws Exception {
		cache.setAvailable(false);

		pipeline().ingest("lighthouse keeper");

		assertEquals(1, store.count("keeper"));
		assertEquals(1, index.documents().size());
	}

	@Test
	public void testEmptyContentRejected() {
		assertThrows(ValidationException.class, () -> pipeline().ingest("   "));
		assertTrue(store.passages().isEmpty());
	}

	@Test
	public void testPassageWithOnlyStopwordsStillStored() throws Exception {
		pipeline().ingest("the and of it");

		assertEquals(1, store.passages().size());
		assertEquals(1, index.documents().size());
	}

	@Test
	public void testFetchAndIngestUsesTextSource() throws Exception {
		Passage passage = pipeline("Metaphors travel between lighthouses").fetchAndIngest();

		assertEquals("Metaphors travel between lighthouses", passage.content());
		assertEquals(1, store.count("lighthouses"));
	}

	@Test
	public void testTextSourceFailureIsFatal() {
		IngestionFailedException e = assertThrows(IngestionFailedException.class, () -> pipeline().fetchAndIngest());

		assertNotNull(e.getCause());
		assertTrue(store.passages().isEmpty());
	}

	@Test
	public void testBlankFetchedTextIsFatal() {
		assertThrows(IngestionFailedException.class, () -> pipeline("  ").fetchAndIngest());
		assertTrue(store.passages().isEmpty());
	}
}
