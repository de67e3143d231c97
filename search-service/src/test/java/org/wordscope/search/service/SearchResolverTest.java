package org.wordscope.search.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.wordscope.core.error.ValidationException;
import org.wordscope.core.model.Passage;
import org.wordscope.core.port.IndexHits;
import org.wordscope.core.port.QueryClause;
import org.wordscope.search.model.SearchResult;
import org.wordscope.testkit.InMemorySearchIndex;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SearchResolverTest {

	private static final Instant CREATED = Instant.parse("2024-04-01T09:00:00Z");

	private InMemorySearchIndex index;
	private SearchResolver resolver;

	@BeforeEach
	public void setUp() {
		index = new InMemorySearchIndex();
		resolver = new SearchResolver(index);
	}

	private static Passage passage(long id, String content) {
		return new Passage(id, content, CREATED);
	}

	@Test
	public void testIndexOrderIsKept() throws Exception {
		Passage a = passage(3, "alpha");
		Passage b = passage(1, "bravo");
		Passage c = passage(2, "charlie");
		index.respondWith(new IndexHits(List.of(
				new IndexHits.Hit(a, 0.9f),
				new IndexHits.Hit(b, 0.5f),
				new IndexHits.Hit(c, 0.5f)), 3));

		SearchResult result = resolver.search(List.of("anything"), "or");

		assertEquals(List.of(a, b, c), result.passages());
		assertEquals(3, result.total());
	}

	@Test
	public void testPageCappedWithFullTotal() throws Exception {
		List<IndexHits.Hit> hits = new ArrayList<>();
		for (long id = 1; id <= 15; id++) {
			hits.add(new IndexHits.Hit(passage(id, "lighthouse " + id), 1.0f));
		}
		index.respondWith(new IndexHits(hits, 15));

		SearchResult result = resolver.search(List.of("lighthouse"), "and");

		assertEquals(10, result.passages().size());
		assertEquals(15, result.total());
		assertEquals(10, index.lastLimit());
	}

	@Test
	public void testAndBuildsMustClausesWithFuzziness() throws Exception {
		resolver.search(List.of("river", "stone"), "AND");

		assertEquals(List.of(QueryClause.must("river"), QueryClause.must("stone")), index.lastClauses());
		assertEquals(2, index.lastFuzziness());
	}

	@Test
	public void testOrBuildsShouldClauses() throws Exception {
		resolver.search(List.of("river", "stone"), " Or ");

		assertEquals(List.of(QueryClause.should("river"), QueryClause.should("stone")), index.lastClauses());
	}

	@Test
	public void testAndNarrowsOrWidens() throws Exception {
		index.indexDocument(passage(1, "river stone"));
		index.indexDocument(passage(2, "river meadow"));

		assertEquals(1, resolver.search(List.of("river", "stone"), "and").total());
		assertEquals(2, resolver.search(List.of("river", "stone"), "or").total());
	}

	@Test
	public void testInvalidOperatorRejectedWithoutQuery() {
		assertThrows(ValidationException.class, () -> resolver.search(List.of("river"), "xor"));
		assertThrows(ValidationException.class, () -> resolver.search(List.of("river"), null));
		assertEquals(0, index.queryCalls());
	}

	@Test
	public void testBlankWordsDropped() throws Exception {
		resolver.search(Arrays.asList(" river ", "", null, "  "), "or");

		assertEquals(List.of(QueryClause.should("river")), index.lastClauses());
	}

	@Test
	public void testEmptyWordListRejected() {
		assertThrows(ValidationException.class, () -> resolver.search(List.of(), "and"));
		assertThrows(ValidationException.class, () -> resolver.search(List.of(" "), "and"));
		assertThrows(ValidationException.class, () -> resolver.search(null, "and"));
		assertEquals(0, index.queryCalls());
	}

	@Test
	public void testIndexDownIsFatal() {
		index.setAvailable(false);

		SearchUnavailableException e = assertThrows(SearchUnavailableException.class,
				() -> resolver.search(List.of("river"), "or"));
		assertNotNull(e.getCause());
	}

	@Test
	public void testInvalidSettingsRejected() {
		assertThrows(IllegalArgumentException.class, () -> new SearchResolver(index, 0, 2));
		assertThrows(IllegalArgumentException.class, () -> new SearchResolver(index, 10, 3));
	}
}
