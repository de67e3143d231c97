package org.wordscope.testkit;

import org.wordscope.core.error.IndexException;
import org.wordscope.core.model.Passage;
import org.wordscope.core.port.IndexHits;
import org.wordscope.core.port.QueryClause;
import org.wordscope.core.port.SearchIndex;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link SearchIndex} double. Either answers from scripted hits or does exact token matching,
 * scoring a passage by the number of clauses it satisfies.
 */
public class InMemorySearchIndex implements SearchIndex {
	private final Map<Long, Passage> documents = new LinkedHashMap<>();
	private IndexHits scripted;
	private List<QueryClause> lastClauses = List.of();
	private int lastFuzziness = -1;
	private int lastLimit = -1;
	private int queryCalls;
	private volatile boolean available = true;

	@Override
	public synchronized void indexDocument(Passage passage) throws IndexException {
		checkAvailable();
		documents.put(passage.id(), passage);
	}

	@Override
	public synchronized IndexHits query(List<QueryClause> clauses, int fuzziness, int limit) throws IndexException {
		queryCalls++;
		lastClauses = List.copyOf(clauses);
		lastFuzziness = fuzziness;
		lastLimit = limit;
		checkAvailable();

		if (scripted != null) {
			List<IndexHits.Hit> page = scripted.hits().stream().limit(limit).toList();
			return new IndexHits(page, scripted.total());
		}

		List<IndexHits.Hit> matches = new ArrayList<>();
		for (Passage passage : documents.values()) {
			Set<String> tokens = Arrays.stream(passage.content().toLowerCase(Locale.ROOT).split("\\W+"))
					.collect(Collectors.toSet());
			int mustMatched = 0;
			int mustTotal = 0;
			int shouldMatched = 0;
			int shouldTotal = 0;
			for (QueryClause clause : clauses) {
				boolean found = tokens.contains(clause.term().toLowerCase(Locale.ROOT));
				if (clause.occur() == QueryClause.Occur.MUST) {
					mustTotal++;
					mustMatched += found ? 1 : 0;
				} else {
					shouldTotal++;
					shouldMatched += found ? 1 : 0;
				}
			}
			boolean matched = mustMatched == mustTotal && (shouldTotal == 0 || shouldMatched > 0 || mustTotal > 0);
			if (matched && mustMatched + shouldMatched > 0) {
				matches.add(new IndexHits.Hit(passage, mustMatched + shouldMatched));
			}
		}
		matches.sort((a, b) -> Float.compare(b.score(), a.score()));
		return new IndexHits(matches.stream().limit(limit).toList(), matches.size());
	}

	@Override
	public void ping() throws IndexException {
		checkAvailable();
	}

	public synchronized void respondWith(IndexHits hits) {
		this.scripted = hits;
	}

	public synchronized List<Passage> documents() {
		return List.copyOf(documents.values());
	}

	public synchronized List<QueryClause> lastClauses() {
		return lastClauses;
	}

	public synchronized int lastFuzziness() {
		return lastFuzziness;
	}

	public synchronized int lastLimit() {
		return lastLimit;
	}

	public synchronized int queryCalls() {
		return queryCalls;
	}

	public void setAvailable(boolean available) {
		this.available = available;
	}

	private void checkAvailable() throws IndexException {
		if (!available) {
			throw new IndexException("Index cluster unreachable");
		}
	}
}
