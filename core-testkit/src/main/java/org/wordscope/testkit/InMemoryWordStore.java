package org.wordscope.testkit;

import org.wordscope.core.error.StoreException;
import org.wordscope.core.model.Passage;
import org.wordscope.core.model.WordFrequency;
import org.wordscope.core.port.WordStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Map-backed {@link WordStore}. Can be switched off to simulate an unreachable database.
 */
public class InMemoryWordStore implements WordStore {
	private final List<Passage> passages = new ArrayList<>();
	private final Map<String, Long> counts = new HashMap<>();
	private final AtomicInteger topWordsCalls = new AtomicInteger();
	private volatile boolean available = true;
	private volatile boolean incrementsAvailable = true;

	@Override
	public synchronized Passage createPassage(String content) throws StoreException {
		checkAvailable();
		Passage passage = new Passage(passages.size() + 1L, content, Instant.now());
		passages.add(passage);
		return passage;
	}

	@Override
	public synchronized long incrementWord(String word, int occurrences) throws StoreException {
		checkAvailable();
		checkIncrementsAvailable();
		return counts.merge(word, (long) occurrences, Long::sum);
	}

	@Override
	public synchronized void incrementWords(Map<String, Integer> occurrences) throws StoreException {
		checkAvailable();
		checkIncrementsAvailable();
		occurrences.forEach((word, n) -> counts.merge(word, (long) n, Long::sum));
	}

	@Override
	public synchronized List<WordFrequency> topWords(int limit) throws StoreException {
		topWordsCalls.incrementAndGet();
		checkAvailable();
		return counts.entrySet().stream()
				.map(e -> new WordFrequency(e.getKey(), e.getValue()))
				.sorted(Comparator.comparingLong(WordFrequency::count).reversed()
						.thenComparing(WordFrequency::word))
				.limit(limit)
				.toList();
	}

	@Override
	public void ping() throws StoreException {
		checkAvailable();
	}

	public synchronized void put(String word, long count) {
		counts.put(word, count);
	}

	public synchronized long count(String word) {
		return counts.getOrDefault(word, 0L);
	}

	public synchronized List<Passage> passages() {
		return List.copyOf(passages);
	}

	public int topWordsCalls() {
		return topWordsCalls.get();
	}

	public void setAvailable(boolean available) {
		this.available = available;
	}

	/**
	 * Fail only frequency increments; passage writes and reads keep working.
	 */
	public void setIncrementsAvailable(boolean incrementsAvailable) {
		this.incrementsAvailable = incrementsAvailable;
	}

	private void checkAvailable() throws StoreException {
		if (!available) {
			throw new StoreException("Connection refused: store is down");
		}
	}

	private void checkIncrementsAvailable() throws StoreException {
		if (!incrementsAvailable) {
			throw new StoreException("Deadlock detected while incrementing word counters");
		}
	}
}
