package org.wordscope.testkit;

import org.wordscope.core.error.CacheException;
import org.wordscope.core.port.CacheStore;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link CacheStore} with a manually advanced clock so tests can expire entries.
 */
public class InMemoryCacheStore implements CacheStore {
	private record Entry(byte[] value, Instant expiresAt) {}

	private final Map<String, Entry> entries = new ConcurrentHashMap<>();
	private final AtomicInteger gets = new AtomicInteger();
	private final AtomicInteger sets = new AtomicInteger();
	private volatile Instant now = Instant.parse("2024-01-01T00:00:00Z");
	private volatile boolean available = true;

	@Override
	public Optional<byte[]> get(String key) throws CacheException {
		gets.incrementAndGet();
		checkAvailable();
		Entry entry = entries.get(key);
		if (entry == null) {
			return Optional.empty();
		}
		if (!now.isBefore(entry.expiresAt())) {
			entries.remove(key);
			return Optional.empty();
		}
		return Optional.of(entry.value().clone());
	}

	@Override
	public void setWithTtl(String key, byte[] value, long ttlSeconds) throws CacheException {
		sets.incrementAndGet();
		checkAvailable();
		entries.put(key, new Entry(value.clone(), now.plusSeconds(ttlSeconds)));
	}

	@Override
	public void delete(String key) throws CacheException {
		checkAvailable();
		entries.remove(key);
	}

	@Override
	public void ping() throws CacheException {
		checkAvailable();
	}

	public void advance(Duration duration) {
		now = now.plus(duration);
	}

	public boolean contains(String key) {
		Entry entry = entries.get(key);
		return entry != null && now.isBefore(entry.expiresAt());
	}

	public void putRaw(String key, byte[] value, long ttlSeconds) {
		entries.put(key, new Entry(value.clone(), now.plusSeconds(ttlSeconds)));
	}

	public int getCalls() {
		return gets.get();
	}

	public int setCalls() {
		return sets.get();
	}

	public void setAvailable(boolean available) {
		this.available = available;
	}

	private void checkAvailable() throws CacheException {
		if (!available) {
			throw new CacheException("Cache unreachable");
		}
	}
}
