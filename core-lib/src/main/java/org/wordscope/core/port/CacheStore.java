package org.wordscope.core.port;

import org.wordscope.core.error.CacheException;

import java.util.Optional;

/**
 * Key/value cache with per-key expiry.
 *
 * <p>Implementations must not block indefinitely when the backing store is down: they fail with
 * {@link CacheException} and callers treat that exactly like a miss.</p>
 */
public interface CacheStore {
	Optional<byte[]> get(String key) throws CacheException;

	void setWithTtl(String key, byte[] value, long ttlSeconds) throws CacheException;

	void delete(String key) throws CacheException;

	void ping() throws CacheException;
}
