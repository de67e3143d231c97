package org.wordscope.core.cache;

import com.google.gson.JsonParseException;
import org.wordscope.core.error.CacheException;
import org.wordscope.core.error.StoreException;
import org.wordscope.core.json.Json;
import org.wordscope.core.model.WordFrequency;
import org.wordscope.core.port.CacheStore;
import org.wordscope.core.port.WordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Optional;

/**
 * The frequency ranking projection kept in the cache under one fixed key.
 */
public class RankingCache {
    private static final Logger logger = LoggerFactory.getLogger(RankingCache.class);

    public static final String KEY = "ranking:top";

    private final CacheStore cache;
    private final long ttlSeconds;
    private final int size;
    private final Clock clock;

    public RankingCache(CacheStore cache, long ttlSeconds, int size, Clock clock) {
        if (size < 1) {
            throw new IllegalArgumentException("Ranking cache size must be positive: " + size);
        }
        this.cache = cache;
        this.ttlSeconds = ttlSeconds;
        this.size = size;
        this.clock = clock;
    }

    public RankingCache(CacheStore cache, long ttlSeconds, int size) {
        this(cache, ttlSeconds, size, Clock.systemUTC());
    }

    /**
     * @return the cached snapshot, or empty if absent or expired
     * @throws CacheException if the cache is unreachable or the entry cannot be decoded
     */
    public Optional<RankingSnapshot> read() throws CacheException {
        Optional<byte[]> raw = cache.get(KEY);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        RankingSnapshot snapshot;
        try {
            snapshot = Json.gson().fromJson(new String(raw.get(), StandardCharsets.UTF_8), RankingSnapshot.class);
        } catch (JsonParseException e) {
            throw new CacheException("Ranking cache entry is not valid JSON", e);
        } catch (RuntimeException e) {
            // Gson wraps failures of the record constructor, e.g. a null row
            throw new CacheException("Ranking cache entry cannot be decoded", e);
        }
        if (snapshot == null || snapshot.words() == null) {
            throw new CacheException("Ranking cache entry is empty");
        }
        for (WordFrequency row : snapshot.words()) {
            if (row.word() == null || row.word().isBlank() || row.count() < 1) {
                throw new CacheException("Ranking cache entry has an invalid row: " + row);
            }
        }
        return Optional.of(snapshot);
    }

    public void write(RankingSnapshot snapshot) throws CacheException {
        byte[] payload = Json.gson().toJson(snapshot).getBytes(StandardCharsets.UTF_8);
        cache.setWithTtl(KEY, payload, ttlSeconds);
        logger.debug("Cached ranking of {} words (limit {}) for {}s", snapshot.words().size(), snapshot.limit(), ttlSeconds);
    }

    public void invalidate() throws CacheException {
        cache.delete(KEY);
        logger.debug("Invalidated ranking cache");
    }

    /**
     * Reads the top rows from the store and replaces the cached snapshot with them.
     *
     * @param limit rows to read; never less than the configured cache size
     * @return the fresh snapshot
     */
    public RankingSnapshot refreshFrom(WordStore store, int limit) throws StoreException, CacheException {
        RankingSnapshot snapshot = snapshotFrom(store, limit);
        write(snapshot);
        return snapshot;
    }

    public RankingSnapshot refreshFrom(WordStore store) throws StoreException, CacheException {
        return refreshFrom(store, size);
    }

    /**
     * Reads the store without touching the cache.
     */
    public RankingSnapshot snapshotFrom(WordStore store, int limit) throws StoreException {
        int effectiveLimit = Math.max(limit, size);
        return new RankingSnapshot(effectiveLimit, store.topWords(effectiveLimit), clock.instant());
    }

    public int size() {
        return size;
    }

    public long ttlSeconds() {
        return ttlSeconds;
    }
}
