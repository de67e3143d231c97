package org.wordscope.core.cache;

import org.wordscope.core.error.CacheException;
import org.wordscope.core.port.CacheStore;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;

/**
 * Per-word definition entries. Absence means unknown or expired, never "the word has no definition".
 */
public class DefinitionCache {
    public static final String KEY_PREFIX = "definition:";

    private final CacheStore cache;
    private final long ttlSeconds;

    public DefinitionCache(CacheStore cache, long ttlSeconds) {
        this.cache = cache;
        this.ttlSeconds = ttlSeconds;
    }

    public Optional<String> get(String word) throws CacheException {
        return cache.get(key(word))
                .map(bytes -> new String(bytes, StandardCharsets.UTF_8))
                .filter(definition -> !definition.isBlank());
    }

    public void put(String word, String definition) throws CacheException {
        cache.setWithTtl(key(word), definition.getBytes(StandardCharsets.UTF_8), ttlSeconds);
    }

    public static String key(String word) {
        return KEY_PREFIX + word.toLowerCase(Locale.ROOT);
    }
}
