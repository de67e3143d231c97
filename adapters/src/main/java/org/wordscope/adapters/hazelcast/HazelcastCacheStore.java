package org.wordscope.adapters.hazelcast;

import com.hazelcast.client.HazelcastClient;
import com.hazelcast.core.Hazelcast;
import com.hazelcast.core.HazelcastException;
import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.map.IMap;
import org.wordscope.core.error.CacheException;
import org.wordscope.core.port.CacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * {@link CacheStore} over a Hazelcast {@link IMap} of raw bytes. Entry expiry uses the per-entry TTL of
 * {@link IMap#set(Object, Object, long, TimeUnit)}.
 */
public class HazelcastCacheStore implements CacheStore, AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(HazelcastCacheStore.class);
	private static final String PING_KEY = "__ping__";

	private final HazelcastInstance hazelcast;
	private final IMap<String, byte[]> map;

	public HazelcastCacheStore(HazelcastInstance hazelcast, String mapName) {
		this.hazelcast = hazelcast;
		this.map = hazelcast.getMap(mapName);
	}

	/**
	 * Start an embedded member or connect as a client, depending on {@link HazelcastSettings#mode()}.
	 */
	public static HazelcastCacheStore start(HazelcastSettings settings) {
		HazelcastInstance instance;
		if (settings.clientMode()) {
			logger.info("Connecting to Hazelcast cluster '{}' as client: {}", settings.clusterName(), settings.members());
			instance = HazelcastClient.newHazelcastClient(HazelcastClientConfigFactory.build(settings));
		} else {
			logger.info("Starting Hazelcast member for cluster '{}' on port {}", settings.clusterName(), settings.port());
			instance = Hazelcast.newHazelcastInstance(HazelcastConfigFactory.build(settings));
		}
		return new HazelcastCacheStore(instance, settings.cacheMapName());
	}

	@Override
	public Optional<byte[]> get(String key) throws CacheException {
		try {
			return Optional.ofNullable(map.get(key));
		} catch (HazelcastException | IllegalStateException e) {
			throw new CacheException("Cache read failed for '" + key + "': " + e.getMessage(), e);
		}
	}

	@Override
	public void setWithTtl(String key, byte[] value, long ttlSeconds) throws CacheException {
		if (ttlSeconds < 1) {
			throw new IllegalArgumentException("TTL must be positive: " + ttlSeconds);
		}
		try {
			map.set(key, value, ttlSeconds, TimeUnit.SECONDS);
		} catch (HazelcastException | IllegalStateException e) {
			throw new CacheException("Cache write failed for '" + key + "': " + e.getMessage(), e);
		}
	}

	@Override
	public void delete(String key) throws CacheException {
		try {
			map.delete(key);
		} catch (HazelcastException | IllegalStateException e) {
			throw new CacheException("Cache delete failed for '" + key + "': " + e.getMessage(), e);
		}
	}

	@Override
	public void ping() throws CacheException {
		if (!hazelcast.getLifecycleService().isRunning()) {
			throw new CacheException("Hazelcast instance is not running");
		}
		try {
			map.containsKey(PING_KEY);
		} catch (HazelcastException | IllegalStateException e) {
			throw new CacheException("Hazelcast unreachable: " + e.getMessage(), e);
		}
	}

	@Override
	public void close() {
		if (hazelcast.getLifecycleService().isRunning()) {
			logger.info("Shutting down Hazelcast instance");
			hazelcast.shutdown();
		}
	}
}
