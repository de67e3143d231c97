package org.wordscope.adapters.hazelcast;

import com.hazelcast.config.Config;
import com.hazelcast.core.Hazelcast;
import com.hazelcast.core.HazelcastInstance;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.wordscope.core.error.CacheException;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class HazelcastCacheStoreTest {

	private HazelcastInstance instance;
	private HazelcastCacheStore cache;

	@BeforeEach
	public void setUp() {
		Config config = new Config();
		config.setClusterName("wordscope-test-" + UUID.randomUUID());
		config.setProperty("hazelcast.logging.type", "slf4j");
		config.setProperty("hazelcast.phone.home.enabled", "false");
		var join = config.getNetworkConfig().getJoin();
		join.getMulticastConfig().setEnabled(false);
		join.getTcpIpConfig().setEnabled(false);
		join.getAutoDetectionConfig().setEnabled(false);

		instance = Hazelcast.newHazelcastInstance(config);
		cache = new HazelcastCacheStore(instance, "wordscope-cache");
	}

	@AfterEach
	public void tearDown() {
		cache.close();
	}

	@Test
	public void testSetThenGet() throws CacheException {
		cache.setWithTtl("definition:river", bytes("a natural stream of water"), 60);

		Optional<byte[]> value = cache.get("definition:river");

		assertTrue(value.isPresent());
		assertEquals("a natural stream of water", new String(value.get(), StandardCharsets.UTF_8));
	}

	@Test
	public void testMissingKeyIsEmpty() throws CacheException {
		assertTrue(cache.get("definition:unknown").isEmpty());
	}

	@Test
	public void testDelete() throws CacheException {
		cache.setWithTtl("ranking:top", bytes("{}"), 60);
		cache.delete("ranking:top");

		assertTrue(cache.get("ranking:top").isEmpty());
	}

	@Test
	public void testEntryExpiresAfterTtl() throws Exception {
		cache.setWithTtl("definition:brief", bytes("short lived"), 1);

		Thread.sleep(2_500);

		assertTrue(cache.get("definition:brief").isEmpty());
	}

	@Test
	public void testNonPositiveTtlRejected() {
		assertThrows(IllegalArgumentException.class, () -> cache.setWithTtl("k", bytes("v"), 0));
	}

	@Test
	public void testOperationsFailAfterShutdown() throws CacheException {
		cache.ping();
		instance.shutdown();

		assertThrows(CacheException.class, () -> cache.ping());
		assertThrows(CacheException.class, () -> cache.get("ranking:top"));
		assertThrows(CacheException.class, () -> cache.setWithTtl("ranking:top", bytes("{}"), 60));
	}

	private static byte[] bytes(String value) {
		return value.getBytes(StandardCharsets.UTF_8);
	}
}
