package org.wordscope.api.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class ApiConfigTest {

	@Test
	public void testDefaultsFromClasspath() {
		ApiConfig cfg = ApiConfig.load(Map.of());

		assertEquals(8000, cfg.serverPort());
		assertEquals("sqlite", cfg.store().type());
		assertEquals(Duration.ofMillis(5000), cfg.store().timeout());
		assertEquals("member", cfg.hazelcast().mode());
		assertEquals(List.of("127.0.0.1"), cfg.hazelcast().members());
		assertTrue(cfg.hazelcast().memberPorts().isEmpty());
		assertEquals(600, cfg.cache().rankingTtlSeconds());
		assertEquals(604_800, cfg.cache().definitionTtlSeconds());
		assertEquals(4, cfg.normalizer().minWordLength());
		assertNull(cfg.normalizer().stopWords());
		assertEquals(10, cfg.search().pageSize());
		assertEquals(2, cfg.search().fuzziness());
		assertEquals(10, cfg.dictionary().defaultTop());
	}

	@Test
	public void testEnvironmentOverridesDottedKeys() {
		ApiConfig cfg = ApiConfig.load(Map.of(
				"SERVER_PORT", "9100",
				"SEARCH_FUZZINESS", "1",
				"store.type", "postgresql"
		));

		assertEquals(9100, cfg.serverPort());
		assertEquals(1, cfg.search().fuzziness());
		assertEquals("postgresql", cfg.store().type());
		assertEquals("jdbc:postgresql://localhost:5432/wordscope", cfg.store().url());
	}

	@Test
	public void testClusterVariablesOverrideHazelcastSettings() {
		ApiConfig cfg = ApiConfig.load(Map.of(
				"CURRENT_NODE_IP", "10.0.0.5",
				"CLUSTER_NODES_LIST", "10.0.0.5, 10.0.0.6"
		));

		assertEquals("10.0.0.5", cfg.hazelcast().currentNodeIp());
		assertEquals(List.of("10.0.0.5", "10.0.0.6"), cfg.hazelcast().members());
	}

	@Test
	public void testMissingKeyFailsFast() {
		Properties properties = new Properties();
		properties.setProperty("server.port", "8000");

		IllegalStateException e = assertThrows(IllegalStateException.class, () -> ApiConfig.from(properties));
		assertTrue(e.getMessage().contains("store.type"));
	}

	@Test
	public void testInvalidIntegerFailsFast() {
		IllegalStateException e = assertThrows(IllegalStateException.class,
				() -> ApiConfig.load(Map.of("SERVER_PORT", "eighty")));
		assertTrue(e.getMessage().contains("server.port"));
	}

	@Test
	public void testUnknownStoreTypeRejected() {
		assertThrows(IllegalStateException.class, () -> ApiConfig.load(Map.of("STORE_TYPE", "mongodb")));
	}
}
