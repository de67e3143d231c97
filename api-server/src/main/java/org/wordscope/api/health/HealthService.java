package org.wordscope.api.health;

import org.wordscope.core.error.AdapterException;
import org.wordscope.core.port.CacheStore;
import org.wordscope.core.port.SearchIndex;
import org.wordscope.core.port.WordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Probes the store, the cache and the search index.
 *
 * <p>The store is the system of record, so losing it makes the service unhealthy. Losing the cache or
 * the index only degrades it.</p>
 */
public class HealthService {
	private static final Logger logger = LoggerFactory.getLogger(HealthService.class);

	public static final String STORE = "store";
	public static final String CACHE = "cache";
	public static final String INDEX = "search_index";

	@FunctionalInterface
	private interface Probe {
		void ping() throws AdapterException;
	}

	private final WordStore store;
	private final CacheStore cache;
	private final SearchIndex index;
	private final Clock clock;

	public HealthService(WordStore store, CacheStore cache, SearchIndex index, Clock clock) {
		this.store = store;
		this.cache = cache;
		this.index = index;
		this.clock = clock;
	}

	public HealthReport check() {
		Map<String, DependencyHealth> dependencies = new LinkedHashMap<>();
		dependencies.put(STORE, probe(STORE, store::ping));
		dependencies.put(CACHE, probe(CACHE, cache::ping));
		dependencies.put(INDEX, probe(INDEX, index::ping));

		return new HealthReport(overall(dependencies), dependencies, clock.instant());
	}

	/**
	 * Ready to serve traffic when the system of record answers.
	 */
	public DependencyHealth readiness() {
		return probe(STORE, store::ping);
	}

	static HealthStatus overall(Map<String, DependencyHealth> dependencies) {
		if (dependencies.get(STORE).status() == HealthStatus.UNHEALTHY) {
			return HealthStatus.UNHEALTHY;
		}
		boolean anyDown = dependencies.values().stream().anyMatch(d -> d.status() == HealthStatus.UNHEALTHY);
		return anyDown ? HealthStatus.DEGRADED : HealthStatus.HEALTHY;
	}

	private static DependencyHealth probe(String name, Probe probe) {
		long start = System.nanoTime();
		try {
			probe.ping();
			return DependencyHealth.healthy(elapsedMs(start));
		} catch (AdapterException e) {
			logger.warn("Health check for {} failed: {}", name, e.getMessage());
			return DependencyHealth.unhealthy(elapsedMs(start), e.getMessage());
		}
	}

	private static long elapsedMs(long startNanos) {
		return (System.nanoTime() - startNanos) / 1_000_000;
	}
}
