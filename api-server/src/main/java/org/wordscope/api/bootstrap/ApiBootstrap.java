package org.wordscope.api.bootstrap;

import io.javalin.Javalin;
import org.wordscope.adapters.hazelcast.HazelcastCacheStore;
import org.wordscope.adapters.http.DictionaryApiDefinitionSource;
import org.wordscope.adapters.http.HttpTextClient;
import org.wordscope.adapters.http.MetaphorpsumTextSource;
import org.wordscope.adapters.jdbc.PostgreSqlWordStore;
import org.wordscope.adapters.jdbc.SqliteWordStore;
import org.wordscope.adapters.lucene.LuceneSearchIndex;
import org.wordscope.api.config.ApiConfig;
import org.wordscope.api.health.HealthController;
import org.wordscope.api.health.HealthService;
import org.wordscope.api.web.ApiHttpServer;
import org.wordscope.core.cache.DefinitionCache;
import org.wordscope.core.cache.RankingCache;
import org.wordscope.core.error.AdapterException;
import org.wordscope.core.port.WordStore;
import org.wordscope.core.text.TextNormalizer;
import org.wordscope.dictionary.controller.DictionaryController;
import org.wordscope.dictionary.service.DictionaryResolver;
import org.wordscope.ingestion.controller.IngestionController;
import org.wordscope.ingestion.service.IngestionPipeline;
import org.wordscope.search.controller.SearchController;
import org.wordscope.search.service.SearchResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Application bootstrapper for the API server.
 *
 * <p>Loads configuration, opens the store, cache and index, wires services and controllers, warms the
 * ranking cache, starts the HTTP API, and registers a JVM shutdown hook.</p>
 */
public final class ApiBootstrap {
	private static final Logger logger = LoggerFactory.getLogger(ApiBootstrap.class);

	private ApiBootstrap() {}

	/**
	 * Starts the API server.
	 *
	 * <p>On startup failure, logs the error and exits with code {@code 1}.</p>
	 */
	public static void run() {
		try {
			start();
		} catch (Exception e) {
			logger.error("Failed to start API server", e);
			System.exit(1);
		}
	}

	private static void start() throws IOException {
		ApiConfig cfg = ApiConfig.load();
		Boot boot = startHttp(cfg);
		addShutdownHook(boot);
		logger.info("API server started successfully.");
	}

	private static Boot startHttp(ApiConfig cfg) throws IOException {
		WordStore store = createStore(cfg.store());
		HazelcastCacheStore cache = HazelcastCacheStore.start(cfg.hazelcast());
		LuceneSearchIndex index = LuceneSearchIndex.open(Path.of(cfg.index().path()));

		HttpTextClient httpClient = new HttpTextClient(cfg.sources().connectTimeout(), cfg.sources().readTimeout());
		TextNormalizer normalizer = createNormalizer(cfg.normalizer());
		RankingCache rankingCache = new RankingCache(cache, cfg.cache().rankingTtlSeconds(), cfg.cache().rankingSize());
		DefinitionCache definitionCache = new DefinitionCache(cache, cfg.cache().definitionTtlSeconds());

		IngestionPipeline pipeline = new IngestionPipeline(
			store,
			index,
			rankingCache,
			normalizer,
			new MetaphorpsumTextSource(httpClient, cfg.sources().textUrl())
		);
		DictionaryResolver dictionary = new DictionaryResolver(
			store,
			rankingCache,
			definitionCache,
			new DictionaryApiDefinitionSource(httpClient, cfg.sources().definitionUrl()),
			cfg.dictionary().defaultTop(),
			cfg.dictionary().maxTop()
		);
		SearchResolver search = new SearchResolver(index, cfg.search().pageSize(), cfg.search().fuzziness());
		HealthService health = new HealthService(store, cache, index, Clock.systemUTC());

		dictionary.warmUp();

		Javalin app = ApiHttpServer.start(
			cfg.serverPort(),
			new IngestionController(pipeline),
			new DictionaryController(dictionary),
			new SearchController(search),
			new HealthController(health)
		);
		return new Boot(app, cache, index);
	}

	private static WordStore createStore(ApiConfig.Store cfg) throws AdapterException {
		if ("postgresql".equals(cfg.type())) {
			return new PostgreSqlWordStore(cfg.url(), cfg.user(), cfg.password(), cfg.timeout());
		}

		Path dbPath = Path.of(cfg.sqlitePath());
		try {
			if (dbPath.getParent() != null) {
				Files.createDirectories(dbPath.getParent());
			}
		} catch (IOException e) {
			throw new IllegalStateException("Cannot create directory for " + dbPath, e);
		}
		return new SqliteWordStore(dbPath.toString(), cfg.timeout());
	}

	private static TextNormalizer createNormalizer(ApiConfig.Normalizer cfg) {
		String stopWords = cfg.stopWords() == null ? TextNormalizer.DEFAULT_STOP_WORDS : cfg.stopWords();
		return new TextNormalizer(cfg.minWordLength(), TextNormalizer.parseStopWords(stopWords));
	}

	private static void addShutdownHook(Boot boot) {
		Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(boot)));
	}

	private static void shutdown(Boot boot) {
		logger.info("Shutting down API server...");
		boot.app.stop();
		try {
			boot.index.close();
		} catch (IOException e) {
			logger.error("Failed to close search index", e);
		}
		boot.cache.close();
		logger.info("API server stopped.");
	}

	private record Boot(Javalin app, HazelcastCacheStore cache, LuceneSearchIndex index) {}
}
