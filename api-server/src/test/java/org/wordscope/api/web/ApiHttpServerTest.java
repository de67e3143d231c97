package org.wordscope.api.web;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.javalin.Javalin;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.wordscope.api.health.HealthController;
import org.wordscope.api.health.HealthService;
import org.wordscope.core.cache.DefinitionCache;
import org.wordscope.core.cache.RankingCache;
import org.wordscope.core.text.TextNormalizer;
import org.wordscope.dictionary.controller.DictionaryController;
import org.wordscope.dictionary.service.DictionaryResolver;
import org.wordscope.ingestion.controller.IngestionController;
import org.wordscope.ingestion.service.IngestionPipeline;
import org.wordscope.search.controller.SearchController;
import org.wordscope.search.service.SearchResolver;
import org.wordscope.testkit.InMemoryCacheStore;
import org.wordscope.testkit.InMemorySearchIndex;
import org.wordscope.testkit.InMemoryWordStore;
import org.wordscope.testkit.StubDefinitionSource;
import org.wordscope.testkit.StubTextSource;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;

public class ApiHttpServerTest {

	private final HttpClient client = HttpClient.newHttpClient();

	private InMemoryWordStore store;
	private InMemoryCacheStore cache;
	private Javalin app;

	@BeforeEach
	public void setUp() {
		store = new InMemoryWordStore();
		cache = new InMemoryCacheStore();
		InMemorySearchIndex index = new InMemorySearchIndex();
		RankingCache rankingCache = new RankingCache(cache, 600, 100);
		StubDefinitionSource definitions = new StubDefinitionSource()
				.define("lighthouse", "A tower with a light to guide ships");

		IngestionPipeline pipeline = new IngestionPipeline(store, index, rankingCache,
				TextNormalizer.withDefaults(), new StubTextSource("The keeper climbed the lighthouse stairs"));
		DictionaryResolver dictionary = new DictionaryResolver(store, rankingCache,
				new DefinitionCache(cache, 604_800), definitions, 10, 100);

		app = ApiHttpServer.start(0,
				new IngestionController(pipeline),
				new DictionaryController(dictionary),
				new SearchController(new SearchResolver(index)),
				new HealthController(new HealthService(store, cache, index, Clock.systemUTC())));
	}

	@AfterEach
	public void tearDown() {
		app.stop();
	}

	private HttpResponse<String> get(String path) throws IOException, InterruptedException {
		HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + app.port() + path)).GET().build();
		return client.send(request, HttpResponse.BodyHandlers.ofString());
	}

	private HttpResponse<String> post(String path, String body) throws IOException, InterruptedException {
		HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + app.port() + path))
				.header("Content-Type", "application/json")
				.POST(HttpRequest.BodyPublishers.ofString(body))
				.build();
		return client.send(request, HttpResponse.BodyHandlers.ofString());
	}

	private static JsonObject json(HttpResponse<String> response) {
		return JsonParser.parseString(response.body()).getAsJsonObject();
	}

	@Test
	public void testIngestThenDictionaryThenSearch() throws Exception {
		HttpResponse<String> ingested = post("/api/ingest",
				"{\"content\": \"The lighthouse keeper polished the lighthouse lamp\"}");
		assertEquals(201, ingested.statusCode());
		assertEquals(1, json(ingested).get("id").getAsLong());

		HttpResponse<String> dictionary = get("/api/dictionary?top=2");
		assertEquals(200, dictionary.statusCode());
		JsonArray definitions = json(dictionary).getAsJsonArray("definitions");
		assertEquals(2, definitions.size());
		JsonObject first = definitions.get(0).getAsJsonObject();
		assertEquals("lighthouse", first.get("word").getAsString());
		assertEquals(2, first.get("frequency").getAsLong());
		assertEquals("A tower with a light to guide ships", first.get("definition").getAsString());
		assertEquals(DictionaryResolver.PLACEHOLDER,
				definitions.get(1).getAsJsonObject().get("definition").getAsString());

		HttpResponse<String> search = post("/api/search", "{\"words\": [\"lamp\", \"keeper\"], \"operator\": \"AND\"}");
		assertEquals(200, search.statusCode());
		JsonObject result = json(search);
		assertEquals(1, result.get("total").getAsLong());
		JsonObject paragraph = result.getAsJsonArray("paragraphs").get(0).getAsJsonObject();
		assertEquals(1, paragraph.get("id").getAsLong());
		assertTrue(paragraph.has("created_at"));
	}

	@Test
	public void testFetchIngestsFromTextSource() throws Exception {
		HttpResponse<String> response = post("/api/fetch", "");

		assertEquals(201, response.statusCode());
		assertEquals("The keeper climbed the lighthouse stairs", json(response).get("content").getAsString());
		assertEquals(1, store.count("stairs"));
	}

	@Test
	public void testFetchFailureIsServerError() throws Exception {
		post("/api/fetch", "");

		HttpResponse<String> exhausted = post("/api/fetch", "");

		assertEquals(500, exhausted.statusCode());
		assertEquals("failed", json(exhausted).get("status").getAsString());
	}

	@Test
	public void testInvalidRequestsAreBadRequests() throws Exception {
		assertEquals(400, post("/api/search", "{\"words\": [\"lamp\"], \"operator\": \"xor\"}").statusCode());
		assertEquals(400, post("/api/search", "{\"words\": [], \"operator\": \"or\"}").statusCode());
		assertEquals(400, post("/api/search", "{not json").statusCode());
		assertEquals(400, post("/api/ingest", "{\"content\": \"  \"}").statusCode());
		assertEquals(400, get("/api/dictionary?top=0").statusCode());
		assertEquals(400, get("/api/dictionary?top=ten").statusCode());
	}

	@Test
	public void testEmptyDictionaryIsNotFound() throws Exception {
		assertEquals(404, get("/api/dictionary").statusCode());
	}

	@Test
	public void testStoreDownFailsDictionaryAndReadiness() throws Exception {
		store.setAvailable(false);

		assertEquals(503, get("/api/dictionary?top=3").statusCode());
		assertEquals(503, get("/health/ready").statusCode());
		assertEquals(200, get("/health/live").statusCode());

		HttpResponse<String> health = get("/health");
		assertEquals(200, health.statusCode());
		assertEquals("unhealthy", json(health).get("status").getAsString());
	}

	@Test
	public void testCacheDownIsDegradedButServing() throws Exception {
		store.put("lighthouse", 4);
		cache.setAvailable(false);

		assertEquals(200, get("/api/dictionary?top=1").statusCode());
		assertEquals("degraded", json(get("/health")).get("status").getAsString());
		assertEquals(200, get("/health/ready").statusCode());
	}
}
