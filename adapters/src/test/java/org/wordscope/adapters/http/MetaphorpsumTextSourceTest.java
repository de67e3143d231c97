package org.wordscope.adapters.http;

import io.javalin.Javalin;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.wordscope.core.error.TextSourceException;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class MetaphorpsumTextSourceTest {

	private Javalin server;
	private HttpTextClient client;

	@BeforeEach
	public void setUp() {
		server = Javalin.create();
		server.get("/paragraphs/1/3", ctx -> ctx.result("  A lighthouse is a patient sentinel.\n"));
		server.get("/empty", ctx -> ctx.result("   "));
		server.get("/down", ctx -> ctx.status(503).result("maintenance"));
		server.start(0);
		client = new HttpTextClient(Duration.ofSeconds(2), Duration.ofSeconds(2));
	}

	@AfterEach
	public void tearDown() {
		server.stop();
	}

	private MetaphorpsumTextSource source(String path) {
		return new MetaphorpsumTextSource(client, "http://localhost:" + server.port() + path);
	}

	@Test
	public void testFetchReturnsTrimmedText() throws TextSourceException {
		assertEquals("A lighthouse is a patient sentinel.", source("/paragraphs/1/3").fetchPassage());
	}

	@Test
	public void testBlankBodyFails() {
		assertThrows(TextSourceException.class, () -> source("/empty").fetchPassage());
	}

	@Test
	public void testErrorStatusFails() {
		TextSourceException e = assertThrows(TextSourceException.class, () -> source("/down").fetchPassage());
		assertTrue(e.getMessage().contains("503"));
	}
}
