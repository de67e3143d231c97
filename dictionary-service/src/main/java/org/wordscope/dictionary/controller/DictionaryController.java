package org.wordscope.dictionary.controller;

import com.google.gson.Gson;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.wordscope.core.error.ValidationException;
import org.wordscope.core.json.Json;
import org.wordscope.core.model.WordDefinition;
import org.wordscope.dictionary.model.DictionaryResponse;
import org.wordscope.dictionary.service.DictionaryResolver;
import org.wordscope.dictionary.service.DictionaryUnavailableException;
import org.wordscope.dictionary.service.EmptyDictionaryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

public class DictionaryController {
	private static final Logger logger = LoggerFactory.getLogger(DictionaryController.class);
	private static final Gson gson = Json.gson();
	private final DictionaryResolver resolver;

	public DictionaryController(DictionaryResolver resolver) {
		this.resolver = resolver;
	}

	/**
	 * Register all routes with the Javalin app
	 */
	public void registerRoutes(Javalin app) {
		app.get("/api/dictionary", this::handleDictionary);

		logger.info("Dictionary routes registered");
	}

	/**
	 * GET /api/dictionary?top=N
	 * Most frequent words with their definitions
	 */
	private void handleDictionary(Context ctx) {
		try {
			int top = parseTop(ctx.queryParam("top"));
			List<WordDefinition> definitions = resolver.topDefinitions(top);
			ctx.status(200).result(gson.toJson(new DictionaryResponse(definitions)));

		} catch (ValidationException e) {
			ctx.status(400).result(gson.toJson(Map.of("error", e.getMessage())));
			logger.warn("Rejected dictionary request: {}", e.getMessage());

		} catch (EmptyDictionaryException e) {
			ctx.status(404).result(gson.toJson(Map.of("error", e.getMessage())));
			logger.info("Dictionary requested before any ingestion");

		} catch (DictionaryUnavailableException e) {
			ctx.status(503).result(gson.toJson(Map.of("error", e.getMessage())));
			logger.error("Dictionary unavailable: {}", e.getMessage());
		}
	}

	private int parseTop(String raw) {
		if (raw == null || raw.isBlank()) {
			return resolver.defaultTop();
		}
		try {
			return Integer.parseInt(raw.trim());
		} catch (NumberFormatException e) {
			throw new ValidationException("Invalid top format. Must be an integer.");
		}
	}
}
