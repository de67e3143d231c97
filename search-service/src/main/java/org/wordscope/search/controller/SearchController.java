package org.wordscope.search.controller;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.wordscope.core.error.ValidationException;
import org.wordscope.core.json.Json;
import org.wordscope.search.model.SearchRequest;
import org.wordscope.search.model.SearchResponse;
import org.wordscope.search.model.SearchResult;
import org.wordscope.search.service.SearchResolver;
import org.wordscope.search.service.SearchUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

public class SearchController {
	private static final Logger logger = LoggerFactory.getLogger(SearchController.class);
	private static final Gson gson = Json.gson();
	private final SearchResolver resolver;

	public SearchController(SearchResolver resolver) {
		this.resolver = resolver;
	}

	/**
	 * Register all routes with the Javalin app
	 */
	public void registerRoutes(Javalin app) {
		app.post("/api/search", this::handleSearch);

		logger.info("Search routes registered");
	}

	/**
	 * POST /api/search
	 * Body: {"words": [...], "operator": "and" | "or"}
	 */
	private void handleSearch(Context ctx) {
		try {
			SearchRequest request = gson.fromJson(ctx.body(), SearchRequest.class);
			if (request == null) {
				throw new ValidationException("Request body must be a JSON object with 'words' and 'operator'");
			}

			SearchResult result = resolver.search(request.words(), request.operator());
			ctx.status(200).result(gson.toJson(SearchResponse.from(result)));

		} catch (JsonParseException e) {
			ctx.status(400).result(gson.toJson(Map.of("error", "Malformed JSON body")));
			logger.warn("Malformed search request: {}", e.getMessage());

		} catch (ValidationException e) {
			ctx.status(400).result(gson.toJson(Map.of("error", e.getMessage())));
			logger.warn("Rejected search request: {}", e.getMessage());

		} catch (SearchUnavailableException e) {
			ctx.status(503).result(gson.toJson(Map.of("error", e.getMessage())));
			logger.error("Search failed: {}", e.getMessage());
		}
	}
}
