package org.wordscope.ingestion.controller;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.wordscope.core.error.ValidationException;
import org.wordscope.core.json.Json;
import org.wordscope.core.model.Passage;
import org.wordscope.ingestion.model.IngestRequest;
import org.wordscope.ingestion.model.IngestionResponse;
import org.wordscope.ingestion.service.IngestionFailedException;
import org.wordscope.ingestion.service.IngestionPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class IngestionController {
	private static final Logger logger = LoggerFactory.getLogger(IngestionController.class);
	private static final Gson gson = Json.gson();
	private final IngestionPipeline pipeline;

	public IngestionController(IngestionPipeline pipeline) {
		this.pipeline = pipeline;
	}

	/**
	 * Register all routes with the Javalin app
	 */
	public void registerRoutes(Javalin app) {
		app.post("/api/fetch", this::handleFetch);

		app.post("/api/ingest", this::handleIngest);

		logger.info("Ingestion routes registered");
	}

	/**
	 * POST /api/fetch
	 * Fetch a passage from the text source and ingest it
	 */
	private void handleFetch(Context ctx) {
		try {
			Passage passage = pipeline.fetchAndIngest();
			ctx.status(201).result(gson.toJson(IngestionResponse.success(passage)));
		} catch (IngestionFailedException e) {
			ctx.status(500).result(gson.toJson(IngestionResponse.failure(e.getMessage())));
			logger.error("Fetch and ingest failed: {}", e.getMessage());
		}
	}

	/**
	 * POST /api/ingest
	 * Ingest the {content} of the request body
	 */
	private void handleIngest(Context ctx) {
		try {
			IngestRequest request = gson.fromJson(ctx.body(), IngestRequest.class);
			if (request == null) {
				throw new ValidationException("Request body must be a JSON object with 'content'");
			}

			Passage passage = pipeline.ingest(request.content());
			ctx.status(201).result(gson.toJson(IngestionResponse.success(passage)));

		} catch (JsonParseException e) {
			ctx.status(400).result(gson.toJson(IngestionResponse.failure("Malformed JSON body")));
			logger.warn("Malformed ingest request: {}", e.getMessage());

		} catch (ValidationException e) {
			ctx.status(400).result(gson.toJson(IngestionResponse.failure(e.getMessage())));
			logger.warn("Rejected ingest request: {}", e.getMessage());

		} catch (IngestionFailedException e) {
			ctx.status(500).result(gson.toJson(IngestionResponse.failure(e.getMessage())));
			logger.error("Ingest failed: {}", e.getMessage());
		}
	}
}
