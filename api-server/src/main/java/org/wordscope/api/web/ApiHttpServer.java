package org.wordscope.api.web;

import com.google.gson.Gson;
import io.javalin.Javalin;
import org.wordscope.api.health.HealthController;
import org.wordscope.core.json.Json;
import org.wordscope.dictionary.controller.DictionaryController;
import org.wordscope.ingestion.controller.IngestionController;
import org.wordscope.search.controller.SearchController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/** HTTP server wiring for the API. */
public final class ApiHttpServer {
	private static final Logger logger = LoggerFactory.getLogger(ApiHttpServer.class);
	private static final Gson gson = Json.gson();

	private ApiHttpServer() {}

	/**
	 * Starts the Javalin HTTP server and registers routes.
	 *
	 * @param port port to bind, 0 for an ephemeral port
	 * @return started {@link Javalin} instance
	 */
	public static Javalin start(int port,
								IngestionController ingestionController,
								DictionaryController dictionaryController,
								SearchController searchController,
								HealthController healthController) {
		Javalin app = Javalin.create(cfg -> {
			cfg.showJavalinBanner = false;
			cfg.http.defaultContentType = "application/json";
		});

		ingestionController.registerRoutes(app);
		dictionaryController.registerRoutes(app);
		searchController.registerRoutes(app);
		healthController.registerRoutes(app);

		app.exception(Exception.class, (e, ctx) -> {
			logger.error("Unhandled error on {} {}", ctx.method(), ctx.path(), e);
			ctx.status(500).result(gson.toJson(Map.of("error", "Internal server error")));
		});

		app.start(port);
		logger.info("Javalin server started on port {}", app.port());
		return app;
	}
}
