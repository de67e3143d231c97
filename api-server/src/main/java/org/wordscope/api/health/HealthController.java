package org.wordscope.api.health;

import com.google.gson.Gson;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.wordscope.core.json.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

public class HealthController {
	private static final Logger logger = LoggerFactory.getLogger(HealthController.class);
	private static final Gson gson = Json.gson();
	private final HealthService healthService;

	public HealthController(HealthService healthService) {
		this.healthService = healthService;
	}

	/**
	 * Register all routes with the Javalin app
	 */
	public void registerRoutes(Javalin app) {
		app.get("/health", this::handleHealth);

		app.get("/health/live", this::handleLive);

		app.get("/health/ready", this::handleReady);

		logger.info("Health routes registered");
	}

	/**
	 * GET /health
	 * Status of every dependency with probe latency
	 */
	private void handleHealth(Context ctx) {
		HealthReport report = healthService.check();
		ctx.status(200).result(gson.toJson(report));
		logger.debug("Health check: {}", report.status());
	}

	/**
	 * GET /health/live
	 * Liveness probe, 200 while the process serves requests
	 */
	private void handleLive(Context ctx) {
		ctx.status(200).result(gson.toJson(Map.of("status", "alive")));
	}

	/**
	 * GET /health/ready
	 * Readiness probe, 503 while the durable store is unreachable
	 */
	private void handleReady(Context ctx) {
		DependencyHealth store = healthService.readiness();
		boolean ready = store.status() == HealthStatus.HEALTHY;

		Map<String, Object> response = new LinkedHashMap<>();
		response.put("status", ready ? "ready" : "not_ready");
		response.put(HealthService.STORE, store);

		ctx.status(ready ? 200 : 503).result(gson.toJson(response));
	}
}
