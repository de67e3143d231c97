package org.wordscope.api.health;

import java.time.Instant;
import java.util.Map;

public record HealthReport(
	HealthStatus status,
	Map<String, DependencyHealth> dependencies,
	Instant timestamp
) {}
