package org.wordscope.api.health;

/**
 * Result of probing one dependency.
 *
 * @param error failure message, null when healthy
 */
public record DependencyHealth(
	HealthStatus status,
	long latencyMs,
	String error
) {
	public static DependencyHealth healthy(long latencyMs) {
		return new DependencyHealth(HealthStatus.HEALTHY, latencyMs, null);
	}

	public static DependencyHealth unhealthy(long latencyMs, String error) {
		return new DependencyHealth(HealthStatus.UNHEALTHY, latencyMs, error);
	}
}
