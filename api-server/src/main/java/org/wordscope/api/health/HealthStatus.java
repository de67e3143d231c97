package org.wordscope.api.health;

import com.google.gson.annotations.SerializedName;

public enum HealthStatus {
	@SerializedName("healthy") HEALTHY,
	@SerializedName("degraded") DEGRADED,
	@SerializedName("unhealthy") UNHEALTHY
}
