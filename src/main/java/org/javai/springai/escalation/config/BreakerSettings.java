package org.javai.springai.escalation.config;

import java.time.Duration;

/**
 * Circuit breaker settings, applied to every remote dependency.
 *
 * @param failureThreshold consecutive failures that open the breaker
 * @param resetTimeout time an open breaker waits before allowing a trial call
 */
public record BreakerSettings(int failureThreshold, Duration resetTimeout) {

	public static final int DEFAULT_FAILURE_THRESHOLD = 3;
	public static final Duration DEFAULT_RESET_TIMEOUT = Duration.ofSeconds(60);

	public BreakerSettings {
		if (failureThreshold < 1) {
			throw new IllegalArgumentException("failureThreshold must be >= 1");
		}
		Durations.requirePositive(resetTimeout, "resetTimeout");
	}

	public static BreakerSettings defaults() {
		return new BreakerSettings(DEFAULT_FAILURE_THRESHOLD, DEFAULT_RESET_TIMEOUT);
	}
}
