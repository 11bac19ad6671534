package org.javai.springai.escalation.config;

import java.time.Duration;

/**
 * Rolling rate limit over all remote calls of one agent.
 *
 * @param limit call attempts allowed per window
 * @param window window length
 * @param emergencyPause how long every remote tier is skipped after the limit is hit
 */
public record RateLimitSettings(int limit, Duration window, Duration emergencyPause) {

	public static final int DEFAULT_LIMIT = 30;
	public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);
	public static final Duration DEFAULT_EMERGENCY_PAUSE = Duration.ofSeconds(60);

	public RateLimitSettings {
		if (limit < 1) {
			throw new IllegalArgumentException("limit must be >= 1");
		}
		Durations.requirePositive(window, "window");
		Durations.requireNonNegative(emergencyPause, "emergencyPause");
	}

	public static RateLimitSettings defaults() {
		return new RateLimitSettings(DEFAULT_LIMIT, DEFAULT_WINDOW, DEFAULT_EMERGENCY_PAUSE);
	}
}
