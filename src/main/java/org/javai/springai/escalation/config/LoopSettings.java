package org.javai.springai.escalation.config;

import java.time.Duration;

/**
 * Repetition detection over region entries.
 *
 * @param threshold visits to one location tolerated per window; one more triggers the corrective signal
 * @param window interval after which all counters are cleared
 * @param cooldown pause imposed after the corrective signal
 */
public record LoopSettings(int threshold, Duration window, Duration cooldown) {

	public static final int DEFAULT_THRESHOLD = 5;
	public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);
	public static final Duration DEFAULT_COOLDOWN = Duration.ofSeconds(5);

	public LoopSettings {
		if (threshold < 1) {
			throw new IllegalArgumentException("threshold must be >= 1");
		}
		Durations.requirePositive(window, "window");
		Durations.requireNonNegative(cooldown, "cooldown");
	}

	public static LoopSettings defaults() {
		return new LoopSettings(DEFAULT_THRESHOLD, DEFAULT_WINDOW, DEFAULT_COOLDOWN);
	}
}
