package org.javai.springai.escalation.resilience;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of a {@link RollingRateLimiter}.
 *
 * @param count attempts admitted in the current window
 * @param windowStart start of the current window, null before the first attempt
 * @param limit attempts allowed per window
 * @param windowSize window length
 */
public record RateWindow(int count, Instant windowStart, int limit, Duration windowSize) {
}
