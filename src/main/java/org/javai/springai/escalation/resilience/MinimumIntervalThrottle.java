package org.javai.springai.escalation.resilience;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Enforces a minimum time between call attempts. Independent of any breaker: a throttled
 * tier is simply not considered for the cycle.
 */
public class MinimumIntervalThrottle {

	private final Duration minInterval;
	private Instant lastAttempt;

	public MinimumIntervalThrottle(Duration minInterval) {
		if (minInterval == null || minInterval.isNegative()) {
			throw new IllegalArgumentException("minInterval must be >= 0");
		}
		this.minInterval = minInterval;
	}

	public synchronized boolean permits(Instant now) {
		return lastAttempt == null || !now.isBefore(lastAttempt.plus(minInterval));
	}

	public synchronized void markAttempt(Instant now) {
		lastAttempt = now;
	}

	public synchronized Optional<Instant> nextAllowedAt() {
		return Optional.ofNullable(lastAttempt).map(t -> t.plus(minInterval));
	}
}
