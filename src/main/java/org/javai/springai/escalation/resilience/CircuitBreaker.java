package org.javai.springai.escalation.resilience;

import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Circuit breaker for one remote dependency.
 *
 * <ul>
 *   <li>{@code closed}: calls pass; each failure counts, and reaching the threshold opens the breaker.</li>
 *   <li>{@code open}: no calls. Once {@code resetTimeout} has passed since the last failure the
 *       breaker moves to {@code half_open}.</li>
 *   <li>{@code half_open}: exactly one trial call. Success closes the breaker and clears the count;
 *       failure reopens it and restarts the reset timeout.</li>
 * </ul>
 *
 * <p>Methods are synchronized so that a host which breaks the one-cycle-at-a-time rule still
 * cannot corrupt the state.</p>
 */
public class CircuitBreaker {

	private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);

	private final String dependency;
	private final int failureThreshold;
	private final Duration resetTimeout;

	private CircuitState state = CircuitState.CLOSED;
	private int consecutiveFailures;
	private Instant lastFailureTime;
	private boolean trialInFlight;

	public CircuitBreaker(String dependency, int failureThreshold, Duration resetTimeout) {
		if (dependency == null || dependency.isBlank()) {
			throw new IllegalArgumentException("dependency must not be blank");
		}
		if (failureThreshold < 1) {
			throw new IllegalArgumentException("failureThreshold must be >= 1");
		}
		if (resetTimeout == null || resetTimeout.isNegative()) {
			throw new IllegalArgumentException("resetTimeout must be >= 0");
		}
		this.dependency = dependency;
		this.failureThreshold = failureThreshold;
		this.resetTimeout = resetTimeout;
	}

	public String dependency() {
		return dependency;
	}

	/**
	 * Whether a call would be let through at {@code now}, moving an expired {@code open}
	 * breaker to {@code half_open} on the way. Does not reserve the half-open trial.
	 */
	public synchronized boolean allowsCall(Instant now) {
		if (state == CircuitState.OPEN && !now.isBefore(lastFailureTime.plus(resetTimeout))) {
			state = CircuitState.HALF_OPEN;
			trialInFlight = false;
			logger.info("Circuit breaker '{}' half-open after {} s; allowing one trial call",
					dependency, resetTimeout.toSeconds());
		}
		return switch (state) {
			case CLOSED -> true;
			case HALF_OPEN -> !trialInFlight;
			case OPEN -> false;
		};
	}

	/**
	 * Reserve permission for one call. In {@code half_open} this consumes the single trial.
	 *
	 * @return false when the call must not be made
	 */
	public synchronized boolean tryAcquire(Instant now) {
		if (!allowsCall(now)) {
			return false;
		}
		if (state == CircuitState.HALF_OPEN) {
			trialInFlight = true;
		}
		return true;
	}

	public synchronized void recordSuccess() {
		if (state != CircuitState.CLOSED) {
			logger.info("Circuit breaker '{}' closed after successful trial call", dependency);
		}
		state = CircuitState.CLOSED;
		consecutiveFailures = 0;
		trialInFlight = false;
	}

	public synchronized void recordFailure(Instant now) {
		consecutiveFailures++;
		switch (state) {
			case HALF_OPEN -> {
				state = CircuitState.OPEN;
				lastFailureTime = now;
				trialInFlight = false;
				logger.warn("Circuit breaker '{}' reopened: trial call failed", dependency);
			}
			case CLOSED -> {
				lastFailureTime = now;
				if (consecutiveFailures >= failureThreshold) {
					state = CircuitState.OPEN;
					logger.warn("Circuit breaker '{}' opened after {} consecutive failures",
							dependency, consecutiveFailures);
				}
			}
			case OPEN -> logger.debug("Failure reported for '{}' while its breaker is already open", dependency);
		}
	}

	/**
	 * Open the breaker regardless of the failure count, as if a failure happened at {@code now}.
	 */
	public synchronized void forceOpen(Instant now) {
		state = CircuitState.OPEN;
		lastFailureTime = now;
		trialInFlight = false;
		logger.warn("Circuit breaker '{}' forced open", dependency);
	}

	/**
	 * Back to {@code closed} with no failure history.
	 */
	public synchronized void reset() {
		state = CircuitState.CLOSED;
		consecutiveFailures = 0;
		lastFailureTime = null;
		trialInFlight = false;
		logger.info("Circuit breaker '{}' reset", dependency);
	}

	public synchronized CircuitBreakerState state() {
		return new CircuitBreakerState(dependency, state, consecutiveFailures, failureThreshold,
				lastFailureTime, resetTimeout);
	}
}
