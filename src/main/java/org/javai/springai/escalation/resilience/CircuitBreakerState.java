package org.javai.springai.escalation.resilience;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of a {@link CircuitBreaker}.
 *
 * @param dependency name of the guarded dependency
 * @param state breaker state
 * @param consecutiveFailures failures since the last success
 * @param failureThreshold failures that open the breaker
 * @param lastFailureTime time of the most recent failure, null when there has been none
 * @param resetTimeout time an open breaker waits before allowing a trial call
 */
public record CircuitBreakerState(
		String dependency,
		CircuitState state,
		int consecutiveFailures,
		int failureThreshold,
		Instant lastFailureTime,
		Duration resetTimeout
) {
}
