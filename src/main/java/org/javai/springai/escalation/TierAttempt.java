package org.javai.springai.escalation;

/**
 * Record of one tier visit during a cycle.
 *
 * @param tier the tier visited
 * @param outcome what happened
 * @param durationMillis time spent in the tier
 * @param detail reason or error message, empty when there is nothing to add
 */
public record TierAttempt(
		DecisionTier tier,
		TierOutcome outcome,
		long durationMillis,
		String detail
) {

	public TierAttempt {
		if (tier == null) {
			throw new IllegalArgumentException("tier must not be null");
		}
		if (outcome == null) {
			throw new IllegalArgumentException("outcome must not be null");
		}
		if (durationMillis < 0) {
			throw new IllegalArgumentException("durationMillis must be >= 0");
		}
		detail = detail == null ? "" : detail;
	}

	public boolean isAccepted() {
		return outcome == TierOutcome.ACCEPTED;
	}
}
