package org.javai.springai.escalation;

/**
 * What happened when the orchestrator visited one tier.
 */
public enum TierOutcome {
	/** The tier produced the action that became the decision. */
	ACCEPTED,
	/** The tier's gate declined the snapshot. */
	DECLINED,
	/** The tier ran but had nothing to propose. */
	EMPTY,
	/** Skipped without a call: breaker open, rate limited, paused or throttled. */
	UNAVAILABLE,
	/** The call did not finish before the tier deadline. */
	TIMEOUT,
	/** The reply could not be turned into an action. */
	MALFORMED_RESPONSE,
	/** The call failed before a reply arrived. */
	TRANSPORT_ERROR,
	/** A local tier threw while evaluating. */
	LOCAL_FAILURE;

	/**
	 * Whether this outcome counts against the tier's dependency.
	 */
	public boolean isDependencyFailure() {
		return this == TIMEOUT || this == MALFORMED_RESPONSE || this == TRANSPORT_ERROR;
	}
}
