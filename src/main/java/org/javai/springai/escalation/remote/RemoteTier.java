package org.javai.springai.escalation.remote;

import java.time.Instant;
import org.javai.springai.escalation.DecisionTier;
import org.javai.springai.escalation.snapshot.StateSnapshot;

/**
 * Client for a remote decision service.
 *
 * <p>Implementations never retry and never throw for remote failures: every problem comes
 * back as {@link TierResult.Failed}. The orchestrator enforces the deadline itself and simply
 * abandons calls that overrun it, so a call must be safe to abandon.</p>
 */
public interface RemoteTier {

	/**
	 * Ladder position of this client, {@link DecisionTier#PATTERN} or {@link DecisionTier#PLANNER}.
	 */
	DecisionTier tier();

	/**
	 * Name of the remote dependency; each name gets its own circuit breaker.
	 */
	String dependencyName();

	/**
	 * Cheap local gate evaluated before any resilience bookkeeping.
	 */
	boolean shouldHandle(StateSnapshot snapshot);

	/**
	 * Ask the remote service for a proposal.
	 *
	 * @param snapshot the cycle's snapshot
	 * @param deadline instant after which the caller will have abandoned the call
	 */
	TierResult decide(StateSnapshot snapshot, Instant deadline);
}
