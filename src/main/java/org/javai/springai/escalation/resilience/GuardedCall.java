package org.javai.springai.escalation.resilience;

import java.util.Optional;
import org.javai.springai.escalation.TierOutcome;
import org.javai.springai.escalation.action.CandidateAction;

/**
 * Result of one remote tier visit through the {@link RemoteCallGuard}.
 *
 * @param outcome what happened
 * @param action the proposal, present only when {@code outcome} is {@link TierOutcome#ACCEPTED}
 * @param source model id that produced the proposal
 * @param detail reason or error message
 */
public record GuardedCall(TierOutcome outcome, Optional<CandidateAction> action, String source, String detail) {

	static GuardedCall accepted(CandidateAction action, String source) {
		return new GuardedCall(TierOutcome.ACCEPTED, Optional.of(action), source, "");
	}

	static GuardedCall of(TierOutcome outcome, String detail) {
		return new GuardedCall(outcome, Optional.empty(), "", detail);
	}
}
