package org.javai.springai.escalation.remote;

import org.javai.springai.escalation.action.CandidateAction;

/**
 * Answer of a remote tier: a proposal, nothing to propose, or a failure.
 */
public sealed interface TierResult {

	record Proposed(CandidateAction action, String source) implements TierResult {
		public Proposed {
			if (action == null || action.isNone()) {
				throw new IllegalArgumentException("action must be a real proposal");
			}
			source = source == null ? "" : source;
		}
	}

	record Empty(String reason) implements TierResult {
	}

	record Failed(TierError error) implements TierResult {
		public Failed {
			if (error == null) {
				throw new IllegalArgumentException("error must not be null");
			}
		}
	}

	static TierResult proposed(CandidateAction action, String source) {
		return new Proposed(action, source);
	}

	static TierResult empty(String reason) {
		return new Empty(reason);
	}

	static TierResult failed(TierError error) {
		return new Failed(error);
	}
}
