package org.javai.springai.escalation.cycle;

import java.util.Optional;
import org.javai.springai.escalation.Decision;
import org.javai.springai.escalation.action.ActionFeedback;

/**
 * What one call to {@link AgentCycleRunner#runOnce()} did.
 */
public sealed interface CycleReport {

	record Decided(Decision decision, Optional<ActionFeedback> feedback) implements CycleReport {
		public Decided {
			if (decision == null) {
				throw new IllegalArgumentException("decision must not be null");
			}
			feedback = feedback == null ? Optional.empty() : feedback;
		}
	}

	record Skipped(SkipReason reason, String detail) implements CycleReport {
		public Skipped {
			if (reason == null) {
				throw new IllegalArgumentException("reason must not be null");
			}
			detail = detail == null ? "" : detail;
		}
	}

	default boolean isSkipped() {
		return this instanceof Skipped;
	}

	default Optional<Decision> decided() {
		return this instanceof Decided decided ? Optional.of(decided.decision()) : Optional.empty();
	}
}
