package org.javai.springai.escalation;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.javai.springai.escalation.action.CandidateAction;

/**
 * The single action chosen for a cycle, with its provenance.
 *
 * @param action the accepted candidate action
 * @param tierUsed the tier that produced it
 * @param latency time from the start of the cycle to the decision
 * @param cycleId monotonically increasing cycle number for this agent
 * @param source policy name or model id inside the tier, empty when the tier has only one source
 * @param attempts every tier visited during the cycle, in order
 */
public record Decision(
		CandidateAction action,
		DecisionTier tierUsed,
		Duration latency,
		long cycleId,
		String source,
		List<TierAttempt> attempts
) {

	public Decision {
		if (action == null) {
			throw new IllegalArgumentException("action must not be null");
		}
		if (action.isNone()) {
			throw new IllegalArgumentException("a decision cannot carry the none action");
		}
		if (tierUsed == null) {
			throw new IllegalArgumentException("tierUsed must not be null");
		}
		if (latency == null || latency.isNegative()) {
			throw new IllegalArgumentException("latency must be >= 0");
		}
		source = source == null ? "" : source;
		attempts = attempts == null ? List.of() : List.copyOf(attempts);
	}

	public String kind() {
		return action.kind();
	}

	public Map<String, Object> parameters() {
		return action.parameters();
	}

	public double confidence() {
		return action.confidence();
	}

	public String rationale() {
		return action.rationale();
	}

	/**
	 * True when the decision came from a tier that needs no I/O.
	 */
	public boolean isLocal() {
		return !tierUsed.isRemote();
	}

	/**
	 * Compact one-line rendering of the tier walk, e.g. {@code reflex:DECLINED > policyBank:ACCEPTED}.
	 */
	public String trail() {
		return attempts.stream()
				.map(a -> a.tier().wireName() + ":" + a.outcome())
				.collect(Collectors.joining(" > "));
	}
}
