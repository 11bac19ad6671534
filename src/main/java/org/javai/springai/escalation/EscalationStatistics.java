package org.javai.springai.escalation;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import org.javai.springai.escalation.action.ActionFeedback;
import org.javai.springai.escalation.action.FeedbackStatus;

/**
 * Running counters for one orchestrator: decisions per tier, latency, and executor feedback.
 */
public class EscalationStatistics {

	private final Map<DecisionTier, Long> decisionsByTier = new EnumMap<>(DecisionTier.class);
	private final Map<DecisionTier, Long> latencyMillisByTier = new EnumMap<>(DecisionTier.class);
	private final Map<FeedbackStatus, Long> feedbackByStatus = new EnumMap<>(FeedbackStatus.class);

	synchronized void record(Decision decision) {
		decisionsByTier.merge(decision.tierUsed(), 1L, Long::sum);
		latencyMillisByTier.merge(decision.tierUsed(), decision.latency().toMillis(), Long::sum);
	}

	synchronized void record(ActionFeedback feedback) {
		feedbackByStatus.merge(feedback.status(), 1L, Long::sum);
	}

	public synchronized long totalDecisions() {
		return decisionsByTier.values().stream().mapToLong(Long::longValue).sum();
	}

	public synchronized long decisions(DecisionTier tier) {
		return decisionsByTier.getOrDefault(tier, 0L);
	}

	public synchronized Map<DecisionTier, Long> decisionsByTier() {
		return Map.copyOf(decisionsByTier);
	}

	/**
	 * Mean decision latency for a tier, zero when the tier has never decided.
	 */
	public synchronized Duration averageLatency(DecisionTier tier) {
		long count = decisions(tier);
		if (count == 0) {
			return Duration.ZERO;
		}
		return Duration.ofMillis(latencyMillisByTier.getOrDefault(tier, 0L) / count);
	}

	public synchronized Duration averageLatency() {
		long count = totalDecisions();
		if (count == 0) {
			return Duration.ZERO;
		}
		long total = latencyMillisByTier.values().stream().mapToLong(Long::longValue).sum();
		return Duration.ofMillis(total / count);
	}

	public synchronized long feedback(FeedbackStatus status) {
		return feedbackByStatus.getOrDefault(status, 0L);
	}
}
