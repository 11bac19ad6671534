package org.javai.springai.escalation.config;

import java.time.Duration;

/**
 * Deadlines and throttling for the remote tiers.
 *
 * @param patternDeadline time the pattern tier may take before its result is abandoned
 * @param plannerDeadline time the planner tier may take before its result is abandoned
 * @param plannerMinInterval minimum time between two planner call attempts
 */
public record RemoteTierSettings(Duration patternDeadline, Duration plannerDeadline, Duration plannerMinInterval) {

	public static final Duration DEFAULT_PATTERN_DEADLINE = Duration.ofMillis(250);
	public static final Duration DEFAULT_PLANNER_DEADLINE = Duration.ofSeconds(10);
	public static final Duration DEFAULT_PLANNER_MIN_INTERVAL = Duration.ofSeconds(60);

	public RemoteTierSettings {
		Durations.requirePositive(patternDeadline, "patternDeadline");
		Durations.requirePositive(plannerDeadline, "plannerDeadline");
		Durations.requireNonNegative(plannerMinInterval, "plannerMinInterval");
	}

	public static RemoteTierSettings defaults() {
		return new RemoteTierSettings(DEFAULT_PATTERN_DEADLINE, DEFAULT_PLANNER_DEADLINE, DEFAULT_PLANNER_MIN_INTERVAL);
	}
}
