package org.javai.springai.escalation.config;

import java.time.Duration;
import org.javai.springai.escalation.policy.PolicyBank;
import org.javai.springai.escalation.reflex.ReflexThresholds;

/**
 * Configuration for one agent's escalation engine.
 *
 * <p>The values are thresholds only. Every agent built from the same configuration still
 * gets its own breakers, rate window, cooldowns and loop counters.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Use defaults
 * EscalationConfig config = EscalationConfig.defaults();
 *
 * // Custom configuration
 * EscalationConfig config = EscalationConfig.builder()
 *         .breaker(new BreakerSettings(5, Duration.ofSeconds(30)))
 *         .regionSettle(Duration.ofSeconds(3))
 *         .build();
 *
 * // From YAML
 * EscalationConfig config = EscalationConfigLoader.fromClasspath("escalation.yml");
 * }</pre>
 *
 * @param breaker circuit breaker thresholds for every remote dependency
 * @param rateLimit rolling limit over all remote calls
 * @param loop repetition detection
 * @param regionSettle cooldown after entering a new region
 * @param remote remote tier deadlines and planner throttle
 * @param reflex reflex thresholds
 * @param policyBudget time budget per policy bank entry
 */
public record EscalationConfig(
		BreakerSettings breaker,
		RateLimitSettings rateLimit,
		LoopSettings loop,
		Duration regionSettle,
		RemoteTierSettings remote,
		ReflexThresholds reflex,
		Duration policyBudget
) {

	public static final Duration DEFAULT_REGION_SETTLE = Duration.ofSeconds(5);

	public EscalationConfig {
		if (breaker == null) {
			throw new IllegalArgumentException("breaker must not be null");
		}
		if (rateLimit == null) {
			throw new IllegalArgumentException("rateLimit must not be null");
		}
		if (loop == null) {
			throw new IllegalArgumentException("loop must not be null");
		}
		if (remote == null) {
			throw new IllegalArgumentException("remote must not be null");
		}
		if (reflex == null) {
			throw new IllegalArgumentException("reflex must not be null");
		}
		Durations.requireNonNegative(regionSettle, "regionSettle");
		Durations.requirePositive(policyBudget, "policyBudget");
	}

	public static EscalationConfig defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builder for {@link EscalationConfig}.
	 */
	public static class Builder {
		private BreakerSettings breaker = BreakerSettings.defaults();
		private RateLimitSettings rateLimit = RateLimitSettings.defaults();
		private LoopSettings loop = LoopSettings.defaults();
		private Duration regionSettle = DEFAULT_REGION_SETTLE;
		private RemoteTierSettings remote = RemoteTierSettings.defaults();
		private ReflexThresholds reflex = ReflexThresholds.defaults();
		private Duration policyBudget = PolicyBank.DEFAULT_PER_ENTRY_BUDGET;

		private Builder() {}

		public Builder breaker(BreakerSettings breaker) {
			this.breaker = breaker;
			return this;
		}

		public Builder rateLimit(RateLimitSettings rateLimit) {
			this.rateLimit = rateLimit;
			return this;
		}

		public Builder loop(LoopSettings loop) {
			this.loop = loop;
			return this;
		}

		public Builder regionSettle(Duration regionSettle) {
			this.regionSettle = regionSettle;
			return this;
		}

		public Builder remote(RemoteTierSettings remote) {
			this.remote = remote;
			return this;
		}

		public Builder reflex(ReflexThresholds reflex) {
			this.reflex = reflex;
			return this;
		}

		public Builder policyBudget(Duration policyBudget) {
			this.policyBudget = policyBudget;
			return this;
		}

		public EscalationConfig build() {
			return new EscalationConfig(breaker, rateLimit, loop, regionSettle, remote, reflex, policyBudget);
		}
	}
}
