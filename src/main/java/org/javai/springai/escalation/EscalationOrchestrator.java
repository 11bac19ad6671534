package org.javai.springai.escalation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.javai.springai.escalation.action.ActionFeedback;
import org.javai.springai.escalation.action.ActionKinds;
import org.javai.springai.escalation.action.CandidateAction;
import org.javai.springai.escalation.config.EscalationConfig;
import org.javai.springai.escalation.policy.PolicyBank;
import org.javai.springai.escalation.policy.PolicySelection;
import org.javai.springai.escalation.reflex.ReflexEvaluator;
import org.javai.springai.escalation.remote.RemoteTier;
import org.javai.springai.escalation.resilience.GuardedCall;
import org.javai.springai.escalation.resilience.RemoteCallGuard;
import org.javai.springai.escalation.resilience.ResilienceState;
import org.javai.springai.escalation.rule.RuleEvaluator;
import org.javai.springai.escalation.snapshot.StateSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces exactly one {@link Decision} per cycle by walking the tier ladder.
 *
 * <p>Tiers are tried one at a time in fixed order: reflex, policy bank, rule, pattern,
 * planner. The first tier to propose an action wins. When none does, the rule evaluator's
 * unconditional answer becomes the decision, so remote tiers are only ever an improvement and
 * never a requirement. Remote tiers are reached exclusively through the
 * {@link RemoteCallGuard}, which applies pauses, throttles, breakers, the rate limit and the
 * per-tier deadline.</p>
 *
 * <p>The only exception that leaves {@link #decide(StateSnapshot)} is
 * {@link SnapshotNotReadyException}.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * try (EscalationOrchestrator orchestrator = EscalationOrchestrator.builder()
 *         .config(EscalationConfig.defaults())
 *         .remoteTier(RemoteTierClients.pattern(url, key, "pattern-v2"))
 *         .remoteTier(RemoteTierClients.planner(url, key, "planner-v1"))
 *         .build()) {
 *     Decision decision = orchestrator.decide(snapshotProvider.capture());
 *     executor.execute(decision).ifPresent(feedback -> orchestrator.reportOutcome(decision, feedback));
 * }
 * }</pre>
 */
public final class EscalationOrchestrator implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(EscalationOrchestrator.class);

	static final String FLOOR_SOURCE = "floor";

	private final ReflexEvaluator reflexEvaluator;
	private final PolicyBank policyBank;
	private final RuleEvaluator ruleEvaluator;
	private final List<RemoteTier> remoteTiers;
	private final ResilienceState resilience;
	private final RemoteCallGuard guard;
	private final Clock clock;
	private final ExecutorService executor;
	private final boolean ownsExecutor;
	private final EscalationStatistics statistics = new EscalationStatistics();
	private final AtomicLong cycles = new AtomicLong();
	private volatile boolean degraded;

	private EscalationOrchestrator(Builder builder) {
		EscalationConfig config = builder.config;
		this.reflexEvaluator = builder.reflexEvaluator != null ? builder.reflexEvaluator : new ReflexEvaluator(config.reflex());
		this.policyBank = builder.policyBank != null ? builder.policyBank : PolicyBank.defaults(config.policyBudget());
		this.ruleEvaluator = builder.ruleEvaluator != null ? builder.ruleEvaluator : new RuleEvaluator();
		this.remoteTiers = builder.remoteTiers.stream()
				.sorted(Comparator.comparing(RemoteTier::tier))
				.toList();
		this.resilience = builder.resilience != null ? builder.resilience : ResilienceState.create(config);
		this.clock = builder.clock;
		this.ownsExecutor = builder.executor == null;
		this.executor = builder.executor != null ? builder.executor : Executors.newCachedThreadPool(daemonThreads());
		Map<DecisionTier, Duration> deadlines = new EnumMap<>(DecisionTier.class);
		deadlines.put(DecisionTier.PATTERN, config.remote().patternDeadline());
		deadlines.put(DecisionTier.PLANNER, config.remote().plannerDeadline());
		this.guard = new RemoteCallGuard(resilience, deadlines, executor, clock);
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Choose the action for this cycle.
	 *
	 * @param snapshot the cycle's snapshot
	 * @return the decision, never null
	 * @throws SnapshotNotReadyException when the snapshot does not describe an initialized agent
	 */
	public Decision decide(StateSnapshot snapshot) {
		validate(snapshot);
		long cycleId = cycles.incrementAndGet();
		Instant start = clock.instant();
		updateDegradedMode();
		List<TierAttempt> attempts = new ArrayList<>();

		Optional<Decision> decision = tryReflex(snapshot, cycleId, start, attempts)
				.or(() -> tryPolicyBank(snapshot, cycleId, start, attempts))
				.or(() -> tryRule(snapshot, cycleId, start, attempts))
				.or(() -> tryRemote(snapshot, cycleId, start, attempts));

		Decision result = decision.orElseGet(() -> floor(snapshot, cycleId, start, attempts));
		statistics.record(result);
		logger.info("Cycle {}: {} from {}{} in {} ms", cycleId, result.kind(), result.tierUsed().wireName(),
				result.source().isEmpty() ? "" : " (" + result.source() + ")", result.latency().toMillis());
		logger.debug("Cycle {} tier walk: {}", cycleId, result.trail());
		return result;
	}

	/**
	 * Feed executor feedback back into the resilience accounting. A failed action that came
	 * from a remote tier counts as one failure against that tier's breaker.
	 */
	public void reportOutcome(Decision decision, ActionFeedback feedback) {
		if (decision == null || feedback == null) {
			throw new IllegalArgumentException("decision and feedback must not be null");
		}
		statistics.record(feedback);
		if (!feedback.kind().equals(decision.kind())) {
			logger.warn("Feedback for '{}' reported against a '{}' decision (cycle {})",
					feedback.kind(), decision.kind(), decision.cycleId());
		}
		if (!feedback.isFailure() || !decision.tierUsed().isRemote()) {
			return;
		}
		remoteTiers.stream()
				.filter(tier -> tier.tier() == decision.tierUsed())
				.findFirst()
				.ifPresent(tier -> {
					resilience.breakerFor(tier.dependencyName()).recordFailure(clock.instant());
					logger.warn("Action from {} tier failed ({}): {}", tier.tier().wireName(),
							feedback.reasonCode(), feedback.detail());
				});
	}

	/**
	 * True while no remote tier could be called, so only local tiers can decide.
	 */
	public boolean isDegraded() {
		return degraded;
	}

	public ResilienceState resilience() {
		return resilience;
	}

	public EscalationStatistics statistics() {
		return statistics;
	}

	public PolicyBank policyBank() {
		return policyBank;
	}

	@Override
	public void close() {
		if (ownsExecutor) {
			executor.shutdownNow();
		}
	}

	private Optional<Decision> tryReflex(StateSnapshot snapshot, long cycleId, Instant start, List<TierAttempt> attempts) {
		Instant tierStart = clock.instant();
		try {
			Optional<CandidateAction> action = reflexEvaluator.evaluate(snapshot);
			if (action.isPresent()) {
				return Optional.of(accept(DecisionTier.REFLEX, action.get(), "", cycleId, start, tierStart, attempts));
			}
			attempts.add(attempt(DecisionTier.REFLEX, TierOutcome.DECLINED, tierStart, "no emergency"));
		}
		catch (RuntimeException ex) {
			logger.warn("Reflex evaluation threw; continuing without it", ex);
			attempts.add(attempt(DecisionTier.REFLEX, TierOutcome.LOCAL_FAILURE, tierStart, ex.getMessage()));
		}
		return Optional.empty();
	}

	private Optional<Decision> tryPolicyBank(StateSnapshot snapshot, long cycleId, Instant start, List<TierAttempt> attempts) {
		Instant tierStart = clock.instant();
		try {
			Optional<PolicySelection> selection = policyBank.select(snapshot);
			if (selection.isPresent()) {
				return Optional.of(accept(DecisionTier.POLICY_BANK, selection.get().action(),
						selection.get().policyName(), cycleId, start, tierStart, attempts));
			}
			attempts.add(attempt(DecisionTier.POLICY_BANK, TierOutcome.EMPTY, tierStart, "no policy proposal"));
		}
		catch (RuntimeException ex) {
			logger.warn("Policy bank threw; continuing without it", ex);
			attempts.add(attempt(DecisionTier.POLICY_BANK, TierOutcome.LOCAL_FAILURE, tierStart, ex.getMessage()));
		}
		return Optional.empty();
	}

	private Optional<Decision> tryRule(StateSnapshot snapshot, long cycleId, Instant start, List<TierAttempt> attempts) {
		Instant tierStart = clock.instant();
		try {
			if (!ruleEvaluator.shouldHandle(snapshot)) {
				attempts.add(attempt(DecisionTier.RULE, TierOutcome.DECLINED, tierStart, "no tactical situation"));
				return Optional.empty();
			}
			Optional<CandidateAction> action = ruleEvaluator.propose(snapshot);
			if (action.isPresent()) {
				return Optional.of(accept(DecisionTier.RULE, action.get(), "", cycleId, start, tierStart, attempts));
			}
			attempts.add(attempt(DecisionTier.RULE, TierOutcome.EMPTY, tierStart, "no tactical action"));
		}
		catch (RuntimeException ex) {
			logger.warn("Rule evaluation threw; continuing without it", ex);
			attempts.add(attempt(DecisionTier.RULE, TierOutcome.LOCAL_FAILURE, tierStart, ex.getMessage()));
		}
		return Optional.empty();
	}

	private Optional<Decision> tryRemote(StateSnapshot snapshot, long cycleId, Instant start, List<TierAttempt> attempts) {
		for (RemoteTier tier : remoteTiers) {
			Instant tierStart = clock.instant();
			GuardedCall call = guard.call(tier, snapshot);
			if (call.outcome() == TierOutcome.ACCEPTED && call.action().isPresent()) {
				return Optional.of(accept(tier.tier(), call.action().get(), call.source(), cycleId, start, tierStart, attempts));
			}
			if (call.outcome().isDependencyFailure()) {
				logger.warn("{} tier {}: {}", tier.tier().wireName(), call.outcome(), call.detail());
			}
			else {
				logger.debug("{} tier {}: {}", tier.tier().wireName(), call.outcome(), call.detail());
			}
			attempts.add(attempt(tier.tier(), call.outcome(), tierStart, call.detail()));
		}
		return Optional.empty();
	}

	private Decision floor(StateSnapshot snapshot, long cycleId, Instant start, List<TierAttempt> attempts) {
		Instant tierStart = clock.instant();
		CandidateAction action;
		try {
			action = ruleEvaluator.decide(snapshot);
		}
		catch (RuntimeException ex) {
			logger.error("Rule floor threw; idling this cycle", ex);
			action = CandidateAction.of(ActionKinds.IDLE, 0.1, "rule floor failed: " + ex.getMessage());
		}
		if (action.isNone()) {
			action = CandidateAction.of(ActionKinds.IDLE, 0.1, action.rationale());
		}
		return accept(DecisionTier.RULE, action, FLOOR_SOURCE, cycleId, start, tierStart, attempts);
	}

	private Decision accept(DecisionTier tier, CandidateAction action, String source, long cycleId,
			Instant start, Instant tierStart, List<TierAttempt> attempts) {
		attempts.add(attempt(tier, TierOutcome.ACCEPTED, tierStart, source));
		Duration latency = nonNegative(Duration.between(start, clock.instant()));
		return new Decision(action, tier, latency, cycleId, source, attempts);
	}

	private TierAttempt attempt(DecisionTier tier, TierOutcome outcome, Instant tierStart, String detail) {
		long millis = nonNegative(Duration.between(tierStart, clock.instant())).toMillis();
		return new TierAttempt(tier, outcome, millis, detail);
	}

	private void updateDegradedMode() {
		boolean nowDegraded = remoteTiers.stream().noneMatch(guard::isAvailable);
		if (nowDegraded != degraded) {
			degraded = nowDegraded;
			if (nowDegraded) {
				logger.info("Entering degraded mode: no remote tier is currently available");
			}
			else {
				logger.info("Leaving degraded mode: remote tiers available again");
			}
		}
	}

	private static void validate(StateSnapshot snapshot) {
		if (snapshot == null) {
			throw new SnapshotNotReadyException("No snapshot available");
		}
		if (snapshot.vitals().maxHealth() <= 0) {
			throw new SnapshotNotReadyException("Snapshot has no maximum health; agent not initialized");
		}
		if (snapshot.location() == null) {
			throw new SnapshotNotReadyException("Snapshot has no location; agent not in a region");
		}
	}

	private static Duration nonNegative(Duration duration) {
		return duration.isNegative() ? Duration.ZERO : duration;
	}

	private static ThreadFactory daemonThreads() {
		AtomicInteger counter = new AtomicInteger();
		return runnable -> {
			Thread thread = new Thread(runnable, "escalation-remote-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
	}

	/**
	 * Builder for {@link EscalationOrchestrator}. Only the configuration is required; each
	 * component not supplied is built from it.
	 */
	public static final class Builder {
		private EscalationConfig config = EscalationConfig.defaults();
		private ReflexEvaluator reflexEvaluator;
		private PolicyBank policyBank;
		private RuleEvaluator ruleEvaluator;
		private final List<RemoteTier> remoteTiers = new ArrayList<>();
		private ResilienceState resilience;
		private Clock clock = Clock.systemUTC();
		private ExecutorService executor;

		private Builder() {
		}

		public Builder config(EscalationConfig config) {
			if (config == null) {
				throw new IllegalArgumentException("config must not be null");
			}
			this.config = config;
			return this;
		}

		public Builder reflexEvaluator(ReflexEvaluator reflexEvaluator) {
			this.reflexEvaluator = reflexEvaluator;
			return this;
		}

		public Builder policyBank(PolicyBank policyBank) {
			this.policyBank = policyBank;
			return this;
		}

		public Builder ruleEvaluator(RuleEvaluator ruleEvaluator) {
			this.ruleEvaluator = ruleEvaluator;
			return this;
		}

		/**
		 * Add a remote tier. At most one client per remote ladder position.
		 */
		public Builder remoteTier(RemoteTier tier) {
			if (tier == null) {
				throw new IllegalArgumentException("tier must not be null");
			}
			if (!tier.tier().isRemote()) {
				throw new IllegalArgumentException("Not a remote tier: " + tier.tier());
			}
			if (remoteTiers.stream().anyMatch(existing -> existing.tier() == tier.tier())) {
				throw new IllegalArgumentException("A " + tier.tier().wireName() + " tier is already registered");
			}
			remoteTiers.add(tier);
			return this;
		}

		/**
		 * Use existing resilience state instead of creating a fresh one. Never share one
		 * instance between agents.
		 */
		public Builder resilience(ResilienceState resilience) {
			this.resilience = resilience;
			return this;
		}

		public Builder clock(Clock clock) {
			if (clock == null) {
				throw new IllegalArgumentException("clock must not be null");
			}
			this.clock = clock;
			return this;
		}

		/**
		 * Executor for remote calls. When not supplied the orchestrator creates and owns one.
		 */
		public Builder executor(ExecutorService executor) {
			this.executor = executor;
			return this;
		}

		public EscalationOrchestrator build() {
			return new EscalationOrchestrator(this);
		}
	}
}
