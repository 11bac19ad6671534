package org.javai.springai.escalation.cycle;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.javai.springai.escalation.Decision;
import org.javai.springai.escalation.EscalationOrchestrator;
import org.javai.springai.escalation.SnapshotNotReadyException;
import org.javai.springai.escalation.action.ActionExecutor;
import org.javai.springai.escalation.action.ActionFeedback;
import org.javai.springai.escalation.action.ActionKinds;
import org.javai.springai.escalation.config.EscalationConfig;
import org.javai.springai.escalation.heal.SelfHealingResolver;
import org.javai.springai.escalation.resilience.CooldownKind;
import org.javai.springai.escalation.resilience.Cooldowns;
import org.javai.springai.escalation.resilience.LoopSignal;
import org.javai.springai.escalation.snapshot.SnapshotProvider;
import org.javai.springai.escalation.snapshot.StateSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one agent: capture, decide, execute, report.
 *
 * <p>Pauses are resume timestamps checked at the top of each cycle, never sleeps. The host
 * calls {@link #runOnce()} on its own schedule, one call at a time per agent.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * AgentCycleRunner runner = AgentCycleRunner.builder()
 *         .snapshotProvider(collector)
 *         .orchestrator(orchestrator)
 *         .executor(executor)
 *         .selfHealing(resolver)
 *         .build();
 *
 * scheduler.scheduleWithFixedDelay(runner::runOnce, 0, 500, TimeUnit.MILLISECONDS);
 * }</pre>
 */
public final class AgentCycleRunner {

	private static final Logger logger = LoggerFactory.getLogger(AgentCycleRunner.class);

	static final String DURATION_PARAMETER = "durationSeconds";

	private final SnapshotProvider snapshotProvider;
	private final EscalationOrchestrator orchestrator;
	private final ActionExecutor executor;
	private final SelfHealingResolver selfHealing;
	private final Duration regionSettle;
	private final Duration loopCooldown;
	private final Clock clock;

	private String currentRegion;

	private AgentCycleRunner(Builder builder) {
		this.snapshotProvider = builder.snapshotProvider;
		this.orchestrator = builder.orchestrator;
		this.executor = builder.executor;
		this.selfHealing = builder.selfHealing;
		this.regionSettle = builder.config.regionSettle();
		this.loopCooldown = builder.config.loop().cooldown();
		this.clock = builder.clock;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Run one cycle.
	 *
	 * @return what the cycle did
	 * @throws SnapshotNotReadyException when the agent cannot be described yet
	 */
	public CycleReport runOnce() {
		Cooldowns cooldowns = orchestrator.resilience().cooldowns();
		Instant now = clock.instant();
		Optional<CooldownKind> suspended = cooldowns.suspendingCycle(now);
		if (suspended.isPresent()) {
			CooldownKind kind = suspended.get();
			return new CycleReport.Skipped(SkipReason.COOLDOWN_ACTIVE,
					kind + " for another " + cooldowns.remaining(kind, now).toMillis() + " ms");
		}

		StateSnapshot snapshot = snapshotProvider.capture();
		if (snapshot == null || snapshot.location() == null) {
			throw new SnapshotNotReadyException("Agent has no location yet");
		}

		Optional<CycleReport> regionChange = handleRegionChange(snapshot.location().region(), now);
		if (regionChange.isPresent()) {
			return regionChange.get();
		}

		Decision decision = orchestrator.decide(snapshot);
		Optional<ActionFeedback> feedback = execute(decision);
		feedback.ifPresent(f -> orchestrator.reportOutcome(decision, f));
		engageActionPause(decision);
		return new CycleReport.Decided(decision, feedback);
	}

	/**
	 * Forward a diagnostic line from the host to the self-healing resolver.
	 */
	public void onDiagnostic(String message) {
		if (selfHealing != null) {
			selfHealing.observe(message);
		}
	}

	private Optional<CycleReport> handleRegionChange(String region, Instant now) {
		if (currentRegion == null) {
			currentRegion = region;
			orchestrator.resilience().loopDetector().recordVisit(region, now);
			return Optional.empty();
		}
		if (currentRegion.equals(region)) {
			return Optional.empty();
		}
		logger.info("Region changed from '{}' to '{}'", currentRegion, region);
		currentRegion = region;
		Cooldowns cooldowns = orchestrator.resilience().cooldowns();
		Optional<LoopSignal> loop = orchestrator.resilience().loopDetector().recordVisit(region, now);
		if (loop.isPresent()) {
			executor.discardMovementIntent();
			cooldowns.engage(CooldownKind.LOOP_BREAK, now, loopCooldown);
			onDiagnostic(loop.get().diagnosticMessage());
			return Optional.of(new CycleReport.Skipped(SkipReason.LOOP_DETECTED, loop.get().diagnosticMessage()));
		}
		cooldowns.engage(CooldownKind.REGION_SETTLE, now, regionSettle);
		return Optional.of(new CycleReport.Skipped(SkipReason.REGION_CHANGED, "entered " + region));
	}

	private Optional<ActionFeedback> execute(Decision decision) {
		try {
			Optional<ActionFeedback> feedback = executor.execute(decision);
			return feedback == null ? Optional.empty() : feedback;
		}
		catch (RuntimeException ex) {
			logger.warn("Executor failed on cycle {} ({})", decision.cycleId(), decision.kind(), ex);
			return Optional.of(ActionFeedback.failed(decision.kind(), "executor_error", String.valueOf(ex.getMessage())));
		}
	}

	private void engageActionPause(Decision decision) {
		if (!ActionKinds.IDLE.equals(decision.kind())) {
			return;
		}
		Object seconds = decision.parameters().get(DURATION_PARAMETER);
		if (seconds instanceof Number number && number.longValue() > 0) {
			orchestrator.resilience().cooldowns()
					.engage(CooldownKind.ACTION_PAUSE, clock.instant(), Duration.ofSeconds(number.longValue()));
			logger.debug("Pausing cycles for {} s after idle action", number.longValue());
		}
	}

	/**
	 * Builder for {@link AgentCycleRunner}.
	 */
	public static final class Builder {
		private SnapshotProvider snapshotProvider;
		private EscalationOrchestrator orchestrator;
		private ActionExecutor executor;
		private SelfHealingResolver selfHealing;
		private EscalationConfig config = EscalationConfig.defaults();
		private Clock clock = Clock.systemUTC();

		private Builder() {
		}

		public Builder snapshotProvider(SnapshotProvider snapshotProvider) {
			this.snapshotProvider = snapshotProvider;
			return this;
		}

		public Builder orchestrator(EscalationOrchestrator orchestrator) {
			this.orchestrator = orchestrator;
			return this;
		}

		public Builder executor(ActionExecutor executor) {
			this.executor = executor;
			return this;
		}

		/**
		 * Optional resolver fed with diagnostics and loop signals.
		 */
		public Builder selfHealing(SelfHealingResolver selfHealing) {
			this.selfHealing = selfHealing;
			return this;
		}

		/**
		 * Source of the region-settle and loop cooldowns. Should be the configuration the
		 * orchestrator was built from.
		 */
		public Builder config(EscalationConfig config) {
			this.config = config;
			return this;
		}

		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		public AgentCycleRunner build() {
			if (snapshotProvider == null || orchestrator == null || executor == null) {
				throw new IllegalArgumentException("snapshotProvider, orchestrator and executor are required");
			}
			if (config == null || clock == null) {
				throw new IllegalArgumentException("config and clock must not be null");
			}
			return new AgentCycleRunner(this);
		}
	}
}
