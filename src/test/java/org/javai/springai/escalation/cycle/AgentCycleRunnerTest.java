package org.javai.springai.escalation.cycle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.javai.springai.escalation.testsupport.Snapshots.calm;
import static org.javai.springai.escalation.testsupport.Snapshots.vitals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import java.time.Duration;
import java.util.Optional;
import org.javai.springai.escalation.EscalationOrchestrator;
import org.javai.springai.escalation.SnapshotNotReadyException;
import org.javai.springai.escalation.action.ActionExecutor;
import org.javai.springai.escalation.action.ActionFeedback;
import org.javai.springai.escalation.action.ActionKinds;
import org.javai.springai.escalation.action.FeedbackStatus;
import org.javai.springai.escalation.config.EscalationConfig;
import org.javai.springai.escalation.config.LoopSettings;
import org.javai.springai.escalation.heal.SelfHealingResolver;
import org.javai.springai.escalation.snapshot.Location;
import org.javai.springai.escalation.snapshot.SnapshotProvider;
import org.javai.springai.escalation.snapshot.StateSnapshot;
import org.javai.springai.escalation.testsupport.MutableClock;
import org.javai.springai.escalation.testsupport.Snapshots;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AgentCycleRunner")
class AgentCycleRunnerTest {

	private final MutableClock clock = new MutableClock(Snapshots.T0);
	private final SnapshotProvider provider = mock(SnapshotProvider.class);
	private final ActionExecutor executor = mock(ActionExecutor.class);

	private EscalationConfig config;
	private EscalationOrchestrator orchestrator;
	private AgentCycleRunner runner;

	@BeforeEach
	void setUp() {
		build(EscalationConfig.defaults(), null);
	}

	@AfterEach
	void tearDown() {
		orchestrator.close();
	}

	private void build(EscalationConfig config, SelfHealingResolver healer) {
		if (orchestrator != null) {
			orchestrator.close();
		}
		this.config = config;
		this.orchestrator = EscalationOrchestrator.builder().config(config).clock(clock).build();
		this.runner = AgentCycleRunner.builder()
				.snapshotProvider(provider)
				.orchestrator(orchestrator)
				.executor(executor)
				.selfHealing(healer)
				.config(config)
				.clock(clock)
				.build();
	}

	private static StateSnapshot in(String region) {
		return calm().location(new Location(region, 100, 100)).build();
	}

	@Nested
	@DisplayName("Deciding")
	class Deciding {

		@Test
		@DisplayName("A cycle decides, executes and reports the executor's feedback")
		void decidesAndReports() {
			when(provider.capture()).thenReturn(calm().build());
			when(executor.execute(any())).thenReturn(Optional.of(ActionFeedback.success(ActionKinds.IDLE)));

			CycleReport report = runner.runOnce();

			assertThat(report.isSkipped()).isFalse();
			assertThat(report.decided()).hasValueSatisfying(d -> assertThat(d.kind()).isEqualTo(ActionKinds.IDLE));
			assertThat(((CycleReport.Decided) report).feedback()).isPresent();
			assertThat(orchestrator.statistics().feedback(FeedbackStatus.SUCCESS)).isEqualTo(1);
		}

		@Test
		@DisplayName("An executor without feedback still completes the cycle")
		void noFeedback() {
			when(provider.capture()).thenReturn(calm().build());
			when(executor.execute(any())).thenReturn(null);

			CycleReport report = runner.runOnce();

			assertThat(((CycleReport.Decided) report).feedback()).isEmpty();
			assertThat(orchestrator.statistics().totalDecisions()).isEqualTo(1);
		}

		@Test
		@DisplayName("A throwing executor turns into failed feedback")
		void executorFailure() {
			when(provider.capture()).thenReturn(calm().build());
			when(executor.execute(any())).thenThrow(new IllegalStateException("socket closed"));

			CycleReport report = runner.runOnce();

			ActionFeedback feedback = ((CycleReport.Decided) report).feedback().orElseThrow();
			assertThat(feedback.isFailure()).isTrue();
			assertThat(feedback.reasonCode()).isEqualTo("executor_error");
			assertThat(feedback.detail()).isEqualTo("socket closed");
			assertThat(orchestrator.statistics().feedback(FeedbackStatus.FAILED)).isEqualTo(1);
		}

		@Test
		@DisplayName("Resting pauses cycles for the rest duration")
		void restPausesCycles() {
			when(provider.capture()).thenReturn(calm().vitals(vitals(1000, 100)).build());
			when(executor.execute(any())).thenReturn(Optional.empty());

			CycleReport rest = runner.runOnce();
			clock.advanceSeconds(9);
			CycleReport paused = runner.runOnce();
			clock.advanceSeconds(1);
			CycleReport resumed = runner.runOnce();

			assertThat(rest.decided()).hasValueSatisfying(d ->
					assertThat(d.parameters()).containsEntry(AgentCycleRunner.DURATION_PARAMETER, 10));
			assertThat(paused).isEqualTo(new CycleReport.Skipped(SkipReason.COOLDOWN_ACTIVE, "ACTION_PAUSE for another 1000 ms"));
			assertThat(resumed.isSkipped()).isFalse();
		}

		@Test
		@DisplayName("An agent without a location is refused before any tier runs")
		void missingLocation() {
			when(provider.capture()).thenReturn(calm().location(null).build());

			assertThatThrownBy(() -> runner.runOnce()).isInstanceOf(SnapshotNotReadyException.class);
			verify(executor, never()).execute(any());
		}
	}

	@Nested
	@DisplayName("Region changes")
	class RegionChanges {

		@Test
		@DisplayName("Entering a new region skips the cycle and settles before deciding again")
		void settlesAfterRegionChange() {
			when(provider.capture()).thenReturn(in("prontera"), in("geffen"));
			when(executor.execute(any())).thenReturn(Optional.empty());

			CycleReport first = runner.runOnce();
			CycleReport changed = runner.runOnce();
			clock.advanceSeconds(2);
			CycleReport settling = runner.runOnce();
			clock.advanceSeconds(3);
			CycleReport settled = runner.runOnce();

			assertThat(first.isSkipped()).isFalse();
			assertThat(changed).isEqualTo(new CycleReport.Skipped(SkipReason.REGION_CHANGED, "entered geffen"));
			assertThat(settling).isInstanceOfSatisfying(CycleReport.Skipped.class,
					s -> assertThat(s.reason()).isEqualTo(SkipReason.COOLDOWN_ACTIVE));
			assertThat(settled.isSkipped()).isFalse();
			assertThat(orchestrator.statistics().totalDecisions()).isEqualTo(2);
		}

		@Test
		@DisplayName("Bouncing between regions trips the loop detector and clears movement intent")
		void loopDetected() {
			SelfHealingResolver healer = mock(SelfHealingResolver.class);
			build(EscalationConfig.builder()
					.loop(new LoopSettings(2, Duration.ofSeconds(60), Duration.ofSeconds(5)))
					.build(), healer);
			when(provider.capture()).thenReturn(in("prontera"), in("geffen"), in("prontera"), in("geffen"), in("prontera"));
			when(executor.execute(any())).thenReturn(Optional.empty());

			CycleReport report = null;
			for (int i = 0; i < 5; i++) {
				report = runner.runOnce();
				clock.advanceSeconds(6);
			}

			String message = "Movement loop detected at prontera (3 visits)";
			assertThat(report).isEqualTo(new CycleReport.Skipped(SkipReason.LOOP_DETECTED, message));
			verify(executor).discardMovementIntent();
			verify(healer).observe(message);
			assertThat(orchestrator.resilience().loopDetector().visitCount("prontera")).isZero();
		}
	}

	@Test
	@DisplayName("Diagnostics are dropped when no resolver is configured")
	void diagnosticsWithoutResolver() {
		runner.onDiagnostic("No path to destination");

		verify(executor, never()).discardMovementIntent();
	}

	@Test
	@DisplayName("Builder requires the provider, orchestrator and executor")
	void builderValidation() {
		assertThatThrownBy(() -> AgentCycleRunner.builder().orchestrator(orchestrator).executor(executor).build())
				.isInstanceOf(IllegalArgumentException.class);
		assertThat(config.regionSettle()).isEqualTo(EscalationConfig.DEFAULT_REGION_SETTLE);
	}
}
