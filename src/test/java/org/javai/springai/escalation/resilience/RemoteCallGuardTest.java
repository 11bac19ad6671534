package org.javai.springai.escalation.resilience;

import static org.assertj.core.api.Assertions.assertThat;
import static org.javai.springai.escalation.testsupport.Snapshots.calm;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.javai.springai.escalation.DecisionTier;
import org.javai.springai.escalation.TierOutcome;
import org.javai.springai.escalation.action.ActionKinds;
import org.javai.springai.escalation.action.CandidateAction;
import org.javai.springai.escalation.config.EscalationConfig;
import org.javai.springai.escalation.config.RateLimitSettings;
import org.javai.springai.escalation.config.RemoteTierSettings;
import org.javai.springai.escalation.remote.TierError;
import org.javai.springai.escalation.snapshot.StateSnapshot;
import org.javai.springai.escalation.testsupport.MutableClock;
import org.javai.springai.escalation.testsupport.ScriptedRemoteTier;
import org.javai.springai.escalation.testsupport.Snapshots;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("RemoteCallGuard")
class RemoteCallGuardTest {

	private static final CandidateAction ATTACK = CandidateAction.of(ActionKinds.ATTACK, Map.of("target", "m-1"), 0.7, "remote");

	private final MutableClock clock = new MutableClock(Snapshots.T0);
	private final ExecutorService executor = Executors.newCachedThreadPool();
	private final StateSnapshot snapshot = calm().build();

	@AfterEach
	void shutdown() {
		executor.shutdownNow();
	}

	private RemoteCallGuard guard(ResilienceState state) {
		return new RemoteCallGuard(state, Map.of(
				DecisionTier.PATTERN, Duration.ofMillis(200),
				DecisionTier.PLANNER, Duration.ofMillis(200)), executor, clock);
	}

	private static ResilienceState state(EscalationConfig config) {
		return ResilienceState.create(config);
	}

	@Test
	@DisplayName("A declining gate skips every check and makes no call")
	void decliningGate() {
		ResilienceState state = state(EscalationConfig.defaults());
		ScriptedRemoteTier tier = ScriptedRemoteTier.pattern().gate(s -> false).thenPropose(ATTACK, "m");

		GuardedCall call = guard(state).call(tier, snapshot);

		assertThat(call.outcome()).isEqualTo(TierOutcome.DECLINED);
		assertThat(tier.calls()).isZero();
		assertThat(state.rateLimiter().window().count()).isZero();
	}

	@Test
	@DisplayName("A proposal is accepted with its source")
	void proposalAccepted() {
		ResilienceState state = state(EscalationConfig.defaults());
		ScriptedRemoteTier tier = ScriptedRemoteTier.pattern().thenPropose(ATTACK, "pattern-v2");

		GuardedCall call = guard(state).call(tier, snapshot);

		assertThat(call.outcome()).isEqualTo(TierOutcome.ACCEPTED);
		assertThat(call.action()).contains(ATTACK);
		assertThat(call.source()).isEqualTo("pattern-v2");
		assertThat(state.rateLimiter().window().count()).isEqualTo(1);
	}

	@Nested
	@DisplayName("Failures")
	class Failures {

		@Test
		@DisplayName("Three transport failures open the breaker and the fourth visit makes no call")
		void breakerOpensAfterThreeFailures() {
			ResilienceState state = state(EscalationConfig.defaults());
			ScriptedRemoteTier tier = ScriptedRemoteTier.pattern().thenFail(TierError.transport("connection refused"));
			RemoteCallGuard guard = guard(state);

			for (int i = 0; i < 3; i++) {
				assertThat(guard.call(tier, snapshot).outcome()).isEqualTo(TierOutcome.TRANSPORT_ERROR);
			}
			GuardedCall fourth = guard.call(tier, snapshot);

			assertThat(fourth.outcome()).isEqualTo(TierOutcome.UNAVAILABLE);
			assertThat(fourth.detail()).contains("open");
			assertThat(tier.calls()).isEqualTo(3);
			assertThat(guard.isAvailable(tier)).isFalse();
		}

		@Test
		@DisplayName("A call that overruns its deadline is a timeout and a breaker failure")
		void timeout() {
			ResilienceState state = state(EscalationConfig.defaults());
			ScriptedRemoteTier tier = ScriptedRemoteTier.pattern().thenHang();

			GuardedCall call = guard(state).call(tier, snapshot);
			tier.release();

			assertThat(call.outcome()).isEqualTo(TierOutcome.TIMEOUT);
			assertThat(state.breakerFor("pattern-service").state().consecutiveFailures()).isEqualTo(1);
		}

		@Test
		@DisplayName("A tier that throws counts as a transport error")
		void throwingTier() {
			ResilienceState state = state(EscalationConfig.defaults());
			ScriptedRemoteTier tier = ScriptedRemoteTier.pattern().thenThrow(new IllegalStateException("socket closed"));

			GuardedCall call = guard(state).call(tier, snapshot);

			assertThat(call.outcome()).isEqualTo(TierOutcome.TRANSPORT_ERROR);
			assertThat(call.detail()).isEqualTo("socket closed");
		}

		@Test
		@DisplayName("Malformed replies and missing results count as malformed")
		void malformed() {
			ResilienceState state = state(EscalationConfig.defaults());
			RemoteCallGuard guard = guard(state);

			GuardedCall malformed = guard.call(ScriptedRemoteTier.pattern()
					.thenFail(TierError.malformed("no kind")), snapshot);
			GuardedCall nothing = guard.call(ScriptedRemoteTier.pattern().thenReturnNull(), snapshot);

			assertThat(malformed.outcome()).isEqualTo(TierOutcome.MALFORMED_RESPONSE);
			assertThat(nothing.outcome()).isEqualTo(TierOutcome.MALFORMED_RESPONSE);
			assertThat(state.breakerFor("pattern-service").state().consecutiveFailures()).isEqualTo(2);
		}

		@Test
		@DisplayName("An empty answer is a success for the breaker")
		void emptyIsSuccess() {
			ResilienceState state = state(EscalationConfig.defaults());
			state.breakerFor("pattern-service").recordFailure(clock.instant());
			ScriptedRemoteTier tier = ScriptedRemoteTier.pattern().thenEmpty("nothing familiar");

			GuardedCall call = guard(state).call(tier, snapshot);

			assertThat(call.outcome()).isEqualTo(TierOutcome.EMPTY);
			assertThat(state.breakerFor("pattern-service").state().consecutiveFailures()).isZero();
		}
	}

	@Test
	@DisplayName("Exceeding the rate limit engages the emergency pause for every remote tier")
	void rateLimitEngagesEmergencyPause() {
		EscalationConfig config = EscalationConfig.builder()
				.rateLimit(new RateLimitSettings(2, Duration.ofSeconds(60), Duration.ofSeconds(60)))
				.build();
		ResilienceState state = state(config);
		RemoteCallGuard guard = guard(state);
		ScriptedRemoteTier pattern = ScriptedRemoteTier.pattern().thenEmpty("none");
		ScriptedRemoteTier planner = ScriptedRemoteTier.planner().thenEmpty("none");

		guard.call(pattern, snapshot);
		guard.call(pattern, snapshot);
		GuardedCall refused = guard.call(pattern, snapshot);

		assertThat(refused.outcome()).isEqualTo(TierOutcome.UNAVAILABLE);
		assertThat(refused.detail()).isEqualTo("rate limit exceeded");
		assertThat(state.cooldowns().isActive(CooldownKind.EMERGENCY_PAUSE, clock.instant())).isTrue();
		assertThat(guard.call(planner, snapshot).outcome()).isEqualTo(TierOutcome.UNAVAILABLE);
		assertThat(planner.calls()).isZero();
		assertThat(guard.isAvailable(pattern)).isFalse();

		clock.advanceSeconds(60);
		assertThat(guard.call(pattern, snapshot).outcome()).isEqualTo(TierOutcome.EMPTY);
	}

	@Test
	@DisplayName("The planner is throttled to its minimum interval")
	void plannerThrottle() {
		EscalationConfig config = EscalationConfig.builder()
				.remote(new RemoteTierSettings(Duration.ofMillis(200), Duration.ofMillis(200), Duration.ofSeconds(60)))
				.build();
		ResilienceState state = state(config);
		RemoteCallGuard guard = guard(state);
		ScriptedRemoteTier planner = ScriptedRemoteTier.planner().thenEmpty("none");

		assertThat(guard.call(planner, snapshot).outcome()).isEqualTo(TierOutcome.EMPTY);
		GuardedCall throttled = guard.call(planner, snapshot);
		clock.advanceSeconds(60);
		GuardedCall later = guard.call(planner, snapshot);

		assertThat(throttled.outcome()).isEqualTo(TierOutcome.UNAVAILABLE);
		assertThat(later.outcome()).isEqualTo(TierOutcome.EMPTY);
		assertThat(throttled.detail()).contains("minimum interval");
		assertThat(planner.calls()).isEqualTo(2);
	}
}
