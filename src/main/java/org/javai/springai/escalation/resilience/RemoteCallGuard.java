package org.javai.springai.escalation.resilience;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.javai.springai.escalation.DecisionTier;
import org.javai.springai.escalation.TierOutcome;
import org.javai.springai.escalation.remote.RemoteTier;
import org.javai.springai.escalation.remote.TierError;
import org.javai.springai.escalation.remote.TierResult;
import org.javai.springai.escalation.snapshot.StateSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The only path from the orchestrator to a remote tier.
 *
 * <p>Checks run cheapest first and all of them happen before any I/O: the tier's gate, the
 * emergency pause, the planner's minimum interval, the dependency's breaker and finally the
 * rate limiter. A call that gets through runs on the guard's executor and is abandoned at the
 * tier deadline. Timeouts, malformed replies and transport errors count as one breaker failure
 * each; proposals and empty answers count as a success.</p>
 */
public class RemoteCallGuard {

	private static final Logger logger = LoggerFactory.getLogger(RemoteCallGuard.class);

	private final ResilienceState state;
	private final Map<DecisionTier, Duration> deadlines;
	private final ExecutorService executor;
	private final Clock clock;

	public RemoteCallGuard(ResilienceState state, Map<DecisionTier, Duration> deadlines,
			ExecutorService executor, Clock clock) {
		if (state == null || deadlines == null || executor == null || clock == null) {
			throw new IllegalArgumentException("state, deadlines, executor and clock must not be null");
		}
		this.state = state;
		this.deadlines = Map.copyOf(deadlines);
		this.executor = executor;
		this.clock = clock;
	}

	/**
	 * Whether a call to {@code tier} could currently be attempted as far as pauses and breakers
	 * are concerned. Used to tell degraded operation apart from ordinary fallthrough.
	 */
	public boolean isAvailable(RemoteTier tier) {
		Instant now = clock.instant();
		if (state.cooldowns().isActive(CooldownKind.EMERGENCY_PAUSE, now)) {
			return false;
		}
		return state.breakerFor(tier.dependencyName()).allowsCall(now);
	}

	public GuardedCall call(RemoteTier tier, StateSnapshot snapshot) {
		try {
			if (!tier.shouldHandle(snapshot)) {
				return GuardedCall.of(TierOutcome.DECLINED, "gate declined");
			}
		}
		catch (RuntimeException ex) {
			logger.warn("{} tier gate threw; skipping the tier", tier.tier().wireName(), ex);
			return GuardedCall.of(TierOutcome.LOCAL_FAILURE, "gate threw: " + ex.getMessage());
		}

		Instant now = clock.instant();
		if (state.cooldowns().isActive(CooldownKind.EMERGENCY_PAUSE, now)) {
			return GuardedCall.of(TierOutcome.UNAVAILABLE, "emergency pause for another "
					+ state.cooldowns().remaining(CooldownKind.EMERGENCY_PAUSE, now).toSeconds() + " s");
		}
		boolean throttled = tier.tier() == DecisionTier.PLANNER;
		if (throttled && !state.plannerThrottle().permits(now)) {
			return GuardedCall.of(TierOutcome.UNAVAILABLE, "planner minimum interval not yet elapsed");
		}
		CircuitBreaker breaker = state.breakerFor(tier.dependencyName());
		if (!breaker.allowsCall(now)) {
			return GuardedCall.of(TierOutcome.UNAVAILABLE, "circuit breaker " + breaker.state().state().wireName());
		}
		if (!state.rateLimiter().tryAcquire(now)) {
			state.cooldowns().engage(CooldownKind.EMERGENCY_PAUSE, now, state.emergencyPause());
			logger.warn("Remote call rate limit of {} per {} s reached; pausing all remote tiers for {} s",
					state.rateLimiter().window().limit(), state.rateLimiter().window().windowSize().toSeconds(),
					state.emergencyPause().toSeconds());
			return GuardedCall.of(TierOutcome.UNAVAILABLE, "rate limit exceeded");
		}
		breaker.tryAcquire(now);
		if (throttled) {
			state.plannerThrottle().markAttempt(now);
		}
		return invoke(tier, snapshot, breaker, now);
	}

	private GuardedCall invoke(RemoteTier tier, StateSnapshot snapshot, CircuitBreaker breaker, Instant now) {
		Duration budget = deadlines.getOrDefault(tier.tier(), Duration.ofSeconds(1));
		Instant deadline = now.plus(budget);
		Future<TierResult> future = executor.submit(() -> tier.decide(snapshot, deadline));
		TierResult result;
		try {
			result = future.get(budget.toMillis(), TimeUnit.MILLISECONDS);
		}
		catch (TimeoutException ex) {
			// the remote side is not told; whatever it sends later is discarded
			future.cancel(true);
			breaker.recordFailure(clock.instant());
			logger.warn("{} tier did not answer within {} ms", tier.tier().wireName(), budget.toMillis());
			return GuardedCall.of(TierOutcome.TIMEOUT, "no answer within " + budget.toMillis() + " ms");
		}
		catch (ExecutionException ex) {
			breaker.recordFailure(clock.instant());
			Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
			logger.warn("{} tier threw instead of returning a result", tier.tier().wireName(), cause);
			return GuardedCall.of(TierOutcome.TRANSPORT_ERROR, String.valueOf(cause.getMessage()));
		}
		catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			future.cancel(true);
			// the half-open trial, if any, has been spent, so the call must be settled either way
			breaker.recordFailure(clock.instant());
			return GuardedCall.of(TierOutcome.TIMEOUT, "interrupted while waiting for the tier");
		}
		return settle(tier, result, breaker);
	}

	private GuardedCall settle(RemoteTier tier, TierResult result, CircuitBreaker breaker) {
		if (result instanceof TierResult.Proposed proposed) {
			breaker.recordSuccess();
			return GuardedCall.accepted(proposed.action(), proposed.source());
		}
		if (result instanceof TierResult.Empty empty) {
			breaker.recordSuccess();
			return GuardedCall.of(TierOutcome.EMPTY, empty.reason());
		}
		if (result instanceof TierResult.Failed failed) {
			breaker.recordFailure(clock.instant());
			return GuardedCall.of(outcomeFor(failed.error()), failed.error().message());
		}
		breaker.recordFailure(clock.instant());
		logger.warn("{} tier returned no result", tier.tier().wireName());
		return GuardedCall.of(TierOutcome.MALFORMED_RESPONSE, "tier returned no result");
	}

	private static TierOutcome outcomeFor(TierError error) {
		return switch (error.kind()) {
			case TIMEOUT -> TierOutcome.TIMEOUT;
			case MALFORMED_RESPONSE -> TierOutcome.MALFORMED_RESPONSE;
			case TRANSPORT -> TierOutcome.TRANSPORT_ERROR;
		};
	}
}
