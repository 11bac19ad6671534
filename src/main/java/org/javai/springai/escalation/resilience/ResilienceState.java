package org.javai.springai.escalation.resilience;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.javai.springai.escalation.config.BreakerSettings;
import org.javai.springai.escalation.config.EscalationConfig;

/**
 * All mutable resilience state of one agent: breakers per remote dependency, the rolling rate
 * window, cooldowns, the planner throttle and the loop detector.
 *
 * <p>Create one per agent. Nothing here is static, so two agents never throttle each other.</p>
 */
public final class ResilienceState {

	private final BreakerSettings breakerSettings;
	private final Map<String, CircuitBreaker> breakers = new LinkedHashMap<>();
	private final RollingRateLimiter rateLimiter;
	private final Duration emergencyPause;
	private final Cooldowns cooldowns = new Cooldowns();
	private final MinimumIntervalThrottle plannerThrottle;
	private final LoopDetector loopDetector;

	private ResilienceState(EscalationConfig config) {
		this.breakerSettings = config.breaker();
		this.rateLimiter = new RollingRateLimiter(config.rateLimit().limit(), config.rateLimit().window());
		this.emergencyPause = config.rateLimit().emergencyPause();
		this.plannerThrottle = new MinimumIntervalThrottle(config.remote().plannerMinInterval());
		this.loopDetector = new LoopDetector(config.loop().threshold(), config.loop().window());
	}

	public static ResilienceState create(EscalationConfig config) {
		if (config == null) {
			throw new IllegalArgumentException("config must not be null");
		}
		return new ResilienceState(config);
	}

	/**
	 * The breaker for a dependency, created closed on first use.
	 */
	public synchronized CircuitBreaker breakerFor(String dependency) {
		return breakers.computeIfAbsent(dependency, name ->
				new CircuitBreaker(name, breakerSettings.failureThreshold(), breakerSettings.resetTimeout()));
	}

	public synchronized Map<String, CircuitBreakerState> breakerStates() {
		Map<String, CircuitBreakerState> states = new LinkedHashMap<>();
		breakers.forEach((name, breaker) -> states.put(name, breaker.state()));
		return states;
	}

	public RollingRateLimiter rateLimiter() {
		return rateLimiter;
	}

	public Duration emergencyPause() {
		return emergencyPause;
	}

	public Cooldowns cooldowns() {
		return cooldowns;
	}

	public MinimumIntervalThrottle plannerThrottle() {
		return plannerThrottle;
	}

	public LoopDetector loopDetector() {
		return loopDetector;
	}
}
