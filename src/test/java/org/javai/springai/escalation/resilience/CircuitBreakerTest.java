package org.javai.springai.escalation.resilience;

import static org.assertj.core.api.Assertions.assertThat;
import java.time.Duration;
import java.time.Instant;
import org.apache.logging.log4j.Level;
import org.javai.springai.escalation.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CircuitBreaker")
class CircuitBreakerTest {

	private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

	private final CircuitBreaker breaker = new CircuitBreaker("planner-service", 3, Duration.ofSeconds(60));

	@Test
	@DisplayName("Opens on the third consecutive failure")
	void opensAtThreshold() {
		breaker.recordFailure(T0);
		breaker.recordFailure(T0.plusSeconds(1));
		assertThat(breaker.state().state()).isEqualTo(CircuitState.CLOSED);
		assertThat(breaker.allowsCall(T0.plusSeconds(1))).isTrue();

		try (LogCaptorAppender appender = LogCaptorAppender.create(CircuitBreaker.class, Level.WARN)) {
			breaker.recordFailure(T0.plusSeconds(2));

			assertThat(appender.messages()).anyMatch(msg -> msg.contains("opened after 3 consecutive failures"));
		}
		assertThat(breaker.state().state()).isEqualTo(CircuitState.OPEN);
		assertThat(breaker.allowsCall(T0.plusSeconds(30))).isFalse();
	}

	@Test
	@DisplayName("A success in between resets the count")
	void successResetsCount() {
		breaker.recordFailure(T0);
		breaker.recordFailure(T0);
		breaker.recordSuccess();
		breaker.recordFailure(T0);

		assertThat(breaker.state().state()).isEqualTo(CircuitState.CLOSED);
		assertThat(breaker.state().consecutiveFailures()).isEqualTo(1);
	}

	@Test
	@DisplayName("Half-open after the reset timeout allows exactly one trial")
	void halfOpenAllowsOneTrial() {
		breaker.forceOpen(T0);
		Instant later = T0.plusSeconds(60);

		assertThat(breaker.tryAcquire(later)).isTrue();
		assertThat(breaker.state().state()).isEqualTo(CircuitState.HALF_OPEN);
		assertThat(breaker.allowsCall(later)).isFalse();
		assertThat(breaker.tryAcquire(later)).isFalse();
	}

	@Test
	@DisplayName("Successful trial closes the breaker")
	void successfulTrialCloses() {
		breaker.forceOpen(T0);
		breaker.tryAcquire(T0.plusSeconds(61));

		breaker.recordSuccess();

		assertThat(breaker.state().state()).isEqualTo(CircuitState.CLOSED);
		assertThat(breaker.state().consecutiveFailures()).isZero();
		assertThat(breaker.allowsCall(T0.plusSeconds(61))).isTrue();
	}

	@Test
	@DisplayName("Failed trial reopens and restarts the reset timeout")
	void failedTrialReopens() {
		breaker.forceOpen(T0);
		Instant trial = T0.plusSeconds(61);
		breaker.tryAcquire(trial);

		breaker.recordFailure(trial);

		assertThat(breaker.state().state()).isEqualTo(CircuitState.OPEN);
		assertThat(breaker.state().lastFailureTime()).isEqualTo(trial);
		assertThat(breaker.allowsCall(trial.plusSeconds(59))).isFalse();
		assertThat(breaker.allowsCall(trial.plusSeconds(60))).isTrue();
	}

	@Test
	@DisplayName("Reset closes an open breaker and forgets its failures")
	void resetClosesBreaker() {
		breaker.recordFailure(T0);
		breaker.recordFailure(T0);
		breaker.recordFailure(T0);

		breaker.reset();

		assertThat(breaker.state().state()).isEqualTo(CircuitState.CLOSED);
		assertThat(breaker.state().consecutiveFailures()).isZero();
		assertThat(breaker.state().lastFailureTime()).isNull();
		assertThat(breaker.allowsCall(T0)).isTrue();
	}
}
