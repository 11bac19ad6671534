package org.javai.springai.escalation.resilience;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * A single "resume not before" instant. Engaging again only ever moves it later.
 */
public class Cooldown {

	private Instant resumeAt;

	public synchronized void engage(Instant until) {
		if (resumeAt == null || until.isAfter(resumeAt)) {
			resumeAt = until;
		}
	}

	public synchronized boolean isActive(Instant now) {
		return resumeAt != null && now.isBefore(resumeAt);
	}

	public synchronized Duration remaining(Instant now) {
		if (!isActive(now)) {
			return Duration.ZERO;
		}
		return Duration.between(now, resumeAt);
	}

	public synchronized Optional<Instant> resumeAt() {
		return Optional.ofNullable(resumeAt);
	}

	public synchronized void clear() {
		resumeAt = null;
	}
}
