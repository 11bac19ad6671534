package org.javai.springai.escalation.resilience;

import java.time.Duration;
import java.time.Instant;

/**
 * Caps remote call attempts per window. The window restarts at the first attempt made after
 * it has run its full length; there is no per-call history.
 */
public class RollingRateLimiter {

	private final int limit;
	private final Duration windowSize;

	private int count;
	private Instant windowStart;

	public RollingRateLimiter(int limit, Duration windowSize) {
		if (limit < 1) {
			throw new IllegalArgumentException("limit must be >= 1");
		}
		if (windowSize == null || windowSize.isNegative() || windowSize.isZero()) {
			throw new IllegalArgumentException("windowSize must be > 0");
		}
		this.limit = limit;
		this.windowSize = windowSize;
	}

	/**
	 * Admit one attempt at {@code now}.
	 *
	 * @return false when the window is already full; the attempt is not counted
	 */
	public synchronized boolean tryAcquire(Instant now) {
		roll(now);
		if (count >= limit) {
			return false;
		}
		count++;
		return true;
	}

	public synchronized RateWindow window() {
		return new RateWindow(count, windowStart, limit, windowSize);
	}

	/**
	 * Window state as it would be seen by an attempt at {@code now}.
	 */
	public synchronized RateWindow window(Instant now) {
		roll(now);
		return window();
	}

	private void roll(Instant now) {
		if (windowStart == null || !now.isBefore(windowStart.plus(windowSize))) {
			count = 0;
			windowStart = now;
		}
	}
}
