package org.javai.springai.escalation.resilience;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counts visits per location and signals when one location is visited more than
 * {@code threshold} times within a window.
 *
 * <p>Counters are cleared wholesale when a window ends and a location's counter is reset as
 * soon as it signals, so memory is bounded by the number of distinct locations seen within
 * one window.</p>
 */
public class LoopDetector {

	private static final Logger logger = LoggerFactory.getLogger(LoopDetector.class);

	private final int threshold;
	private final Duration window;
	private final Map<String, Integer> visits = new HashMap<>();
	private Instant windowStart;

	public LoopDetector(int threshold, Duration window) {
		if (threshold < 1) {
			throw new IllegalArgumentException("threshold must be >= 1");
		}
		if (window == null || window.isNegative() || window.isZero()) {
			throw new IllegalArgumentException("window must be > 0");
		}
		this.threshold = threshold;
		this.window = window;
	}

	/**
	 * Count a visit to {@code location}.
	 *
	 * @return a signal when this visit pushed the location over the threshold
	 */
	public synchronized Optional<LoopSignal> recordVisit(String location, Instant now) {
		if (location == null || location.isBlank()) {
			throw new IllegalArgumentException("location must not be blank");
		}
		if (windowStart == null || !now.isBefore(windowStart.plus(window))) {
			visits.clear();
			windowStart = now;
		}
		int count = visits.merge(location, 1, Integer::sum);
		if (count <= threshold) {
			return Optional.empty();
		}
		visits.put(location, 0);
		logger.warn("Loop detected: '{}' visited {} times within {} s", location, count, window.toSeconds());
		return Optional.of(new LoopSignal(location, count, now));
	}

	public synchronized int visitCount(String location) {
		return visits.getOrDefault(location, 0);
	}

	public synchronized int trackedLocations() {
		return visits.size();
	}
}
