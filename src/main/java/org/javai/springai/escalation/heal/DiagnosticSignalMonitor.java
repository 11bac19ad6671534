package org.javai.springai.escalation.heal;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Counts matches per healing rule. A count restarts when the gap since the previous match
 * is longer than the rule's window, and resets once the rule fires.
 */
class DiagnosticSignalMonitor {

	private final Map<String, Counter> counters = new HashMap<>();

	/**
	 * Record a match for {@code rule} at {@code now}.
	 *
	 * @return true when this match makes the rule fire
	 */
	synchronized boolean recordMatch(HealingRule rule, Instant now) {
		Counter counter = counters.computeIfAbsent(rule.name(), name -> new Counter());
		if (counter.last != null && Duration.between(counter.last, now).compareTo(rule.within()) > 0) {
			counter.count = 0;
		}
		counter.count++;
		counter.last = now;
		if (counter.count < rule.occurrences()) {
			return false;
		}
		counters.remove(rule.name());
		return true;
	}

	synchronized int count(String ruleName) {
		Counter counter = counters.get(ruleName);
		return counter == null ? 0 : counter.count;
	}

	private static final class Counter {
		private int count;
		private Instant last;
	}
}
