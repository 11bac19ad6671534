package org.javai.springai.escalation.config;

import java.time.Duration;

final class Durations {

	private Durations() {
	}

	static void requirePositive(Duration value, String name) {
		if (value == null || value.isNegative() || value.isZero()) {
			throw new IllegalArgumentException(name + " must be > 0");
		}
	}

	static void requireNonNegative(Duration value, String name) {
		if (value == null || value.isNegative()) {
			throw new IllegalArgumentException(name + " must be >= 0");
		}
	}
}
