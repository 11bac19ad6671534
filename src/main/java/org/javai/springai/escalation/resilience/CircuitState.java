package org.javai.springai.escalation.resilience;

/**
 * States of a {@link CircuitBreaker}.
 */
public enum CircuitState {
	CLOSED("closed"),
	OPEN("open"),
	HALF_OPEN("half_open");

	private final String wireName;

	CircuitState(String wireName) {
		this.wireName = wireName;
	}

	public String wireName() {
		return wireName;
	}
}
