package org.javai.springai.escalation.policy;

/**
 * How the {@link PolicyBank} chooses among applicable policies.
 */
public enum ArbitrationMode {

	/**
	 * Walk policies in declared order and take the first applicable one. Its answer is final
	 * for the tier, even when it turns out to be {@code none}.
	 */
	FIRST_APPLICABLE,

	/**
	 * Evaluate every applicable policy and take the highest-confidence non-empty answer,
	 * breaking ties by declared order.
	 */
	CONFIDENCE_RANKED
}
