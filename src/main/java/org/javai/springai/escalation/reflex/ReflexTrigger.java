package org.javai.springai.escalation.reflex;

/**
 * Emergency predicates in precedence order. When several fire, the earliest constant wins.
 */
public enum ReflexTrigger {
	CRITICAL_HEALTH,
	DANGEROUS_STATUS,
	HOSTILE_CONTACT,
	OVER_CAPACITY,
	CRITICAL_STAMINA
}
