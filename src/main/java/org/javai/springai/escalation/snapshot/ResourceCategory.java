package org.javai.springai.escalation.snapshot;

/**
 * Coarse classification of a carried resource.
 */
public enum ResourceCategory {
	HEALTH_RESTORE,
	STAMINA_RESTORE,
	STATUS_CURE,
	EQUIPMENT,
	MATERIAL,
	OTHER
}
