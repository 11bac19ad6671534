package org.javai.springai.escalation.cycle;

/**
 * Why a cycle ended without a decision.
 */
public enum SkipReason {
	/** A cycle-suspending cooldown was still running. */
	COOLDOWN_ACTIVE,
	/** The agent just entered a new region and is letting it settle. */
	REGION_CHANGED,
	/** The agent kept re-entering the same region; movement was reset. */
	LOOP_DETECTED
}
