package org.javai.springai.escalation.resilience;

/**
 * Independent cooldowns an agent may be under.
 */
public enum CooldownKind {
	/** Rate limit exceeded: every remote tier is skipped. */
	EMERGENCY_PAUSE,
	/** After an idle or recovery action: whole cycles are skipped. */
	ACTION_PAUSE,
	/** After entering a new region: whole cycles are skipped while the region loads. */
	REGION_SETTLE,
	/** After a movement loop was broken: whole cycles are skipped. */
	LOOP_BREAK;

	/**
	 * Whether this cooldown suspends whole cycles rather than just the remote tiers.
	 */
	public boolean suspendsCycle() {
		return this != EMERGENCY_PAUSE;
	}
}
