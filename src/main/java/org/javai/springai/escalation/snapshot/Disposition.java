package org.javai.springai.escalation.snapshot;

/**
 * How a nearby entity relates to the agent.
 */
public enum Disposition {
	/** Will attack or is attacking the agent. */
	HOSTILE,
	/** Attackable but passive until provoked. */
	NEUTRAL,
	/** Party member or otherwise friendly. */
	ALLY,
	/** Another player who is not an ally. */
	PLAYER
}
