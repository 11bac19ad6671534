package org.javai.springai.escalation.action;

/**
 * Well-known action kinds understood by the action executor.
 *
 * <p>Kinds are plain strings on {@link CandidateAction} so that remote tiers may propose
 * kinds the local tiers never produce; these constants cover the ones the local tiers use.</p>
 */
public final class ActionKinds {

	public static final String USE_ITEM = "useItem";
	public static final String ATTACK = "attack";
	public static final String SKILL = "skill";
	public static final String MOVE = "move";
	public static final String RETREAT = "retreat";
	public static final String RESPAWN = "respawn";
	public static final String SELL_OR_STORE = "sellOrStore";
	public static final String ALLOCATE_POINTS = "allocatePoints";
	public static final String COMMAND = "command";
	public static final String IDLE = "idle";
	public static final String NONE = "none";

	private ActionKinds() {
	}
}
