package org.javai.springai.escalation;

/**
 * The decision sources of the escalation ladder, in ladder order.
 */
public enum DecisionTier {
	REFLEX("reflex", false),
	POLICY_BANK("policyBank", false),
	RULE("rule", false),
	PATTERN("pattern", true),
	PLANNER("planner", true);

	private final String wireName;
	private final boolean remote;

	DecisionTier(String wireName, boolean remote) {
		this.wireName = wireName;
		this.remote = remote;
	}

	/**
	 * Name used in the decision output consumed by the action executor.
	 */
	public String wireName() {
		return wireName;
	}

	public boolean isRemote() {
		return remote;
	}
}
