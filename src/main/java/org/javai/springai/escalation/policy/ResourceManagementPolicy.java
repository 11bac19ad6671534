package org.javai.springai.escalation.policy;

import java.util.Map;
import org.javai.springai.escalation.action.ActionKinds;
import org.javai.springai.escalation.action.CandidateAction;
import org.javai.springai.escalation.snapshot.StateSnapshot;

/**
 * Sends the agent to unload before carrying capacity becomes an emergency.
 */
public final class ResourceManagementPolicy implements Policy {

	public static final String NAME = "resourceManagement";

	static final double HEAVY_LOAD_RATIO = 0.85;
	static final int CROWDED_INVENTORY = 50;

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public boolean applicable(StateSnapshot snapshot) {
		return isHeavy(snapshot) || isCrowded(snapshot);
	}

	@Override
	public CandidateAction decide(StateSnapshot snapshot) {
		if (isHeavy(snapshot)) {
			return CandidateAction.of(ActionKinds.MOVE, Map.of("destination", "storage"), 0.85,
					"load above " + Math.round(HEAVY_LOAD_RATIO * 100) + "%, returning to storage");
		}
		if (isCrowded(snapshot)) {
			return CandidateAction.of(ActionKinds.SELL_OR_STORE, Map.of("destination", "merchant"), 0.80,
					"carrying more than " + CROWDED_INVENTORY + " item stacks, going to sell");
		}
		return CandidateAction.none("inventory in order");
	}

	private static boolean isHeavy(StateSnapshot snapshot) {
		return snapshot.vitals().maxLoad() > 0 && snapshot.loadRatio() > HEAVY_LOAD_RATIO;
	}

	private static boolean isCrowded(StateSnapshot snapshot) {
		return snapshot.distinctCarriedCount() > CROWDED_INVENTORY;
	}
}
