package org.javai.springai.escalation.policy;

import java.util.Map;
import java.util.Optional;
import org.javai.springai.escalation.action.ActionKinds;
import org.javai.springai.escalation.action.CandidateAction;
import org.javai.springai.escalation.snapshot.NearbyEntity;
import org.javai.springai.escalation.snapshot.StateSnapshot;

/**
 * Role-specific behavior: support roles heal injured allies, casters open on groups.
 */
public final class ClassTacticsPolicy implements Policy {

	public static final String NAME = "classTactics";

	static final double SUPPORT_RANGE = 9;
	static final double ALLY_INJURED_RATIO = 0.8;
	static final double CASTER_RANGE = 15;
	static final int CASTER_GROUP_SIZE = 3;

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public boolean applicable(StateSnapshot snapshot) {
		if (Roles.is(snapshot.role(), Roles.SUPPORT)) {
			return injuredAlly(snapshot).isPresent();
		}
		if (Roles.is(snapshot.role(), Roles.CASTER)) {
			return snapshot.targetsWithin(CASTER_RANGE).size() >= CASTER_GROUP_SIZE;
		}
		return false;
	}

	@Override
	public CandidateAction decide(StateSnapshot snapshot) {
		if (Roles.is(snapshot.role(), Roles.SUPPORT)) {
			return injuredAlly(snapshot)
					.map(ally -> CandidateAction.of(ActionKinds.SKILL,
							Map.of("skill", "Heal", "target", ally.id()), 0.9, "healing " + ally.name()))
					.orElseGet(() -> CandidateAction.none("no ally needs healing"));
		}
		if (Roles.is(snapshot.role(), Roles.CASTER)
				&& snapshot.targetsWithin(CASTER_RANGE).size() >= CASTER_GROUP_SIZE) {
			return CandidateAction.of(ActionKinds.SKILL,
					Map.of("skill", "Storm Gust", "targetArea", "group"), 0.85, "area spell on grouped targets");
		}
		return CandidateAction.none("no role-specific action");
	}

	private static Optional<NearbyEntity> injuredAlly(StateSnapshot snapshot) {
		return snapshot.alliesWithin(SUPPORT_RANGE).stream()
				.filter(ally -> ally.healthRatio() < ALLY_INJURED_RATIO)
				.findFirst();
	}
}
