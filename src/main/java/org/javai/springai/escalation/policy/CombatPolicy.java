package org.javai.springai.escalation.policy;

import java.util.Map;
import java.util.Optional;
import org.javai.springai.escalation.action.ActionKinds;
import org.javai.springai.escalation.action.CandidateAction;
import org.javai.springai.escalation.snapshot.NearbyEntity;
import org.javai.springai.escalation.snapshot.StateSnapshot;

/**
 * Engages targets while the agent is healthy enough to fight.
 *
 * <p>Crowds get an area skill, single targets the role's signature skill when stamina
 * allows, and a basic attack otherwise.</p>
 */
public final class CombatPolicy implements Policy {

	public static final String NAME = "combat";

	static final double ENGAGE_DISTANCE = 15;
	static final double MIN_HEALTH_RATIO = 0.5;
	static final double CROWD_DISTANCE = 5;
	static final int CROWD_SIZE = 3;
	static final double SKILL_STAMINA_RATIO = 0.3;
	static final String AREA_SKILL = "Magnum Break";

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public boolean applicable(StateSnapshot snapshot) {
		return snapshot.healthRatio() > MIN_HEALTH_RATIO
				&& !snapshot.targetsWithin(ENGAGE_DISTANCE).isEmpty();
	}

	@Override
	public CandidateAction decide(StateSnapshot snapshot) {
		Optional<NearbyEntity> target = snapshot.preferredTarget(ENGAGE_DISTANCE);
		if (target.isEmpty()) {
			return CandidateAction.none("no combat target in range");
		}
		if (snapshot.targetsWithin(CROWD_DISTANCE).size() >= CROWD_SIZE) {
			return CandidateAction.of(ActionKinds.SKILL,
					Map.of("skill", AREA_SKILL, "targetArea", "self"), 0.85, "multiple targets, using area skill");
		}
		NearbyEntity chosen = target.get();
		Optional<String> skill = snapshot.staminaRatio() >= SKILL_STAMINA_RATIO
				? Roles.signatureSkill(snapshot.role())
				: Optional.empty();
		if (skill.isPresent()) {
			return CandidateAction.of(ActionKinds.SKILL,
					Map.of("skill", skill.get(), "target", chosen.id()), 0.9, "using " + skill.get() + " on " + chosen.name());
		}
		return CandidateAction.of(ActionKinds.ATTACK,
				Map.of("target", chosen.id()), 0.75, "basic attack on " + chosen.name());
	}
}
