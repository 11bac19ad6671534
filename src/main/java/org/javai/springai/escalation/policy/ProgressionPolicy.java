package org.javai.springai.escalation.policy;

import java.util.Map;
import java.util.Optional;
import org.javai.springai.escalation.action.ActionKinds;
import org.javai.springai.escalation.action.CandidateAction;
import org.javai.springai.escalation.snapshot.StateSnapshot;

/**
 * Spends free advancement points and flags class-change milestones.
 */
public final class ProgressionPolicy implements Policy {

	public static final String NAME = "progression";

	public static final String CHANGE_CLASS = "changeClass";

	static final int FIRST_CLASS_LEVEL = 10;
	static final int SECOND_CLASS_LEVEL = 50;

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public boolean applicable(StateSnapshot snapshot) {
		return classChangeDue(snapshot) || snapshot.freePoints().any();
	}

	@Override
	public CandidateAction decide(StateSnapshot snapshot) {
		if (classChangeDue(snapshot)) {
			return CandidateAction.of(CHANGE_CLASS, Map.of("targetClass", "auto"), 0.9,
					"class change available at level " + snapshot.level());
		}
		if (snapshot.freePoints().attributePoints() > 0) {
			String attribute = Roles.primaryAttribute(snapshot.role());
			return CandidateAction.of(ActionKinds.ALLOCATE_POINTS,
					Map.of("pool", "attribute", "target", attribute, "points", 1), 0.85,
					"allocate attribute point to " + attribute);
		}
		if (snapshot.freePoints().skillPoints() > 0) {
			Optional<String> skill = Roles.signatureSkill(snapshot.role());
			if (skill.isPresent()) {
				return CandidateAction.of(ActionKinds.ALLOCATE_POINTS,
						Map.of("pool", "skill", "target", skill.get(), "points", 1), 0.85,
						"learn " + skill.get());
			}
		}
		return CandidateAction.none("no progression step available");
	}

	private static boolean classChangeDue(StateSnapshot snapshot) {
		String role = Roles.normalize(snapshot.role());
		return (snapshot.level() == FIRST_CLASS_LEVEL && Roles.NOVICE.equals(role))
				|| (snapshot.level() == SECOND_CLASS_LEVEL && Roles.FIRST_CLASS.contains(role));
	}
}
