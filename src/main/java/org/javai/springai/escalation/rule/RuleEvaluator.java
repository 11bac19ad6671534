package org.javai.springai.escalation.rule;

import java.util.Map;
import java.util.Optional;
import org.javai.springai.escalation.action.ActionKinds;
import org.javai.springai.escalation.action.CandidateAction;
import org.javai.springai.escalation.snapshot.CarriedResource;
import org.javai.springai.escalation.snapshot.NearbyEntity;
import org.javai.springai.escalation.snapshot.ResourceCategory;
import org.javai.springai.escalation.snapshot.StateSnapshot;

/**
 * Deterministic local fallback logic.
 *
 * <p>{@link #propose(StateSnapshot)} covers tactical situations (healing, engaging, retreating
 * from a crowd) and is what the ladder's rule step accepts. {@link #decide(StateSnapshot)}
 * never comes back empty: when there is nothing tactical to do it rests or idles, which makes
 * it the floor that guarantees a decision every cycle.</p>
 */
public final class RuleEvaluator {

	static final double HEAL_RATIO = 0.60;
	static final double CRITICAL_RATIO = 0.25;
	static final double ATTACK_MIN_HEALTH_RATIO = 0.40;
	static final double ATTACK_DISTANCE = 15;
	static final double SAFE_DISTANCE = 8;
	static final int CROWD_SIZE = 3;
	static final double REST_STAMINA_RATIO = 0.5;
	static final int REST_SECONDS = 10;
	static final String FALLBACK_HEAL_ITEM = "Red Potion";

	/**
	 * Cheap gate: true when hostiles or neutrals are around, or healing is due.
	 */
	public boolean shouldHandle(StateSnapshot snapshot) {
		return !snapshot.targetsWithin(Double.MAX_VALUE).isEmpty() || healingDue(snapshot);
	}

	/**
	 * A tactical action, or empty when the situation calls for none.
	 */
	public Optional<CandidateAction> propose(StateSnapshot snapshot) {
		if (healingDue(snapshot)) {
			String item = snapshot.strongest(ResourceCategory.HEALTH_RESTORE)
					.map(CarriedResource::name)
					.orElse(FALLBACK_HEAL_ITEM);
			return Optional.of(CandidateAction.of(ActionKinds.USE_ITEM, Map.of("item", item), 0.75,
					"rule: health below " + Math.round(HEAL_RATIO * 100) + "%, healing"));
		}
		if (snapshot.healthRatio() >= ATTACK_MIN_HEALTH_RATIO) {
			Optional<NearbyEntity> target = snapshot.preferredTarget(ATTACK_DISTANCE);
			if (target.isPresent()) {
				return Optional.of(CandidateAction.of(ActionKinds.ATTACK, Map.of("target", target.get().id()), 0.8,
						"rule: basic attack on " + target.get().name()));
			}
		}
		if (snapshot.hostilesWithin(SAFE_DISTANCE).size() >= CROWD_SIZE) {
			return Optional.of(CandidateAction.of(ActionKinds.RETREAT, Map.of("direction", "away"), 0.7,
					"rule: too many hostiles nearby, retreating"));
		}
		return Optional.empty();
	}

	/**
	 * Always an action: the tactical proposal when there is one, otherwise rest or idle.
	 */
	public CandidateAction decide(StateSnapshot snapshot) {
		return propose(snapshot).orElseGet(() -> restOrIdle(snapshot));
	}

	private static CandidateAction restOrIdle(StateSnapshot snapshot) {
		if (snapshot.hostilesWithin(SAFE_DISTANCE).isEmpty()
				&& snapshot.vitals().maxStamina() > 0
				&& snapshot.staminaRatio() < REST_STAMINA_RATIO) {
			return CandidateAction.of(ActionKinds.IDLE, Map.of("mode", "rest", "durationSeconds", REST_SECONDS), 0.6,
					"rule: nothing to do, resting to recover stamina");
		}
		return CandidateAction.of(ActionKinds.IDLE, Map.of(), 0.5, "rule: no tactical action required");
	}

	private static boolean healingDue(StateSnapshot snapshot) {
		if (snapshot.vitals().maxHealth() == 0) {
			return false;
		}
		double ratio = snapshot.healthRatio();
		return ratio < HEAL_RATIO && ratio > CRITICAL_RATIO;
	}
}
