package org.javai.springai.escalation.reflex;

import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.javai.springai.escalation.action.ActionKinds;
import org.javai.springai.escalation.action.CandidateAction;
import org.javai.springai.escalation.snapshot.CarriedResource;
import org.javai.springai.escalation.snapshot.ResourceCategory;
import org.javai.springai.escalation.snapshot.StateSnapshot;

/**
 * Local safety checks evaluated before anything else in a cycle.
 *
 * <p>Stateless and free of I/O: the result depends only on the snapshot and the
 * thresholds, so two snapshots with the same vitals, carried items and nearby hostiles
 * always yield the same action. Every reflex action carries confidence 1.0.</p>
 */
public final class ReflexEvaluator {

	private final ReflexThresholds thresholds;

	public ReflexEvaluator(ReflexThresholds thresholds) {
		if (thresholds == null) {
			throw new IllegalArgumentException("thresholds must not be null");
		}
		this.thresholds = thresholds;
	}

	public ReflexEvaluator() {
		this(ReflexThresholds.defaults());
	}

	public ReflexThresholds thresholds() {
		return thresholds;
	}

	/**
	 * The reflex action for this snapshot, or empty when no emergency predicate fires.
	 */
	public Optional<CandidateAction> evaluate(StateSnapshot snapshot) {
		Set<ReflexTrigger> fired = triggers(snapshot);
		if (fired.isEmpty()) {
			return Optional.empty();
		}
		// EnumSet iterates in declaration order, which is the precedence order
		ReflexTrigger winner = fired.iterator().next();
		return Optional.of(actionFor(winner, snapshot));
	}

	/**
	 * Every predicate that fires for the snapshot.
	 */
	public Set<ReflexTrigger> triggers(StateSnapshot snapshot) {
		Set<ReflexTrigger> fired = EnumSet.noneOf(ReflexTrigger.class);
		if (snapshot.vitals().maxHealth() > 0 && snapshot.healthRatio() < thresholds.criticalHealthRatio()) {
			fired.add(ReflexTrigger.CRITICAL_HEALTH);
		}
		if (thresholds.dangerousStatuses().stream().anyMatch(snapshot::hasStatus)) {
			fired.add(ReflexTrigger.DANGEROUS_STATUS);
		}
		if (snapshot.vitals().maxHealth() > 0
				&& snapshot.healthRatio() < thresholds.lowHealthRatio()
				&& !snapshot.hostilesWithin(thresholds.hostileContactDistance()).isEmpty()) {
			fired.add(ReflexTrigger.HOSTILE_CONTACT);
		}
		if (snapshot.vitals().maxLoad() > 0 && snapshot.loadRatio() >= thresholds.overCapacityRatio()) {
			fired.add(ReflexTrigger.OVER_CAPACITY);
		}
		if (snapshot.vitals().maxStamina() > 0 && snapshot.staminaRatio() < thresholds.criticalStaminaRatio()) {
			fired.add(ReflexTrigger.CRITICAL_STAMINA);
		}
		return fired;
	}

	private CandidateAction actionFor(ReflexTrigger trigger, StateSnapshot snapshot) {
		return switch (trigger) {
			case CRITICAL_HEALTH -> useItem(
					bestItem(snapshot, ResourceCategory.HEALTH_RESTORE, thresholds.fallbackHealthItem()),
					"health critical (<" + percent(thresholds.criticalHealthRatio()) + ")");
			case DANGEROUS_STATUS -> useItem(
					bestItem(snapshot, ResourceCategory.STATUS_CURE, thresholds.fallbackStatusCureItem()),
					"dangerous status effect active");
			case HOSTILE_CONTACT -> useItem(
					bestItem(snapshot, ResourceCategory.HEALTH_RESTORE, thresholds.fallbackContactHealthItem()),
					"health low (<" + percent(thresholds.lowHealthRatio()) + ") under hostile contact");
			case OVER_CAPACITY -> CandidateAction.of(ActionKinds.COMMAND,
					Map.of("command", thresholds.unloadCommand()), 1.0,
					"reflex: carrying load at or above " + percent(thresholds.overCapacityRatio()));
			case CRITICAL_STAMINA -> useItem(
					bestItem(snapshot, ResourceCategory.STAMINA_RESTORE, thresholds.fallbackStaminaItem()),
					"stamina critical (<" + percent(thresholds.criticalStaminaRatio()) + ")");
		};
	}

	private static String bestItem(StateSnapshot snapshot, ResourceCategory category, String fallback) {
		return snapshot.strongest(category)
				.map(CarriedResource::name)
				.orElse(fallback);
	}

	private static CandidateAction useItem(String item, String rationale) {
		return CandidateAction.of(ActionKinds.USE_ITEM, Map.of("item", item), 1.0, "reflex: " + rationale);
	}

	private static String percent(double ratio) {
		return Math.round(ratio * 100) + "%";
	}
}
