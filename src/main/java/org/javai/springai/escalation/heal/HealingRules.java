package org.javai.springai.escalation.heal;

import java.time.Duration;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Built-in healing rules.
 */
public final class HealingRules {

	public static final String TELEPORT_WITHOUT_MEANS = "teleportWithoutMeans";
	public static final String UNREACHABLE_SUPPLIER = "unreachableSupplier";

	private HealingRules() {
	}

	/**
	 * Teleport directives are enabled but the agent has neither the skill nor the item:
	 * three failures within 30 seconds disable every active {@code teleportAuto_*} directive.
	 */
	public static HealingRule teleportWithoutMeans() {
		return new HealingRule(TELEPORT_WITHOUT_MEANS,
				Pattern.compile(Pattern.quote("You don't have the Teleport skill or a Fly Wing"), Pattern.CASE_INSENSITIVE),
				3, Duration.ofSeconds(30),
				new PrefixedDirectiveTransform("teleportAuto_", "0"),
				"teleportAuto enabled without Teleport skill or Fly Wing");
	}

	/**
	 * The supply merchant cannot be reached and the agent keeps bouncing between regions:
	 * three such diagnostics within five minutes disable the {@code buyAuto} blocks.
	 */
	public static HealingRule unreachableSupplier() {
		return new HealingRule(UNREACHABLE_SUPPLIER,
				Pattern.compile("Movement loop detected|NPC not found", Pattern.CASE_INSENSITIVE),
				3, Duration.ofMinutes(5),
				new BlockDirectiveTransform("buyAuto"),
				"buyAuto keeps sending the agent to an unreachable merchant");
	}

	public static List<HealingRule> defaults() {
		return List.of(teleportWithoutMeans(), unreachableSupplier());
	}
}
