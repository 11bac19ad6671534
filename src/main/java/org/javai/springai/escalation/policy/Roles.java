package org.javai.springai.escalation.policy;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Role lookups shared by the representative policies. Role names are matched case-insensitively.
 */
final class Roles {

	static final Set<String> SUPPORT = Set.of("priest", "acolyte", "sage");
	static final Set<String> CASTER = Set.of("wizard", "magician");
	static final Set<String> FIRST_CLASS = Set.of("swordsman", "magician", "archer", "acolyte", "merchant", "thief");
	static final String NOVICE = "novice";

	private static final Map<String, String> SIGNATURE_SKILLS = Map.of(
			"knight", "Bash",
			"swordsman", "Bash",
			"wizard", "Fire Bolt",
			"magician", "Fire Bolt",
			"hunter", "Double Strafe",
			"archer", "Double Strafe");

	private static final Map<String, String> PRIMARY_ATTRIBUTES = Map.of(
			"sword", "STR",
			"knight", "STR",
			"magi", "INT",
			"wizard", "INT",
			"arch", "DEX",
			"hunter", "DEX",
			"thief", "AGI",
			"assassin", "AGI");

	private Roles() {
	}

	static String normalize(String role) {
		return role == null ? "" : role.trim().toLowerCase(Locale.ROOT);
	}

	static boolean is(String role, Set<String> group) {
		return group.contains(normalize(role));
	}

	static Optional<String> signatureSkill(String role) {
		return Optional.ofNullable(SIGNATURE_SKILLS.get(normalize(role)));
	}

	static String primaryAttribute(String role) {
		String normalized = normalize(role);
		return PRIMARY_ATTRIBUTES.entrySet().stream()
				.filter(e -> normalized.contains(e.getKey()))
				.map(Map.Entry::getValue)
				.findFirst()
				.orElse("STR");
	}
}
