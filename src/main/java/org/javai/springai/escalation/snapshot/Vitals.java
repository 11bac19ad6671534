package org.javai.springai.escalation.snapshot;

/**
 * Agent vitals at the moment a snapshot was taken.
 *
 * <p>A maximum of zero is accepted here so that a half-initialized agent can still be
 * represented; the orchestrator refuses such snapshots before any tier sees them.</p>
 *
 * @param health current health
 * @param maxHealth maximum health
 * @param stamina current stamina (mana, spirit or the environment's equivalent)
 * @param maxStamina maximum stamina
 * @param load current carried weight
 * @param maxLoad carrying capacity
 */
public record Vitals(
		int health,
		int maxHealth,
		int stamina,
		int maxStamina,
		int load,
		int maxLoad
) {

	public Vitals {
		if (health < 0) {
			throw new IllegalArgumentException("health must be >= 0");
		}
		if (maxHealth < 0) {
			throw new IllegalArgumentException("maxHealth must be >= 0");
		}
		if (stamina < 0) {
			throw new IllegalArgumentException("stamina must be >= 0");
		}
		if (maxStamina < 0) {
			throw new IllegalArgumentException("maxStamina must be >= 0");
		}
		if (load < 0) {
			throw new IllegalArgumentException("load must be >= 0");
		}
		if (maxLoad < 0) {
			throw new IllegalArgumentException("maxLoad must be >= 0");
		}
	}

	public double healthRatio() {
		return ratio(health, maxHealth);
	}

	public double staminaRatio() {
		return ratio(stamina, maxStamina);
	}

	public double loadRatio() {
		return maxLoad == 0 ? 0.0 : (double) load / maxLoad;
	}

	// An unknown maximum reads as "full" so that missing data never fires an emergency.
	private static double ratio(int current, int max) {
		return max == 0 ? 1.0 : (double) current / max;
	}
}
