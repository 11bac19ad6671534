package org.javai.springai.escalation.snapshot;

/**
 * An entity within perception range of the agent.
 *
 * @param id environment-specific identifier, used as an attack or skill target
 * @param name display name
 * @param disposition relation to the agent
 * @param distance distance in cells
 * @param health current health, or 0 when unknown
 * @param maxHealth maximum health, or 0 when unknown
 */
public record NearbyEntity(
		String id,
		String name,
		Disposition disposition,
		double distance,
		int health,
		int maxHealth
) {

	public NearbyEntity {
		if (id == null || id.isBlank()) {
			throw new IllegalArgumentException("id must not be blank");
		}
		if (disposition == null) {
			throw new IllegalArgumentException("disposition must not be null");
		}
		if (distance < 0) {
			throw new IllegalArgumentException("distance must be >= 0");
		}
	}

	public boolean isHostile() {
		return disposition == Disposition.HOSTILE;
	}

	/**
	 * Whether the agent may attack this entity. Hostile and neutral creatures qualify.
	 */
	public boolean isTargetable() {
		return disposition == Disposition.HOSTILE || disposition == Disposition.NEUTRAL;
	}

	public double healthRatio() {
		return maxHealth == 0 ? 1.0 : (double) health / maxHealth;
	}
}
