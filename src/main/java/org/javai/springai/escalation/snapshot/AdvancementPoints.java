package org.javai.springai.escalation.snapshot;

/**
 * Unspent advancement points.
 */
public record AdvancementPoints(int attributePoints, int skillPoints) {

	public static final AdvancementPoints NONE = new AdvancementPoints(0, 0);

	public AdvancementPoints {
		if (attributePoints < 0) {
			throw new IllegalArgumentException("attributePoints must be >= 0");
		}
		if (skillPoints < 0) {
			throw new IllegalArgumentException("skillPoints must be >= 0");
		}
	}

	public boolean any() {
		return attributePoints > 0 || skillPoints > 0;
	}
}
