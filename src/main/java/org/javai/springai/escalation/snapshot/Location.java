package org.javai.springai.escalation.snapshot;

/**
 * Region and cell coordinates of the agent.
 */
public record Location(String region, int x, int y) {

	public Location {
		if (region == null || region.isBlank()) {
			throw new IllegalArgumentException("region must not be blank");
		}
	}

	public boolean sameRegion(Location other) {
		return other != null && region.equals(other.region);
	}
}
