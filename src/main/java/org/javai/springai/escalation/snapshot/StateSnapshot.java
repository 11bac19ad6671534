package org.javai.springai.escalation.snapshot;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only view of the world for one decision cycle.
 *
 * <p>Produced once per cycle by a {@link SnapshotProvider} and consumed by every tier.
 * Collections are copied on construction so a snapshot can never change after it has been
 * handed to the orchestrator.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * StateSnapshot snapshot = StateSnapshot.builder()
 *         .agentName("Aria")
 *         .level(42)
 *         .vitals(new Vitals(800, 1000, 120, 300, 1200, 2000))
 *         .location(new Location("prontera", 150, 180))
 *         .nearby(new NearbyEntity("m-1", "Poring", Disposition.HOSTILE, 4, 50, 50))
 *         .timestamp(clock.instant())
 *         .build();
 * }</pre>
 *
 * @param agentName name of the controlled agent
 * @param level base level of the agent
 * @param role class or job of the agent, e.g. {@code "priest"}
 * @param vitals health, stamina and carrying load
 * @param location current region and cell, may be null while the agent is loading
 * @param carried carried resources
 * @param nearby entities within perception range
 * @param statusEffects active status effects by name
 * @param freePoints unspent advancement points
 * @param currency carried currency
 * @param timestamp capture time
 */
public record StateSnapshot(
		String agentName,
		int level,
		String role,
		Vitals vitals,
		Location location,
		List<CarriedResource> carried,
		List<NearbyEntity> nearby,
		Set<String> statusEffects,
		AdvancementPoints freePoints,
		long currency,
		Instant timestamp
) {

	public StateSnapshot {
		if (vitals == null) {
			throw new IllegalArgumentException("vitals must not be null");
		}
		if (timestamp == null) {
			throw new IllegalArgumentException("timestamp must not be null");
		}
		if (level < 0) {
			throw new IllegalArgumentException("level must be >= 0");
		}
		agentName = agentName == null ? "" : agentName;
		role = role == null ? "" : role;
		carried = carried == null ? List.of() : List.copyOf(carried);
		nearby = nearby == null ? List.of() : List.copyOf(nearby);
		statusEffects = statusEffects == null ? Set.of() : Set.copyOf(statusEffects);
		freePoints = freePoints == null ? AdvancementPoints.NONE : freePoints;
	}

	public double healthRatio() {
		return vitals.healthRatio();
	}

	public double staminaRatio() {
		return vitals.staminaRatio();
	}

	public double loadRatio() {
		return vitals.loadRatio();
	}

	public boolean hasStatus(String effect) {
		return statusEffects.stream().anyMatch(s -> s.equalsIgnoreCase(effect));
	}

	/**
	 * Hostile entities within the given distance, nearest first.
	 */
	public List<NearbyEntity> hostilesWithin(double distance) {
		return nearby.stream()
				.filter(NearbyEntity::isHostile)
				.filter(e -> e.distance() <= distance)
				.sorted(Comparator.comparingDouble(NearbyEntity::distance))
				.toList();
	}

	/**
	 * Hostile or neutral entities within the given distance, nearest first.
	 */
	public List<NearbyEntity> targetsWithin(double distance) {
		return nearby.stream()
				.filter(NearbyEntity::isTargetable)
				.filter(e -> e.distance() <= distance)
				.sorted(Comparator.comparingDouble(NearbyEntity::distance))
				.toList();
	}

	/**
	 * The entity to engage within range: the nearest hostile, otherwise the nearest neutral.
	 */
	public Optional<NearbyEntity> preferredTarget(double maxDistance) {
		List<NearbyEntity> hostiles = hostilesWithin(maxDistance);
		if (!hostiles.isEmpty()) {
			return Optional.of(hostiles.get(0));
		}
		return targetsWithin(maxDistance).stream().findFirst();
	}

	public List<NearbyEntity> alliesWithin(double distance) {
		return nearby.stream()
				.filter(e -> e.disposition() == Disposition.ALLY)
				.filter(e -> e.distance() <= distance)
				.sorted(Comparator.comparingDouble(NearbyEntity::distance))
				.toList();
	}

	/**
	 * The strongest available resource of the given category.
	 */
	public Optional<CarriedResource> strongest(ResourceCategory category) {
		return carried.stream()
				.filter(r -> r.category() == category)
				.filter(CarriedResource::isAvailable)
				.max(Comparator.comparingInt(CarriedResource::potency));
	}

	public int distinctCarriedCount() {
		return carried.size();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * A builder seeded with this snapshot's values.
	 */
	public Builder toBuilder() {
		Builder builder = new Builder()
				.agentName(agentName)
				.level(level)
				.role(role)
				.vitals(vitals)
				.location(location)
				.freePoints(freePoints)
				.currency(currency)
				.timestamp(timestamp);
		builder.carried.addAll(carried);
		builder.nearby.addAll(nearby);
		builder.statusEffects.addAll(statusEffects);
		return builder;
	}

	/**
	 * Builder for {@link StateSnapshot}.
	 */
	public static final class Builder {
		private String agentName;
		private int level = 1;
		private String role;
		private Vitals vitals;
		private Location location;
		private final List<CarriedResource> carried = new ArrayList<>();
		private final List<NearbyEntity> nearby = new ArrayList<>();
		private final Set<String> statusEffects = new LinkedHashSet<>();
		private AdvancementPoints freePoints = AdvancementPoints.NONE;
		private long currency;
		private Instant timestamp;

		private Builder() {
		}

		public Builder agentName(String agentName) {
			this.agentName = agentName;
			return this;
		}

		public Builder level(int level) {
			this.level = level;
			return this;
		}

		public Builder role(String role) {
			this.role = role;
			return this;
		}

		public Builder vitals(Vitals vitals) {
			this.vitals = vitals;
			return this;
		}

		public Builder location(Location location) {
			this.location = location;
			return this;
		}

		public Builder carried(CarriedResource... resources) {
			this.carried.addAll(List.of(resources));
			return this;
		}

		public Builder nearby(NearbyEntity... entities) {
			this.nearby.addAll(List.of(entities));
			return this;
		}

		public Builder clearNearby() {
			this.nearby.clear();
			return this;
		}

		public Builder statusEffects(String... effects) {
			this.statusEffects.addAll(List.of(effects));
			return this;
		}

		public Builder freePoints(AdvancementPoints freePoints) {
			this.freePoints = freePoints;
			return this;
		}

		public Builder currency(long currency) {
			this.currency = currency;
			return this;
		}

		public Builder timestamp(Instant timestamp) {
			this.timestamp = timestamp;
			return this;
		}

		public StateSnapshot build() {
			return new StateSnapshot(agentName, level, role, vitals, location, carried, nearby,
					statusEffects, freePoints, currency, timestamp);
		}
	}
}
