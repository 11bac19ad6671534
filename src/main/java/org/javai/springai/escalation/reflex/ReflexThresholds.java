package org.javai.springai.escalation.reflex;

import java.util.List;
import java.util.Set;

/**
 * Thresholds and fallback items for the reflex predicates.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ReflexThresholds thresholds = ReflexThresholds.builder()
 *         .criticalHealthRatio(0.30)
 *         .fallbackHealthItem("Yellow Potion")
 *         .build();
 * }</pre>
 *
 * @param criticalHealthRatio health ratio below which survival outranks everything else
 * @param lowHealthRatio health ratio below which hostile contact becomes an emergency
 * @param hostileContactDistance distance within which a hostile counts as in contact
 * @param overCapacityRatio load ratio at or above which the agent must unload
 * @param criticalStaminaRatio stamina ratio below which stamina must be restored
 * @param dangerousStatuses status effects that need an immediate cure
 * @param fallbackHealthItem item used for critical health when nothing better is carried
 * @param fallbackContactHealthItem item used under hostile contact when nothing better is carried
 * @param fallbackStatusCureItem item used to cure a dangerous status when nothing better is carried
 * @param fallbackStaminaItem item used for critical stamina when nothing better is carried
 * @param unloadCommand command sent when over capacity
 */
public record ReflexThresholds(
		double criticalHealthRatio,
		double lowHealthRatio,
		double hostileContactDistance,
		double overCapacityRatio,
		double criticalStaminaRatio,
		Set<String> dangerousStatuses,
		String fallbackHealthItem,
		String fallbackContactHealthItem,
		String fallbackStatusCureItem,
		String fallbackStaminaItem,
		String unloadCommand
) {

	public static final List<String> DEFAULT_DANGEROUS_STATUSES =
			List.of("Stunned", "Frozen", "Stone Curse", "Sleep", "Blind", "Silence");

	public ReflexThresholds {
		requireRatio(criticalHealthRatio, "criticalHealthRatio");
		requireRatio(lowHealthRatio, "lowHealthRatio");
		requireRatio(overCapacityRatio, "overCapacityRatio");
		requireRatio(criticalStaminaRatio, "criticalStaminaRatio");
		if (lowHealthRatio < criticalHealthRatio) {
			throw new IllegalArgumentException("lowHealthRatio must be >= criticalHealthRatio");
		}
		if (hostileContactDistance < 0) {
			throw new IllegalArgumentException("hostileContactDistance must be >= 0");
		}
		dangerousStatuses = dangerousStatuses == null ? Set.of() : Set.copyOf(dangerousStatuses);
		requireName(fallbackHealthItem, "fallbackHealthItem");
		requireName(fallbackContactHealthItem, "fallbackContactHealthItem");
		requireName(fallbackStatusCureItem, "fallbackStatusCureItem");
		requireName(fallbackStaminaItem, "fallbackStaminaItem");
		requireName(unloadCommand, "unloadCommand");
	}

	public static ReflexThresholds defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	private static void requireRatio(double value, String name) {
		if (value < 0.0 || value > 1.0) {
			throw new IllegalArgumentException(name + " must be in [0, 1]");
		}
	}

	private static void requireName(String value, String name) {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException(name + " must not be blank");
		}
	}

	/**
	 * Builder for {@link ReflexThresholds}.
	 */
	public static class Builder {
		private double criticalHealthRatio = 0.25;
		private double lowHealthRatio = 0.40;
		private double hostileContactDistance = 5;
		private double overCapacityRatio = 0.90;
		private double criticalStaminaRatio = 0.20;
		private Set<String> dangerousStatuses = Set.copyOf(DEFAULT_DANGEROUS_STATUSES);
		private String fallbackHealthItem = "White Potion";
		private String fallbackContactHealthItem = "Red Potion";
		private String fallbackStatusCureItem = "Green Potion";
		private String fallbackStaminaItem = "Blue Potion";
		private String unloadCommand = "storage";

		private Builder() {}

		public Builder criticalHealthRatio(double criticalHealthRatio) {
			this.criticalHealthRatio = criticalHealthRatio;
			return this;
		}

		public Builder lowHealthRatio(double lowHealthRatio) {
			this.lowHealthRatio = lowHealthRatio;
			return this;
		}

		public Builder hostileContactDistance(double hostileContactDistance) {
			this.hostileContactDistance = hostileContactDistance;
			return this;
		}

		public Builder overCapacityRatio(double overCapacityRatio) {
			this.overCapacityRatio = overCapacityRatio;
			return this;
		}

		public Builder criticalStaminaRatio(double criticalStaminaRatio) {
			this.criticalStaminaRatio = criticalStaminaRatio;
			return this;
		}

		public Builder dangerousStatuses(Set<String> dangerousStatuses) {
			this.dangerousStatuses = dangerousStatuses;
			return this;
		}

		public Builder fallbackHealthItem(String fallbackHealthItem) {
			this.fallbackHealthItem = fallbackHealthItem;
			return this;
		}

		public Builder fallbackContactHealthItem(String fallbackContactHealthItem) {
			this.fallbackContactHealthItem = fallbackContactHealthItem;
			return this;
		}

		public Builder fallbackStatusCureItem(String fallbackStatusCureItem) {
			this.fallbackStatusCureItem = fallbackStatusCureItem;
			return this;
		}

		public Builder fallbackStaminaItem(String fallbackStaminaItem) {
			this.fallbackStaminaItem = fallbackStaminaItem;
			return this;
		}

		public Builder unloadCommand(String unloadCommand) {
			this.unloadCommand = unloadCommand;
			return this;
		}

		public ReflexThresholds build() {
			return new ReflexThresholds(criticalHealthRatio, lowHealthRatio, hostileContactDistance,
					overCapacityRatio, criticalStaminaRatio, dangerousStatuses, fallbackHealthItem,
					fallbackContactHealthItem, fallbackStatusCureItem, fallbackStaminaItem, unloadCommand);
		}
	}
}
