package org.javai.springai.escalation.snapshot;

/**
 * One stack of an item the agent is carrying.
 *
 * @param id environment-specific item identifier
 * @param name display name, also used when the item is referenced by an action
 * @param quantity number of units in the stack (&gt;= 0)
 * @param category coarse classification used by local tiers
 * @param potency relative strength for consumables; higher is stronger, 0 when not applicable
 */
public record CarriedResource(
		String id,
		String name,
		int quantity,
		ResourceCategory category,
		int potency
) {

	public CarriedResource {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("name must not be blank");
		}
		if (quantity < 0) {
			throw new IllegalArgumentException("quantity must be >= 0");
		}
		if (category == null) {
			category = ResourceCategory.OTHER;
		}
	}

	public boolean isAvailable() {
		return quantity > 0;
	}
}
