package org.javai.springai.escalation.resilience;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * One {@link Cooldown} per {@link CooldownKind}.
 */
public class Cooldowns {

	private final Map<CooldownKind, Cooldown> cooldowns = new EnumMap<>(CooldownKind.class);

	public Cooldowns() {
		for (CooldownKind kind : CooldownKind.values()) {
			cooldowns.put(kind, new Cooldown());
		}
	}

	public void engage(CooldownKind kind, Instant now, Duration duration) {
		cooldowns.get(kind).engage(now.plus(duration));
	}

	public boolean isActive(CooldownKind kind, Instant now) {
		return cooldowns.get(kind).isActive(now);
	}

	public Duration remaining(CooldownKind kind, Instant now) {
		return cooldowns.get(kind).remaining(now);
	}

	/**
	 * The first active cooldown that suspends whole cycles, in declaration order.
	 */
	public Optional<CooldownKind> suspendingCycle(Instant now) {
		for (CooldownKind kind : CooldownKind.values()) {
			if (kind.suspendsCycle() && isActive(kind, now)) {
				return Optional.of(kind);
			}
		}
		return Optional.empty();
	}

	public void clear(CooldownKind kind) {
		cooldowns.get(kind).clear();
	}
}
