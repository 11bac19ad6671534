package org.javai.springai.escalation.policy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.LongSupplier;
import org.javai.springai.escalation.action.CandidateAction;
import org.javai.springai.escalation.snapshot.StateSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered registry of {@link Policy} entries.
 *
 * <p>The order is configuration: it is fixed when the bank is built and never computed from
 * the snapshot. A new order yields a new bank via {@link #withOrder(List)}.</p>
 *
 * <p>Every entry is bounded by a per-entry budget covering both {@code applicable} and
 * {@code decide}. An entry that throws or runs over budget is skipped and the walk continues
 * with the next entry.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * PolicyBank bank = PolicyBank.builder()
 *         .register(new CombatPolicy())
 *         .register(new ResourceManagementPolicy())
 *         .perEntryBudget(Duration.ofMillis(50))
 *         .build();
 *
 * Optional<PolicySelection> selection = bank.select(snapshot);
 * }</pre>
 */
public final class PolicyBank {

	private static final Logger logger = LoggerFactory.getLogger(PolicyBank.class);

	public static final Duration DEFAULT_PER_ENTRY_BUDGET = Duration.ofMillis(50);

	private final List<Policy> policies;
	private final Duration perEntryBudget;
	private final ArbitrationMode arbitrationMode;
	private final LongSupplier nanoTime;

	private PolicyBank(List<Policy> policies, Duration perEntryBudget, ArbitrationMode arbitrationMode,
			LongSupplier nanoTime) {
		this.policies = List.copyOf(policies);
		this.perEntryBudget = perEntryBudget;
		this.arbitrationMode = arbitrationMode;
		this.nanoTime = nanoTime;
	}

	/**
	 * The representative bank: combat first, then resource management, class tactics and
	 * progression.
	 */
	public static PolicyBank defaults() {
		return defaults(DEFAULT_PER_ENTRY_BUDGET);
	}

	public static PolicyBank defaults(Duration perEntryBudget) {
		return builder()
				.register(new CombatPolicy())
				.register(new ResourceManagementPolicy())
				.register(new ClassTacticsPolicy())
				.register(new ProgressionPolicy())
				.perEntryBudget(perEntryBudget)
				.build();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Policy names in declared order.
	 */
	public List<String> order() {
		return policies.stream().map(Policy::name).toList();
	}

	public Duration perEntryBudget() {
		return perEntryBudget;
	}

	public ArbitrationMode arbitrationMode() {
		return arbitrationMode;
	}

	public boolean isEmpty() {
		return policies.isEmpty();
	}

	/**
	 * A bank holding the same policies in a new order.
	 *
	 * @param names every registered policy name exactly once
	 * @throws IllegalArgumentException when {@code names} is not a permutation of {@link #order()}
	 */
	public PolicyBank withOrder(List<String> names) {
		Map<String, Policy> byName = new LinkedHashMap<>();
		policies.forEach(p -> byName.put(p.name(), p));
		if (names.size() != byName.size() || !byName.keySet().containsAll(names)
				|| new HashSet<>(names).size() != names.size()) {
			throw new IllegalArgumentException("order must name every registered policy exactly once: " + names);
		}
		List<Policy> reordered = names.stream().map(byName::get).toList();
		return new PolicyBank(reordered, perEntryBudget, arbitrationMode, nanoTime);
	}

	/**
	 * Choose a policy for the snapshot.
	 *
	 * @return the selection, or empty when no policy produced a usable proposal
	 */
	public Optional<PolicySelection> select(StateSnapshot snapshot) {
		return switch (arbitrationMode) {
			case FIRST_APPLICABLE -> selectFirstApplicable(snapshot);
			case CONFIDENCE_RANKED -> selectHighestConfidence(snapshot);
		};
	}

	private Optional<PolicySelection> selectFirstApplicable(StateSnapshot snapshot) {
		for (Policy policy : policies) {
			EntryResult result = evaluate(policy, snapshot);
			switch (result.status()) {
				case NOT_APPLICABLE, FAILED, OVER_BUDGET -> {
					continue;
				}
				case EMPTY -> {
					logger.debug("Policy '{}' was applicable but proposed nothing", policy.name());
					return Optional.empty();
				}
				case PROPOSED -> {
					return Optional.of(new PolicySelection(policy.name(), result.action(), result.elapsed()));
				}
			}
		}
		return Optional.empty();
	}

	private Optional<PolicySelection> selectHighestConfidence(StateSnapshot snapshot) {
		PolicySelection best = null;
		for (Policy policy : policies) {
			EntryResult result = evaluate(policy, snapshot);
			if (result.status() != EntryStatus.PROPOSED) {
				continue;
			}
			// strictly greater keeps the earlier entry on ties
			if (best == null || result.action().confidence() > best.action().confidence()) {
				best = new PolicySelection(policy.name(), result.action(), result.elapsed());
			}
		}
		return Optional.ofNullable(best);
	}

	private EntryResult evaluate(Policy policy, StateSnapshot snapshot) {
		long start = nanoTime.getAsLong();
		CandidateAction action;
		try {
			if (!policy.applicable(snapshot)) {
				return new EntryResult(EntryStatus.NOT_APPLICABLE, null, elapsedSince(start));
			}
			action = policy.decide(snapshot);
		}
		catch (RuntimeException ex) {
			logger.warn("Policy '{}' threw while evaluating; skipping it", policy.name(), ex);
			return new EntryResult(EntryStatus.FAILED, null, elapsedSince(start));
		}
		Duration elapsed = elapsedSince(start);
		if (elapsed.compareTo(perEntryBudget) > 0) {
			logger.warn("Policy '{}' took {} ms, over its {} ms budget; discarding its proposal",
					policy.name(), elapsed.toMillis(), perEntryBudget.toMillis());
			return new EntryResult(EntryStatus.OVER_BUDGET, null, elapsed);
		}
		if (action == null || action.isNone()) {
			return new EntryResult(EntryStatus.EMPTY, null, elapsed);
		}
		return new EntryResult(EntryStatus.PROPOSED, action, elapsed);
	}

	private Duration elapsedSince(long startNanos) {
		return Duration.ofNanos(Math.max(0, nanoTime.getAsLong() - startNanos));
	}

	private enum EntryStatus {
		NOT_APPLICABLE,
		EMPTY,
		PROPOSED,
		FAILED,
		OVER_BUDGET
	}

	private record EntryResult(EntryStatus status, CandidateAction action, Duration elapsed) {
	}

	/**
	 * Builder for {@link PolicyBank}. Registration order is bank order.
	 */
	public static final class Builder {
		private final List<Policy> policies = new ArrayList<>();
		private final Set<String> names = new HashSet<>();
		private Duration perEntryBudget = DEFAULT_PER_ENTRY_BUDGET;
		private ArbitrationMode arbitrationMode = ArbitrationMode.FIRST_APPLICABLE;
		private LongSupplier nanoTime = System::nanoTime;

		private Builder() {
		}

		public Builder register(Policy policy) {
			if (policy == null) {
				throw new IllegalArgumentException("policy must not be null");
			}
			if (!names.add(policy.name())) {
				throw new IllegalArgumentException("Duplicate policy name: " + policy.name());
			}
			policies.add(policy);
			return this;
		}

		public Builder perEntryBudget(Duration perEntryBudget) {
			if (perEntryBudget == null || perEntryBudget.isNegative() || perEntryBudget.isZero()) {
				throw new IllegalArgumentException("perEntryBudget must be > 0");
			}
			this.perEntryBudget = perEntryBudget;
			return this;
		}

		public Builder arbitrationMode(ArbitrationMode arbitrationMode) {
			if (arbitrationMode == null) {
				throw new IllegalArgumentException("arbitrationMode must not be null");
			}
			this.arbitrationMode = arbitrationMode;
			return this;
		}

		/**
		 * Source of monotonic nanoseconds used to measure entry budgets.
		 */
		public Builder nanoTime(LongSupplier nanoTime) {
			if (nanoTime == null) {
				throw new IllegalArgumentException("nanoTime must not be null");
			}
			this.nanoTime = nanoTime;
			return this;
		}

		public PolicyBank build() {
			return new PolicyBank(policies, perEntryBudget, arbitrationMode, nanoTime);
		}
	}
}
