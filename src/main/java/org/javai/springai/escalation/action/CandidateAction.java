package org.javai.springai.escalation.action;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An action proposed by one tier.
 *
 * <p>Immutable once created. The {@code none} kind is the explicit "nothing to propose"
 * answer; the orchestrator treats it as an empty result and moves on.</p>
 *
 * @param kind action kind, see {@link ActionKinds}
 * @param parameters kind-specific parameters
 * @param confidence confidence in [0, 1]
 * @param rationale short human-readable reason
 */
public record CandidateAction(
		String kind,
		Map<String, Object> parameters,
		double confidence,
		String rationale
) {

	public CandidateAction {
		if (kind == null || kind.isBlank()) {
			throw new IllegalArgumentException("kind must not be blank");
		}
		if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
			throw new IllegalArgumentException("confidence must be in [0, 1]");
		}
		parameters = parameters == null ? Map.of() : copyPreservingOrder(parameters);
		rationale = rationale == null ? "" : rationale;
	}

	public static CandidateAction of(String kind, double confidence, String rationale) {
		return new CandidateAction(kind, Map.of(), confidence, rationale);
	}

	public static CandidateAction of(String kind, Map<String, Object> parameters, double confidence, String rationale) {
		return new CandidateAction(kind, parameters, confidence, rationale);
	}

	public static CandidateAction none(String rationale) {
		return new CandidateAction(ActionKinds.NONE, Map.of(), 0.0, rationale);
	}

	public boolean isNone() {
		return ActionKinds.NONE.equals(kind);
	}

	public boolean isKind(String other) {
		return kind.equals(other);
	}

	/**
	 * Parameter value by name, or null when absent.
	 */
	public Object parameter(String name) {
		return parameters.get(name);
	}

	private static Map<String, Object> copyPreservingOrder(Map<String, Object> source) {
		Map<String, Object> copy = new LinkedHashMap<>();
		source.forEach((key, value) -> {
			if (key == null || value == null) {
				throw new IllegalArgumentException("parameters must not contain null keys or values");
			}
			copy.put(key, value);
		});
		return Collections.unmodifiableMap(copy);
	}
}
