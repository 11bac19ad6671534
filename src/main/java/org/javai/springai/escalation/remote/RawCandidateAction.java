package org.javai.springai.escalation.remote;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Raw JSON representation of a remote proposal, for Jackson deserialization.
 *
 * <p>Example JSON:
 * <pre>
 * {
 *   "kind": "attack",
 *   "parameters": { "target": "m-17" },
 *   "confidence": 0.8,
 *   "rationale": "closest aggressive monster"
 * }
 * </pre>
 *
 * @param kind action kind, {@code none} when there is nothing to propose
 * @param parameters kind-specific parameters
 * @param confidence confidence in [0, 1], may be omitted
 * @param rationale short reason
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawCandidateAction(
		@JsonProperty("kind") String kind,
		@JsonProperty("parameters") Map<String, Object> parameters,
		@JsonProperty("confidence") Double confidence,
		@JsonProperty("rationale") String rationale
) {
}
