package org.javai.springai.escalation.remote;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.springai.escalation.action.CandidateAction;

/**
 * Turns a model reply into a {@link CandidateAction}. Accepts bare JSON or JSON inside a
 * markdown code block.
 */
public class CandidateActionParser {

	private static final Pattern JSON_BLOCK_PATTERN = Pattern.compile("```(?:json)?\\s*\\n?(\\{.*?\\})\\s*```", Pattern.DOTALL);
	private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

	private final double defaultConfidence;

	public CandidateActionParser(double defaultConfidence) {
		if (defaultConfidence < 0.0 || defaultConfidence > 1.0) {
			throw new IllegalArgumentException("defaultConfidence must be in [0, 1]");
		}
		this.defaultConfidence = defaultConfidence;
	}

	/**
	 * Parse a reply.
	 *
	 * @throws MalformedResponseException when the reply holds no usable action
	 */
	public CandidateAction parse(String response) {
		if (response == null || response.isBlank()) {
			throw new MalformedResponseException("Model returned an empty response");
		}
		String json = extractJsonContent(response)
				.orElseThrow(() -> new MalformedResponseException("Response does not contain a JSON object"));
		RawCandidateAction raw;
		try {
			raw = JSON_MAPPER.readValue(json, RawCandidateAction.class);
		}
		catch (JsonProcessingException e) {
			throw new MalformedResponseException("Failed to parse action JSON: " + e.getOriginalMessage(), e);
		}
		return toAction(raw);
	}

	private CandidateAction toAction(RawCandidateAction raw) {
		if (raw.kind() == null || raw.kind().isBlank()) {
			throw new MalformedResponseException("Action JSON has no 'kind'");
		}
		double confidence = raw.confidence() != null ? raw.confidence() : defaultConfidence;
		Map<String, Object> parameters = new HashMap<>();
		if (raw.parameters() != null) {
			raw.parameters().forEach((key, value) -> {
				if (key != null && value != null) {
					parameters.put(key, value);
				}
			});
		}
		try {
			return new CandidateAction(raw.kind().trim(), parameters, confidence, raw.rationale());
		}
		catch (IllegalArgumentException e) {
			throw new MalformedResponseException("Invalid action: " + e.getMessage(), e);
		}
	}

	private Optional<String> extractJsonContent(String response) {
		String trimmed = response.trim();

		Matcher matcher = JSON_BLOCK_PATTERN.matcher(trimmed);
		if (matcher.find()) {
			return Optional.of(matcher.group(1).trim());
		}

		if (trimmed.startsWith("{") && trimmed.endsWith("}")) {
			return Optional.of(trimmed);
		}

		return Optional.empty();
	}

	/**
	 * Raised when a reply cannot be turned into an action.
	 */
	public static class MalformedResponseException extends RuntimeException {
		public MalformedResponseException(String message) {
			super(message);
		}

		public MalformedResponseException(String message, Throwable cause) {
			super(message, cause);
		}
	}
}
