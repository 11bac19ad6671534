package org.javai.springai.escalation.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Serializes snapshots for the remote tiers.
 */
public final class SnapshotJson {

	private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
			.registerModule(new JavaTimeModule())
			.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

	private SnapshotJson() {
	}

	public static String toJson(StateSnapshot snapshot) {
		try {
			return JSON_MAPPER.writeValueAsString(snapshot);
		}
		catch (JsonProcessingException e) {
			throw new SnapshotSerializationException("Failed to serialize snapshot: " + e.getOriginalMessage(), e);
		}
	}

	/**
	 * Raised when a snapshot cannot be rendered as JSON.
	 */
	public static class SnapshotSerializationException extends RuntimeException {
		public SnapshotSerializationException(String message, Throwable cause) {
			super(message, cause);
		}
	}
}
