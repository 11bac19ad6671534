package org.javai.springai.escalation.remote;

/**
 * Why a remote tier failed to produce an answer.
 *
 * @param kind failure class
 * @param message human-readable detail
 */
public record TierError(Kind kind, String message) {

	public enum Kind {
		/** No answer before the deadline. */
		TIMEOUT,
		/** An answer arrived but could not be turned into an action. */
		MALFORMED_RESPONSE,
		/** The call failed before an answer arrived. */
		TRANSPORT
	}

	public TierError {
		if (kind == null) {
			throw new IllegalArgumentException("kind must not be null");
		}
		message = message == null ? "" : message;
	}

	public static TierError timeout(String message) {
		return new TierError(Kind.TIMEOUT, message);
	}

	public static TierError malformed(String message) {
		return new TierError(Kind.MALFORMED_RESPONSE, message);
	}

	public static TierError transport(String message) {
		return new TierError(Kind.TRANSPORT, message);
	}
}
