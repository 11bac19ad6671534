package org.javai.springai.escalation;

/**
 * Raised when the agent cannot be described yet, for example while it is still logging in
 * or loading a region. The cycle is abandoned without a decision.
 */
public class SnapshotNotReadyException extends RuntimeException {

	public SnapshotNotReadyException(String message) {
		super(message);
	}

	public SnapshotNotReadyException(String message, Throwable cause) {
		super(message, cause);
	}
}
