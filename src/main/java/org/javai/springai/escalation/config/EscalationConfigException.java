package org.javai.springai.escalation.config;

/**
 * Raised when an escalation configuration document cannot be read or is invalid.
 */
public class EscalationConfigException extends RuntimeException {

	public EscalationConfigException(String message) {
		super(message);
	}

	public EscalationConfigException(String message, Throwable cause) {
		super(message, cause);
	}
}
