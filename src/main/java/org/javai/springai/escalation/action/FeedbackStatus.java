package org.javai.springai.escalation.action;

/**
 * Outcome reported by the action executor.
 */
public enum FeedbackStatus {
	SUCCESS,
	FAILED,
	PARTIAL
}
