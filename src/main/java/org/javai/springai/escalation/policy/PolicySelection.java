package org.javai.springai.escalation.policy;

import java.time.Duration;
import org.javai.springai.escalation.action.CandidateAction;

/**
 * The policy chosen by the bank and what it proposed.
 *
 * @param policyName name of the chosen policy
 * @param action its proposal, never {@code none}
 * @param elapsed time spent evaluating the chosen policy
 */
public record PolicySelection(String policyName, CandidateAction action, Duration elapsed) {

	public PolicySelection {
		if (policyName == null || policyName.isBlank()) {
			throw new IllegalArgumentException("policyName must not be blank");
		}
		if (action == null || action.isNone()) {
			throw new IllegalArgumentException("action must be a real proposal");
		}
		if (elapsed == null) {
			elapsed = Duration.ZERO;
		}
	}
}
