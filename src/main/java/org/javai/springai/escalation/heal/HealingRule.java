package org.javai.springai.escalation.heal;

import java.time.Duration;
import java.util.regex.Pattern;

/**
 * A diagnostic pattern that, once seen often enough in a short time, justifies rewriting the
 * configuration.
 *
 * @param name rule name used in logs and the audit trail
 * @param trigger pattern searched for in each diagnostic message
 * @param occurrences matches needed to fire
 * @param within maximum gap between consecutive matches; a longer gap restarts the count
 * @param transform rewrite applied when the rule fires
 * @param reason human-readable reason recorded in the audit trail
 */
public record HealingRule(
		String name,
		Pattern trigger,
		int occurrences,
		Duration within,
		DirectiveTransform transform,
		String reason
) {

	public HealingRule {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("name must not be blank");
		}
		if (trigger == null) {
			throw new IllegalArgumentException("trigger must not be null");
		}
		if (occurrences < 1) {
			throw new IllegalArgumentException("occurrences must be >= 1");
		}
		if (within == null || within.isNegative() || within.isZero()) {
			throw new IllegalArgumentException("within must be > 0");
		}
		if (transform == null) {
			throw new IllegalArgumentException("transform must not be null");
		}
		reason = reason == null ? "" : reason;
	}

	public boolean matches(String message) {
		return message != null && trigger.matcher(message).find();
	}
}
