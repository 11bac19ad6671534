package org.javai.springai.escalation.heal;

import java.time.Instant;
import java.util.List;

/**
 * Audit entry for one configuration rewrite.
 *
 * @param timestamp when the rewrite happened
 * @param rule name of the rule that fired
 * @param reason the rule's reason
 * @param trigger the diagnostic message that made the rule fire
 * @param affectedDirectives directives that were disabled
 * @param artifact location of the rewritten configuration
 */
public record HealingRecord(
		Instant timestamp,
		String rule,
		String reason,
		String trigger,
		List<String> affectedDirectives,
		String artifact
) {

	public HealingRecord {
		affectedDirectives = affectedDirectives == null ? List.of() : List.copyOf(affectedDirectives);
	}
}
