package org.javai.springai.escalation.heal;

import java.io.IOException;

/**
 * Append-only record of every configuration rewrite.
 */
@FunctionalInterface
public interface HealingAuditLog {

	void append(HealingRecord record) throws IOException;
}
