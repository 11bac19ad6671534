package org.javai.springai.escalation.resilience;

import java.time.Instant;

/**
 * Corrective signal raised by the {@link LoopDetector}.
 *
 * @param location the location visited too often
 * @param visits visits counted when the signal fired
 * @param detectedAt time of the triggering visit
 */
public record LoopSignal(String location, int visits, Instant detectedAt) {

	/**
	 * Diagnostic line handed to the self-healing resolver.
	 */
	public String diagnosticMessage() {
		return "Movement loop detected at " + location + " (" + visits + " visits)";
	}
}
