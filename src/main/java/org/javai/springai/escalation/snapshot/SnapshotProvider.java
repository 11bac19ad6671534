package org.javai.springai.escalation.snapshot;

import org.javai.springai.escalation.SnapshotNotReadyException;

/**
 * Supplies one immutable view of the world per decision cycle.
 *
 * <p>Implemented by the host that talks to the live environment.</p>
 */
@FunctionalInterface
public interface SnapshotProvider {

	/**
	 * Capture the current state.
	 *
	 * @return the snapshot for this cycle
	 * @throws SnapshotNotReadyException when the agent is not yet in a state that can be described
	 */
	StateSnapshot capture();
}
