package org.javai.springai.escalation.action;

import java.util.Optional;
import org.javai.springai.escalation.Decision;

/**
 * Carries out decisions in the live environment.
 *
 * <p>Implemented by the host. Translating {@code kind} and {@code parameters} into
 * environment commands is entirely the executor's concern.</p>
 */
public interface ActionExecutor {

	/**
	 * Execute a committed decision.
	 *
	 * @param decision the decision for this cycle
	 * @return feedback when the executor can tell how the action went
	 */
	Optional<ActionFeedback> execute(Decision decision);

	/**
	 * Abandon any in-flight route or movement target.
	 */
	void discardMovementIntent();
}
