package org.javai.springai.escalation.policy;

import org.javai.springai.escalation.action.CandidateAction;
import org.javai.springai.escalation.snapshot.StateSnapshot;

/**
 * One independently authored concern inside the {@link PolicyBank}.
 *
 * <p>Both methods must be free of side effects: the orchestrator may evaluate a policy and
 * then discard its answer. Anything with an effect on the world happens only after the
 * resulting decision has been committed and handed to the action executor.</p>
 */
public interface Policy {

	/**
	 * Unique name of this policy within a bank. Used to express the bank's order.
	 */
	String name();

	/**
	 * Cheap check whether this policy has something to say about the snapshot.
	 */
	boolean applicable(StateSnapshot snapshot);

	/**
	 * Propose an action. Returning {@link CandidateAction#none(String)} means the policy
	 * looked closer and found nothing to do.
	 */
	CandidateAction decide(StateSnapshot snapshot);
}
