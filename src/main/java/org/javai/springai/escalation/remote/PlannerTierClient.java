package org.javai.springai.escalation.remote;

import java.util.function.Predicate;
import org.javai.springai.escalation.DecisionTier;
import org.javai.springai.escalation.snapshot.StateSnapshot;
import org.springframework.ai.chat.client.ChatClient;

/**
 * Client for the high-latency strategic planning service.
 *
 * <p>By default the planner is only consulted at level milestones. The minimum interval
 * between planner calls is enforced by the orchestrator, not here.</p>
 */
public class PlannerTierClient extends ChatClientRemoteTier {

	public static final String DEFAULT_DEPENDENCY = "planner-service";

	static final int MILESTONE_STEP = 10;

	private static final String INSTRUCTION = """
			You are the strategic planner of a game-playing agent. Given the agent's current state,
			choose the next step toward its long-term progression: leveling route, class advancement,
			equipment and economy.""";

	private final Predicate<StateSnapshot> gate;

	public PlannerTierClient(ChatClient chatClient, String modelId) {
		this(chatClient, modelId, DEFAULT_DEPENDENCY, levelMilestone());
	}

	public PlannerTierClient(ChatClient chatClient, String modelId, String dependencyName,
			Predicate<StateSnapshot> gate) {
		super(chatClient, modelId, dependencyName, 0.8);
		if (gate == null) {
			throw new IllegalArgumentException("gate must not be null");
		}
		this.gate = gate;
	}

	/**
	 * True at levels 10, 20, 30 and so on.
	 */
	public static Predicate<StateSnapshot> levelMilestone() {
		return snapshot -> snapshot.level() >= MILESTONE_STEP && snapshot.level() % MILESTONE_STEP == 0;
	}

	@Override
	public DecisionTier tier() {
		return DecisionTier.PLANNER;
	}

	@Override
	public boolean shouldHandle(StateSnapshot snapshot) {
		return gate.test(snapshot);
	}

	@Override
	protected String systemInstruction() {
		return INSTRUCTION;
	}
}
