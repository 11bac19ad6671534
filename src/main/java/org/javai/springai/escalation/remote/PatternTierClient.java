package org.javai.springai.escalation.remote;

import java.util.function.Predicate;
import org.javai.springai.escalation.DecisionTier;
import org.javai.springai.escalation.snapshot.StateSnapshot;
import org.springframework.ai.chat.client.ChatClient;

/**
 * Client for the low-latency pattern-matching service.
 */
public class PatternTierClient extends ChatClientRemoteTier {

	public static final String DEFAULT_DEPENDENCY = "pattern-service";

	private static final String INSTRUCTION = """
			You recognize familiar situations for a game-playing agent. Given the agent's current state,
			propose the action that has worked best in similar situations.""";

	private final Predicate<StateSnapshot> gate;

	public PatternTierClient(ChatClient chatClient, String modelId) {
		this(chatClient, modelId, DEFAULT_DEPENDENCY, snapshot -> true);
	}

	public PatternTierClient(ChatClient chatClient, String modelId, String dependencyName,
			Predicate<StateSnapshot> gate) {
		super(chatClient, modelId, dependencyName, 0.6);
		if (gate == null) {
			throw new IllegalArgumentException("gate must not be null");
		}
		this.gate = gate;
	}

	@Override
	public DecisionTier tier() {
		return DecisionTier.PATTERN;
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
