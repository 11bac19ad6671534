package org.javai.springai.escalation.remote;

import static org.assertj.core.api.Assertions.assertThat;
import static org.javai.springai.escalation.testsupport.Snapshots.calm;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import java.time.Instant;
import org.javai.springai.escalation.DecisionTier;
import org.javai.springai.escalation.snapshot.StateSnapshot;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.ai.chat.client.ChatClient;

/**
 * Remote tier clients against mocked ChatClients; no model is called.
 */
class ChatClientRemoteTierTest {

	private final StateSnapshot snapshot = calm().build();
	private final Instant deadline = Instant.parse("2025-01-01T00:00:01Z");

	@Test
	void proposalCarriesTheModelIdAsSource() {
		ChatClient client = mockClient("{\"kind\": \"attack\", \"parameters\": {\"target\": \"m-3\"}, \"confidence\": 0.7}");
		PatternTierClient tier = new PatternTierClient(client, "pattern-v2");

		TierResult result = tier.decide(snapshot, deadline);

		assertThat(result).isInstanceOf(TierResult.Proposed.class);
		TierResult.Proposed proposed = (TierResult.Proposed) result;
		assertThat(proposed.source()).isEqualTo("pattern-v2");
		assertThat(proposed.action().parameters()).containsEntry("target", "m-3");
		assertThat(tier.tier()).isEqualTo(DecisionTier.PATTERN);
		assertThat(tier.dependencyName()).isEqualTo(PatternTierClient.DEFAULT_DEPENDENCY);
	}

	@Test
	void noneReplyIsEmpty() {
		PatternTierClient tier = new PatternTierClient(mockClient("{\"kind\": \"none\", \"rationale\": \"unfamiliar\"}"), "p");

		TierResult result = tier.decide(snapshot, deadline);

		assertThat(result).isEqualTo(new TierResult.Empty("unfamiliar"));
	}

	@Test
	void garbageReplyIsMalformed() {
		PatternTierClient tier = new PatternTierClient(mockClient("{{{"), "p");

		TierResult result = tier.decide(snapshot, deadline);

		assertThat(result).isInstanceOf(TierResult.Failed.class);
		assertThat(((TierResult.Failed) result).error().kind()).isEqualTo(TierError.Kind.MALFORMED_RESPONSE);
	}

	@Test
	void clientExceptionIsTransportFailure() {
		ChatClient client = mock(ChatClient.class, Mockito.RETURNS_DEEP_STUBS);
		when(client.prompt().call().content()).thenThrow(new IllegalStateException("connection refused"));
		PlannerTierClient tier = new PlannerTierClient(client, "planner-v1");

		TierResult result = tier.decide(snapshot, deadline);

		assertThat(result).isInstanceOf(TierResult.Failed.class);
		TierError error = ((TierResult.Failed) result).error();
		assertThat(error.kind()).isEqualTo(TierError.Kind.TRANSPORT);
		assertThat(error.message()).contains("connection refused");
	}

	@Test
	void plannerOnlyHandlesLevelMilestones() {
		PlannerTierClient tier = new PlannerTierClient(mockClient("{}"), "planner-v1");

		assertThat(tier.shouldHandle(calm().level(40).build())).isTrue();
		assertThat(tier.shouldHandle(calm().level(42).build())).isFalse();
		assertThat(tier.shouldHandle(calm().level(0).build())).isFalse();
		assertThat(tier.tier()).isEqualTo(DecisionTier.PLANNER);
	}

	private static ChatClient mockClient(String response) {
		ChatClient client = mock(ChatClient.class, Mockito.RETURNS_DEEP_STUBS);
		when(client.prompt().call().content()).thenReturn(response);
		return client;
	}
}
