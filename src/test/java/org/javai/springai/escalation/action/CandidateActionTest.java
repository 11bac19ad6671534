package org.javai.springai.escalation.action;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CandidateActionTest {

	@Test
	void confidenceMustBeWithinUnitInterval() {
		assertThatThrownBy(() -> CandidateAction.of("attack", 1.01, ""))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("confidence");
		assertThatThrownBy(() -> CandidateAction.of("attack", -0.1, ""))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> CandidateAction.of("attack", Double.NaN, ""))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void kindMustNotBeBlank() {
		assertThatThrownBy(() -> CandidateAction.of(" ", 0.5, ""))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("kind must not be blank");
	}

	@Test
	void parametersAreCopiedInOrderAndImmutable() {
		Map<String, Object> source = new LinkedHashMap<>();
		source.put("skill", "Bash");
		source.put("target", "m-1");

		CandidateAction action = CandidateAction.of(ActionKinds.SKILL, source, 0.9, "bash it");
		source.put("extra", "later");

		assertThat(action.parameters()).containsExactly(Map.entry("skill", "Bash"), Map.entry("target", "m-1"));
		assertThatThrownBy(() -> action.parameters().put("x", "y"))
				.isInstanceOf(UnsupportedOperationException.class);
	}

	@Test
	void nullParameterValuesAreRejected() {
		Map<String, Object> source = new HashMap<>();
		source.put("target", null);

		assertThatThrownBy(() -> CandidateAction.of(ActionKinds.ATTACK, source, 0.5, ""))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void noneIsTheExplicitEmptyAnswer() {
		CandidateAction none = CandidateAction.none("nothing to do");

		assertThat(none.isNone()).isTrue();
		assertThat(none.confidence()).isZero();
		assertThat(none.rationale()).isEqualTo("nothing to do");
		assertThat(CandidateAction.of(ActionKinds.IDLE, 0.5, null).rationale()).isEmpty();
	}

	@Test
	void feedbackFactories() {
		ActionFeedback ok = ActionFeedback.success(ActionKinds.ATTACK);
		ActionFeedback failed = ActionFeedback.failed(ActionKinds.USE_ITEM, "no_item", "out of potions");

		assertThat(ok.isFailure()).isFalse();
		assertThat(ok.reasonCode()).isEmpty();
		assertThat(failed.isFailure()).isTrue();
		assertThat(failed.status()).isEqualTo(FeedbackStatus.FAILED);
	}
}
