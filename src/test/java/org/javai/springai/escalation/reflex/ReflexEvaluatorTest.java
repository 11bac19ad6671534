package org.javai.springai.escalation.reflex;

import static org.assertj.core.api.Assertions.assertThat;
import static org.javai.springai.escalation.testsupport.Snapshots.calm;
import static org.javai.springai.escalation.testsupport.Snapshots.cure;
import static org.javai.springai.escalation.testsupport.Snapshots.healing;
import static org.javai.springai.escalation.testsupport.Snapshots.hostile;
import static org.javai.springai.escalation.testsupport.Snapshots.stamina;
import static org.javai.springai.escalation.testsupport.Snapshots.vitals;
import static org.javai.springai.escalation.testsupport.Snapshots.withLoad;
import java.time.Duration;
import java.util.Optional;
import org.javai.springai.escalation.action.ActionKinds;
import org.javai.springai.escalation.action.CandidateAction;
import org.javai.springai.escalation.snapshot.StateSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ReflexEvaluator")
class ReflexEvaluatorTest {

	private final ReflexEvaluator evaluator = new ReflexEvaluator();

	@Test
	@DisplayName("Healthy agent with nothing around triggers nothing")
	void calmAgentTriggersNothing() {
		StateSnapshot snapshot = calm().build();

		assertThat(evaluator.evaluate(snapshot)).isEmpty();
		assertThat(evaluator.triggers(snapshot)).isEmpty();
	}

	@Nested
	@DisplayName("Critical health")
	class CriticalHealth {

		@Test
		@DisplayName("Uses the strongest carried healing item")
		void usesStrongestHealingItem() {
			StateSnapshot snapshot = calm()
					.vitals(vitals(200, 300))
					.carried(healing("Red Potion", 10, 45), healing("White Potion", 2, 325), healing("Orange Potion", 4, 105))
					.build();

			CandidateAction action = evaluator.evaluate(snapshot).orElseThrow();

			assertThat(action.kind()).isEqualTo(ActionKinds.USE_ITEM);
			assertThat(action.parameters()).containsEntry("item", "White Potion");
			assertThat(action.confidence()).isEqualTo(1.0);
			assertThat(action.rationale()).startsWith("reflex: ");
		}

		@Test
		@DisplayName("Falls back to the configured item when nothing is carried")
		void fallsBackToConfiguredItem() {
			ReflexEvaluator custom = new ReflexEvaluator(ReflexThresholds.builder()
					.fallbackHealthItem("Yellow Potion")
					.build());

			CandidateAction action = custom.evaluate(calm().vitals(vitals(100, 300)).build()).orElseThrow();

			assertThat(action.parameters()).containsEntry("item", "Yellow Potion");
		}

		@Test
		@DisplayName("Exactly at the threshold does not fire")
		void thresholdIsExclusive() {
			assertThat(evaluator.evaluate(calm().vitals(vitals(250, 300)).build())).isEmpty();
		}

		@Test
		@DisplayName("Same vitals, items and hostiles always yield the same action")
		void deterministic() {
			StateSnapshot first = calm()
					.vitals(vitals(150, 300))
					.carried(healing("Red Potion", 3, 45))
					.nearby(hostile("m-1", 3))
					.build();
			StateSnapshot second = first.toBuilder()
					.agentName("Other")
					.timestamp(first.timestamp().plus(Duration.ofMinutes(5)))
					.build();

			Optional<CandidateAction> a = evaluator.evaluate(first);
			Optional<CandidateAction> b = evaluator.evaluate(second);

			assertThat(a).isPresent();
			assertThat(a).isEqualTo(b);
		}
	}

	@Nested
	@DisplayName("Precedence")
	class Precedence {

		@Test
		@DisplayName("Critical health outranks a dangerous status")
		void criticalHealthFirst() {
			StateSnapshot snapshot = calm()
					.vitals(vitals(100, 300))
					.statusEffects("Stunned")
					.carried(cure("Green Potion", 3))
					.build();

			assertThat(evaluator.triggers(snapshot))
					.containsExactly(ReflexTrigger.CRITICAL_HEALTH, ReflexTrigger.DANGEROUS_STATUS);
			assertThat(evaluator.evaluate(snapshot).orElseThrow().parameters())
					.containsEntry("item", "White Potion");
		}

		@Test
		@DisplayName("A dangerous status is cured with the carried cure")
		void curesDangerousStatus() {
			StateSnapshot snapshot = calm()
					.statusEffects("frozen")
					.carried(cure("Panacea", 1))
					.build();

			CandidateAction action = evaluator.evaluate(snapshot).orElseThrow();

			assertThat(action.parameters()).containsEntry("item", "Panacea");
		}

		@Test
		@DisplayName("Low health only matters with a hostile in contact")
		void hostileContact() {
			StateSnapshot alone = calm().vitals(vitals(350, 300)).build();
			StateSnapshot contact = calm().vitals(vitals(350, 300)).nearby(hostile("m-1", 3)).build();
			StateSnapshot distant = calm().vitals(vitals(350, 300)).nearby(hostile("m-1", 9)).build();

			assertThat(evaluator.evaluate(alone)).isEmpty();
			assertThat(evaluator.evaluate(distant)).isEmpty();
			assertThat(evaluator.triggers(contact)).containsExactly(ReflexTrigger.HOSTILE_CONTACT);
			assertThat(evaluator.evaluate(contact).orElseThrow().parameters()).containsEntry("item", "Red Potion");
		}

		@Test
		@DisplayName("Over capacity sends the unload command")
		void overCapacity() {
			CandidateAction action = evaluator.evaluate(calm().vitals(withLoad(1000, 1800)).build()).orElseThrow();

			assertThat(action.kind()).isEqualTo(ActionKinds.COMMAND);
			assertThat(action.parameters()).containsEntry("command", "storage");
		}

		@Test
		@DisplayName("Critical stamina restores stamina last")
		void criticalStamina() {
			StateSnapshot snapshot = calm()
					.vitals(vitals(1000, 30))
					.carried(stamina("Blue Potion", 2, 60), stamina("Grape Juice", 5, 20))
					.build();

			assertThat(evaluator.triggers(snapshot)).containsExactly(ReflexTrigger.CRITICAL_STAMINA);
			assertThat(evaluator.evaluate(snapshot).orElseThrow().parameters()).containsEntry("item", "Blue Potion");
		}
	}
}
