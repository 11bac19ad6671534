package org.javai.springai.escalation.heal;

import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Directive transforms")
class DirectiveTransformTest {

	private static final String CONFIG = """
			attackAuto 2
			teleportAuto_hp 10
			teleportAuto_idle 0
			# teleportAuto_search 1
			teleportAuto_minAggressives 3

			buyAuto Red Potion {
				npc prontera 150 180
				maxAmount 50
			}

			buyAuto Fly Wing
			sitAuto_hp_lower 40
			""";

	@Nested
	@DisplayName("PrefixedDirectiveTransform")
	class Prefixed {

		private final PrefixedDirectiveTransform transform = new PrefixedDirectiveTransform("teleportAuto_", "0");

		@Test
		@DisplayName("Comments out every active directive with the prefix")
		void disablesActiveDirectives() {
			TransformResult result = transform.apply(CONFIG);

			assertThat(result.changed()).isTrue();
			assertThat(result.affectedDirectives())
					.containsExactly("teleportAuto_hp 10", "teleportAuto_minAggressives 3");
			assertThat(result.text())
					.contains(ConfigLines.DISABLED_MARKER + "teleportAuto_hp 10\n")
					.contains("\nteleportAuto_idle 0\n")
					.contains("\n# teleportAuto_search 1\n")
					.contains("\nattackAuto 2\n");
		}

		@Test
		@DisplayName("Applying twice changes nothing the second time")
		void idempotent() {
			String once = transform.apply(CONFIG).text();

			TransformResult twice = transform.apply(once);

			assertThat(twice.changed()).isFalse();
			assertThat(twice.text()).isEqualTo(once);
		}

		@Test
		@DisplayName("Keeps line terminators and untouched lines byte for byte")
		void preservesOtherLines() {
			String text = "a 1\r\nteleportAuto_hp 5\r\nb 2";

			TransformResult result = transform.apply(text);

			assertThat(result.text()).isEqualTo("a 1\r\n" + ConfigLines.DISABLED_MARKER + "teleportAuto_hp 5\r\nb 2");
		}

		@Test
		@DisplayName("A trailing comment is not part of the value")
		void ignoresTrailingComment() {
			String text = "teleportAuto_idle 0 # off\nteleportAuto_hp 10 # low health\n";

			TransformResult result = transform.apply(text);

			assertThat(result.affectedDirectives()).containsExactly("teleportAuto_hp 10");
			assertThat(result.text())
					.startsWith("teleportAuto_idle 0 # off\n")
					.endsWith(ConfigLines.DISABLED_MARKER + "teleportAuto_hp 10 # low health\n");
		}

		@Test
		@DisplayName("An already neutral directive with a comment leaves the configuration unchanged")
		void neutralWithComment() {
			assertThat(transform.apply("teleportAuto_idle 0 # off\n").changed()).isFalse();
		}
	}

	@Nested
	@DisplayName("BlockDirectiveTransform")
	class Block {

		private final BlockDirectiveTransform transform = new BlockDirectiveTransform("buyAuto");

		@Test
		@DisplayName("Comments out header, body and closing brace")
		void disablesWholeBlock() {
			TransformResult result = transform.apply(CONFIG);

			assertThat(result.affectedDirectives()).containsExactly("buyAuto Red Potion", "buyAuto Fly Wing");
			assertThat(result.text())
					.contains(ConfigLines.DISABLED_MARKER + "buyAuto Red Potion {\n")
					.contains(ConfigLines.DISABLED_MARKER + "\tnpc prontera 150 180\n")
					.contains(ConfigLines.DISABLED_MARKER + "}\n")
					.contains(ConfigLines.DISABLED_MARKER + "buyAuto Fly Wing\n")
					.contains("\nsitAuto_hp_lower 40\n");
		}

		@Test
		@DisplayName("Leaves a configuration without the directive unchanged")
		void noDirective() {
			TransformResult result = transform.apply("attackAuto 2\n");

			assertThat(result.changed()).isFalse();
			assertThat(result.text()).isEqualTo("attackAuto 2\n");
		}

		@Test
		@DisplayName("Applying twice changes nothing the second time")
		void idempotent() {
			String once = transform.apply(CONFIG).text();

			assertThat(transform.apply(once).changed()).isFalse();
		}

		@Test
		@DisplayName("A closing brace followed by a comment ends the block")
		void closingBraceWithComment() {
			String text = "buyAuto Red Potion {\n\tnpc prontera 150 180\n} # potions\nattackAuto 2\nroute_randomWalk 1\n";

			TransformResult result = transform.apply(text);

			assertThat(result.affectedDirectives()).containsExactly("buyAuto Red Potion");
			assertThat(result.text())
					.contains(ConfigLines.DISABLED_MARKER + "} # potions\n")
					.contains("\nattackAuto 2\n")
					.endsWith("\nroute_randomWalk 1\n");
		}

		@Test
		@DisplayName("A header with a trailing comment still opens a block")
		void headerWithComment() {
			String text = "buyAuto Red Potion { # restock\n\tmaxAmount 50\n}\nattackAuto 2\n";

			TransformResult result = transform.apply(text);

			assertThat(result.affectedDirectives()).containsExactly("buyAuto Red Potion");
			assertThat(result.text())
					.contains(ConfigLines.DISABLED_MARKER + "\tmaxAmount 50\n")
					.contains(ConfigLines.DISABLED_MARKER + "}\n")
					.endsWith("\nattackAuto 2\n");
		}
	}
}
