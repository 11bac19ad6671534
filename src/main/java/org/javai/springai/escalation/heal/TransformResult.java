package org.javai.springai.escalation.heal;

import java.util.List;

/**
 * Output of a {@link DirectiveTransform}.
 *
 * @param text the transformed configuration text
 * @param affectedDirectives directives that were neutralized, in file order
 */
public record TransformResult(String text, List<String> affectedDirectives) {

	public TransformResult {
		if (text == null) {
			throw new IllegalArgumentException("text must not be null");
		}
		affectedDirectives = affectedDirectives == null ? List.of() : List.copyOf(affectedDirectives);
	}

	public static TransformResult unchanged(String text) {
		return new TransformResult(text, List.of());
	}

	public boolean changed() {
		return !affectedDirectives.isEmpty();
	}
}
