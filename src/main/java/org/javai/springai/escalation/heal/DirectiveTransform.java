package org.javai.springai.escalation.heal;

/**
 * Pure rewrite of a line-oriented configuration text.
 *
 * <p>Implementations only ever comment lines out with {@link ConfigLines#DISABLED_MARKER};
 * they never delete or reorder content, and applying a transform twice changes nothing the
 * second time.</p>
 */
@FunctionalInterface
public interface DirectiveTransform {

	TransformResult apply(String text);
}
