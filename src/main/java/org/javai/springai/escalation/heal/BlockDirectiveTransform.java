package org.javai.springai.escalation.heal;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Disables every active block of a directive, for example
 * <pre>
 * buyAuto Red Potion {
 *     npc prontera 150 180
 *     maxAmount 50
 * }
 * </pre>
 * Header, body and closing brace are all commented out. A header without a block is
 * disabled on its own.
 */
public class BlockDirectiveTransform implements DirectiveTransform {

	private final Pattern header;

	public BlockDirectiveTransform(String directive) {
		if (directive == null || directive.isBlank()) {
			throw new IllegalArgumentException("directive must not be blank");
		}
		this.header = Pattern.compile("^\\s*" + Pattern.quote(directive) + "\\b.*$");
	}

	@Override
	public TransformResult apply(String text) {
		StringBuilder out = new StringBuilder(text.length() + 128);
		List<String> affected = new ArrayList<>();
		boolean inBlock = false;
		for (String line : ConfigLines.split(text)) {
			if (inBlock) {
				out.append(ConfigLines.isComment(line) ? line : ConfigLines.disable(line));
				if (!ConfigLines.isComment(line) && ConfigLines.content(line).stripLeading().startsWith("}")) {
					inBlock = false;
				}
				continue;
			}
			if (ConfigLines.isComment(line) || !header.matcher(ConfigLines.content(line)).matches()) {
				out.append(line);
				continue;
			}
			out.append(ConfigLines.disable(line));
			String trimmed = ConfigLines.directivePart(line);
			affected.add(trimmed.endsWith("{") ? trimmed.substring(0, trimmed.length() - 1).strip() : trimmed);
			inBlock = trimmed.endsWith("{");
		}
		return affected.isEmpty() ? TransformResult.unchanged(text) : new TransformResult(out.toString(), affected);
	}
}
