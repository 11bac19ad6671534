package org.javai.springai.escalation.heal;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Disables every active single-line directive whose name starts with a prefix, for example
 * all {@code teleportAuto_*} settings. Directives already set to the neutral value are left
 * alone; a trailing {@code # ...} comment is not part of the value.
 */
public class PrefixedDirectiveTransform implements DirectiveTransform {

	private final Pattern directive;
	private final String neutralValue;

	public PrefixedDirectiveTransform(String prefix, String neutralValue) {
		if (prefix == null || prefix.isBlank()) {
			throw new IllegalArgumentException("prefix must not be blank");
		}
		this.directive = Pattern.compile("^\\s*(" + Pattern.quote(prefix) + "\\w*)(?:\\s+(.*?))?\\s*$");
		this.neutralValue = neutralValue == null ? "" : neutralValue;
	}

	@Override
	public TransformResult apply(String text) {
		StringBuilder out = new StringBuilder(text.length() + 64);
		List<String> affected = new ArrayList<>();
		for (String line : ConfigLines.split(text)) {
			if (ConfigLines.isComment(line)) {
				out.append(line);
				continue;
			}
			Matcher matcher = directive.matcher(ConfigLines.directivePart(line));
			if (!matcher.matches()) {
				out.append(line);
				continue;
			}
			String value = matcher.group(2) == null ? "" : matcher.group(2);
			if (value.isEmpty() || value.equals(neutralValue)) {
				out.append(line);
				continue;
			}
			out.append(ConfigLines.disable(line));
			affected.add((matcher.group(1) + " " + value).trim());
		}
		return affected.isEmpty() ? TransformResult.unchanged(text) : new TransformResult(out.toString(), affected);
	}
}
