package org.javai.springai.escalation.heal;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Line handling shared by the directive transforms. Lines keep their original terminators so
 * that a rewrite touches nothing but the lines it disables.
 */
final class ConfigLines {

	static final String DISABLED_MARKER = "# [DISABLED BY SELF-HEAL] ";

	private static final Pattern TRAILING_COMMENT = Pattern.compile("\\s+#.*$");

	private ConfigLines() {
	}

	/**
	 * Split into lines, each keeping its own terminator. Concatenating the result yields the input.
	 */
	static List<String> split(String text) {
		List<String> lines = new ArrayList<>();
		int start = 0;
		for (int i = 0; i < text.length(); i++) {
			if (text.charAt(i) == '\n') {
				lines.add(text.substring(start, i + 1));
				start = i + 1;
			}
		}
		if (start < text.length()) {
			lines.add(text.substring(start));
		}
		return lines;
	}

	static String content(String line) {
		return line.substring(0, line.length() - terminator(line).length());
	}

	static String terminator(String line) {
		if (line.endsWith("\r\n")) {
			return "\r\n";
		}
		if (line.endsWith("\n")) {
			return "\n";
		}
		return "";
	}

	/**
	 * Line content without a trailing {@code # ...} comment and surrounding whitespace.
	 */
	static String directivePart(String line) {
		return TRAILING_COMMENT.matcher(content(line)).replaceFirst("").strip();
	}

	static boolean isComment(String line) {
		return content(line).stripLeading().startsWith("#");
	}

	static String disable(String line) {
		return DISABLED_MARKER + content(line) + terminator(line);
	}
}
