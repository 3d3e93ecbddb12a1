package edu.cmu.cs.cs15745.heapviz.output;

import java.util.Map;

/**
 * Makes address and label text safe to embed in the emitted documents. The
 * substitution replaces every occurrence of each special character by a
 * letter, so applying it twice changes nothing.
 */
public final class Escaping {
	private Escaping() { }

	private static final Map<Character, Character> SUBSTITUTES = Map.of(
		'(', 'B',
		'$', 'D',
		'#', 'H',
		'&', 'E',
		'@', 'A',
		')', 'B',
		'+', 'P',
		'-', 'M');

	// Characters a record port name cannot carry.
	private static final String PORT_FORBIDDEN = "\"<>{}|\\";

	// Characters that must be backslash-escaped in a quoted record label.
	private static final String LABEL_SPECIAL = "\"{}|<>\\";

	/** Apply the substitution to every special character. */
	public static String strip(String text) {
		var result = new StringBuilder(text.length());
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			result.append(SUBSTITUTES.getOrDefault(c, c));
		}
		return result.toString();
	}

	/**
	 * Text usable as the name of a port of a record node.
	 *
	 * @throws EscapingException if a character remains that a port cannot carry
	 */
	public static String portName(String text) {
		String stripped = strip(text);
		for (int i = 0; i < stripped.length(); i++) {
			char c = stripped.charAt(i);
			if (PORT_FORBIDDEN.indexOf(c) >= 0 || Character.isISOControl(c)) {
				throw new EscapingException(text, i);
			}
		}
		return stripped;
	}

	/**
	 * Text usable inside a quoted label, record labels included. Line breaks,
	 * {@code \r\n} and a lone {@code \r} among them, become the {@code \n}
	 * escape of the label language.
	 *
	 * @throws EscapingException if a control character other than a tab or a
	 *         line break remains, or a surrogate is unpaired
	 */
	public static String dotLabel(String text) {
		String stripped = strip(text);
		var result = new StringBuilder(stripped.length());
		for (int i = 0; i < stripped.length(); i++) {
			char c = stripped.charAt(i);
			if (c == '\r' && i + 1 < stripped.length() && stripped.charAt(i + 1) == '\n') {
				continue;
			}
			if (c == '\n' || c == '\r') {
				result.append("\\n");
				continue;
			}
			if ((Character.isISOControl(c) && c != '\t') || isUnpairedSurrogate(stripped, i)) {
				throw new EscapingException(text, i);
			}
			if (LABEL_SPECIAL.indexOf(c) >= 0) {
				result.append('\\');
			}
			result.append(c);
		}
		return result.toString();
	}

	/**
	 * Text usable as character data or an attribute value of the tree
	 * document. Entity escaping is left to the printer.
	 *
	 * @throws EscapingException if a character remains that XML 1.0 cannot carry
	 */
	public static String xmlText(String text) {
		String stripped = strip(text);
		int bad = firstNonXmlChar(stripped);
		if (bad >= 0) {
			throw new EscapingException(text, bad);
		}
		return stripped;
	}

	// Index of the first character outside the XML 1.0 Char production, or -1.
	static int firstNonXmlChar(String text) {
		int i = 0;
		while (i < text.length()) {
			int cp = text.codePointAt(i);
			if (!isXmlChar(cp)) {
				return i;
			}
			i += Character.charCount(cp);
		}
		return -1;
	}

	private static boolean isXmlChar(int cp) {
		return cp == 0x9 || cp == 0xA || cp == 0xD
				|| (cp >= 0x20 && cp <= 0xD7FF)
				|| (cp >= 0xE000 && cp <= 0xFFFD)
				|| (cp >= 0x10000 && cp <= 0x10FFFF);
	}

	private static boolean isUnpairedSurrogate(String text, int i) {
		char c = text.charAt(i);
		if (Character.isHighSurrogate(c)) {
			return i + 1 >= text.length() || !Character.isLowSurrogate(text.charAt(i + 1));
		}
		if (Character.isLowSurrogate(c)) {
			return i == 0 || !Character.isHighSurrogate(text.charAt(i - 1));
		}
		return false;
	}
}
