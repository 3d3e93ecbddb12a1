package edu.cmu.cs.cs15745.heapviz.output;

/**
 * Thrown when text drawn from an address or label contains a character the
 * target format cannot carry even after substitution.
 */
public class EscapingException extends IllegalArgumentException {
	private static final long serialVersionUID = 1L;

	private final String text;
	private final int index;

	public EscapingException(String text, int index) {
		super(String.format("Cannot embed %s: character '%s' at %d", text, printable(text.charAt(index)), index));
		this.text = text;
		this.index = index;
	}

	/** The text that could not be embedded. */
	public String text() {
		return text;
	}

	/** Position of the first offending character. */
	public int index() {
		return index;
	}

	private static String printable(char c) {
		return Character.isISOControl(c) || Character.isSurrogate(c) ? String.format("\\u%04x", (int) c) : String.valueOf(c);
	}
}
