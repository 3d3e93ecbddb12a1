package edu.cmu.cs.cs15745.heapviz.output;

/**
 * Prints a {@link XmlTree}. The pretty printer writes a preamble and one
 * element per line, indented by depth; the compact printer writes the bare
 * tree on one line. Attribute values and text are entity-escaped; a
 * character XML 1.0 cannot carry raises an {@link EscapingException}.
 */
public final class XmlPrinter {
	public static final String PREAMBLE = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>";

	private static final String INDENT = "  ";

	private final boolean pretty;

	private XmlPrinter(boolean pretty) {
		this.pretty = pretty;
	}

	public static XmlPrinter pretty() {
		return new XmlPrinter(true);
	}

	public static XmlPrinter compact() {
		return new XmlPrinter(false);
	}

	public static XmlPrinter of(boolean pretty) {
		return new XmlPrinter(pretty);
	}

	public String print(XmlTree tree) {
		var out = new StringBuilder();
		if (pretty) {
			out.append(PREAMBLE).append('\n');
		}
		print(out, tree, 0);
		return out.toString();
	}

	private void print(StringBuilder out, XmlTree tree, int depth) {
		tree.accept(new XmlTree.Visitor<Void>() {
			@Override
			public Void visitElement(XmlTree.Element e) {
				indent(out, depth);
				out.append('<').append(e.tag());
				for (var attribute : e.attributes().entrySet()) {
					out.append(' ').append(attribute.getKey()).append("=\"").append(escape(attribute.getValue()))
						.append('"');
				}
				if (e.children().isEmpty()) {
					out.append("/>");
					newline(out);
					return null;
				}
				out.append('>');
				newline(out);
				for (var child : e.children()) {
					print(out, child, depth + 1);
				}
				indent(out, depth);
				out.append("</").append(e.tag()).append('>');
				newline(out);
				return null;
			}

			@Override
			public Void visitText(XmlTree.Text t) {
				indent(out, depth);
				out.append(escape(t.content()));
				newline(out);
				return null;
			}
		});
	}

	private void indent(StringBuilder out, int depth) {
		if (pretty) {
			for (int i = 0; i < depth; i++) {
				out.append(INDENT);
			}
		}
	}

	private void newline(StringBuilder out) {
		if (pretty) {
			out.append('\n');
		}
	}

	// Entity-escapes text; characters XML 1.0 cannot carry at all are an error.
	static String escape(String text) {
		int bad = Escaping.firstNonXmlChar(text);
		if (bad >= 0) {
			throw new EscapingException(text, bad);
		}
		var result = new StringBuilder(text.length());
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			switch (c) {
			case '&':
				result.append("&amp;");
				break;
			case '<':
				result.append("&lt;");
				break;
			case '>':
				result.append("&gt;");
				break;
			case '"':
				result.append("&quot;");
				break;
			case '\'':
				result.append("&apos;");
				break;
			default:
				result.append(c);
			}
		}
		return result.toString();
	}
}
