package edu.cmu.cs.cs15745.heapviz.output;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A generic tagged tree: elements with ordered attributes and children, and
 * text leaves. Values are kept raw; {@link XmlPrinter} escapes them.
 */
public abstract class XmlTree {
	// Disallow external subclassing.
	private XmlTree() {
	}

	public interface Visitor<T> {
		T visitElement(Element e);
		T visitText(Text t);
	}

	public abstract <T> T accept(Visitor<T> visitor);

	public static Element element(String tag) {
		return new Element(tag);
	}

	public static Text text(String content) {
		return new Text(content);
	}

	public static final class Element extends XmlTree {
		private final String tag;
		private final Map<String, String> attributes = new LinkedHashMap<>();
		private final List<XmlTree> children = new ArrayList<>();

		private Element(String tag) {
			this.tag = Objects.requireNonNull(tag);
		}

		public String tag() {
			return tag;
		}

		/** Attributes in insertion order. */
		public Map<String, String> attributes() {
			return Collections.unmodifiableMap(attributes);
		}

		public Optional<String> attribute(String name) {
			return Optional.ofNullable(attributes.get(name));
		}

		public List<XmlTree> children() {
			return Collections.unmodifiableList(children);
		}

		/** Child elements with the given tag, in order. */
		public List<Element> children(String childTag) {
			return children.stream()
				.filter(c -> c instanceof Element)
				.map(c -> (Element) c)
				.filter(c -> c.tag.equals(childTag))
				.collect(Collectors.toList());
		}

		public Element attr(String name, Object value) {
			attributes.put(Objects.requireNonNull(name), String.valueOf(value));
			return this;
		}

		public Element add(XmlTree child) {
			children.add(Objects.requireNonNull(child));
			return this;
		}

		public Element addAll(List<? extends XmlTree> newChildren) {
			newChildren.forEach(this::add);
			return this;
		}

		@Override
		public <T> T accept(Visitor<T> visitor) {
			return visitor.visitElement(this);
		}

		@Override
		public String toString() {
			return XmlPrinter.compact().print(this);
		}
	}

	public static final class Text extends XmlTree {
		private final String content;

		private Text(String content) {
			this.content = Objects.requireNonNull(content);
		}

		public String content() {
			return content;
		}

		@Override
		public <T> T accept(Visitor<T> visitor) {
			return visitor.visitText(this);
		}

		@Override
		public String toString() {
			return content;
		}
	}
}
