package edu.cmu.cs.cs15745.heapviz.heap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import edu.cmu.cs.cs15745.heapviz.util.Pair;
import edu.cmu.cs.cs15745.heapviz.util.Util;

/**
 * The content of a memory cell is one of the following:
 * <ul>
 * <li>a scalar value (an address);</li>
 * <li>a struct, i.e. an ordered list of named fields, each with content;</li>
 * <li>an array, i.e. a size and an ordered list of indexed elements.</li>
 * </ul>
 */
public abstract class Content {
	// Disallow external subclassing.
	private Content() {
	}

	/**
	 * Visitor for Content's fixed set of subclasses.
	 */
	public interface Visitor<T> {
		T visitScalar(Scalar s);
		T visitStruct(NestedStruct s);
		T visitArray(NestedArray a);
	}

	public abstract <T> T accept(Visitor<T> visitor);

	public static Scalar scalar(Address value) {
		return new Scalar(value);
	}

	public static NestedStruct struct(List<Pair<String, Content>> fields) {
		return new NestedStruct(fields);
	}

	public static NestedArray array(Address size, List<Pair<Address, Content>> elements) {
		return new NestedArray(size, elements);
	}

	/** Whether this content has members, i.e. is rendered as a panel. */
	public boolean isNested() {
		return !(this instanceof Scalar);
	}

	public static final class Scalar extends Content {
		private final Address value;

		public Scalar(Address value) {
			this.value = Objects.requireNonNull(value);
		}

		public Address value() {
			return value;
		}

		@Override
		public <T> T accept(Visitor<T> visitor) {
			return visitor.visitScalar(this);
		}

		@Override
		public int hashCode() {
			return value.hashCode();
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Scalar && value.equals(((Scalar) o).value);
		}

		@Override
		public String toString() {
			return value.toString();
		}
	}

	/**
	 * Fields are kept in declaration order.
	 */
	public static final class NestedStruct extends Content {
		private final List<Pair<String, Content>> fields;

		public NestedStruct(List<Pair<String, Content>> fields) {
			this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
		}

		public List<Pair<String, Content>> fields() {
			return fields;
		}

		@Override
		public <T> T accept(Visitor<T> visitor) {
			return visitor.visitStruct(this);
		}

		@Override
		public int hashCode() {
			return fields.hashCode();
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof NestedStruct && fields.equals(((NestedStruct) o).fields);
		}

		@Override
		public String toString() {
			return String.format("{%s}", Util.join(", ", fields));
		}
	}

	/**
	 * Elements are kept in declaration order, keyed by their index expression.
	 */
	public static final class NestedArray extends Content {
		private final Address size;
		private final List<Pair<Address, Content>> elements;

		public NestedArray(Address size, List<Pair<Address, Content>> elements) {
			this.size = Objects.requireNonNull(size);
			this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
		}

		public Address size() {
			return size;
		}

		public List<Pair<Address, Content>> elements() {
			return elements;
		}

		@Override
		public <T> T accept(Visitor<T> visitor) {
			return visitor.visitArray(this);
		}

		@Override
		public int hashCode() {
			return 31 * size.hashCode() + elements.hashCode();
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof NestedArray)) return false;
			NestedArray other = (NestedArray) o;
			return size.equals(other.size) && elements.equals(other.elements);
		}

		@Override
		public String toString() {
			return String.format("[%s]{%s}", size, Util.join(", ", elements));
		}
	}
}
