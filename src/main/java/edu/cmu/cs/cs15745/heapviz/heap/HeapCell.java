package edu.cmu.cs.cs15745.heapviz.heap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import edu.cmu.cs.cs15745.heapviz.util.Pair;
import edu.cmu.cs.cs15745.heapviz.util.Util;

/**
 * A HeapCell is one predicate of a symbolic heap:
 * <ul>
 * <li>addr |-> content (points-to, scalar or nested content)</li>
 * <li>addr |-> {fields} (struct)</li>
 * <li>addr |-> [size]{elements} (array)</li>
 * <li>lseg(first, last) with a body heap (singly linked list segment)</li>
 * <li>dllseg(first, firstPrev, lastNext, last) with a body heap (doubly linked list segment)</li>
 * </ul>
 * The body of a segment is itself a symbolic heap and is rendered as a
 * separate nested subgraph.
 */
public abstract class HeapCell {
	// Disallow external subclassing.
	private HeapCell() {
	}

	/**
	 * Visitor for HeapCell's fixed set of subclasses.
	 */
	public interface Visitor<T> {
		T visitPointsTo(PointsTo p);
		T visitStruct(Struct s);
		T visitArray(Array a);
		T visitListSeg(ListSeg l);
		T visitDllSeg(DllSeg d);
	}

	/**
	 * Convenience class for unit-returning visitor.
	 */
	public static abstract class StatefulVisitor {
		public void iterPointsTo(PointsTo p) { }
		public void iterStruct(Struct s) { }
		public void iterArray(Array a) { }
		public void iterListSeg(ListSeg l) { }
		public void iterDllSeg(DllSeg d) { }
		public Visitor<?> visitor() {
			return new Visitor<Object>() {
				@Override
				public Object visitPointsTo(PointsTo p) {
					iterPointsTo(p);
					return null;
				}

				@Override
				public Object visitStruct(Struct s) {
					iterStruct(s);
					return null;
				}

				@Override
				public Object visitArray(Array a) {
					iterArray(a);
					return null;
				}

				@Override
				public Object visitListSeg(ListSeg l) {
					iterListSeg(l);
					return null;
				}

				@Override
				public Object visitDllSeg(DllSeg d) {
					iterDllSeg(d);
					return null;
				}
			};
		}
	}

	public abstract <T> T accept(Visitor<T> visitor);

	/** The allocated address; the first element for segments. */
	public abstract Address address();

	/**
	 * addr |-> content
	 */
	public static final class PointsTo extends HeapCell {
		private final Address address;
		private final Content content;
		private final String type;

		public PointsTo(Address address, Content content, String type) {
			this.address = Objects.requireNonNull(address);
			this.content = Objects.requireNonNull(content);
			this.type = Objects.requireNonNull(type);
		}

		@Override
		public Address address() {
			return address;
		}

		public Content content() {
			return content;
		}

		public String type() {
			return type;
		}

		@Override
		public <T> T accept(Visitor<T> visitor) {
			return visitor.visitPointsTo(this);
		}

		@Override
		public int hashCode() {
			return Objects.hash(address, content, type);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof PointsTo)) return false;
			PointsTo other = (PointsTo) o;
			return address.equals(other.address) && content.equals(other.content) && type.equals(other.type);
		}

		@Override
		public String toString() {
			return String.format("%s |-> %s : %s", address, content, type);
		}
	}

	/**
	 * addr |-> {fields}
	 */
	public static final class Struct extends HeapCell {
		private final Address address;
		private final Content.NestedStruct content;
		private final String type;

		public Struct(Address address, List<Pair<String, Content>> fields, String type) {
			this.address = Objects.requireNonNull(address);
			this.content = Content.struct(fields);
			this.type = Objects.requireNonNull(type);
		}

		@Override
		public Address address() {
			return address;
		}

		public Content.NestedStruct content() {
			return content;
		}

		public List<Pair<String, Content>> fields() {
			return content.fields();
		}

		public String type() {
			return type;
		}

		@Override
		public <T> T accept(Visitor<T> visitor) {
			return visitor.visitStruct(this);
		}

		@Override
		public int hashCode() {
			return Objects.hash(address, content, type);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Struct)) return false;
			Struct other = (Struct) o;
			return address.equals(other.address) && content.equals(other.content) && type.equals(other.type);
		}

		@Override
		public String toString() {
			return String.format("%s |-> %s : %s", address, content, type);
		}
	}

	/**
	 * addr |-> [size]{elements}
	 */
	public static final class Array extends HeapCell {
		private final Address address;
		private final Content.NestedArray content;
		private final String type;

		public Array(Address address, Address size, List<Pair<Address, Content>> elements, String type) {
			this.address = Objects.requireNonNull(address);
			this.content = Content.array(size, elements);
			this.type = Objects.requireNonNull(type);
		}

		@Override
		public Address address() {
			return address;
		}

		public Content.NestedArray content() {
			return content;
		}

		public Address size() {
			return content.size();
		}

		public List<Pair<Address, Content>> elements() {
			return content.elements();
		}

		public String type() {
			return type;
		}

		@Override
		public <T> T accept(Visitor<T> visitor) {
			return visitor.visitArray(this);
		}

		@Override
		public int hashCode() {
			return Objects.hash(address, content, type);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Array)) return false;
			Array other = (Array) o;
			return address.equals(other.address) && content.equals(other.content) && type.equals(other.type);
		}

		@Override
		public String toString() {
			return String.format("%s |-> %s : %s", address, content, type);
		}
	}

	/**
	 * lseg(first, last): a chain of cells starting at first whose final cell
	 * points to last.
	 */
	public static final class ListSeg extends HeapCell {
		private final SegmentKind kind;
		private final Address first;
		private final Address last;
		private final List<HeapCell> body;

		public ListSeg(SegmentKind kind, Address first, Address last, List<HeapCell> body) {
			this.kind = Objects.requireNonNull(kind);
			this.first = Objects.requireNonNull(first);
			this.last = Objects.requireNonNull(last);
			this.body = Collections.unmodifiableList(new ArrayList<>(body));
		}

		public SegmentKind kind() {
			return kind;
		}

		public Address first() {
			return first;
		}

		public Address last() {
			return last;
		}

		public List<HeapCell> body() {
			return body;
		}

		@Override
		public Address address() {
			return first;
		}

		@Override
		public <T> T accept(Visitor<T> visitor) {
			return visitor.visitListSeg(this);
		}

		@Override
		public int hashCode() {
			return Objects.hash(kind, first, last, body);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof ListSeg)) return false;
			ListSeg other = (ListSeg) o;
			return kind == other.kind && first.equals(other.first) && last.equals(other.last)
					&& body.equals(other.body);
		}

		@Override
		public String toString() {
			return String.format("lseg%s(%s, %s) {%s}", kind, first, last, Util.join("; ", body));
		}
	}

	/**
	 * dllseg(first, firstPrev, lastNext, last): a doubly linked chain from first
	 * to last, where first points back to firstPrev and last points forward to
	 * lastNext.
	 */
	public static final class DllSeg extends HeapCell {
		private final SegmentKind kind;
		private final Address first;
		private final Address last;
		private final Address firstPrev;
		private final Address lastNext;
		private final List<HeapCell> body;

		public DllSeg(SegmentKind kind, Address first, Address last, Address firstPrev, Address lastNext,
				List<HeapCell> body) {
			this.kind = Objects.requireNonNull(kind);
			this.first = Objects.requireNonNull(first);
			this.last = Objects.requireNonNull(last);
			this.firstPrev = Objects.requireNonNull(firstPrev);
			this.lastNext = Objects.requireNonNull(lastNext);
			this.body = Collections.unmodifiableList(new ArrayList<>(body));
		}

		public SegmentKind kind() {
			return kind;
		}

		public Address first() {
			return first;
		}

		public Address last() {
			return last;
		}

		public Address firstPrev() {
			return firstPrev;
		}

		public Address lastNext() {
			return lastNext;
		}

		public List<HeapCell> body() {
			return body;
		}

		@Override
		public Address address() {
			return first;
		}

		@Override
		public <T> T accept(Visitor<T> visitor) {
			return visitor.visitDllSeg(this);
		}

		@Override
		public int hashCode() {
			return Objects.hash(kind, first, last, firstPrev, lastNext, body);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof DllSeg)) return false;
			DllSeg other = (DllSeg) o;
			return kind == other.kind && first.equals(other.first) && last.equals(other.last)
					&& firstPrev.equals(other.firstPrev) && lastNext.equals(other.lastNext)
					&& body.equals(other.body);
		}

		@Override
		public String toString() {
			return String.format("dllseg%s(%s, %s, %s, %s) {%s}", kind, first, firstPrev, lastNext, last,
					Util.join("; ", body));
		}
	}
}
