package edu.cmu.cs.cs15745.heapviz.graph;

import java.util.Objects;

import edu.cmu.cs.cs15745.heapviz.heap.Address;
import edu.cmu.cs.cs15745.heapviz.heap.Content;
import edu.cmu.cs.cs15745.heapviz.heap.SegmentKind;

/**
 * A rendered node is one of the following:
 * <ul>
 * <li>Nil: a fresh box for one reference to the null pointer</li>
 * <li>Dangling: an address referenced but not allocated</li>
 * <li>Cell: the box of an allocated address</li>
 * <li>StructPanel/ArrayPanel: the members of the cell whose address it shares</li>
 * <li>ListSegPlaceholder/DllSegPlaceholder: the summary of a list segment</li>
 * </ul>
 * Nodes compare by identity.
 */
public abstract class Node {
	private final Coordinate coordinate;
	private final Color color;

	// Disallow external subclassing.
	private Node(Coordinate coordinate, Color color) {
		this.coordinate = Objects.requireNonNull(coordinate);
		this.color = Objects.requireNonNull(color);
	}

	/**
	 * Visitor for Node's fixed set of subclasses.
	 */
	public interface Visitor<T> {
		T visitNil(Nil n);
		T visitDangling(Dangling d);
		T visitCell(Cell c);
		T visitStructPanel(StructPanel s);
		T visitArrayPanel(ArrayPanel a);
		T visitListSeg(ListSegPlaceholder l);
		T visitDllSeg(DllSegPlaceholder d);
	}

	public abstract <T> T accept(Visitor<T> visitor);

	public Coordinate coordinate() {
		return coordinate;
	}

	public Color color() {
		return color;
	}

	/** The address this node stands for; the first element for segments. */
	public abstract Address address();

	/** Whether the node renders the members of a cell rather than the cell itself. */
	public boolean isPanel() {
		return false;
	}

	@Override
	public String toString() {
		return String.format("%s@%s(%s)", getClass().getSimpleName(), coordinate, address());
	}

	public static final class Nil extends Node {
		public Nil(Coordinate coordinate) {
			super(coordinate, Color.GREEN);
		}

		@Override
		public Address address() {
			return Address.NIL;
		}

		@Override
		public <T> T accept(Visitor<T> visitor) {
			return visitor.visitNil(this);
		}
	}

	public static final class Dangling extends Node {
		private final Address address;

		public Dangling(Coordinate coordinate, Address address, Color color) {
			super(coordinate, color);
			this.address = Objects.requireNonNull(address);
		}

		@Override
		public Address address() {
			return address;
		}

		@Override
		public <T> T accept(Visitor<T> visitor) {
			return visitor.visitDangling(this);
		}
	}

	public static final class Cell extends Node {
		private final Address address;
		private final Content content;

		public Cell(Coordinate coordinate, Address address, Content content, Color color) {
			super(coordinate, color);
			this.address = Objects.requireNonNull(address);
			this.content = Objects.requireNonNull(content);
		}

		@Override
		public Address address() {
			return address;
		}

		/** What the cell holds; nested content is drawn by the panel next to it. */
		public Content content() {
			return content;
		}

		@Override
		public <T> T accept(Visitor<T> visitor) {
			return visitor.visitCell(this);
		}
	}

	public static final class StructPanel extends Node {
		private final Address address;
		private final Content.NestedStruct fields;

		public StructPanel(Coordinate coordinate, Address address, Content.NestedStruct fields, Color color) {
			super(coordinate, color);
			this.address = Objects.requireNonNull(address);
			this.fields = Objects.requireNonNull(fields);
		}

		@Override
		public Address address() {
			return address;
		}

		public Content.NestedStruct fields() {
			return fields;
		}

		@Override
		public boolean isPanel() {
			return true;
		}

		@Override
		public <T> T accept(Visitor<T> visitor) {
			return visitor.visitStructPanel(this);
		}
	}

	public static final class ArrayPanel extends Node {
		private final Address address;
		private final Content.NestedArray elements;

		public ArrayPanel(Coordinate coordinate, Address address, Content.NestedArray elements, Color color) {
			super(coordinate, color);
			this.address = Objects.requireNonNull(address);
			this.elements = Objects.requireNonNull(elements);
		}

		@Override
		public Address address() {
			return address;
		}

		public Address size() {
			return elements.size();
		}

		public Content.NestedArray elements() {
			return elements;
		}

		@Override
		public boolean isPanel() {
			return true;
		}

		@Override
		public <T> T accept(Visitor<T> visitor) {
			return visitor.visitArrayPanel(this);
		}
	}

	/**
	 * Drawn as a chain "first -> ... -> last" inside a cluster. The coordinate is
	 * the box of first; lastBox is where the link to the sink starts and where
	 * the sub-render of the body is anchored.
	 */
	public static final class ListSegPlaceholder extends Node {
		private final Address first;
		private final Address last;
		private final SegmentKind kind;
		private final Coordinate lastBox;
		private final Coordinate cluster;
		private final Coordinate ellipsis;

		public ListSegPlaceholder(Coordinate coordinate, Coordinate lastBox, Coordinate cluster, Coordinate ellipsis,
				Address first, Address last, SegmentKind kind, Color color) {
			super(coordinate, color);
			this.lastBox = Objects.requireNonNull(lastBox);
			this.cluster = Objects.requireNonNull(cluster);
			this.ellipsis = Objects.requireNonNull(ellipsis);
			this.first = Objects.requireNonNull(first);
			this.last = Objects.requireNonNull(last);
			this.kind = Objects.requireNonNull(kind);
		}

		@Override
		public Address address() {
			return first;
		}

		public Address first() {
			return first;
		}

		public Address last() {
			return last;
		}

		public SegmentKind kind() {
			return kind;
		}

		public Coordinate lastBox() {
			return lastBox;
		}

		public Coordinate cluster() {
			return cluster;
		}

		public Coordinate ellipsis() {
			return ellipsis;
		}

		public Coordinate anchor() {
			return lastBox;
		}

		@Override
		public <T> T accept(Visitor<T> visitor) {
			return visitor.visitListSeg(this);
		}
	}

	/**
	 * Drawn as "first <-> ... <-> last" inside a cluster. The box of first starts
	 * the backward link, lastBox starts the forward link and the ellipsis box
	 * anchors the sub-render of the body.
	 */
	public static final class DllSegPlaceholder extends Node {
		private final Address first;
		private final Address last;
		private final Address firstPrev;
		private final Address lastNext;
		private final SegmentKind kind;
		private final Coordinate lastBox;
		private final Coordinate cluster;
		private final Coordinate ellipsis;

		public DllSegPlaceholder(Coordinate coordinate, Coordinate lastBox, Coordinate cluster, Coordinate ellipsis,
				Address first, Address last, Address firstPrev, Address lastNext, SegmentKind kind, Color color) {
			super(coordinate, color);
			this.lastBox = Objects.requireNonNull(lastBox);
			this.cluster = Objects.requireNonNull(cluster);
			this.ellipsis = Objects.requireNonNull(ellipsis);
			this.first = Objects.requireNonNull(first);
			this.last = Objects.requireNonNull(last);
			this.firstPrev = Objects.requireNonNull(firstPrev);
			this.lastNext = Objects.requireNonNull(lastNext);
			this.kind = Objects.requireNonNull(kind);
		}

		@Override
		public Address address() {
			return first;
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

		public SegmentKind kind() {
			return kind;
		}

		public Coordinate lastBox() {
			return lastBox;
		}

		public Coordinate cluster() {
			return cluster;
		}

		public Coordinate ellipsis() {
			return ellipsis;
		}

		public Coordinate anchor() {
			return ellipsis;
		}

		@Override
		public <T> T accept(Visitor<T> visitor) {
			return visitor.visitDllSeg(this);
		}
	}
}
