package edu.cmu.cs.cs15745.heapviz.graph;

import java.util.Objects;

/**
 * A directed link between two rendered nodes. The field strings name a member
 * (a field path or array index) of a panel, or the panel's header when the
 * edge enters a panel as a whole; they are empty when the endpoint is a plain
 * box. Field and label texts are raw: emitters escape them.
 */
public final class Edge {
	public enum Kind {
		CELL_TO_CELL,
		CELL_TO_STRUCT,
		STRUCT_TO_CELL,
		STRUCT_TO_STRUCT,
		ARRAY_LINK,
		ARRAY_TO_CELL,
		ARRAY_TO_STRUCT,
		LIST_SEG_LINK,
		DLL_SEG_LINK;
	}

	private final Kind kind;
	private final Coordinate source;
	private final String sourceField;
	private final Coordinate target;
	private final String targetField;
	private final String label;
	private final Color color;

	public Edge(Kind kind, Coordinate source, String sourceField, Coordinate target, String targetField, String label,
			Color color) {
		this.kind = Objects.requireNonNull(kind);
		this.source = Objects.requireNonNull(source);
		this.sourceField = Objects.requireNonNull(sourceField);
		this.target = Objects.requireNonNull(target);
		this.targetField = Objects.requireNonNull(targetField);
		this.label = Objects.requireNonNull(label);
		this.color = Objects.requireNonNull(color);
	}

	/** Edge between two plain boxes. */
	public static Edge plain(Kind kind, Coordinate source, Coordinate target, Color color) {
		return new Edge(kind, source, "", target, "", "", color);
	}

	public Kind kind() {
		return kind;
	}

	public Coordinate source() {
		return source;
	}

	public String sourceField() {
		return sourceField;
	}

	public Coordinate target() {
		return target;
	}

	public String targetField() {
		return targetField;
	}

	public String label() {
		return label;
	}

	public Color color() {
		return color;
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, source, sourceField, target, targetField, label, color);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Edge)) return false;
		Edge other = (Edge) o;
		return kind == other.kind && source.equals(other.source) && sourceField.equals(other.sourceField)
				&& target.equals(other.target) && targetField.equals(other.targetField)
				&& label.equals(other.label) && color == other.color;
	}

	@Override
	public String toString() {
		return String.format("%s:%s -[%s]-> %s:%s (%s)", source, sourceField, label, target, targetField, kind);
	}
}
