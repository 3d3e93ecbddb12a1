package edu.cmu.cs.cs15745.heapviz.graph;

/**
 * Identifies a rendered node: a render-wide unique id plus the nesting level
 * of the (sub-)render the node belongs to.
 */
public final class Coordinate {
	private final int id;
	private final int level;

	public Coordinate(int id, int level) {
		this.id = id;
		this.level = level;
	}

	public int id() {
		return id;
	}

	public int level() {
		return level;
	}

	@Override
	public int hashCode() {
		return 31 * id + level;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Coordinate)) return false;
		Coordinate other = (Coordinate) o;
		return id == other.id && level == other.level;
	}

	/** Same shape as the suffix of node names in the graph description, e.g. "4L1". */
	@Override
	public String toString() {
		return id + "L" + level;
	}
}
