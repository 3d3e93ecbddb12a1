package edu.cmu.cs.cs15745.heapviz.graph;

import java.util.Locale;

/** Palette of rendered nodes and edges. RED flags elements changed by a diff. */
public enum Color {
	BLACK, BLUE, GREEN, ORANGE, RED;

	/** Name understood by the graph description language. */
	public String dotName() {
		return name().toLowerCase(Locale.ROOT);
	}
}
