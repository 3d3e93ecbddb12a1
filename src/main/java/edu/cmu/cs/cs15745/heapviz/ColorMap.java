package edu.cmu.cs.cs15745.heapviz;

import edu.cmu.cs.cs15745.heapviz.graph.Color;
import edu.cmu.cs.cs15745.heapviz.heap.Atom;
import edu.cmu.cs.cs15745.heapviz.heap.HeapCell;

/**
 * Decides the color of what a heap cell or atom renders to. Consulted when
 * nodes and edges are created.
 */
public interface ColorMap {
	Color color(HeapCell cell);

	Color color(Atom atom);

	/** Colors used when no diff is shown. */
	ColorMap BASELINE = new ColorMap() {
		@Override
		public Color color(HeapCell cell) {
			return Color.BLACK;
		}

		@Override
		public Color color(Atom atom) {
			return Color.ORANGE;
		}
	};
}
