package edu.cmu.cs.cs15745.heapviz;

import java.util.Objects;

import edu.cmu.cs.cs15745.heapviz.graph.Color;
import edu.cmu.cs.cs15745.heapviz.heap.Atom;
import edu.cmu.cs.cs15745.heapviz.heap.HeapCell;

/**
 * Colors changed elements red, everything else with the baseline colors.
 */
public final class DiffColorer implements ColorMap {
	private final DiffOracle oracle;
	private final ColorMap baseline;

	private DiffColorer(DiffOracle oracle, ColorMap baseline) {
		this.oracle = Objects.requireNonNull(oracle);
		this.baseline = Objects.requireNonNull(baseline);
	}

	public static ColorMap colorMap(DiffOracle oracle) {
		return new DiffColorer(oracle, ColorMap.BASELINE);
	}

	@Override
	public Color color(HeapCell cell) {
		return changed(cell) ? Color.RED : baseline.color(cell);
	}

	@Override
	public Color color(Atom atom) {
		return changed(atom) ? Color.RED : baseline.color(atom);
	}

	private boolean changed(Object element) {
		return oracle.classify(element) != DiffOracle.Change.UNCHANGED;
	}
}
