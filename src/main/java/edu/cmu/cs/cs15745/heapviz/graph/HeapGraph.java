package edu.cmu.cs.cs15745.heapviz.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import edu.cmu.cs.cs15745.heapviz.heap.Atom;

/**
 * The rendered graph of one proposition: its layers in the order they were
 * built (top-level heap first), plus the pure atoms summarized as the stack.
 */
public final class HeapGraph {
	/** What the proposition is, printed on its banner. */
	public enum Kind {
		HEAP, PRE, POST;
	}

	private final Kind kind;
	private final List<Layer> layers;
	private final List<Atom> pure;
	private final Color stackColor;
	private final int nextFreeId;

	public HeapGraph(Kind kind, List<Layer> layers, List<Atom> pure, Color stackColor, int nextFreeId) {
		this.kind = Objects.requireNonNull(kind);
		this.layers = Collections.unmodifiableList(new ArrayList<>(layers));
		this.pure = Collections.unmodifiableList(new ArrayList<>(pure));
		this.stackColor = Objects.requireNonNull(stackColor);
		this.nextFreeId = nextFreeId;
		if (layers.isEmpty()) {
			throw new IllegalArgumentException("A heap graph has at least its top-level layer.");
		}
	}

	public Kind kind() {
		return kind;
	}

	public List<Layer> layers() {
		return layers;
	}

	public Layer top() {
		return layers.get(0);
	}

	public List<Atom> pure() {
		return pure;
	}

	public Color stackColor() {
		return stackColor;
	}

	/** First id not used by this graph. */
	public int nextFreeId() {
		return nextFreeId;
	}

	public List<Node> allNodes() {
		return layers.stream().flatMap(l -> l.nodes().stream()).collect(Collectors.toList());
	}

	public List<Edge> allEdges() {
		return layers.stream().flatMap(l -> l.edges().stream()).collect(Collectors.toList());
	}

	@Override
	public String toString() {
		return String.format("%s graph:\n%s", kind, layers);
	}
}
