package edu.cmu.cs.cs15745.heapviz.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The rendering of one symbolic heap: the top-level heap of a proposition, or
 * the body of a list segment. Bodies are separate layers one nesting level
 * below the layer holding their segment, tied to it by an anchor edge.
 */
public final class Layer {
	private final Coordinate header;
	private final int ordinal;
	private final Optional<Node> owner;
	private final Optional<Edge> anchorEdge;
	private final List<Node> nodes;
	private final List<Edge> edges;

	public Layer(Coordinate header, int ordinal, Optional<Node> owner, Optional<Edge> anchorEdge, List<Node> nodes,
			List<Edge> edges) {
		this.header = Objects.requireNonNull(header);
		this.ordinal = ordinal;
		this.owner = Objects.requireNonNull(owner);
		this.anchorEdge = Objects.requireNonNull(anchorEdge);
		this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
		this.edges = Collections.unmodifiableList(new ArrayList<>(edges));
	}

	/** The first coordinate of the layer, used for its banner. */
	public Coordinate header() {
		return header;
	}

	public int level() {
		return header.level();
	}

	/** 0 for the top-level heap, k for the k-th expanded segment body. */
	public int ordinal() {
		return ordinal;
	}

	/** The segment placeholder whose body this layer renders. */
	public Optional<Node> owner() {
		return owner;
	}

	/** Edge from the owner's anchor to header(). */
	public Optional<Edge> anchorEdge() {
		return anchorEdge;
	}

	public List<Node> nodes() {
		return nodes;
	}

	public List<Edge> edges() {
		return edges;
	}

	public <N extends Node> List<N> nodes(Class<N> kind) {
		return nodes.stream().filter(kind::isInstance).map(kind::cast).collect(Collectors.toList());
	}

	@Override
	public String toString() {
		return String.format("Layer %s:\n\t%s\n\t%s", header, nodes, edges);
	}
}
