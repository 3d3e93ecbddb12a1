package edu.cmu.cs.cs15745.heapviz;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;

import edu.cmu.cs.cs15745.heapviz.graph.Color;
import edu.cmu.cs.cs15745.heapviz.graph.Coordinate;
import edu.cmu.cs.cs15745.heapviz.graph.Node;
import edu.cmu.cs.cs15745.heapviz.heap.Address;
import edu.cmu.cs.cs15745.heapviz.heap.HeapCell;
import edu.cmu.cs.cs15745.heapviz.util.MultiMap;

/**
 * Everything mutable during one render call. A fresh context is built for
 * every call and dropped when it returns, so no call sees another's state.
 * Caches are keyed by layer ordinal.
 */
final class RenderContext {
	private final NodeAllocator allocator;
	private final Prover prover;
	private final ColorMap colors;

	private final MultiMap<Integer, Node.Dangling> dangling = new MultiMap<>();
	private final MultiMap<Integer, Node.Nil> nils = new MultiMap<>();
	private final MultiMap<Integer, Address> structBacked = new MultiMap<>();

	// Segment bodies waiting to be rendered.
	private final Queue<PendingRender> workList = new ArrayDeque<>();

	RenderContext(Prover prover, ColorMap colors, int firstId) {
		this.prover = Objects.requireNonNull(prover);
		this.colors = Objects.requireNonNull(colors);
		this.allocator = new NodeAllocator(firstId);
	}

	Prover prover() {
		return prover;
	}

	ColorMap colors() {
		return colors;
	}

	NodeAllocator allocator() {
		return allocator;
	}

	Queue<PendingRender> workList() {
		return workList;
	}

	/** Dangling nodes created so far for the layer, in creation order. */
	List<Node.Dangling> dangling(int layer) {
		return dangling.values(layer);
	}

	Optional<Node.Dangling> findDangling(int layer, Address address) {
		for (var d : dangling.values(layer)) {
			if (prover.structuralEquality(d.address(), address)) {
				return Optional.of(d);
			}
		}
		return Optional.empty();
	}

	/** The dangling node of the address in the layer, created on first request. */
	Node.Dangling danglingFor(int layer, int level, Address address, Color color) {
		var existing = findDangling(layer, address);
		if (existing.isPresent()) {
			return existing.get();
		}
		var d = new Node.Dangling(allocator.allocate(level), address, color);
		dangling.getList(layer).add(d);
		return d;
	}

	List<Node.Nil> nils(int layer) {
		return nils.values(layer);
	}

	/** Nil nodes are never shared: every call makes a new one. */
	Node.Nil newNil(int layer, int level) {
		var nil = new Node.Nil(allocator.allocate(level));
		nils.getList(layer).add(nil);
		return nil;
	}

	void addStructBacked(int layer, Address address) {
		structBacked.getList(layer).add(address);
	}

	boolean isStructBacked(int layer, Address address) {
		for (var a : structBacked.values(layer)) {
			if (prover.structuralEquality(a, address)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * A heap waiting to be rendered as its own layer. The top-level heap has no
	 * owner; a segment body is owned by the segment's placeholder and is
	 * anchored at one of its coordinates.
	 */
	static final class PendingRender {
		private final List<HeapCell> cells;
		private final int level;
		private final Optional<Node> owner;
		private final Optional<Coordinate> anchor;

		private PendingRender(List<HeapCell> cells, int level, Optional<Node> owner, Optional<Coordinate> anchor) {
			this.cells = Objects.requireNonNull(cells);
			this.level = level;
			this.owner = owner;
			this.anchor = anchor;
		}

		static PendingRender top(List<HeapCell> cells) {
			return new PendingRender(cells, 0, Optional.empty(), Optional.empty());
		}

		static PendingRender body(List<HeapCell> cells, int level, Node owner, Coordinate anchor) {
			return new PendingRender(cells, level, Optional.of(owner), Optional.of(anchor));
		}

		List<HeapCell> cells() {
			return cells;
		}

		int level() {
			return level;
		}

		Optional<Node> owner() {
			return owner;
		}

		Optional<Coordinate> anchor() {
			return anchor;
		}
	}
}
