package edu.cmu.cs.cs15745.heapviz;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import edu.cmu.cs.cs15745.heapviz.graph.Color;
import edu.cmu.cs.cs15745.heapviz.graph.Coordinate;
import edu.cmu.cs.cs15745.heapviz.graph.Edge;
import edu.cmu.cs.cs15745.heapviz.graph.MemberPaths;
import edu.cmu.cs.cs15745.heapviz.graph.Node;
import edu.cmu.cs.cs15745.heapviz.heap.Address;
import edu.cmu.cs.cs15745.heapviz.heap.Content;
import edu.cmu.cs.cs15745.heapviz.heap.HeapCell;
import edu.cmu.cs.cs15745.heapviz.heap.HeapCell.Array;
import edu.cmu.cs.cs15745.heapviz.heap.HeapCell.DllSeg;
import edu.cmu.cs.cs15745.heapviz.heap.HeapCell.ListSeg;
import edu.cmu.cs.cs15745.heapviz.heap.HeapCell.PointsTo;
import edu.cmu.cs.cs15745.heapviz.heap.HeapCell.Struct;

/**
 * Resolves the references made by the cells of one layer into edges. Must run
 * after the layer's nodes and dangling nodes exist: nil nodes, and dangling
 * nodes for members of nested content, are created on the way.
 */
final class LinkBuilder {
	private final RenderContext context;
	private final int level;
	private final int layer;

	LinkBuilder(RenderContext context, int level, int layer) {
		this.context = Objects.requireNonNull(context);
		this.level = level;
		this.layer = layer;
	}

	// Where an edge ends: a node, and the coordinate of the box within it.
	private static final class Target {
		final Node node;
		final Coordinate coordinate;

		Target(Node node, Coordinate coordinate) {
			this.node = node;
			this.coordinate = coordinate;
		}

		String port() {
			return node.isPanel() ? node.address().text() : "";
		}
	}

	// Nodes built for the layer, the candidates of every lookup.
	private List<Node> layerNodes = List.of();

	List<Edge> buildEdges(List<HeapCell> cells, GraphBuilder.Result built) {
		layerNodes = built.nodes();
		var edges = new ArrayList<Edge>();
		for (int i = 0; i < cells.size(); i++) {
			var cell = cells.get(i);
			cell.accept(new EdgeMaker(edges, built, i, cell, context.colors().color(cell)).visitor());
		}
		return edges;
	}

	private final class EdgeMaker extends HeapCell.StatefulVisitor {
		private final List<Edge> edges;
		private final GraphBuilder.Result built;
		private final int position;
		private final HeapCell cell;
		private final Color color;

		EdgeMaker(List<Edge> edges, GraphBuilder.Result built, int position, HeapCell cell, Color color) {
			this.edges = edges;
			this.built = built;
			this.position = position;
			this.cell = cell;
			this.color = color;
		}

		@Override
		public void iterPointsTo(PointsTo p) {
			p.content().accept(new Content.Visitor<Void>() {
				@Override
				public Void visitScalar(Content.Scalar s) {
					linkScalar(p.address(), s.value());
					return null;
				}

				@Override
				public Void visitStruct(Content.NestedStruct s) {
					linkPanel(Edge.Kind.CELL_TO_STRUCT);
					return null;
				}

				@Override
				public Void visitArray(Content.NestedArray a) {
					linkPanel(Edge.Kind.ARRAY_LINK);
					return null;
				}
			});
		}

		@Override
		public void iterStruct(Struct s) {
			linkPanel(Edge.Kind.CELL_TO_STRUCT);
		}

		@Override
		public void iterArray(Array a) {
			linkPanel(Edge.Kind.ARRAY_LINK);
		}

		@Override
		public void iterListSeg(ListSeg l) {
			var placeholder = (Node.ListSegPlaceholder) single(l.first());
			var target = resolveOrCreate(l.last(), false, color);
			edges.add(new Edge(Edge.Kind.LIST_SEG_LINK, placeholder.lastBox(), "", target.coordinate, target.port(),
					"", color));
		}

		@Override
		public void iterDllSeg(DllSeg d) {
			var placeholder = (Node.DllSegPlaceholder) single(d.first());
			findExisting(d.firstPrev()).ifPresent(back -> edges.add(new Edge(Edge.Kind.DLL_SEG_LINK,
					placeholder.coordinate(), "", back.coordinate, back.port(), "", color)));
			findExisting(d.lastNext()).ifPresent(forward -> edges.add(new Edge(Edge.Kind.DLL_SEG_LINK,
					placeholder.lastBox(), "", forward.coordinate, forward.port(), "", color)));
		}

		// Scalar cell: one edge from every box drawn for its address.
		private void linkScalar(Address address, Address value) {
			var target = resolveOrCreate(value, false, color);
			Edge.Kind kind = target.node.isPanel() ? Edge.Kind.CELL_TO_STRUCT : Edge.Kind.CELL_TO_CELL;
			for (var source : sources(address)) {
				edges.add(new Edge(kind, source.coordinate(), "", target.coordinate, target.port(), "", color));
			}
		}

		// Pointer box to the panel header, then one edge per scalar member.
		private void linkPanel(Edge.Kind headerKind) {
			var nodes = built.nodesOf(position);
			if (nodes.size() != 2 || !nodes.get(1).isPanel()) {
				throw new RenderInconsistencyException("Missing panel for " + cell);
			}
			Node pointer = nodes.get(0);
			Node panel = nodes.get(1);
			edges.add(new Edge(headerKind, pointer.coordinate(), "", panel.coordinate(), panel.address().text(), "",
					color));
			linkMember(panel, "", "", ((Node.Cell) pointer).content());
		}

		private void linkFields(Node panel, String prefix, Content.NestedStruct struct) {
			for (var field : struct.fields()) {
				String path = MemberPaths.field(prefix, field.fst());
				linkMember(panel, path, field.fst(), field.snd());
			}
		}

		private void linkElements(Node panel, String prefix, Content.NestedArray array) {
			for (var element : array.elements()) {
				String index = element.fst().text();
				String path = MemberPaths.element(prefix, index);
				linkMember(panel, path, index, element.snd());
			}
		}

		// Scalar members get an edge; nested ones are walked with the member path as prefix.
		private void linkMember(Node panel, String path, String label, Content content) {
			content.accept(new Content.Visitor<Void>() {
				@Override
				public Void visitScalar(Content.Scalar s) {
					var target = resolveOrCreate(s.value(), true, color);
					edges.add(new Edge(memberKind(panel, target.node), panel.coordinate(), path, target.coordinate,
							target.port(), label, color));
					return null;
				}

				@Override
				public Void visitStruct(Content.NestedStruct s) {
					linkFields(panel, path, s);
					return null;
				}

				@Override
				public Void visitArray(Content.NestedArray a) {
					linkElements(panel, path, a);
					return null;
				}
			});
		}

		// Boxes of this cell's address; a skipped scalar cell borrows the pointer box of its struct.
		private List<Node> sources(Address address) {
			var own = built.nodesOf(position);
			if (!own.isEmpty()) {
				return own;
			}
			var result = new ArrayList<Node>();
			for (var node : built.nodes()) {
				if (!node.isPanel() && context.prover().structuralEquality(node.address(), address)) {
					result.add(node);
				}
			}
			if (result.isEmpty()) {
				throw new RenderInconsistencyException("No source node for " + cell);
			}
			return result;
		}

		private Node single(Address address) {
			var nodes = built.nodesOf(position);
			if (nodes.size() != 1) {
				throw new RenderInconsistencyException("No source node for " + address);
			}
			return nodes.get(0);
		}
	}

	private static Edge.Kind memberKind(Node panel, Node target) {
		boolean fromArray = panel instanceof Node.ArrayPanel;
		if (target.isPanel()) {
			return fromArray ? Edge.Kind.ARRAY_TO_STRUCT : Edge.Kind.STRUCT_TO_STRUCT;
		}
		return fromArray ? Edge.Kind.ARRAY_TO_CELL : Edge.Kind.STRUCT_TO_CELL;
	}

	/**
	 * Resolves a referenced address: a fresh nil node when it is provably zero,
	 * the matching node of the layer when there is one, its dangling node
	 * otherwise. Members of nested content prefer the panel of their target.
	 */
	private Target resolveOrCreate(Address address, boolean preferPanel, Color color) {
		if (context.prover().isProvablyZero(address)) {
			Node nil = context.newNil(layer, level);
			return new Target(nil, nil.coordinate());
		}
		var chosen = choose(address, preferPanel);
		if (chosen.isPresent()) {
			return chosen.get();
		}
		Node dangling = context.danglingFor(layer, level, address, color);
		return new Target(dangling, dangling.coordinate());
	}

	// Never creates nodes.
	private Optional<Target> findExisting(Address address) {
		var chosen = choose(address, false);
		if (chosen.isPresent()) {
			return chosen;
		}
		return context.findDangling(layer, address).map(d -> new Target(d, d.coordinate()));
	}

	private Optional<Target> choose(Address address, boolean preferPanel) {
		var candidates = candidates(address);
		switch (candidates.size()) {
		case 0:
			return Optional.empty();
		case 1:
			return Optional.of(candidates.get(0));
		case 2:
			var first = candidates.get(0);
			var second = candidates.get(1);
			if (first.node.isPanel() == second.node.isPanel()) {
				return Optional.of(first);
			}
			return Optional.of(first.node.isPanel() == preferPanel ? first : second);
		default:
			throw new RenderInconsistencyException(String.format("%d nodes at address %s on level %d: %s",
					candidates.size(), address, level, candidates.stream().map(t -> t.node).toArray()));
		}
	}

	// Allocated nodes of the layer standing for the address, including the last box of a DLL segment.
	private List<Target> candidates(Address address) {
		var result = new ArrayList<Target>();
		for (var node : layerNodes) {
			if (context.prover().structuralEquality(node.address(), address)) {
				result.add(new Target(node, node.coordinate()));
			}
			if (node instanceof Node.DllSegPlaceholder) {
				var dll = (Node.DllSegPlaceholder) node;
				if (context.prover().structuralEquality(dll.last(), address)) {
					result.add(new Target(dll, dll.lastBox()));
				}
			}
		}
		return result;
	}
}
