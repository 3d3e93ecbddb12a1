package edu.cmu.cs.cs15745.heapviz;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import edu.cmu.cs.cs15745.heapviz.graph.Color;
import edu.cmu.cs.cs15745.heapviz.graph.Coordinate;
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
 * Turns the cells of one layer into rendered nodes. Segment bodies are not
 * rendered here: they are put on the context's work list, one level deeper.
 */
final class GraphBuilder {
	private final RenderContext context;
	private final int level;
	private final int layer;

	GraphBuilder(RenderContext context, int level, int layer) {
		this.context = Objects.requireNonNull(context);
		this.level = level;
		this.layer = layer;
	}

	/**
	 * The nodes of a layer, in cell order, together with the nodes each cell
	 * produced (a cell may produce none, one or two nodes). Cells are told apart
	 * by their position in the layer, so a cell listed twice owns two sets of
	 * nodes.
	 */
	static final class Result {
		private final List<Node> nodes = new ArrayList<>();
		private final List<List<Node>> byPosition = new ArrayList<>();

		List<Node> nodes() {
			return Collections.unmodifiableList(nodes);
		}

		List<Node> nodesOf(int position) {
			return Collections.unmodifiableList(byPosition.get(position));
		}

		private void add(int position, Node node) {
			nodes.add(node);
			byPosition.get(position).add(node);
		}
	}

	// Can only be built once.
	private boolean alreadyBuilt = false;

	Result buildNodes(List<HeapCell> cells) {
		if (alreadyBuilt) {
			throw new IllegalStateException("Already called buildNodes.");
		}
		alreadyBuilt = true;

		recordStructBacked(cells);
		var result = new Result();
		for (int i = 0; i < cells.size(); i++) {
			var cell = cells.get(i);
			result.byPosition.add(new ArrayList<>());
			cell.accept(new NodeMaker(result, i, context.colors().color(cell)).visitor());
		}
		return result;
	}

	// Addresses whose cell has members; a scalar cell at one of them is not drawn.
	private void recordStructBacked(List<HeapCell> cells) {
		var visitor = new HeapCell.StatefulVisitor() {
			@Override
			public void iterPointsTo(PointsTo p) {
				if (p.content().isNested()) {
					context.addStructBacked(layer, p.address());
				}
			}

			@Override
			public void iterStruct(Struct s) {
				context.addStructBacked(layer, s.address());
			}

			@Override
			public void iterArray(Array a) {
				context.addStructBacked(layer, a.address());
			}
		}.visitor();
		cells.forEach(c -> c.accept(visitor));
	}

	private final class NodeMaker extends HeapCell.StatefulVisitor {
		private final Result result;
		private final int position;
		private final Color color;

		NodeMaker(Result result, int position, Color color) {
			this.result = result;
			this.position = position;
			this.color = color;
		}

		@Override
		public void iterPointsTo(PointsTo p) {
			if (p.content().isNested()) {
				pointerAndPanel(p.address(), p.content());
			} else if (!context.isStructBacked(layer, p.address())) {
				result.add(position, new Node.Cell(context.allocator().allocate(level), p.address(), p.content(), color));
			}
		}

		@Override
		public void iterStruct(Struct s) {
			pointerAndPanel(s.address(), s.content());
		}

		@Override
		public void iterArray(Array a) {
			pointerAndPanel(a.address(), a.content());
		}

		@Override
		public void iterListSeg(ListSeg l) {
			var allocator = context.allocator();
			Coordinate first = allocator.allocate(level);
			Coordinate last = allocator.allocate(level);
			Coordinate cluster = allocator.allocate(level);
			Coordinate ellipsis = allocator.allocate(level);
			var placeholder = new Node.ListSegPlaceholder(first, last, cluster, ellipsis, l.first(), l.last(), l.kind(),
					color);
			result.add(position, placeholder);
			context.workList().add(
					RenderContext.PendingRender.body(l.body(), level + 1, placeholder, placeholder.anchor()));
		}

		@Override
		public void iterDllSeg(DllSeg d) {
			var allocator = context.allocator();
			Coordinate first = allocator.allocate(level);
			Coordinate last = allocator.allocate(level);
			Coordinate cluster = allocator.allocate(level);
			Coordinate ellipsis = allocator.allocate(level);
			var placeholder = new Node.DllSegPlaceholder(first, last, cluster, ellipsis, d.first(), d.last(),
					d.firstPrev(), d.lastNext(), d.kind(), color);
			result.add(position, placeholder);
			context.workList().add(
					RenderContext.PendingRender.body(d.body(), level + 1, placeholder, placeholder.anchor()));
		}

		// The pointer box at n, the panel with its members at n + 1.
		private void pointerAndPanel(Address address, Content content) {
			Coordinate pointer = context.allocator().allocate(level);
			Coordinate members = context.allocator().allocate(level);
			result.add(position, new Node.Cell(pointer, address, content, color));
			result.add(position, content.accept(new Content.Visitor<Node>() {
				@Override
				public Node visitScalar(Content.Scalar s) {
					throw new IllegalArgumentException("Scalar content has no panel: " + s);
				}

				@Override
				public Node visitStruct(Content.NestedStruct s) {
					return new Node.StructPanel(members, address, s, color);
				}

				@Override
				public Node visitArray(Content.NestedArray a) {
					return new Node.ArrayPanel(members, address, a, color);
				}
			}));
		}
	}
}
