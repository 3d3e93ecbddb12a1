package edu.cmu.cs.cs15745.heapviz;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import edu.cmu.cs.cs15745.heapviz.graph.Color;
import edu.cmu.cs.cs15745.heapviz.graph.Coordinate;
import edu.cmu.cs.cs15745.heapviz.graph.Edge;
import edu.cmu.cs.cs15745.heapviz.graph.HeapGraph;
import edu.cmu.cs.cs15745.heapviz.graph.Layer;
import edu.cmu.cs.cs15745.heapviz.graph.Node;
import edu.cmu.cs.cs15745.heapviz.heap.HeapCell;
import edu.cmu.cs.cs15745.heapviz.heap.Proposition;
import edu.cmu.cs.cs15745.heapviz.output.DotPrinter;
import edu.cmu.cs.cs15745.heapviz.output.TreeDocumentBuilder;
import edu.cmu.cs.cs15745.heapviz.output.XmlPrinter;

/**
 * Entry point of the rendering engine. Every call builds its own context, so
 * one renderer may be used for any number of propositions, also concurrently.
 */
public final class HeapRenderer {
	private static final Logger logger = LogManager.getLogger(HeapRenderer.class);

	private final RenderOptions options;

	public HeapRenderer() {
		this(RenderOptions.DEFAULTS);
	}

	public HeapRenderer(RenderOptions options) {
		this.options = Objects.requireNonNull(options);
	}

	public RenderOptions options() {
		return options;
	}

	/** Render a proposition on its own. */
	public RenderResult render(Proposition prop) {
		return render(prop, HeapGraph.Kind.HEAP, ColorMap.BASELINE, 0, 1);
	}

	public RenderResult renderPrecondition(Proposition pre) {
		return render(pre, HeapGraph.Kind.PRE, ColorMap.BASELINE, 0, 1);
	}

	/** Render a postcondition, in red where it differs from its precondition. */
	public RenderResult render(Proposition post, Proposition pre) {
		return render(withPreStack(post, pre), HeapGraph.Kind.POST, diffColors(post, pre), 0, 1);
	}

	RenderResult render(Proposition prop, HeapGraph.Kind kind, ColorMap colors, int firstId, int number) {
		var graph = buildGraph(prop, kind, Provers.fromPureFacts(prop.pi()), colors, firstId);
		String body = DotPrinter.proposition(graph, number, options.showStack(kind));
		var document = TreeDocumentBuilder.proposition(graph, number);
		return new RenderResult(graph, DotPrinter.digraph(body), document,
				XmlPrinter.of(options.prettyXml()).print(document));
	}

	static ColorMap diffColors(Proposition post, Proposition pre) {
		return DiffColorer.colorMap(new PropositionDiff(pre, post));
	}

	/** The post with the stack cells of the pre it does not allocate itself placed first. */
	static Proposition withPreStack(Proposition post, Proposition pre) {
		var prover = Provers.fromPureFacts(post.pi());
		List<HeapCell> missing = new ArrayList<>();
		for (var cell : pre.stackCells()) {
			boolean allocated = post.sigma().stream()
				.anyMatch(c -> prover.structuralEquality(c.address(), cell.address()));
			if (!allocated) {
				missing.add(cell);
			}
		}
		return missing.isEmpty() ? post : post.withLeadingCells(missing);
	}

	/**
	 * Build the graph of a proposition. The top-level heap is rendered first;
	 * segment bodies found on the way are rendered afterwards, breadth-first,
	 * each as its own layer one level below the segment.
	 *
	 * @throws RenderInconsistencyException if the heap is malformed
	 */
	public HeapGraph buildGraph(Proposition prop, HeapGraph.Kind kind, Prover prover, ColorMap colors, int firstId) {
		var context = new RenderContext(prover, colors, firstId);
		var workList = context.workList();
		workList.add(RenderContext.PendingRender.top(prop.sigma()));
		List<Layer> layers = new ArrayList<>();
		while (!workList.isEmpty()) {
			var pending = workList.remove();
			layers.add(buildLayer(context, pending, layers.size()));
		}
		Color stackColor = prop.pi().stream().anyMatch(a -> colors.color(a) == Color.RED)
				? Color.RED
				: Color.ORANGE;
		return new HeapGraph(kind, layers, prop.pi(), stackColor, context.allocator().peek());
	}

	private Layer buildLayer(RenderContext context, RenderContext.PendingRender pending, int ordinal) {
		int level = pending.level();
		var cells = pending.cells();
		Coordinate header = context.allocator().allocate(level);

		var built = new GraphBuilder(context, level, ordinal).buildNodes(cells);
		new DanglingResolver(context, level, ordinal).resolve(cells);
		var edges = new LinkBuilder(context, level, ordinal).buildEdges(cells, built);

		List<Node> nodes = new ArrayList<>(built.nodes());
		nodes.addAll(context.dangling(ordinal));
		nodes.addAll(context.nils(ordinal));
		if (options.pruneSpecPlaceholders()) {
			var pruned = PruningPass.prune(nodes, edges);
			logger.debug("Pruned {} nodes from layer {}", nodes.size() - pruned.fst().size(), ordinal);
			nodes = pruned.fst();
			edges = pruned.snd();
		}

		Optional<Edge> anchorEdge = pending.owner().map(owner -> Edge.plain(anchorKind(owner),
				pending.anchor().get(), header, owner.color()));
		logger.debug("Layer {} at level {}: {} cells, {} nodes, {} edges", ordinal, level, cells.size(), nodes.size(),
				edges.size());
		return new Layer(header, ordinal, pending.owner(), anchorEdge, nodes, edges);
	}

	private static Edge.Kind anchorKind(Node owner) {
		return owner instanceof Node.DllSegPlaceholder ? Edge.Kind.DLL_SEG_LINK : Edge.Kind.LIST_SEG_LINK;
	}
}
