package edu.cmu.cs.cs15745.heapviz;

import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.stream.Collectors;

import com.ibm.wala.util.graph.impl.SlowSparseNumberedGraph;

import edu.cmu.cs.cs15745.heapviz.graph.Coordinate;
import edu.cmu.cs.cs15745.heapviz.graph.Edge;
import edu.cmu.cs.cs15745.heapviz.graph.Node;
import edu.cmu.cs.cs15745.heapviz.util.Pair;

/**
 * Drops the boxes of specification placeholders nothing points to, together
 * with the edges leaving them. A box whose last incoming edge is dropped this
 * way is examined again, so no unreferenced placeholder box survives.
 */
final class PruningPass {
	private PruningPass() { }

	static boolean isCandidate(Node node) {
		return node.address().isSpecPlaceholder() && node.accept(new Node.Visitor<Boolean>() {
			@Override
			public Boolean visitNil(Node.Nil n) {
				return false;
			}

			@Override
			public Boolean visitDangling(Node.Dangling d) {
				return true;
			}

			@Override
			public Boolean visitCell(Node.Cell c) {
				return true;
			}

			@Override
			public Boolean visitStructPanel(Node.StructPanel s) {
				return true;
			}

			@Override
			public Boolean visitArrayPanel(Node.ArrayPanel a) {
				return true;
			}

			@Override
			public Boolean visitListSeg(Node.ListSegPlaceholder l) {
				return false;
			}

			@Override
			public Boolean visitDllSeg(Node.DllSegPlaceholder d) {
				return false;
			}
		});
	}

	static Pair<List<Node>, List<Edge>> prune(List<Node> nodes, List<Edge> edges) {
		var graph = SlowSparseNumberedGraph.<Coordinate>make();
		Map<Coordinate, Node> byCoordinate = new HashMap<>();
		for (var node : nodes) {
			graph.addNode(node.coordinate());
			byCoordinate.put(node.coordinate(), node);
		}
		for (var edge : edges) {
			if (!graph.containsNode(edge.source())) graph.addNode(edge.source());
			if (!graph.containsNode(edge.target())) graph.addNode(edge.target());
			graph.addEdge(edge.source(), edge.target());
		}

		Queue<Node> workList = nodes.stream()
			.filter(PruningPass::isCandidate)
			.collect(Collectors.toCollection(ArrayDeque::new));
		Set<Coordinate> removed = new HashSet<>();
		while (!workList.isEmpty()) {
			var node = workList.remove();
			var coordinate = node.coordinate();
			if (removed.contains(coordinate) || graph.getPredNodeCount(coordinate) > 0) {
				continue;
			}
			removed.add(coordinate);
			var successors = new HashSet<Coordinate>();
			for (var it = graph.getSuccNodes(coordinate); it.hasNext();) {
				successors.add(it.next());
			}
			graph.removeOutgoingEdges(coordinate);
			for (var succ : successors) {
				var next = byCoordinate.get(succ);
				if (next != null && isCandidate(next)) {
					workList.add(next);
				}
			}
		}

		var keptNodes = nodes.stream()
			.filter(n -> !removed.contains(n.coordinate()))
			.collect(Collectors.toList());
		var keptEdges = edges.stream()
			.filter(e -> !removed.contains(e.source()))
			.collect(Collectors.toList());
		return Pair.of(keptNodes, keptEdges);
	}
}
