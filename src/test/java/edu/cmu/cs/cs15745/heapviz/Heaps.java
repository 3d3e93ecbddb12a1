package edu.cmu.cs.cs15745.heapviz;

import java.util.List;

import edu.cmu.cs.cs15745.heapviz.graph.HeapGraph;
import edu.cmu.cs.cs15745.heapviz.graph.Layer;
import edu.cmu.cs.cs15745.heapviz.graph.Node;
import edu.cmu.cs.cs15745.heapviz.heap.Address;
import edu.cmu.cs.cs15745.heapviz.heap.Content;
import edu.cmu.cs.cs15745.heapviz.heap.HeapCell;
import edu.cmu.cs.cs15745.heapviz.heap.Proposition;
import edu.cmu.cs.cs15745.heapviz.util.Pair;

// Shorthands for building heaps in tests.
final class Heaps {
	private Heaps() { }

	static final String TYPE = "struct node";

	static Address v(String name) {
		return Address.logical(name);
	}

	static HeapCell pointsTo(Address address, Address value) {
		return new HeapCell.PointsTo(address, Content.scalar(value), TYPE);
	}

	static HeapCell pointsTo(String address, String value) {
		return pointsTo(v(address), v(value));
	}

	static HeapCell toNil(String address) {
		return pointsTo(v(address), Address.NIL);
	}

	@SafeVarargs
	static HeapCell struct(Address address, Pair<String, Content>... fields) {
		return new HeapCell.Struct(address, List.of(fields), TYPE);
	}

	static Pair<String, Content> field(String name, Address value) {
		return Pair.of(name, Content.scalar(value));
	}

	static Pair<String, Content> field(String name, Content value) {
		return Pair.of(name, value);
	}

	static HeapGraph graph(HeapCell... cells) {
		return graph(Proposition.of(cells));
	}

	static HeapGraph graph(Proposition prop) {
		return new HeapRenderer().render(prop).graph();
	}

	static long incoming(HeapGraph graph, Node node) {
		return graph.allEdges().stream().filter(e -> e.target().equals(node.coordinate())).count();
	}

	static Node.Cell cellAt(Layer layer, Address address) {
		return layer.nodes(Node.Cell.class).stream()
			.filter(c -> c.address().equals(address))
			.findFirst()
			.orElseThrow(() -> new AssertionError("No cell at " + address + " in " + layer));
	}
}
