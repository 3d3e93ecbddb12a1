package edu.cmu.cs.cs15745.heapviz;

import static edu.cmu.cs.cs15745.heapviz.Heaps.cellAt;
import static edu.cmu.cs.cs15745.heapviz.Heaps.field;
import static edu.cmu.cs.cs15745.heapviz.Heaps.graph;
import static edu.cmu.cs.cs15745.heapviz.Heaps.pointsTo;
import static edu.cmu.cs.cs15745.heapviz.Heaps.struct;
import static edu.cmu.cs.cs15745.heapviz.Heaps.toNil;
import static edu.cmu.cs.cs15745.heapviz.Heaps.v;

import java.util.ArrayList;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import edu.cmu.cs.cs15745.heapviz.graph.Color;
import edu.cmu.cs.cs15745.heapviz.graph.Coordinate;
import edu.cmu.cs.cs15745.heapviz.graph.Edge;
import edu.cmu.cs.cs15745.heapviz.graph.HeapGraph;
import edu.cmu.cs.cs15745.heapviz.graph.Node;
import edu.cmu.cs.cs15745.heapviz.heap.Address;
import edu.cmu.cs.cs15745.heapviz.heap.Atom;
import edu.cmu.cs.cs15745.heapviz.heap.Content;
import edu.cmu.cs.cs15745.heapviz.heap.HeapCell;
import edu.cmu.cs.cs15745.heapviz.heap.Proposition;
import edu.cmu.cs.cs15745.heapviz.heap.SegmentKind;
import edu.cmu.cs.cs15745.heapviz.util.Pair;

public class TestHeapRenderer {

	private static Coordinate at(int id, int level) {
		return new Coordinate(id, level);
	}

	private static Edge plain(Edge.Kind kind, int source, int target) {
		return Edge.plain(kind, at(source, 0), at(target, 0), Color.BLACK);
	}

	@Test
	public void testChainEndsInNil() {
		var graph = graph(pointsTo("x", "y"), toNil("y"));
		var top = graph.top();
		Assert.assertEquals(1, graph.layers().size());
		Assert.assertEquals(at(0, 0), top.header());
		Assert.assertEquals(at(1, 0), cellAt(top, v("x")).coordinate());
		Assert.assertEquals(at(2, 0), cellAt(top, v("y")).coordinate());
		Assert.assertEquals(List.of(at(3, 0)), coordinates(top.nodes(Node.Nil.class)));
		Assert.assertEquals(List.of(
				plain(Edge.Kind.CELL_TO_CELL, 1, 2),
				plain(Edge.Kind.CELL_TO_CELL, 2, 3)), top.edges());
		Assert.assertEquals(4, graph.nextFreeId());
	}

	@Test
	public void testEveryNilReferenceGetsItsOwnNode() {
		var top = graph(toNil("x"), toNil("y")).top();
		var nils = top.nodes(Node.Nil.class);
		Assert.assertEquals(2, nils.size());
		Assert.assertNotEquals(nils.get(0).coordinate(), nils.get(1).coordinate());
		Assert.assertEquals(nils.get(0).coordinate(), top.edges().get(0).target());
		Assert.assertEquals(nils.get(1).coordinate(), top.edges().get(1).target());
	}

	@Test
	public void testDanglingNodeIsShared() {
		var graph = graph(pointsTo("x", "d"), pointsTo("y", "d"));
		var top = graph.top();
		var dangling = top.nodes(Node.Dangling.class);
		Assert.assertEquals(1, dangling.size());
		Assert.assertEquals(v("d"), dangling.get(0).address());
		Assert.assertEquals(2, Heaps.incoming(graph, dangling.get(0)));
	}

	@Test
	public void testAddressEqualToZeroIsNil() {
		var prop = new Proposition(List.of(pointsTo("x", "z")), List.of(Atom.eq(v("z"), Address.NIL)));
		var top = graph(prop).top();
		Assert.assertTrue(top.nodes(Node.Dangling.class).isEmpty());
		Assert.assertEquals(1, top.nodes(Node.Nil.class).size());
	}

	@Test
	public void testStructGetsPointerAndPanel() {
		var top = graph(struct(v("x"), field("next", v("y"))), toNil("y")).top();
		Assert.assertEquals(at(1, 0), cellAt(top, v("x")).coordinate());
		var panels = top.nodes(Node.StructPanel.class);
		Assert.assertEquals(1, panels.size());
		Assert.assertEquals(at(2, 0), panels.get(0).coordinate());
		Assert.assertEquals(at(3, 0), cellAt(top, v("y")).coordinate());
		Assert.assertEquals(List.of(
				new Edge(Edge.Kind.CELL_TO_STRUCT, at(1, 0), "", at(2, 0), "x", "", Color.BLACK),
				new Edge(Edge.Kind.STRUCT_TO_CELL, at(2, 0), "next", at(3, 0), "", "next", Color.BLACK),
				plain(Edge.Kind.CELL_TO_CELL, 3, 4)), top.edges());
	}

	@Test
	public void testMemberPrefersPanelScalarPrefersPointer() {
		var top = graph(
				struct(v("x"), field("next", v("y"))),
				struct(v("y"), field("next", Address.NIL)),
				pointsTo("z", "y")).top();
		// x: 1, 2; y: 3, 4; z: 5; nil: 6
		var member = top.edges().get(1);
		Assert.assertEquals(Edge.Kind.STRUCT_TO_STRUCT, member.kind());
		Assert.assertEquals(at(4, 0), member.target());
		Assert.assertEquals("y", member.targetField());
		var scalar = top.edges().get(top.edges().size() - 1);
		Assert.assertEquals(Edge.Kind.CELL_TO_CELL, scalar.kind());
		Assert.assertEquals(at(5, 0), scalar.source());
		Assert.assertEquals(at(3, 0), scalar.target());
	}

	@Test
	public void testNestedMemberPath() {
		var inner = Content.struct(List.of(Pair.of("p", Content.scalar(v("q")))));
		var top = graph(struct(v("x"), field("inner", inner))).top();
		var dangling = top.nodes(Node.Dangling.class);
		Assert.assertEquals(1, dangling.size());
		Assert.assertEquals(at(3, 0), dangling.get(0).coordinate());
		Assert.assertEquals(new Edge(Edge.Kind.STRUCT_TO_CELL, at(2, 0), "inner.p", at(3, 0), "", "p", Color.BLACK),
				top.edges().get(1));
	}

	@Test
	public void testArrayEdges() {
		var array = new HeapCell.Array(v("a"), Address.constant(2), List.of(
				Pair.of(Address.constant(0), Content.scalar(Address.NIL)),
				Pair.of(Address.constant(1), Content.scalar(v("b")))), Heaps.TYPE);
		var top = graph(array, toNil("b")).top();
		Assert.assertEquals(1, top.nodes(Node.ArrayPanel.class).size());
		var edges = top.edges();
		Assert.assertEquals(Edge.Kind.ARRAY_LINK, edges.get(0).kind());
		Assert.assertEquals("a", edges.get(0).targetField());
		Assert.assertEquals(Edge.Kind.ARRAY_TO_CELL, edges.get(1).kind());
		Assert.assertEquals("0", edges.get(1).sourceField());
		Assert.assertEquals(Edge.Kind.ARRAY_TO_CELL, edges.get(2).kind());
		Assert.assertEquals("1", edges.get(2).sourceField());
		Assert.assertEquals(cellAt(top, v("b")).coordinate(), edges.get(2).target());
	}

	@Test
	public void testScalarCellAtStructAddressIsNotDrawn() {
		var top = graph(struct(v("x"), field("f", Address.NIL)), pointsTo("x", "y")).top();
		Assert.assertEquals(1, top.nodes(Node.Cell.class).size());
		var toY = top.edges().stream()
			.filter(e -> e.target().equals(top.nodes(Node.Dangling.class).get(0).coordinate()))
			.findFirst()
			.get();
		Assert.assertEquals(at(1, 0), toY.source());
	}

	@Test
	public void testNodeCount() {
		var top = graph(
				pointsTo("a", "b"),
				struct(v("b"), field("f", v("a"))),
				toNil("c")).top();
		Assert.assertTrue(top.nodes(Node.Dangling.class).isEmpty());
		int nonNil = top.nodes().size() - top.nodes(Node.Nil.class).size();
		// Three cells plus one panel.
		Assert.assertEquals(4, nonNil);
	}

	@Test
	public void testSingleDangling() {
		var top = graph(pointsTo("x", "z")).top();
		Assert.assertEquals(1, top.nodes(Node.Cell.class).size());
		var dangling = top.nodes(Node.Dangling.class);
		Assert.assertEquals(1, dangling.size());
		Assert.assertEquals(List.of(plain(Edge.Kind.CELL_TO_CELL, 1, dangling.get(0).coordinate().id())), top.edges());
	}

	@Test
	public void testListSegmentBody() {
		var seg = new HeapCell.ListSeg(SegmentKind.NE, v("a"), v("b"), List.of(pointsTo("p", "q")));
		var graph = graph(seg);
		Assert.assertEquals(2, graph.layers().size());

		var top = graph.top();
		var placeholder = top.nodes(Node.ListSegPlaceholder.class).get(0);
		Assert.assertEquals(at(1, 0), placeholder.coordinate());
		Assert.assertEquals(at(2, 0), placeholder.lastBox());
		Assert.assertEquals(at(3, 0), placeholder.cluster());
		Assert.assertEquals(at(4, 0), placeholder.ellipsis());
		Assert.assertEquals(at(5, 0), top.nodes(Node.Dangling.class).get(0).coordinate());
		Assert.assertEquals(List.of(plain(Edge.Kind.LIST_SEG_LINK, 2, 5)), top.edges());

		var body = graph.layers().get(1);
		Assert.assertEquals(at(6, 1), body.header());
		Assert.assertEquals(1, body.ordinal());
		Assert.assertEquals(placeholder, body.owner().get());
		Assert.assertEquals(at(7, 1), cellAt(body, v("p")).coordinate());
		Assert.assertEquals(at(8, 1), body.nodes(Node.Dangling.class).get(0).coordinate());
		Assert.assertEquals(List.of(Edge.plain(Edge.Kind.CELL_TO_CELL, at(7, 1), at(8, 1), Color.BLACK)),
				body.edges());
		Assert.assertEquals(Edge.plain(Edge.Kind.LIST_SEG_LINK, at(2, 0), at(6, 1), Color.BLACK),
				body.anchorEdge().get());
	}

	@Test
	public void testDoublyLinkedSegment() {
		var dll = new HeapCell.DllSeg(SegmentKind.PE, v("a"), v("b"), v("p"), v("n"), List.of());
		var graph = graph(dll, pointsTo("p", "a"), toNil("n"), pointsTo("q", "b"));
		var top = graph.top();
		// dll: 1 to 4, p: 5, n: 6, q: 7, nil: 8
		Assert.assertTrue(top.nodes(Node.Dangling.class).isEmpty());
		Assert.assertEquals(List.of(
				plain(Edge.Kind.DLL_SEG_LINK, 1, 5),
				plain(Edge.Kind.DLL_SEG_LINK, 2, 6),
				plain(Edge.Kind.CELL_TO_CELL, 5, 1),
				plain(Edge.Kind.CELL_TO_CELL, 6, 8),
				plain(Edge.Kind.CELL_TO_CELL, 7, 2)), top.edges());
		var body = graph.layers().get(1);
		Assert.assertEquals(at(9, 1), body.header());
		Assert.assertEquals(Edge.plain(Edge.Kind.DLL_SEG_LINK, at(4, 0), at(9, 1), Color.BLACK),
				body.anchorEdge().get());
	}

	@Test
	public void testDoublyLinkedSegmentToNilHasNoAdjacency() {
		var dll = new HeapCell.DllSeg(SegmentKind.NE, v("a"), v("b"), Address.NIL, Address.NIL, List.of());
		var top = graph(dll).top();
		Assert.assertEquals(1, top.nodes().size());
		Assert.assertTrue(top.edges().isEmpty());
	}

	@Test
	public void testRepeatedCellInstanceIsDrawnTwice() {
		var cell = pointsTo("x", "y");
		var expected = List.of(
				plain(Edge.Kind.CELL_TO_CELL, 1, 3),
				plain(Edge.Kind.CELL_TO_CELL, 2, 3));
		Assert.assertEquals(expected, graph(cell, cell).top().edges());
		Assert.assertEquals(expected, graph(pointsTo("x", "y"), pointsTo("x", "y")).top().edges());
	}

	@Test
	public void testRepeatedStructInstanceKeepsItsPanels() {
		var cell = struct(v("s"), field("f", Address.NIL));
		var top = graph(cell, cell).top();
		Assert.assertEquals(2, top.nodes(Node.StructPanel.class).size());
		Assert.assertEquals(4, top.edges().size());
		Assert.assertEquals(new Edge(Edge.Kind.CELL_TO_STRUCT, at(1, 0), "", at(2, 0), "s", "", Color.BLACK),
				top.edges().get(0));
		Assert.assertEquals(new Edge(Edge.Kind.CELL_TO_STRUCT, at(3, 0), "", at(4, 0), "s", "", Color.BLACK),
				top.edges().get(2));
	}

	@Test(expected = RenderInconsistencyException.class)
	public void testThreeNodesAtOneAddress() {
		graph(struct(v("x"), field("f", Address.NIL)),
				new HeapCell.ListSeg(SegmentKind.NE, v("x"), Address.NIL, List.of()),
				pointsTo("y", "x"));
	}

	@Test
	public void testDeepNesting() {
		int depth = 500;
		List<HeapCell> body = List.of(pointsTo("leaf", "end"));
		for (int i = depth - 1; i >= 0; i--) {
			body = List.of(new HeapCell.ListSeg(SegmentKind.PE, v("a" + i), v("b" + i), body));
		}
		var graph = graph(new Proposition(body, List.of()));
		Assert.assertEquals(depth + 1, graph.layers().size());
		var last = graph.layers().get(depth);
		Assert.assertEquals(depth, last.level());
		Assert.assertEquals(v("leaf"), last.nodes(Node.Cell.class).get(0).address());
	}

	@Test
	public void testSiblingBodiesShareALevel() {
		var first = new HeapCell.ListSeg(SegmentKind.NE, v("a"), v("b"), List.of(toNil("p")));
		var second = new HeapCell.ListSeg(SegmentKind.NE, v("b"), v("c"), List.of(toNil("p")));
		var graph = graph(first, second);
		Assert.assertEquals(3, graph.layers().size());
		Assert.assertEquals(1, graph.layers().get(1).level());
		Assert.assertEquals(1, graph.layers().get(2).level());
		// Each body has its own nil.
		Assert.assertEquals(1, graph.layers().get(1).nodes(Node.Nil.class).size());
		Assert.assertEquals(1, graph.layers().get(2).nodes(Node.Nil.class).size());
	}

	@Test
	public void testIdsAreUnique() {
		var seg = new HeapCell.ListSeg(SegmentKind.NE, v("a"), v("b"),
				List.of(struct(v("s"), field("f", v("t"))), toNil("t")));
		var graph = graph(seg, pointsTo("b", "a"));
		var ids = new ArrayList<Integer>();
		for (var layer : graph.layers()) {
			ids.add(layer.header().id());
			for (var node : layer.nodes()) {
				ids.add(node.coordinate().id());
			}
		}
		Assert.assertEquals(ids.size(), ids.stream().distinct().count());
		Assert.assertTrue(ids.stream().allMatch(id -> id < graph.nextFreeId()));
	}

	@Test
	public void testRenderingIsRepeatable() {
		var renderer = new HeapRenderer();
		var prop = Proposition.of(
				struct(v("x"), field("next", v("y"))),
				new HeapCell.ListSeg(SegmentKind.NE, v("y"), Address.NIL, List.of(pointsTo("p", "q"))));
		var first = renderer.render(prop);
		var second = renderer.render(prop);
		Assert.assertEquals(first.dot(), second.dot());
		Assert.assertEquals(first.xml(), second.xml());
	}

	@Test
	public void testPostconditionDiff() {
		var x = Address.local("x");
		var pre = Proposition.of(pointsTo(x, Address.constant(1)));
		var post = Proposition.of(pointsTo(x, Address.constant(2)));
		var renderer = new HeapRenderer();

		var preGraph = renderer.renderPrecondition(pre).graph();
		Assert.assertEquals(HeapGraph.Kind.PRE, preGraph.kind());
		Assert.assertEquals(Color.BLACK, cellAt(preGraph.top(), x).color());

		var postGraph = renderer.render(post, pre).graph();
		Assert.assertEquals(HeapGraph.Kind.POST, postGraph.kind());
		Assert.assertEquals(Color.RED, cellAt(postGraph.top(), x).color());
		Assert.assertEquals(Color.RED, postGraph.top().edges().get(0).color());
		Assert.assertEquals(Color.RED, postGraph.top().nodes(Node.Dangling.class).get(0).color());
	}

	@Test
	public void testStackColor() {
		var cell = pointsTo("x", "y");
		var pre = new Proposition(List.of(cell), List.of(Atom.neq(v("y"), Address.NIL)));
		var post = new Proposition(List.of(cell), List.of(Atom.eq(v("y"), Address.NIL)));
		var renderer = new HeapRenderer();
		Assert.assertEquals(Color.ORANGE, renderer.render(pre).graph().stackColor());
		Assert.assertEquals(Color.ORANGE, renderer.render(pre, pre).graph().stackColor());
		Assert.assertEquals(Color.RED, renderer.render(post, pre).graph().stackColor());
	}

	@Test
	public void testPostGetsStackOfPre() {
		var x = Address.local("x");
		var y = Address.local("y");
		var pre = Proposition.of(pointsTo(x, v("a")), pointsTo(y, v("b")));
		var post = Proposition.of(pointsTo(y, v("c")));
		var merged = HeapRenderer.withPreStack(post, pre);
		Assert.assertEquals(List.of(pointsTo(x, v("a")), pointsTo(y, v("c"))), merged.sigma());
		Assert.assertSame(post, HeapRenderer.withPreStack(post, post));
	}

	@Test
	public void testFirstId() {
		var graph = new HeapRenderer().buildGraph(Proposition.of(toNil("x")), HeapGraph.Kind.HEAP,
				Provers.SYNTACTIC, ColorMap.BASELINE, 10);
		Assert.assertEquals(at(10, 0), graph.top().header());
		Assert.assertEquals(13, graph.nextFreeId());
	}

	private static List<Coordinate> coordinates(List<? extends Node> nodes) {
		var result = new ArrayList<Coordinate>();
		nodes.forEach(n -> result.add(n.coordinate()));
		return result;
	}
}
