package edu.cmu.cs.cs15745.heapviz.output;

import java.util.List;
import java.util.stream.Collectors;

import edu.cmu.cs.cs15745.heapviz.graph.Edge;
import edu.cmu.cs.cs15745.heapviz.graph.HeapGraph;
import edu.cmu.cs.cs15745.heapviz.graph.Layer;
import edu.cmu.cs.cs15745.heapviz.graph.Node;
import edu.cmu.cs.cs15745.heapviz.heap.Address;
import edu.cmu.cs.cs15745.heapviz.heap.Atom;
import edu.cmu.cs.cs15745.heapviz.heap.Content;
import edu.cmu.cs.cs15745.heapviz.output.XmlTree.Element;

/**
 * Builds the tree document of a rendered graph: one {@code heap} per layer
 * holding its nodes and edges, followed by the {@code stack} summary of the
 * pure part.
 */
public final class TreeDocumentBuilder {
	private TreeDocumentBuilder() { }

	/** Tag of the document root for each kind of proposition. */
	public static String tag(HeapGraph.Kind kind) {
		switch (kind) {
		case PRE:
			return "precondition";
		case POST:
			return "postcondition";
		default:
			return "proposition";
		}
	}

	public static Element proposition(HeapGraph graph, int id) {
		var root = XmlTree.element(tag(graph.kind())).attr("id", id);
		graph.layers().forEach(layer -> root.add(heap(layer)));
		return root.add(stack(graph.pure()));
	}

	public static Element heap(Layer layer) {
		var heap = XmlTree.element("heap").attr("id", layer.header().id());
		layer.owner().ifPresent(owner -> heap.attr("owner", owner.coordinate().id()));
		layer.nodes().forEach(node -> heap.add(node(node)));
		layer.edges().forEach(edge -> heap.add(edge(edge)));
		return heap;
	}

	public static Element stack(List<Atom> pure) {
		return XmlTree.element("stack").addAll(pure.stream()
			.map(atom -> XmlTree.element("stack-variable")
				.attr("type", atom.kind().category())
				.attr("instance", text(atom.toString())))
			.collect(Collectors.toList()));
	}

	public static Element edge(Edge edge) {
		return XmlTree.element("edge")
			.attr("source", edge.source().id())
			.attr("target", edge.target().id())
			.attr("label", text(edge.label()));
	}

	public static Element node(Node node) {
		return node.accept(new Node.Visitor<Element>() {
			@Override
			public Element visitNil(Node.Nil n) {
				return common(n, "nil");
			}

			@Override
			public Element visitDangling(Node.Dangling d) {
				return common(d, "dangling");
			}

			@Override
			public Element visitCell(Node.Cell c) {
				var element = common(c, "allocated");
				if (!c.content().isNested()) {
					element.add(content(c.content()));
				}
				return element;
			}

			@Override
			public Element visitStructPanel(Node.StructPanel s) {
				return common(s, "struct").add(content(s.fields()));
			}

			@Override
			public Element visitArrayPanel(Node.ArrayPanel a) {
				return common(a, "array").add(content(a.elements()));
			}

			@Override
			public Element visitListSeg(Node.ListSegPlaceholder l) {
				return XmlTree.element("node")
					.attr("id", l.coordinate().id())
					.attr("address", text(l.first()))
					.attr("node-type", "single linked list")
					.attr("list-type", l.kind().description())
					.attr("memory-type", "other");
			}

			@Override
			public Element visitDllSeg(Node.DllSegPlaceholder d) {
				return XmlTree.element("node")
					.attr("id", d.coordinate().id())
					.attr("addr-first", text(d.first()))
					.attr("addr-last", text(d.last()))
					.attr("node-type", "double linked list")
					.attr("list-type", d.kind().description())
					.attr("memory-type", "other")
					.add(content(Content.scalar(d.firstPrev())))
					.add(content(Content.scalar(d.lastNext())));
			}
		});
	}

	private static Element common(Node node, String nodeType) {
		return XmlTree.element("node")
			.attr("id", node.coordinate().id())
			.attr("address", text(node.address()))
			.attr("node-type", nodeType)
			.attr("memory-type", node.address().memoryType());
	}

	/** The {@code cell}, {@code struct} or {@code array} tree of a content. */
	public static Element content(Content content) {
		return content.accept(new Content.Visitor<Element>() {
			@Override
			public Element visitScalar(Content.Scalar s) {
				return XmlTree.element("cell").attr("content-value", text(s.value()));
			}

			@Override
			public Element visitStruct(Content.NestedStruct s) {
				return XmlTree.element("struct").addAll(s.fields().stream()
					.map(f -> XmlTree.element("struct-field").attr("id", text(f.fst())).add(content(f.snd())))
					.collect(Collectors.toList()));
			}

			@Override
			public Element visitArray(Content.NestedArray a) {
				return XmlTree.element("array").attr("size", text(a.size())).addAll(a.elements().stream()
					.map(e -> XmlTree.element("array-element").attr("index", text(e.fst())).add(content(e.snd())))
					.collect(Collectors.toList()));
			}
		});
	}

	/**
	 * The document of a procedure: its signature, then one specification per
	 * spec, each holding its precondition and postconditions in order.
	 */
	public static Element procedure(String file, int line, String signature, List<Element> specifications) {
		return XmlTree.element("procedure")
			.attr("file", file)
			.attr("line", line)
			.add(XmlTree.element("signature").attr("name", signature))
			.add(XmlTree.element("specifications").addAll(specifications));
	}

	public static Element specification(int id, List<Element> propositions) {
		return XmlTree.element("specification").attr("id", id).addAll(propositions);
	}

	private static String text(Address address) {
		return text(address.text());
	}

	private static String text(String raw) {
		return Escaping.xmlText(raw);
	}
}
