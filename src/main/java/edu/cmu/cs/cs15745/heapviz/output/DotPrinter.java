package edu.cmu.cs.cs15745.heapviz.output;

import java.util.List;

import edu.cmu.cs.cs15745.heapviz.graph.Coordinate;
import edu.cmu.cs.cs15745.heapviz.graph.Edge;
import edu.cmu.cs.cs15745.heapviz.graph.HeapGraph;
import edu.cmu.cs.cs15745.heapviz.graph.Layer;
import edu.cmu.cs.cs15745.heapviz.graph.MemberPaths;
import edu.cmu.cs.cs15745.heapviz.graph.Node;
import edu.cmu.cs.cs15745.heapviz.heap.Content;
import edu.cmu.cs.cs15745.heapviz.heap.SegmentKind;
import edu.cmu.cs.cs15745.heapviz.util.Util;

/**
 * Writes rendered graphs as a graph description. Plain boxes are named
 * {@code state<id>L<level>}, panels {@code struct<id>L<level>}; a panel has one
 * port for its header (named after its address) and one per scalar member
 * (named after the member path).
 */
public final class DotPrinter {
	private DotPrinter() { }

	/** A complete document around the given body. */
	public static String digraph(String body) {
		return "digraph main { \nnode [shape=box]; \ncompound = true; \n" + body + "\n}\n";
	}

	/** Banner text of each kind of proposition. */
	public static String banner(HeapGraph.Kind kind) {
		switch (kind) {
		case PRE:
			return "PRE";
		case POST:
			return "POST";
		default:
			return "HEAP";
		}
	}

	/**
	 * The cluster of one proposition: banner, optional stack summary, the
	 * top-level layer and one dashed sub-cluster per segment body.
	 */
	public static String proposition(HeapGraph graph, int number, boolean showStack) {
		var out = new StringBuilder();
		var top = graph.top();
		int id = top.header().id();
		out.append("\n subgraph cluster_prop_").append(id).append(" { color=black \n");
		String banner = banner(graph.kind());
		out.append(String.format(" %s%dL0 [label=\"%s %d \",  style=filled, color= yellow]\n", banner, id, banner,
				number));
		if (showStack) {
			out.append("subgraph {\n");
			out.append(String.format(" node [shape=box]; \n state_pi_%d [label=\"STACK \\n\\n %s\" color=%s style=filled]\n",
					id, Escaping.dotLabel(Util.join(" & ", graph.pure())), graph.stackColor().dotName()));
			out.append("}\n");
		}
		layer(out, top);
		for (var layer : graph.layers().subList(1, graph.layers().size())) {
			out.append("\n subgraph cluster_prop_").append(layer.header().id()).append(" { \n");
			out.append("style=dashed; color=blue \n");
			out.append(String.format(" %s [label=\"INTERNAL STRUCTURE %d \",  style=filled, color= lightblue]\n",
					state(layer.header()), layer.ordinal()));
			layer.anchorEdge().ifPresent(anchor -> out.append(String.format(
					"%s -> %s [color=\"lightblue \"  arrowhead=none] \n", state(anchor.source()), state(anchor.target()))));
			layer(out, layer);
			out.append("\n } \n");
		}
		out.append("\n } \n");
		return out.toString();
	}

	/** The blue cluster grouping a precondition with its postconditions. */
	public static String spec(int clusterId, int bannerId, int number, List<String> propositions) {
		var out = new StringBuilder();
		out.append("\n subgraph cluster_").append(clusterId).append(" { color=blue \n");
		out.append(String.format("\n state%dL0 [label=\"SPEC %d \",  style=filled, color= lightblue]\n", bannerId,
				number));
		propositions.forEach(out::append);
		out.append("\n } \n");
		return out.toString();
	}

	private static void layer(StringBuilder out, Layer layer) {
		for (var node : layer.nodes()) {
			out.append(node(node));
		}
		for (var edge : layer.edges()) {
			out.append(edge(edge));
		}
	}

	static String state(Coordinate c) {
		return "state" + c;
	}

	static String struct(Coordinate c) {
		return "struct" + c;
	}

	public static String node(Node node) {
		return node.accept(NODE_FORMATTER);
	}

	private static final Node.Visitor<String> NODE_FORMATTER = new Node.Visitor<String>() {
		@Override
		public String visitNil(Node.Nil n) {
			return String.format("%s [label=\"NIL \", color=green, style=filled]\n", state(n.coordinate()));
		}

		@Override
		public String visitDangling(Node.Dangling d) {
			return String.format("%s [label=\"%s \", color=red, style=dashed, fontcolor=%s]\n", state(d.coordinate()),
					Escaping.dotLabel(d.address().text()), d.color().dotName());
		}

		@Override
		public String visitCell(Node.Cell c) {
			return String.format("%s [label=\"%s\" fontcolor=%s]\n", state(c.coordinate()),
					Escaping.dotLabel(c.address().text()), c.color().dotName());
		}

		@Override
		public String visitStructPanel(Node.StructPanel s) {
			String header = String.format("{<%s> STRUCT: %s }", Escaping.portName(s.address().text()),
					Escaping.dotLabel(s.address().text()));
			return record(s, header + " | " + fields("", s.fields()));
		}

		@Override
		public String visitArrayPanel(Node.ArrayPanel a) {
			String header = String.format("{<%s> ARRAY| SIZE: %s }", Escaping.portName(a.address().text()),
					Escaping.dotLabel(a.size().text()));
			return record(a, header + " | " + elements("", a.elements()));
		}

		@Override
		public String visitListSeg(Node.ListSegPlaceholder l) {
			var out = new StringBuilder();
			out.append(cluster(l.cluster(), "list", l.kind()));
			out.append(String.format("%s [label=\"%s\" fontcolor=%s]\n", state(l.coordinate()),
					Escaping.dotLabel(l.first().text()), l.color().dotName()));
			out.append(ellipsis(l.ellipsis()));
			out.append(chain(l.coordinate(), l.ellipsis()));
			out.append(String.format("%s [label=\" \"] \n", state(l.lastBox())));
			out.append(chain(l.ellipsis(), l.lastBox()));
			out.append("}\n");
			return out.toString();
		}

		@Override
		public String visitDllSeg(Node.DllSegPlaceholder d) {
			var out = new StringBuilder();
			out.append(cluster(d.cluster(), "doubly-linked list", d.kind()));
			out.append(String.format("%s [label=\"%s\" fontcolor=%s]\n", state(d.coordinate()),
					Escaping.dotLabel(d.first().text()), d.color().dotName()));
			out.append(ellipsis(d.ellipsis()));
			out.append(chain(d.coordinate(), d.ellipsis()));
			out.append(chain(d.ellipsis(), d.coordinate()));
			out.append(String.format("%s [label=\"%s\"]\n", state(d.lastBox()), Escaping.dotLabel(d.last().text())));
			out.append(chain(d.lastBox(), d.ellipsis()));
			out.append(chain(d.ellipsis(), d.lastBox()));
			out.append("}\n");
			return out.toString();
		}
	};

	private static String record(Node panel, String label) {
		return String.format("%s [shape=record, label=\"%s\", fontcolor=%s]\n", struct(panel.coordinate()), label,
				panel.color().dotName());
	}

	private static String cluster(Coordinate c, String what, SegmentKind kind) {
		return String.format(
				"subgraph cluster_%s { style=filled; color=lightgrey; node [style=filled,color=white];  label=\"%s %s\";\n",
				c, what, kind.name());
	}

	private static String ellipsis(Coordinate c) {
		return String.format("%s [label=\"... \" style=filled color=lightgrey] \n", state(c));
	}

	private static String chain(Coordinate from, Coordinate to) {
		return String.format("%s -> %s [label=\" \"] \n", state(from), state(to));
	}

	// Record fields of a struct; nested members are grouped under their name.
	private static String fields(String prefix, Content.NestedStruct struct) {
		return Util.join(" | ", struct.fields(),
				field -> member(MemberPaths.field(prefix, field.fst()), field.fst(), field.snd()));
	}

	private static String elements(String prefix, Content.NestedArray array) {
		return Util.join(" | ", array.elements(), element -> {
			String index = element.fst().text();
			return member(MemberPaths.element(prefix, index), index, element.snd());
		});
	}

	private static String member(String path, String name, Content content) {
		return content.accept(new Content.Visitor<String>() {
			@Override
			public String visitScalar(Content.Scalar s) {
				return String.format("{ <%s> %s: %s }", Escaping.portName(path), Escaping.dotLabel(name),
						Escaping.dotLabel(s.value().text()));
			}

			@Override
			public String visitStruct(Content.NestedStruct s) {
				return String.format("{ %s: STRUCT | { %s } }", Escaping.dotLabel(name), fields(path, s));
			}

			@Override
			public String visitArray(Content.NestedArray a) {
				return String.format("{ %s: ARRAY[%s] | { %s } }", Escaping.dotLabel(name),
						Escaping.dotLabel(a.size().text()), elements(path, a));
			}
		});
	}

	public static String edge(Edge edge) {
		String source;
		String target;
		switch (edge.kind()) {
		case STRUCT_TO_CELL:
		case ARRAY_TO_CELL:
			source = port(struct(edge.source()), edge.sourceField());
			target = port(state(edge.target()), edge.targetField());
			break;
		case STRUCT_TO_STRUCT:
		case ARRAY_TO_STRUCT:
			source = port(struct(edge.source()), edge.sourceField());
			target = port(struct(edge.target()), edge.targetField());
			break;
		case CELL_TO_STRUCT:
		case ARRAY_LINK:
			source = port(state(edge.source()), edge.sourceField());
			target = port(struct(edge.target()), edge.targetField());
			break;
		default:
			source = port(state(edge.source()), edge.sourceField());
			target = port(state(edge.target()), edge.targetField());
		}
		return String.format("%s -> %s[label=\"%s\", color=%s];\n", source, target, Escaping.dotLabel(edge.label()),
				edge.color().dotName());
	}

	private static String port(String name, String field) {
		return field.isEmpty() ? name : String.format("%s:\"%s\"", name, Escaping.portName(field));
	}
}
