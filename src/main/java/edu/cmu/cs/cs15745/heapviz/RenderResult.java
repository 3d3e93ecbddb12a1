package edu.cmu.cs.cs15745.heapviz;

import java.util.Objects;

import edu.cmu.cs.cs15745.heapviz.graph.HeapGraph;
import edu.cmu.cs.cs15745.heapviz.output.XmlTree;

/**
 * What one render call produces: the graph and its two textual forms.
 */
public final class RenderResult {
	private final HeapGraph graph;
	private final String dot;
	private final XmlTree.Element document;
	private final String xml;

	RenderResult(HeapGraph graph, String dot, XmlTree.Element document, String xml) {
		this.graph = Objects.requireNonNull(graph);
		this.dot = Objects.requireNonNull(dot);
		this.document = Objects.requireNonNull(document);
		this.xml = Objects.requireNonNull(xml);
	}

	public HeapGraph graph() {
		return graph;
	}

	/** A complete digraph document. */
	public String dot() {
		return dot;
	}

	public XmlTree.Element document() {
		return document;
	}

	public String xml() {
		return xml;
	}
}
