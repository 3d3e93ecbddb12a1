package edu.cmu.cs.cs15745.heapviz;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import edu.cmu.cs.cs15745.heapviz.graph.HeapGraph;
import edu.cmu.cs.cs15745.heapviz.heap.Proposition;
import edu.cmu.cs.cs15745.heapviz.heap.Spec;
import edu.cmu.cs.cs15745.heapviz.output.DotPrinter;
import edu.cmu.cs.cs15745.heapviz.output.EscapingException;
import edu.cmu.cs.cs15745.heapviz.output.TreeDocumentBuilder;
import edu.cmu.cs.cs15745.heapviz.output.XmlPrinter;
import edu.cmu.cs.cs15745.heapviz.output.XmlTree;

/**
 * Renders the specs of one procedure into a single graph description and a
 * single tree document. Node ids are threaded from one proposition to the
 * next so that they never clash within the graph description. A proposition
 * that fails to render is reported and skipped; the others still are
 * rendered.
 */
public final class SpecBatchRenderer {
	private static final Logger logger = LogManager.getLogger(SpecBatchRenderer.class);

	private final HeapRenderer renderer;

	public SpecBatchRenderer(HeapRenderer renderer) {
		this.renderer = Objects.requireNonNull(renderer);
	}

	public BatchResult render(String file, int line, String signature, List<Spec> specs) {
		var batch = new Batch();
		var dot = new StringBuilder();
		var specifications = new ArrayList<XmlTree.Element>();
		int number = 0;
		for (var spec : specs) {
			number++;
			int clusterId = batch.nextId++;
			int bannerId = batch.nextId++;
			var bodies = new ArrayList<String>();
			var documents = new ArrayList<XmlTree.Element>();
			batch.renderOne(number, "PRE", spec.pre(), HeapGraph.Kind.PRE, ColorMap.BASELINE, number, bodies,
					documents);
			int postNumber = 0;
			for (var post : spec.posts()) {
				postNumber++;
				batch.renderOne(number, "POST " + postNumber, HeapRenderer.withPreStack(post, spec.pre()),
						HeapGraph.Kind.POST, HeapRenderer.diffColors(post, spec.pre()), postNumber, bodies, documents);
			}
			dot.append(DotPrinter.spec(clusterId, bannerId, number, bodies));
			specifications.add(TreeDocumentBuilder.specification(number, documents));
		}
		var document = TreeDocumentBuilder.procedure(file, line, signature, specifications);
		if (!batch.failures.isEmpty()) {
			logger.warn("{}: {} of {} propositions not rendered", signature, batch.failures.size(),
					batch.failures.size() + batch.rendered);
		}
		return new BatchResult(DotPrinter.digraph(dot.toString()), document,
				XmlPrinter.of(renderer.options().prettyXml()).print(document), batch.rendered, batch.failures);
	}

	// State of one batch.
	private final class Batch {
		int nextId = 0;
		int documentId = 0;
		int rendered = 0;
		final List<BatchResult.Failure> failures = new ArrayList<>();

		void renderOne(int spec, String name, Proposition prop, HeapGraph.Kind kind, ColorMap colors, int number,
				List<String> bodies, List<XmlTree.Element> documents) {
			try {
				var graph = renderer.buildGraph(prop, kind, Provers.fromPureFacts(prop.pi()), colors, nextId);
				String body = DotPrinter.proposition(graph, number, renderer.options().showStack(kind));
				var document = TreeDocumentBuilder.proposition(graph, ++documentId);
				bodies.add(body);
				documents.add(document);
				nextId = graph.nextFreeId();
				rendered++;
			} catch (RenderInconsistencyException | EscapingException e) {
				logger.warn("Skipping spec {} {}: {}", spec, name, e.getMessage());
				failures.add(new BatchResult.Failure(spec, name, e));
			}
		}
	}
}
