package edu.cmu.cs.cs15745.heapviz;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import edu.cmu.cs.cs15745.heapviz.output.XmlTree;

/**
 * The documents of a batch of specs, together with the propositions that
 * could not be rendered and were left out of them.
 */
public final class BatchResult {
	/** A proposition left out of the batch. */
	public static final class Failure {
		private final int spec;
		private final String proposition;
		private final RuntimeException cause;

		Failure(int spec, String proposition, RuntimeException cause) {
			this.spec = spec;
			this.proposition = Objects.requireNonNull(proposition);
			this.cause = Objects.requireNonNull(cause);
		}

		/** 1-based number of the spec. */
		public int spec() {
			return spec;
		}

		/** "PRE" or "POST k". */
		public String proposition() {
			return proposition;
		}

		public RuntimeException cause() {
			return cause;
		}

		@Override
		public String toString() {
			return String.format("spec %d, %s: %s", spec, proposition, cause.getMessage());
		}
	}

	private final String dot;
	private final XmlTree.Element document;
	private final String xml;
	private final int rendered;
	private final List<Failure> failures;

	BatchResult(String dot, XmlTree.Element document, String xml, int rendered, List<Failure> failures) {
		this.dot = Objects.requireNonNull(dot);
		this.document = Objects.requireNonNull(document);
		this.xml = Objects.requireNonNull(xml);
		this.rendered = rendered;
		this.failures = Collections.unmodifiableList(new ArrayList<>(failures));
	}

	public String dot() {
		return dot;
	}

	public XmlTree.Element document() {
		return document;
	}

	public String xml() {
		return xml;
	}

	/** Number of propositions that made it into the documents. */
	public int rendered() {
		return rendered;
	}

	public List<Failure> failures() {
		return failures;
	}

	public boolean isComplete() {
		return failures.isEmpty();
	}
}
