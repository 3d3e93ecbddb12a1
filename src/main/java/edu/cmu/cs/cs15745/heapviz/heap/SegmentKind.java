package edu.cmu.cs.cs15745.heapviz.heap;

/** Whether a list segment is known to be non-empty or possibly empty. */
public enum SegmentKind {
	NE("non-empty"),
	PE("possibly empty");

	private final String description;

	SegmentKind(String description) {
		this.description = description;
	}

	public String description() {
		return description;
	}
}
