package edu.cmu.cs.cs15745.heapviz;

/**
 * The heap being rendered is malformed: an address resolves to too many
 * nodes, or a cell has no node to start its links from. Only the current
 * render is aborted.
 */
public class RenderInconsistencyException extends IllegalStateException {
	private static final long serialVersionUID = 1L;

	public RenderInconsistencyException(String message) {
		super(message);
	}
}
