package edu.cmu.cs.cs15745.heapviz;

import edu.cmu.cs.cs15745.heapviz.graph.Coordinate;

/**
 * Issues node ids for one render call. Ids are strictly increasing and shared
 * by all nesting levels.
 */
final class NodeAllocator {
	private int next;

	NodeAllocator(int firstId) {
		if (firstId < 0) {
			throw new IllegalArgumentException("Negative first id: " + firstId);
		}
		next = firstId;
	}

	int allocate() {
		return next++;
	}

	Coordinate allocate(int level) {
		return new Coordinate(allocate(), level);
	}

	/** First id not handed out yet. */
	int peek() {
		return next;
	}
}
