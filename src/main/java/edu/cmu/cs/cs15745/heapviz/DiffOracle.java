package edu.cmu.cs.cs15745.heapviz;

/**
 * Classifies heap cells and pure atoms of a postcondition (or of its
 * precondition) by how they changed between the two.
 */
public interface DiffOracle {
	enum Change {
		UNCHANGED, ADDED, REMOVED;
	}

	Change classify(Object element);
}
