package edu.cmu.cs.cs15745.heapviz;

import edu.cmu.cs.cs15745.heapviz.heap.Address;

/** The decision procedures the renderer relies on. */
public interface Prover {
	/** Whether the address is provably the null pointer. */
	boolean isProvablyZero(Address address);

	/** Whether two addresses denote the same node. */
	boolean structuralEquality(Address a, Address b);
}
