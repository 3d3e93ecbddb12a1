package edu.cmu.cs.cs15745.heapviz;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

import edu.cmu.cs.cs15745.heapviz.heap.Proposition;

/**
 * Diff oracle comparing the cells and atoms of two propositions by equality:
 * what only the post has was added, what only the pre has was removed.
 */
public final class PropositionDiff implements DiffOracle {
	private final Set<Object> before = new HashSet<>();
	private final Set<Object> after = new HashSet<>();

	public PropositionDiff(Proposition pre, Proposition post) {
		Objects.requireNonNull(pre);
		Objects.requireNonNull(post);
		before.addAll(pre.sigma());
		before.addAll(pre.pi());
		after.addAll(post.sigma());
		after.addAll(post.pi());
	}

	@Override
	public Change classify(Object element) {
		boolean inBefore = before.contains(element);
		boolean inAfter = after.contains(element);
		if (inAfter && !inBefore) {
			return Change.ADDED;
		}
		if (inBefore && !inAfter) {
			return Change.REMOVED;
		}
		return Change.UNCHANGED;
	}
}
