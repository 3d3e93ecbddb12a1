package edu.cmu.cs.cs15745.heapviz.heap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A procedure specification: one precondition and the postconditions that
 * can be derived from it.
 */
public final class Spec {
	private final Proposition pre;
	private final List<Proposition> posts;

	public Spec(Proposition pre, List<Proposition> posts) {
		this.pre = Objects.requireNonNull(pre);
		this.posts = Collections.unmodifiableList(new ArrayList<>(posts));
	}

	public Proposition pre() {
		return pre;
	}

	public List<Proposition> posts() {
		return posts;
	}

	@Override
	public String toString() {
		return String.format("PRE: %s\nPOSTS: %s", pre, posts);
	}
}
