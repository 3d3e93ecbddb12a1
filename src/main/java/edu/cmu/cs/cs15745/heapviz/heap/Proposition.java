package edu.cmu.cs.cs15745.heapviz.heap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import edu.cmu.cs.cs15745.heapviz.util.Util;

/**
 * A symbolic heap: an ordered list of heap cells (the spatial part, sigma)
 * plus an ordered list of pure atoms (pi).
 */
public final class Proposition {
	private final List<HeapCell> sigma;
	private final List<Atom> pi;

	public Proposition(List<HeapCell> sigma, List<Atom> pi) {
		this.sigma = Collections.unmodifiableList(new ArrayList<>(sigma));
		this.pi = Collections.unmodifiableList(new ArrayList<>(pi));
	}

	public static Proposition of(HeapCell... cells) {
		return new Proposition(List.of(cells), List.of());
	}

	public List<HeapCell> sigma() {
		return sigma;
	}

	public List<Atom> pi() {
		return pi;
	}

	/** Cells allocated at a local program variable. */
	public List<HeapCell> stackCells() {
		return sigma.stream()
			.filter(cell -> cell.address().isStackVariable())
			.collect(Collectors.toList());
	}

	/** A copy of this proposition with the given cells placed before the existing ones. */
	public Proposition withLeadingCells(List<HeapCell> cells) {
		List<HeapCell> result = new ArrayList<>(cells);
		result.addAll(sigma);
		return new Proposition(result, pi);
	}

	@Override
	public int hashCode() {
		return 31 * sigma.hashCode() + pi.hashCode();
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Proposition)) return false;
		Proposition other = (Proposition) o;
		return sigma.equals(other.sigma) && pi.equals(other.pi);
	}

	@Override
	public String toString() {
		return String.format("%s | %s", Util.join(" * ", sigma), Util.join(" & ", pi));
	}
}
