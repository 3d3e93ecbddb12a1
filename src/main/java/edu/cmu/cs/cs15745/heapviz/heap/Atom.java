package edu.cmu.cs.cs15745.heapviz.heap;

import java.util.Objects;

/**
 * An atom of the pure part of a proposition:
 * <ul>
 * <li>lhs = rhs (equality)</li>
 * <li>lhs != rhs (disequality)</li>
 * <li>lhs <= rhs, lhs < rhs (inequality)</li>
 * </ul>
 */
public final class Atom {
	public enum Kind {
		EQUALITY("equality", "="),
		DISEQUALITY("disequality", "!="),
		LESS_EQUAL("inequality", "<="),
		LESS_THAN("inequality", "<");

		private final String category;
		private final String operator;

		Kind(String category, String operator) {
			this.category = category;
			this.operator = operator;
		}

		/** One of "equality", "disequality" or "inequality". */
		public String category() {
			return category;
		}

		public String operator() {
			return operator;
		}
	}

	private final Kind kind;
	private final Address lhs;
	private final Address rhs;

	public Atom(Kind kind, Address lhs, Address rhs) {
		this.kind = Objects.requireNonNull(kind);
		this.lhs = Objects.requireNonNull(lhs);
		this.rhs = Objects.requireNonNull(rhs);
	}

	public static Atom eq(Address lhs, Address rhs) {
		return new Atom(Kind.EQUALITY, lhs, rhs);
	}

	public static Atom neq(Address lhs, Address rhs) {
		return new Atom(Kind.DISEQUALITY, lhs, rhs);
	}

	public static Atom le(Address lhs, Address rhs) {
		return new Atom(Kind.LESS_EQUAL, lhs, rhs);
	}

	public static Atom lt(Address lhs, Address rhs) {
		return new Atom(Kind.LESS_THAN, lhs, rhs);
	}

	public Kind kind() {
		return kind;
	}

	public Address lhs() {
		return lhs;
	}

	public Address rhs() {
		return rhs;
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, lhs, rhs);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Atom)) return false;
		Atom other = (Atom) o;
		return kind == other.kind && lhs.equals(other.lhs) && rhs.equals(other.rhs);
	}

	@Override
	public String toString() {
		return String.format("%s %s %s", lhs, kind.operator(), rhs);
	}
}
