package edu.cmu.cs.cs15745.heapviz.heap;

import java.util.Objects;

/**
 * An address is a program expression used as the location (or the value) of a
 * memory cell. Equality is structural: two addresses are equal when they have
 * the same kind and the same printed text.
 */
public final class Address {
	/** The literal null pointer. Never gets a dangling node. */
	public static final Address NIL = constant(0);

	private static final String RETURN_NAME = "return";

	/**
	 * Kind of expression an address stands for.
	 */
	public enum Kind {
		CONSTANT,
		GLOBAL_VAR,
		LOCAL_VAR,
		RETURN_VAR,
		LOGICAL_VAR,
		// Anonymous/existential values introduced by the analysis for specs.
		SPEC_VAR,
		EXPRESSION;
	}

	private final Kind kind;
	private final String text;

	private Address(Kind kind, String text) {
		this.kind = Objects.requireNonNull(kind);
		this.text = Objects.requireNonNull(text);
	}

	public static Address constant(long value) {
		return new Address(Kind.CONSTANT, Long.toString(value));
	}

	public static Address global(String name) {
		return new Address(Kind.GLOBAL_VAR, "#GB$" + name);
	}

	/** A local program variable; the local called "return" is the return slot. */
	public static Address local(String name) {
		return new Address(RETURN_NAME.equals(name) ? Kind.RETURN_VAR : Kind.LOCAL_VAR, "&" + name);
	}

	public static Address logical(String name) {
		return new Address(Kind.LOGICAL_VAR, name);
	}

	public static Address spec(int stamp) {
		return new Address(Kind.SPEC_VAR, "$spec" + stamp);
	}

	/** Any other expression, e.g. "x+1" or "a[i]". */
	public static Address expression(String text) {
		return new Address(Kind.EXPRESSION, text);
	}

	public Kind kind() {
		return kind;
	}

	public String text() {
		return text;
	}

	public boolean isNil() {
		return equals(NIL);
	}

	public boolean isSpecPlaceholder() {
		return kind == Kind.SPEC_VAR;
	}

	public boolean isStackVariable() {
		return kind == Kind.LOCAL_VAR || kind == Kind.RETURN_VAR;
	}

	/** Kind of memory the address lives in, as reported in the tree document. */
	public String memoryType() {
		switch (kind) {
		case GLOBAL_VAR:
			return "global";
		case RETURN_VAR:
			return "return";
		case LOCAL_VAR:
			return "parameter";
		default:
			return "other";
		}
	}

	@Override
	public int hashCode() {
		return 31 * kind.hashCode() + text.hashCode();
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Address)) return false;
		Address other = (Address) o;
		return kind == other.kind && text.equals(other.text);
	}

	@Override
	public String toString() {
		return text;
	}
}
