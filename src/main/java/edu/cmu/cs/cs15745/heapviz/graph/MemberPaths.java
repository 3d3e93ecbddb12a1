package edu.cmu.cs.cs15745.heapviz.graph;

/**
 * Names of the members of a panel, used as the ports edges start from.
 * Nested members are qualified by their parent: "next.val", "data[0]".
 */
public final class MemberPaths {
	private MemberPaths() { }

	public static String field(String prefix, String name) {
		return prefix.isEmpty() ? name : prefix + "." + name;
	}

	public static String element(String prefix, String index) {
		return prefix.isEmpty() ? index : prefix + "[" + index + "]";
	}
}
