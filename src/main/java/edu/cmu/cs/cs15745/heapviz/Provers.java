package edu.cmu.cs.cs15745.heapviz;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import edu.cmu.cs.cs15745.heapviz.heap.Address;
import edu.cmu.cs.cs15745.heapviz.heap.Atom;

// Static utility class consisting of different provers.
public final class Provers {
	private Provers() { }

	// Only the literal null pointer is zero; addresses match when equal.
	public static final Prover SYNTACTIC = new Prover() {
		@Override
		public boolean isProvablyZero(Address address) {
			return address.isNil();
		}

		@Override
		public boolean structuralEquality(Address a, Address b) {
			return a.equals(b);
		}

		@Override
		public String toString() {
			return "Syntactic prover";
		}
	};

	/**
	 * Also knows the equalities of a pure part: an address is zero when the
	 * equalities, closed under transitivity, relate it to the null pointer.
	 */
	public static Prover fromPureFacts(List<Atom> pure) {
		var classes = new EqualityClasses();
		for (var atom : pure) {
			if (atom.kind() == Atom.Kind.EQUALITY) {
				classes.union(atom.lhs(), atom.rhs());
			}
		}
		return new Prover() {
			@Override
			public boolean isProvablyZero(Address address) {
				return address.isNil() || classes.find(address).equals(classes.find(Address.NIL));
			}

			@Override
			public boolean structuralEquality(Address a, Address b) {
				return a.equals(b);
			}

			@Override
			public String toString() {
				return String.format("Pure-facts prover (%d equalities)", classes.size());
			}
		};
	}

	// Union-find over addresses.
	private static final class EqualityClasses {
		private final Map<Address, Address> parent = new HashMap<>();

		Address find(Address a) {
			Address root = a;
			while (parent.containsKey(root)) {
				root = parent.get(root);
			}
			// Path compression
			while (!a.equals(root)) {
				Address next = parent.get(a);
				parent.put(a, root);
				a = next;
			}
			return root;
		}

		void union(Address a, Address b) {
			Address ra = find(a);
			Address rb = find(b);
			if (!ra.equals(rb)) {
				parent.put(ra, rb);
			}
		}

		int size() {
			return parent.size();
		}
	}
}
