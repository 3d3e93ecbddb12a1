package edu.cmu.cs.cs15745.heapviz;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import edu.cmu.cs.cs15745.heapviz.graph.Color;
import edu.cmu.cs.cs15745.heapviz.heap.Address;
import edu.cmu.cs.cs15745.heapviz.heap.Content;
import edu.cmu.cs.cs15745.heapviz.heap.HeapCell;
import edu.cmu.cs.cs15745.heapviz.heap.HeapCell.DllSeg;
import edu.cmu.cs.cs15745.heapviz.heap.HeapCell.ListSeg;
import edu.cmu.cs.cs15745.heapviz.heap.HeapCell.PointsTo;
import edu.cmu.cs.cs15745.heapviz.util.Pair;

/**
 * Finds the addresses a layer refers to without allocating them and gives
 * each of them one dangling node. Only direct references are considered here;
 * members of nested content are resolved lazily while linking.
 */
final class DanglingResolver {
	private final RenderContext context;
	private final int level;
	private final int layer;

	DanglingResolver(RenderContext context, int level, int layer) {
		this.context = Objects.requireNonNull(context);
		this.level = level;
		this.layer = layer;
	}

	/**
	 * Registers the dangling nodes of the layer with the context, in order of
	 * first reference.
	 */
	void resolve(List<HeapCell> cells) {
		var allocated = allocatedAddresses(cells);
		var referenced = referencedAddresses(cells);
		for (var ref : referenced) {
			Address address = ref.fst();
			if (context.prover().isProvablyZero(address) || contains(allocated, address)) {
				continue;
			}
			if (context.findDangling(layer, address).isPresent()) {
				continue;
			}
			context.danglingFor(layer, level, address, ref.snd());
		}
	}

	// Addresses with a box of their own in this layer.
	List<Address> allocatedAddresses(List<HeapCell> cells) {
		var result = new ArrayList<Address>();
		var visitor = new HeapCell.StatefulVisitor() {
			@Override
			public void iterPointsTo(PointsTo p) {
				result.add(p.address());
			}

			@Override
			public void iterStruct(HeapCell.Struct s) {
				result.add(s.address());
			}

			@Override
			public void iterArray(HeapCell.Array a) {
				result.add(a.address());
			}

			@Override
			public void iterListSeg(ListSeg l) {
				result.add(l.first());
			}

			@Override
			public void iterDllSeg(DllSeg d) {
				result.add(d.first());
				result.add(d.last());
			}
		}.visitor();
		cells.forEach(c -> c.accept(visitor));
		return result;
	}

	// Each reference with the color of the cell making it.
	private List<Pair<Address, Color>> referencedAddresses(List<HeapCell> cells) {
		var result = new ArrayList<Pair<Address, Color>>();
		for (var cell : cells) {
			Color color = context.colors().color(cell);
			cell.accept(new HeapCell.StatefulVisitor() {
				@Override
				public void iterPointsTo(PointsTo p) {
					if (p.content() instanceof Content.Scalar) {
						result.add(Pair.of(((Content.Scalar) p.content()).value(), color));
					}
				}

				@Override
				public void iterListSeg(ListSeg l) {
					result.add(Pair.of(l.last(), color));
				}

				@Override
				public void iterDllSeg(DllSeg d) {
					result.add(Pair.of(d.lastNext(), color));
					result.add(Pair.of(d.firstPrev(), color));
				}
			}.visitor());
		}
		return result;
	}

	private boolean contains(List<Address> addresses, Address address) {
		for (var a : addresses) {
			if (context.prover().structuralEquality(a, address)) {
				return true;
			}
		}
		return false;
	}
}
