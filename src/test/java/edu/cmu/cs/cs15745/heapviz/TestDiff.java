package edu.cmu.cs.cs15745.heapviz;

import static edu.cmu.cs.cs15745.heapviz.Heaps.pointsTo;

import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import edu.cmu.cs.cs15745.heapviz.graph.Color;
import edu.cmu.cs.cs15745.heapviz.heap.Address;
import edu.cmu.cs.cs15745.heapviz.heap.Atom;
import edu.cmu.cs.cs15745.heapviz.heap.Proposition;

public class TestDiff {
  private static final Address X = Address.local("x");

  @Test
  public void test1() {
    var kept = pointsTo("k", "v");
    var removed = pointsTo(X, Address.constant(1));
    var added = pointsTo(X, Address.constant(2));
    var pre = Proposition.of(kept, removed);
    var post = Proposition.of(kept, added);
    var diff = new PropositionDiff(pre, post);
    Assert.assertEquals(DiffOracle.Change.UNCHANGED, diff.classify(kept));
    Assert.assertEquals(DiffOracle.Change.REMOVED, diff.classify(removed));
    Assert.assertEquals(DiffOracle.Change.ADDED, diff.classify(added));
  }

  @Test
  public void test2() {
    var same = Atom.neq(X, Address.NIL);
    var fresh = Atom.eq(Address.logical("r"), Address.NIL);
    var pre = new Proposition(List.of(), List.of(same));
    var post = new Proposition(List.of(), List.of(same, fresh));
    var colors = DiffColorer.colorMap(new PropositionDiff(pre, post));
    Assert.assertEquals(Color.ORANGE, colors.color(same));
    Assert.assertEquals(Color.RED, colors.color(fresh));
  }

  @Test
  public void test3() {
    var cell = pointsTo("k", "v");
    var colors = DiffColorer.colorMap(new PropositionDiff(Proposition.of(cell), Proposition.of(cell)));
    Assert.assertEquals(Color.BLACK, colors.color(cell));
    Assert.assertEquals(Color.RED, colors.color(pointsTo("k", "w")));
    Assert.assertEquals(Color.BLACK, ColorMap.BASELINE.color(pointsTo("k", "w")));
  }
}
