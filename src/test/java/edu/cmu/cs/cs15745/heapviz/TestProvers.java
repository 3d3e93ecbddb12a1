package edu.cmu.cs.cs15745.heapviz;

import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import edu.cmu.cs.cs15745.heapviz.heap.Address;
import edu.cmu.cs.cs15745.heapviz.heap.Atom;

public class TestProvers {
  private static final Address A = Address.logical("a");
  private static final Address B = Address.logical("b");
  private static final Address C = Address.logical("c");

  @Test
  public void test1() {
    var prover = Provers.SYNTACTIC;
    Assert.assertTrue(prover.isProvablyZero(Address.NIL));
    Assert.assertTrue(prover.isProvablyZero(Address.constant(0)));
    Assert.assertFalse(prover.isProvablyZero(A));
    Assert.assertTrue(prover.structuralEquality(A, Address.logical("a")));
    Assert.assertFalse(prover.structuralEquality(A, Address.expression("a")));
  }

  @Test
  public void test2() {
    var prover = Provers.fromPureFacts(List.of(Atom.eq(A, B), Atom.eq(B, Address.NIL), Atom.neq(C, Address.NIL)));
    Assert.assertTrue(prover.isProvablyZero(A));
    Assert.assertTrue(prover.isProvablyZero(B));
    Assert.assertFalse(prover.isProvablyZero(C));
    Assert.assertTrue(prover.isProvablyZero(Address.NIL));
  }

  @Test
  public void test3() {
    var prover = Provers.fromPureFacts(List.of(Atom.le(A, Address.NIL), Atom.lt(B, Address.NIL)));
    Assert.assertFalse(prover.isProvablyZero(A));
    Assert.assertFalse(prover.isProvablyZero(B));
  }
}
