package WFST.Model;

import WFST.FstTestUtils;
import WFST.MutableArcIterator;
import WFST.MutableFst;
import WFST.Properties;
import WFST.SymbolTable;
import WFST.Weight.TropicalWeight;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static WFST.FstTestUtils.arc;
import static WFST.FstTestUtils.w;

public class CopyOnWriteTest {
  @Test
  void testCopyShares() {
    final VectorFst<TropicalWeight> a = FstTestUtils.chain(3);
    final VectorFst<TropicalWeight> b = a.copy();
    Assertions.assertTrue(a.sharesImplWith(b));
    Assertions.assertEquals(2, a.holders());
    FstTestUtils.assertSameFst(a, b);
  }

  @Test
  void testMutationIsolated() {
    final VectorFst<TropicalWeight> a = FstTestUtils.chain(3);
    final VectorFst<TropicalWeight> b = a.copy();
    b.addArc(0, arc(9, 9, 0, 3));
    b.setFinal(1, w(4));

    Assertions.assertFalse(a.sharesImplWith(b));
    Assertions.assertEquals(1, a.numArcs(0));
    Assertions.assertEquals(TropicalWeight.ZERO, a.finalWeight(1));
    Assertions.assertEquals(2, b.numArcs(0));
    Assertions.assertEquals(1, a.holders());
    Assertions.assertEquals(1, b.holders());

    // unique now, so no further copies
    final VectorFstImpl<TropicalWeight> impl = b.getImpl();
    b.addState();
    Assertions.assertSame(impl, b.getImpl());
  }

  @Test
  void testReleaseLetsHolderMutateInPlace() {
    final VectorFst<TropicalWeight> a = FstTestUtils.chain(3);
    final VectorFstImpl<TropicalWeight> impl = a.getImpl();
    final VectorFst<TropicalWeight> b = a.copy();
    b.release();
    Assertions.assertEquals(1, a.holders());
    a.addState();
    Assertions.assertSame(impl, a.getImpl());
    Assertions.assertThrows(IllegalStateException.class, b::start);
  }

  @Test
  void testSafeCopyNeverShares() {
    final VectorFst<TropicalWeight> a = FstTestUtils.chain(3);
    final VectorFst<TropicalWeight> b = a.copy(true);
    Assertions.assertFalse(a.sharesImplWith(b));
    Assertions.assertEquals(1, a.holders());
    FstTestUtils.assertSameFst(a, b);
  }

  @Test
  void testSafeCopyReadConcurrently() throws InterruptedException {
    final VectorFst<TropicalWeight> a = FstTestUtils.chain(50);
    final VectorFst<TropicalWeight> b = a.copy(true);
    final List<Integer> expected = FstTestUtils.stateList(b);
    final AtomicReference<Throwable> failure = new AtomicReference<>();

    final Thread writer = new Thread(() -> {
      try {
        for (int i = 0; i < 2000; i++) {
          final int s = a.addState();
          a.addArc(s, arc(1, 1, 0, 0));
          a.setFinal(i % 50, w(i));
        }
      } catch (Throwable t) {
        failure.set(t);
      }
    });
    writer.start();
    for (int i = 0; i < 200; i++) {
      Assertions.assertEquals(51, b.numStates());
      Assertions.assertEquals(expected, FstTestUtils.stateList(b));
      Assertions.assertEquals(TropicalWeight.ONE, b.finalWeight(50));
      Assertions.assertEquals(TropicalWeight.ZERO, b.finalWeight(0));
    }
    writer.join();
    Assertions.assertNull(failure.get());
    Assertions.assertEquals(2051, a.numStates());
    Assertions.assertEquals(51, b.numStates());
  }

  @Test
  void testIntrinsicPropertiesDoNotFork() {
    final VectorFst<TropicalWeight> a = FstTestUtils.chain(3);
    final VectorFst<TropicalWeight> b = a.copy();
    b.setProperties(Properties.ACYCLIC, Properties.ACYCLIC | Properties.CYCLIC);
    Assertions.assertTrue(a.sharesImplWith(b));
    Assertions.assertEquals(Properties.ACYCLIC, a.properties(Properties.ACYCLIC, false));

    b.setProperties(Properties.ERROR, Properties.ERROR);
    Assertions.assertFalse(a.sharesImplWith(b));
    Assertions.assertEquals(0, a.properties(Properties.ERROR, false));
    Assertions.assertEquals(Properties.ERROR, b.properties(Properties.ERROR, false));
  }

  @Test
  void testMutableArcIteratorForksOnWrite() {
    final VectorFst<TropicalWeight> a = FstTestUtils.chain(3);
    final VectorFst<TropicalWeight> b = a.copy();
    final MutableArcIterator<TropicalWeight> aiter = b.mutableArcs(1);
    Assertions.assertEquals(arc(2, 2, 1, 2), aiter.value());
    Assertions.assertTrue(a.sharesImplWith(b));

    aiter.setValue(aiter.value().withWeight(w(7)));
    Assertions.assertFalse(a.sharesImplWith(b));
    Assertions.assertEquals(arc(2, 2, 7, 2), aiter.value());
    Assertions.assertEquals(arc(2, 2, 1, 2), FstTestUtils.arcList(a, 1).get(0));
  }

  @Test
  void testDeleteAllStatesOnSharedImpl() {
    final VectorFst<TropicalWeight> a = FstTestUtils.chain(3);
    final SymbolTable syms = new SymbolTable("out");
    syms.addSymbol("x");
    a.setOutputSymbols(syms);
    final MutableFst<TropicalWeight> b = a.copy();
    b.deleteStates();

    Assertions.assertEquals(0, b.numStates());
    Assertions.assertEquals(syms, b.outputSymbols());
    Assertions.assertNotSame(a.outputSymbols(), b.outputSymbols());
    Assertions.assertEquals(4, a.numStates());
    Assertions.assertEquals(1, a.holders());
  }

  @Test
  void testSymbolChangeForks() {
    final VectorFst<TropicalWeight> a = FstTestUtils.chain(1);
    final VectorFst<TropicalWeight> b = a.copy();
    b.setInputSymbols(new SymbolTable("b"));
    Assertions.assertNull(a.inputSymbols());
    Assertions.assertEquals("b", b.inputSymbols().getName());
  }

  @Test
  void testManyHandles() {
    final VectorFst<TropicalWeight> a = FstTestUtils.chain(2);
    final List<VectorFst<TropicalWeight>> copies = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      copies.add(a.copy());
    }
    Assertions.assertEquals(6, a.holders());
    copies.get(2).addState();
    Assertions.assertEquals(5, a.holders());
    for (VectorFst<TropicalWeight> c : copies) {
      c.release();
    }
    Assertions.assertEquals(1, a.holders());
    Assertions.assertEquals(Collections.singletonList(arc(1, 1, 1, 1)), FstTestUtils.arcList(a, 0));
  }
}
