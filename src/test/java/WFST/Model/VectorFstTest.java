package WFST.Model;

import WFST.Arc;
import WFST.ArcIterator;
import WFST.FstTestUtils;
import WFST.MutableArcIterator;
import WFST.Properties;
import WFST.SymbolTable;
import WFST.Weight.TropicalSemiring;
import WFST.Weight.TropicalWeight;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static WFST.FstTestUtils.arc;
import static WFST.FstTestUtils.w;

public class VectorFstTest {
  @Test
  void testBuild() {
    final VectorFst<TropicalWeight> fst = new VectorFst<>(TropicalSemiring.INSTANCE);
    Assertions.assertEquals(Arc.NO_STATE_ID, fst.start());
    Assertions.assertEquals(0, fst.numStates());
    Assertions.assertEquals(0, fst.size());
    Assertions.assertEquals("vector", fst.type());
    Assertions.assertEquals("standard", fst.arcType());

    final int s0 = fst.addState();
    final int s1 = fst.addState();
    fst.addStates(2);
    Assertions.assertEquals(0, s0);
    Assertions.assertEquals(1, s1);
    Assertions.assertEquals(4, fst.numStates());
    fst.setStart(s0);
    fst.addArc(s0, arc(0, 3, 1, s1));
    fst.addArc(s0, arc(0, 0, 0, 2));
    fst.addArc(s0, arc(4, 0, 0, 3));
    fst.setFinal(3, w(2));
    fst.setFinal(2);

    Assertions.assertEquals(0, fst.start());
    Assertions.assertEquals(3, fst.numArcs(0));
    Assertions.assertEquals(2, fst.numInputEpsilons(0));
    Assertions.assertEquals(2, fst.numOutputEpsilons(0));
    Assertions.assertEquals(w(2), fst.finalWeight(3));
    Assertions.assertEquals(TropicalWeight.ONE, fst.finalWeight(2));
    Assertions.assertEquals(TropicalWeight.ZERO, fst.finalWeight(1));
    Assertions.assertEquals(Arrays.asList(0, 1, 2, 3), FstTestUtils.stateList(fst));
  }

  @Test
  void testArcIteratorSeek() {
    final VectorFst<TropicalWeight> fst = FstTestUtils.chain(1);
    fst.addArc(0, arc(5, 5, 0, 0));
    fst.addArc(0, arc(6, 6, 0, 1));
    final ArcIterator<TropicalWeight> aiter = fst.arcs(0);
    aiter.seek(2);
    Assertions.assertEquals(6, aiter.value().getILabel());
    Assertions.assertEquals(2, aiter.position());
    aiter.next();
    Assertions.assertTrue(aiter.done());
    aiter.reset();
    Assertions.assertEquals(1, aiter.value().getILabel());
  }

  @Test
  void testSetStartOutOfRange() {
    final VectorFst<TropicalWeight> fst = FstTestUtils.chain(2);
    Assertions.assertThrows(IndexOutOfBoundsException.class, () -> fst.setStart(3));
    Assertions.assertThrows(IndexOutOfBoundsException.class, () -> fst.setStart(-5));
    fst.setStart(Arc.NO_STATE_ID);
    Assertions.assertEquals(Arc.NO_STATE_ID, fst.start());
  }

  @Test
  void testDeleteStatesRenumbers() {
    final VectorFst<TropicalWeight> fst = FstTestUtils.chain(4);
    fst.addArc(0, arc(0, 0, 0, 2));
    fst.addArc(3, arc(9, 9, 0, 0));
    fst.deleteStates(IntArrayList.wrap(new int[]{2}));

    Assertions.assertEquals(4, fst.numStates());
    Assertions.assertEquals(0, fst.start());
    // arcs into the deleted state are gone, including the epsilon
    Assertions.assertEquals(Arrays.asList(arc(1, 1, 1, 1)), FstTestUtils.arcList(fst, 0));
    Assertions.assertEquals(0, fst.numInputEpsilons(0));
    Assertions.assertTrue(FstTestUtils.arcList(fst, 1).isEmpty());
    // old 3 is now 2, old 4 is now 3
    Assertions.assertEquals(Arrays.asList(arc(4, 4, 1, 3), arc(9, 9, 0, 0)), FstTestUtils.arcList(fst, 2));
    Assertions.assertEquals(TropicalWeight.ONE, fst.finalWeight(3));

    fst.deleteStates(IntArrayList.wrap(new int[]{0}));
    Assertions.assertEquals(Arc.NO_STATE_ID, fst.start());
    Assertions.assertEquals(Arrays.asList(arc(4, 4, 1, 2)), FstTestUtils.arcList(fst, 1));
  }

  @Test
  void testDeleteArcs() {
    final VectorFst<TropicalWeight> fst = FstTestUtils.chain(1);
    fst.addArc(0, arc(0, 0, 0, 1));
    fst.addArc(0, arc(2, 0, 0, 1));
    fst.deleteArcs(0, 1);
    Assertions.assertEquals(2, fst.numArcs(0));
    Assertions.assertEquals(1, fst.numInputEpsilons(0));
    Assertions.assertEquals(1, fst.numOutputEpsilons(0));
    fst.deleteArcs(0);
    Assertions.assertEquals(0, fst.numArcs(0));
    Assertions.assertEquals(0, fst.numInputEpsilons(0));
  }

  @Test
  void testDeleteAllStatesKeepsSymbols() {
    final VectorFst<TropicalWeight> fst = FstTestUtils.chain(3);
    final SymbolTable syms = new SymbolTable("in");
    syms.addSymbol("a");
    fst.setInputSymbols(syms);
    fst.setProperties(Properties.ERROR, Properties.ERROR);
    fst.deleteStates();
    Assertions.assertEquals(0, fst.numStates());
    Assertions.assertEquals(Arc.NO_STATE_ID, fst.start());
    Assertions.assertEquals(syms, fst.inputSymbols());
    Assertions.assertEquals(Properties.ERROR | Properties.NULL_PROPERTIES | Properties.EXPANDED | Properties.MUTABLE,
        fst.properties(Properties.FST_PROPERTIES, false));
  }

  @Test
  void testSymbolsAreCopied() {
    final VectorFst<TropicalWeight> fst = FstTestUtils.chain(1);
    final SymbolTable syms = new SymbolTable("in");
    fst.setInputSymbols(syms);
    syms.addSymbol("late");
    Assertions.assertFalse(fst.inputSymbols().member("late"));
    fst.setInputSymbols(null);
    Assertions.assertNull(fst.inputSymbols());
  }

  @Test
  void testMutableArcIterator() {
    final VectorFst<TropicalWeight> fst = FstTestUtils.chain(2);
    fst.addArc(0, arc(7, 7, 0, 2));
    final MutableArcIterator<TropicalWeight> aiter = fst.mutableArcs(0);
    aiter.seek(1);
    aiter.setValue(aiter.value().withLabels(0, 0));
    Assertions.assertEquals(arc(0, 0, 0, 2), FstTestUtils.arcList(fst, 0).get(1));
    Assertions.assertEquals(1, fst.numInputEpsilons(0));
    Assertions.assertEquals(1, fst.numOutputEpsilons(0));
    Assertions.assertEquals(Properties.EPSILONS, fst.properties(Properties.EPSILONS, false));
    Assertions.assertEquals(2, fst.numArcs(0));
  }

  @Test
  void testConvertingCopy() {
    final ConstFst<TropicalWeight> cfst = new ConstFst<>(FstTestUtils.singleArc());
    final VectorFst<TropicalWeight> fst = new VectorFst<>(cfst);
    FstTestUtils.assertSameFst(cfst, fst);
    Assertions.assertEquals(Properties.MUTABLE, fst.properties(Properties.MUTABLE, false));
    fst.addArc(1, arc(1, 1, 0, 0));
    Assertions.assertEquals(0, cfst.numArcs(1));
  }
}
