package WFST.Ops;

import WFST.FstTestUtils;
import WFST.Model.VectorFst;
import WFST.Properties;
import WFST.SymbolTable;
import WFST.Verify;
import WFST.Weight.TropicalSemiring;
import WFST.Weight.TropicalWeight;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static WFST.FstTestUtils.arc;
import static WFST.FstTestUtils.w;

public class InvertTest {
  private static VectorFst<TropicalWeight> withSymbols() {
    final VectorFst<TropicalWeight> fst = FstTestUtils.singleArc();
    fst.addArc(1, arc(0, 4, 1, 0));
    fst.setInputSymbols(symbols("in"));
    fst.setOutputSymbols(symbols("out"));
    return fst;
  }

  /** Covers labels 0 to 5, so either side can check against either table. */
  private static SymbolTable symbols(String name) {
    final SymbolTable syms = new SymbolTable(name);
    syms.addSymbol("<eps>");
    for (String symbol : Arrays.asList("a", "b", "c", "d", "e")) {
      syms.addSymbol(symbol);
    }
    return syms;
  }

  @Test
  void testInvertInPlace() {
    final VectorFst<TropicalWeight> fst = FstTestUtils.singleArc();
    Invert.invert(fst);
    Assertions.assertEquals(Arrays.asList(arc(5, 2, 2, 1)), FstTestUtils.arcList(fst, 0));
    Assertions.assertEquals(w(3), fst.finalWeight(1));
    Assertions.assertEquals(0, fst.start());
  }

  @Test
  void testInvolution() {
    final VectorFst<TropicalWeight> fst = withSymbols();
    Invert.invert(fst);
    Invert.invert(fst);
    FstTestUtils.assertSameFst(withSymbols(), fst);
    Assertions.assertEquals("in", fst.inputSymbols().getName());
    Assertions.assertEquals("out", fst.outputSymbols().getName());
  }

  @Test
  void testSymbolsSwapped() {
    final VectorFst<TropicalWeight> fst = withSymbols();
    Invert.invert(fst);
    Assertions.assertEquals("out", fst.inputSymbols().getName());
    Assertions.assertEquals("in", fst.outputSymbols().getName());
    Assertions.assertEquals(Arrays.asList(arc(4, 0, 1, 0)), FstTestUtils.arcList(fst, 1));
    Assertions.assertEquals(1, fst.numOutputEpsilons(1));
    Assertions.assertEquals(0, fst.numInputEpsilons(1));
  }

  @Test
  void testInvertIntoOther() {
    final VectorFst<TropicalWeight> source = withSymbols();
    final VectorFst<TropicalWeight> out = new VectorFst<>(TropicalSemiring.INSTANCE);
    out.addStates(7);
    Invert.invert(source, out);
    Assertions.assertEquals(2, out.numStates());
    Assertions.assertEquals(Arrays.asList(arc(4, 0, 1, 0)), FstTestUtils.arcList(out, 1));
    Assertions.assertEquals("out", out.inputSymbols().getName());
    // source untouched
    Assertions.assertEquals(Arrays.asList(arc(2, 5, 2, 1)), FstTestUtils.arcList(source, 0));
    Assertions.assertEquals("in", source.inputSymbols().getName());
  }

  @Test
  void testPropertiesSwapped() {
    final VectorFst<TropicalWeight> fst = withSymbols();
    fst.addArc(0, arc(3, 5, 0, 1));
    fst.properties(Properties.FST_PROPERTIES, true);
    Assertions.assertEquals(Properties.I_DETERMINISTIC | Properties.NON_O_DETERMINISTIC,
        fst.properties(Properties.I_DETERMINISTIC | Properties.NON_O_DETERMINISTIC, false));
    Invert.invert(fst);
    Assertions.assertEquals(Properties.NON_I_DETERMINISTIC | Properties.O_DETERMINISTIC,
        fst.properties(Properties.NON_I_DETERMINISTIC | Properties.O_DETERMINISTIC, false));
    Assertions.assertTrue(Verify.verify(fst));
  }

  @Test
  void testDelayedInvert() {
    final VectorFst<TropicalWeight> source = withSymbols();
    final InvertFst<TropicalWeight> fst = new InvertFst<>(source);
    final VectorFst<TropicalWeight> eager = withSymbols();
    Invert.invert(eager);
    FstTestUtils.assertSameFst(eager, fst);
    Assertions.assertEquals("invert", fst.type());
    Assertions.assertEquals("out", fst.inputSymbols().getName());
    Assertions.assertEquals("in", fst.outputSymbols().getName());
    Assertions.assertEquals(0, fst.properties(Properties.EXPANDED, false));
  }

  @Test
  void testNoStart() {
    final VectorFst<TropicalWeight> fst = withSymbols();
    fst.setStart(-1);
    Invert.invert(fst);
    // only the symbol tables change
    Assertions.assertEquals(Arrays.asList(arc(2, 5, 2, 1)), FstTestUtils.arcList(fst, 0));
    Assertions.assertEquals("out", fst.inputSymbols().getName());
  }
}
