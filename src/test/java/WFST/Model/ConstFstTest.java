package WFST.Model;

import WFST.Arc;
import WFST.FstTestUtils;
import WFST.Ops.InvertFst;
import WFST.Properties;
import WFST.SymbolTable;
import WFST.Weight.TropicalSemiring;
import WFST.Weight.TropicalWeight;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static WFST.FstTestUtils.arc;

public class ConstFstTest {
  @Test
  void testFromVector() {
    final VectorFst<TropicalWeight> vfst = FstTestUtils.chain(4);
    vfst.addArc(2, arc(0, 0, 3, 0));
    final SymbolTable syms = new SymbolTable("in");
    syms.addSymbol("<eps>");
    vfst.setInputSymbols(syms);

    final ConstFst<TropicalWeight> cfst = new ConstFst<>(vfst);
    Assertions.assertEquals("const", cfst.type());
    Assertions.assertEquals(5, cfst.numStates());
    FstTestUtils.assertSameFst(vfst, cfst);
    Assertions.assertEquals(syms, cfst.inputSymbols());
    Assertions.assertEquals(Properties.EXPANDED, cfst.properties(Properties.EXPANDED | Properties.MUTABLE, false));

    // the source can change without affecting the const copy
    vfst.deleteArcs(2);
    Assertions.assertEquals(2, cfst.numArcs(2));
  }

  @Test
  void testFromDelayed() {
    final ConstFst<TropicalWeight> cfst = new ConstFst<>(new InvertFst<>(FstTestUtils.singleArc()));
    Assertions.assertEquals(2, cfst.numStates());
    Assertions.assertEquals(0, cfst.start());
    Assertions.assertEquals(arc(5, 2, 2, 1), FstTestUtils.arcList(cfst, 0).get(0));
  }

  @Test
  void testEmpty() {
    final ConstFst<TropicalWeight> cfst = new ConstFst<>(new VectorFst<>(TropicalSemiring.INSTANCE));
    Assertions.assertEquals(0, cfst.numStates());
    Assertions.assertEquals(Arc.NO_STATE_ID, cfst.start());
    Assertions.assertTrue(FstTestUtils.stateList(cfst).isEmpty());
  }

  @Test
  void testCopiesShare() {
    final ConstFst<TropicalWeight> cfst = new ConstFst<>(FstTestUtils.chain(2));
    final ConstFst<TropicalWeight> unsafe = cfst.copy(false);
    final ConstFst<TropicalWeight> safe = cfst.copy(true);
    Assertions.assertTrue(cfst.sharesImplWith(unsafe));
    Assertions.assertTrue(cfst.sharesImplWith(safe));
    Assertions.assertEquals(3, cfst.holders());
    FstTestUtils.assertSameFst(cfst, safe);
  }
}
