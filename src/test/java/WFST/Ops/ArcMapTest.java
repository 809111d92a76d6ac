package WFST.Ops;

import WFST.Arc;
import WFST.FstTestUtils;
import WFST.Model.VectorFst;
import WFST.Properties;
import WFST.SymbolTable;
import WFST.Weight.TropicalSemiring;
import WFST.Weight.TropicalWeight;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static WFST.FstTestUtils.arc;
import static WFST.FstTestUtils.w;

public class ArcMapTest {
  /** Adds one to every non-zero weight, final weights included. */
  private static class PlusOneMapper implements ArcMapper<TropicalWeight> {
    @Override
    public Arc<TropicalWeight> map(Arc<TropicalWeight> arc) {
      if (arc.getWeight().equals(TropicalWeight.ZERO)) {
        return arc;
      }
      return arc.withWeight(TropicalSemiring.INSTANCE.times(arc.getWeight(), w(1)));
    }

    @Override
    public MapSymbolsAction inputSymbolsAction() {
      return MapSymbolsAction.COPY;
    }

    @Override
    public MapSymbolsAction outputSymbolsAction() {
      return MapSymbolsAction.NOOP;
    }

    @Override
    public long properties(long inprops) {
      return inprops & ~(Properties.WEIGHTED | Properties.UNWEIGHTED | Properties.WEIGHTED_CYCLES
          | Properties.UNWEIGHTED_CYCLES);
    }
  }

  /** Asks for a superfinal arc, which is not supported. */
  private static class SuperfinalMapper extends PlusOneMapper {
    @Override
    public Arc<TropicalWeight> map(Arc<TropicalWeight> arc) {
      if (arc.getNextState() == Arc.NO_STATE_ID) {
        return new Arc<>(1, 1, arc.getWeight(), Arc.NO_STATE_ID);
      }
      return arc;
    }
  }

  private static VectorFst<TropicalWeight> source() {
    final VectorFst<TropicalWeight> fst = FstTestUtils.singleArc();
    final SymbolTable syms = new SymbolTable("in");
    syms.addSymbol("<eps>");
    fst.setInputSymbols(syms);
    fst.setOutputSymbols(syms);
    return fst;
  }

  @Test
  void testMapInPlace() {
    final VectorFst<TropicalWeight> fst = source();
    ArcMap.map(fst, new PlusOneMapper());
    Assertions.assertEquals(Arrays.asList(arc(2, 5, 3, 1)), FstTestUtils.arcList(fst, 0));
    Assertions.assertEquals(w(4), fst.finalWeight(1));
    Assertions.assertEquals(TropicalWeight.ZERO, fst.finalWeight(0));
    Assertions.assertEquals("in", fst.inputSymbols().getName());
    Assertions.assertEquals("in", fst.outputSymbols().getName());
    Assertions.assertEquals(0, fst.properties(Properties.ERROR, false));
  }

  @Test
  void testMapIntoOther() {
    final VectorFst<TropicalWeight> out = new VectorFst<>(TropicalSemiring.INSTANCE);
    ArcMap.map(source(), out, new PlusOneMapper());
    Assertions.assertEquals(Arrays.asList(arc(2, 5, 3, 1)), FstTestUtils.arcList(out, 0));
    Assertions.assertEquals(w(4), out.finalWeight(1));
    Assertions.assertEquals("in", out.inputSymbols().getName());
    // NOOP leaves the target's own table alone
    Assertions.assertNull(out.outputSymbols());
  }

  @Test
  void testDelayedMap() {
    final ArcMapFst<TropicalWeight> fst = new ArcMapFst<>(source(), new PlusOneMapper());
    final VectorFst<TropicalWeight> eager = source();
    ArcMap.map(eager, new PlusOneMapper());
    Assertions.assertEquals("map", fst.type());
    Assertions.assertEquals(eager.start(), fst.start());
    Assertions.assertEquals(FstTestUtils.arcList(eager, 0), FstTestUtils.arcList(fst, 0));
    Assertions.assertEquals(eager.finalWeight(1), fst.finalWeight(1));
    Assertions.assertEquals("in", fst.inputSymbols().getName());
    Assertions.assertNull(fst.outputSymbols());
  }

  @Test
  void testSuperfinalIsAnError() {
    final VectorFst<TropicalWeight> fst = source();
    ArcMap.map(fst, new SuperfinalMapper());
    Assertions.assertEquals(Properties.ERROR, fst.properties(Properties.ERROR, false));
    Assertions.assertEquals(w(3), fst.finalWeight(1));

    final ArcMapFst<TropicalWeight> delayed = new ArcMapFst<>(source(), new SuperfinalMapper());
    Assertions.assertEquals(0, delayed.properties(Properties.ERROR, false));
    Assertions.assertEquals(TropicalWeight.NO_WEIGHT, delayed.finalWeight(1));
    Assertions.assertEquals(Properties.ERROR, delayed.properties(Properties.ERROR, false));
  }
}
