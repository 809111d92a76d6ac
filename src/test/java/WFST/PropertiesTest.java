package WFST;

import WFST.Model.VectorFst;
import WFST.Ops.Closure;
import WFST.Ops.ClosureType;
import WFST.Ops.Invert;
import WFST.Weight.TropicalSemiring;
import WFST.Weight.TropicalWeight;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static WFST.FstTestUtils.arc;
import static WFST.FstTestUtils.w;

public class PropertiesTest {
  private static void assertHas(long props, long bits) {
    Assertions.assertEquals(bits, props & bits, "missing: " + Properties.describe(bits & ~props));
  }

  private static void assertStoredCompatible(MutableFst<TropicalWeight> fst) {
    final long stored = fst.properties(Properties.FST_PROPERTIES, false);
    final long computed = PropertyComputation.compute(fst, Properties.FST_PROPERTIES).getProperties();
    Assertions.assertTrue(Properties.compatProperties(stored, computed),
        "stored: " + Properties.describe(stored) + " computed: " + Properties.describe(computed));
  }

  @Test
  void testKnownAndCompat() {
    final long known = Properties.knownProperties(Properties.ACCEPTOR | Properties.NOT_STRING);
    assertHas(known, Properties.ACCEPTOR | Properties.NOT_ACCEPTOR | Properties.STRING | Properties.NOT_STRING);
    assertHas(known, Properties.BINARY_PROPERTIES);
    Assertions.assertEquals(0, known & (Properties.CYCLIC | Properties.ACYCLIC));

    Assertions.assertFalse(Properties.compatProperties(Properties.ACCEPTOR, Properties.NOT_ACCEPTOR));
    Assertions.assertTrue(Properties.compatProperties(Properties.ACCEPTOR | Properties.CYCLIC, Properties.ACCEPTOR));
    Assertions.assertTrue(Properties.compatProperties(Properties.TOP_SORTED, 0));
    Assertions.assertFalse(Properties.compatProperties(Properties.MUTABLE, 0));

    Assertions.assertEquals("expanded, acceptor", Properties.describe(Properties.EXPANDED | Properties.ACCEPTOR));
  }

  @Test
  void testTransferFunctions() {
    assertHas(Properties.setStartProperties(Properties.ACYCLIC), Properties.INITIAL_ACYCLIC);
    Assertions.assertEquals(0, Properties.setStartProperties(Properties.ACCESSIBLE) & Properties.ACCESSIBLE);

    final TropicalWeight zero = TropicalWeight.ZERO;
    final TropicalWeight one = TropicalWeight.ONE;
    long props = Properties.setFinalProperties(Properties.UNWEIGHTED, zero, w(2), zero, one);
    assertHas(props, Properties.WEIGHTED);
    Assertions.assertEquals(0, props & Properties.UNWEIGHTED);

    props = Properties.addArcProperties(Properties.NULL_PROPERTIES, 1, arc(0, 3, 1, 1), arc(5, 5, 0, 2), zero, one);
    assertHas(props, Properties.NOT_ACCEPTOR | Properties.I_EPSILONS | Properties.NOT_I_LABEL_SORTED
        | Properties.NOT_TOP_SORTED | Properties.WEIGHTED);
    Assertions.assertEquals(0, props & (Properties.ACCEPTOR | Properties.TOP_SORTED | Properties.ACYCLIC));

    props = Properties.deleteAllStatesProperties(Properties.ERROR | Properties.CYCLIC, Properties.EXPANDED);
    Assertions.assertEquals(Properties.ERROR | Properties.NULL_PROPERTIES | Properties.EXPANDED, props);

    props = Properties.invertProperties(Properties.I_DETERMINISTIC | Properties.NO_O_EPSILONS | Properties.ACYCLIC);
    Assertions.assertEquals(Properties.O_DETERMINISTIC | Properties.NO_I_EPSILONS | Properties.ACYCLIC, props);
  }

  @Test
  void testNewFst() {
    final VectorFst<TropicalWeight> fst = new VectorFst<>(TropicalSemiring.INSTANCE);
    Assertions.assertEquals(Properties.NULL_PROPERTIES | Properties.EXPANDED | Properties.MUTABLE,
        fst.properties(Properties.FST_PROPERTIES, false));
  }

  @Test
  void testComputeString() {
    final PropertyComputation.Result result =
        PropertyComputation.compute(FstTestUtils.singleArc(), Properties.FST_PROPERTIES);
    Assertions.assertEquals(Properties.FST_PROPERTIES, result.getKnown());
    assertHas(result.getProperties(), Properties.EXPANDED | Properties.MUTABLE | Properties.NOT_ACCEPTOR
        | Properties.I_DETERMINISTIC | Properties.NO_EPSILONS | Properties.WEIGHTED | Properties.ACYCLIC
        | Properties.INITIAL_ACYCLIC | Properties.TOP_SORTED | Properties.ACCESSIBLE | Properties.CO_ACCESSIBLE
        | Properties.STRING | Properties.UNWEIGHTED_CYCLES);
  }

  @Test
  void testComputeCyclic() {
    final VectorFst<TropicalWeight> fst = new VectorFst<>(TropicalSemiring.INSTANCE);
    fst.addStates(3);
    fst.setStart(0);
    fst.addArc(0, arc(1, 1, 0, 1));
    fst.addArc(0, arc(1, 1, 0, 1));
    fst.addArc(1, arc(2, 2, 2, 0));
    fst.setFinal(1);
    final long props = PropertyComputation.compute(fst, Properties.FST_PROPERTIES).getProperties();
    assertHas(props, Properties.CYCLIC | Properties.INITIAL_CYCLIC | Properties.WEIGHTED_CYCLES
        | Properties.NOT_TOP_SORTED | Properties.NOT_STRING | Properties.NON_I_DETERMINISTIC
        | Properties.NOT_ACCESSIBLE | Properties.NOT_CO_ACCESSIBLE | Properties.ACCEPTOR);
  }

  @Test
  void testPropertiesOnDemand() {
    final VectorFst<TropicalWeight> fst = FstTestUtils.singleArc();
    // adding states forgets accessibility
    Assertions.assertEquals(0, fst.properties(Properties.ACCESSIBLE | Properties.NOT_ACCESSIBLE, false));
    Assertions.assertEquals(Properties.ACCESSIBLE, fst.properties(Properties.ACCESSIBLE, true));
    Assertions.assertEquals(Properties.ACCESSIBLE, fst.properties(Properties.ACCESSIBLE, false));
  }

  @Test
  void testStoredBitsAreTrusted() {
    final VectorFst<TropicalWeight> fst = FstTestUtils.singleArc();
    fst.setProperties(Properties.CYCLIC, Properties.CYCLIC | Properties.ACYCLIC);
    Assertions.assertEquals(Properties.CYCLIC, fst.properties(Properties.CYCLIC, true));
    Assertions.assertFalse(Verify.verify(fst));

    final boolean verify = FstFlags.VERIFY_PROPERTIES;
    FstFlags.VERIFY_PROPERTIES = true;
    try {
      assertHas(PropertyComputation.test(fst, Properties.CYCLIC).getProperties(), Properties.ACYCLIC);
    } finally {
      FstFlags.VERIFY_PROPERTIES = verify;
    }
  }

  @Test
  void testErrorIsNotScanned() {
    final VectorFst<TropicalWeight> fst = FstTestUtils.singleArc();
    fst.setProperties(Properties.ERROR, Properties.ERROR);
    final PropertyComputation.Result result = PropertyComputation.compute(fst, Properties.FST_PROPERTIES);
    Assertions.assertEquals(Properties.BINARY_PROPERTIES, result.getKnown());
    Assertions.assertEquals(Properties.ERROR | Properties.EXPANDED | Properties.MUTABLE, result.getProperties());
    // sticky
    fst.setProperties(0, Properties.FST_PROPERTIES);
    Assertions.assertEquals(Properties.ERROR, fst.properties(Properties.ERROR, false));
  }

  @Test
  void testStoredStaysCompatible() {
    final VectorFst<TropicalWeight> fst = FstTestUtils.chain(4);
    assertStoredCompatible(fst);
    fst.addArc(4, arc(0, 0, 2, 2));
    assertStoredCompatible(fst);
    fst.setFinal(2, w(1.5f));
    assertStoredCompatible(fst);
    for (MutableArcIterator<TropicalWeight> aiter = fst.mutableArcs(1); !aiter.done(); aiter.next()) {
      aiter.setValue(aiter.value().withLabels(7, 0));
    }
    assertStoredCompatible(fst);
    fst.deleteArcs(4);
    assertStoredCompatible(fst);
    fst.deleteStates(IntArrayList.wrap(new int[]{3}));
    assertStoredCompatible(fst);
    Invert.invert(fst);
    assertStoredCompatible(fst);
    Closure.closure(fst, ClosureType.CLOSURE_STAR);
    assertStoredCompatible(fst);
    fst.properties(Properties.FST_PROPERTIES, true);
    Assertions.assertTrue(Verify.verify(fst));
    fst.deleteStates();
    assertStoredCompatible(fst);
  }
}
