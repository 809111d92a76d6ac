package WFST.Cache;

import WFST.Arc;
import WFST.FstTestUtils;
import WFST.Model.VectorFst;
import WFST.Ops.Closure;
import WFST.Ops.ClosureFst;
import WFST.Ops.ClosureType;
import WFST.Ops.InvertFst;
import WFST.Weight.TropicalWeight;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static WFST.FstTestUtils.arc;

public class CacheFstTest {
  @Test
  void testExpandsOnlyWhatIsAsked() {
    final CountingFst<TropicalWeight> source = new CountingFst<>(FstTestUtils.chain(100));
    final InvertFst<TropicalWeight> fst = new InvertFst<>(source);
    Assertions.assertEquals(0, source.arcRequests());

    Assertions.assertEquals(0, fst.start());
    Assertions.assertEquals(0, source.arcRequests());
    Assertions.assertEquals(CacheState.Expansion.UNVISITED, fst.expansionState(0));

    Assertions.assertEquals(Arrays.asList(arc(1, 1, 1, 1)), FstTestUtils.arcList(fst, 0));
    Assertions.assertEquals(1, source.arcRequests(0));
    Assertions.assertEquals(CacheState.Expansion.CACHED, fst.expansionState(0));
    Assertions.assertEquals(CacheState.Expansion.UNVISITED, fst.expansionState(1));

    // served from the cache
    Assertions.assertEquals(1, fst.numArcs(0));
    FstTestUtils.arcList(fst, 0);
    Assertions.assertEquals(1, source.arcRequests());
    Assertions.assertEquals(1, fst.numCachedStates());

    // a final weight alone does not expand
    Assertions.assertEquals(TropicalWeight.ONE, fst.finalWeight(100));
    Assertions.assertEquals(CacheState.Expansion.UNVISITED, fst.expansionState(100));
    Assertions.assertEquals(2, fst.numCachedStates());
    Assertions.assertEquals(0, source.arcRequests(100));
  }

  @Test
  void testStateIterationExpandsEachStateOnce() {
    final CountingFst<TropicalWeight> source = new CountingFst<>(FstTestUtils.chain(10));
    final ClosureFst<TropicalWeight> fst = new ClosureFst<>(source, ClosureType.CLOSURE_PLUS);
    final List<Integer> states = FstTestUtils.stateList(fst);
    Assertions.assertEquals(11, states.size());
    Assertions.assertEquals(Integer.valueOf(10), states.get(10));
    for (int s = 0; s <= 10; s++) {
      Assertions.assertEquals(1, source.arcRequests(s));
    }
    // iterating again and reading every arc reuses the cache
    for (int s : FstTestUtils.stateList(fst)) {
      FstTestUtils.arcList(fst, s);
    }
    Assertions.assertEquals(11, source.arcRequests());
  }

  @Test
  void testStateIterationStopsAtLastReachable() {
    final VectorFst<TropicalWeight> vfst = FstTestUtils.chain(3);
    vfst.addStates(2);
    final InvertFst<TropicalWeight> fst = new InvertFst<>(new CountingFst<>(vfst));
    // states 4 and 5 are neither reachable nor below a reachable id
    Assertions.assertEquals(Arrays.asList(0, 1, 2, 3), FstTestUtils.stateList(fst));

    final InvertFst<TropicalWeight> empty = new InvertFst<>(new VectorFst<>(vfst.semiring()));
    Assertions.assertEquals(Arc.NO_STATE_ID, empty.start());
    Assertions.assertTrue(FstTestUtils.stateList(empty).isEmpty());
  }

  @Test
  void testBoundedCache() {
    final VectorFst<TropicalWeight> source = FstTestUtils.chain(50);
    final CacheOptions opts = new CacheOptions(true, 4);
    final ClosureFst<TropicalWeight> fst = new ClosureFst<>(source, ClosureType.CLOSURE_STAR, opts);
    Assertions.assertTrue(fst.getCacheOptions().isGc());

    final VectorFst<TropicalWeight> eager = new VectorFst<>(source);
    Closure.closure(eager, ClosureType.CLOSURE_STAR);
    for (int s : FstTestUtils.stateList(fst)) {
      FstTestUtils.arcList(fst, s);
      Assertions.assertTrue(fst.numCachedStates() <= 4);
    }
    // evicted states are recomputed on demand
    FstTestUtils.assertSameFst(eager, fst);
    Assertions.assertTrue(fst.numCachedStates() <= 4);
  }

  @Test
  void testBadOptions() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> new CacheOptions(true, 0));
    Assertions.assertFalse(new CacheOptions(false, 10).isGc());
  }

  @Test
  void testCopies() {
    final CountingFst<TropicalWeight> source = new CountingFst<>(FstTestUtils.chain(5));
    final InvertFst<TropicalWeight> fst = new InvertFst<>(source);
    FstTestUtils.arcList(fst, 0);

    final InvertFst<TropicalWeight> shared = fst.copy();
    Assertions.assertEquals(CacheState.Expansion.CACHED, shared.expansionState(0));
    FstTestUtils.arcList(shared, 0);
    Assertions.assertEquals(1, source.arcRequests(0));

    final InvertFst<TropicalWeight> safe = fst.copy(true);
    Assertions.assertEquals(CacheState.Expansion.UNVISITED, safe.expansionState(0));
    Assertions.assertEquals(FstTestUtils.arcList(fst, 0), FstTestUtils.arcList(safe, 0));
    Assertions.assertEquals(2, source.arcRequests(0));
    Assertions.assertEquals("invert", safe.type());
  }

  @Test
  void testSafeCopiesAcrossThreads() throws InterruptedException {
    final ClosureFst<TropicalWeight> fst = new ClosureFst<>(FstTestUtils.chain(200), ClosureType.CLOSURE_STAR);
    final VectorFst<TropicalWeight> expected = new VectorFst<>(fst);
    final Throwable[] failures = new Throwable[4];
    final Thread[] threads = new Thread[4];
    for (int i = 0; i < threads.length; i++) {
      final int id = i;
      final ClosureFst<TropicalWeight> copy = fst.copy(true);
      threads[i] = new Thread(() -> {
        try {
          FstTestUtils.assertSameFst(expected, copy);
        } catch (Throwable t) {
          failures[id] = t;
        }
      });
      threads[i].start();
    }
    for (Thread t : threads) {
      t.join();
    }
    for (Throwable t : failures) {
      Assertions.assertNull(t);
    }
  }
}
