package WFST.Ops;

import WFST.Arc;
import WFST.MutableFst;
import WFST.Properties;
import WFST.StateIterator;

/**
 * Kleene closure in place. Every final state gets an epsilon arc, weighted by its final weight,
 * back to the start state. The star closure also gets a new final start state with an epsilon arc
 * to the old start, so the empty string is accepted with weight one.
 * <p>
 * Linear in the number of states; properties follow from the input properties without a rescan.
 */
public final class Closure {
    private Closure() {
    }

    public static <W> void closure(MutableFst<W> fst, ClosureType type) {
        final long props = fst.properties(Properties.FST_PROPERTIES, false);
        final int start = fst.start();
        final W zero = fst.semiring().zero();
        if (start == Arc.NO_STATE_ID && type == ClosureType.CLOSURE_PLUS) {
            return;
        }
        if (start != Arc.NO_STATE_ID) {
            for (StateIterator siter = fst.states(); !siter.done(); siter.next()) {
                final int s = siter.value();
                final W weight = fst.finalWeight(s);
                if (!weight.equals(zero)) {
                    fst.addArc(s, new Arc<>(Arc.EPSILON, Arc.EPSILON, weight, start));
                }
            }
        }
        if (type == ClosureType.CLOSURE_STAR) {
            fst.reserveStates(fst.numStates() + 1);
            final int nstart = fst.addState();
            fst.setStart(nstart);
            fst.setFinal(nstart);
            if (start != Arc.NO_STATE_ID) {
                fst.addArc(nstart, new Arc<>(Arc.EPSILON, Arc.EPSILON, fst.semiring().one(), start));
            }
        }
        fst.setProperties(Properties.closureProperties(props, type == ClosureType.CLOSURE_STAR, false),
            Properties.FST_PROPERTIES);
    }
}
