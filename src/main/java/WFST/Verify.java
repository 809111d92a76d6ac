package WFST;

import WFST.Weight.Semiring;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Structural sanity check of a transducer. Mutators never call this; it is a diagnostic
 * for catching dangling next states, bad labels and non-member weights after the fact.
 */
public final class Verify {
    private static final Logger logger = LogManager.getLogger(Verify.class.getSimpleName());

    private Verify() {
    }

    /**
     * Logs the first violation found.
     * @return true iff the transducer is well-formed and its stored properties are consistent
     */
    public static <W> boolean verify(Fst<W> fst) {
        final Semiring<W> semiring = fst.semiring();
        final int ns = countStates(fst);
        final int start = fst.start();
        final SymbolTable isyms = fst.inputSymbols();
        final SymbolTable osyms = fst.outputSymbols();

        if (start < Arc.NO_STATE_ID) {
            logger.error("Verify: FST start state ID is negative");
            return false;
        } else if (start >= ns) {
            logger.error("Verify: FST start state ID exceeds number of states");
            return false;
        }

        for (StateIterator siter = fst.states(); !siter.done(); siter.next()) {
            final int s = siter.value();
            int na = 0;
            int nieps = 0;
            int noeps = 0;
            for (ArcIterator<W> aiter = fst.arcs(s); !aiter.done(); aiter.next(), ++na) {
                final Arc<W> arc = aiter.value();
                if (arc.getILabel() < 0) {
                    logger.error("Verify: FST input label ID of arc at position {} of state {} is negative", na, s);
                    return false;
                } else if (isyms != null && !isyms.member(arc.getILabel())) {
                    logger.error("Verify: FST input label ID {} of arc at position {} of state {} is missing from input symbol table \"{}\"",
                        arc.getILabel(), na, s, isyms.getName());
                    return false;
                } else if (arc.getOLabel() < 0) {
                    logger.error("Verify: FST output label ID of arc at position {} of state {} is negative", na, s);
                    return false;
                } else if (osyms != null && !osyms.member(arc.getOLabel())) {
                    logger.error("Verify: FST output label ID {} of arc at position {} of state {} is missing from output symbol table \"{}\"",
                        arc.getOLabel(), na, s, osyms.getName());
                    return false;
                } else if (!semiring.member(arc.getWeight())) {
                    logger.error("Verify: FST weight of arc at position {} of state {} is invalid", na, s);
                    return false;
                } else if (arc.getNextState() < 0) {
                    logger.error("Verify: FST destination state ID of arc at position {} of state {} is negative", na, s);
                    return false;
                } else if (arc.getNextState() >= ns) {
                    logger.error("Verify: FST destination state ID of arc at position {} of state {} exceeds number of states",
                        na, s);
                    return false;
                }
                if (arc.getILabel() == Arc.EPSILON) {
                    ++nieps;
                }
                if (arc.getOLabel() == Arc.EPSILON) {
                    ++noeps;
                }
            }
            if (!semiring.member(fst.finalWeight(s))) {
                logger.error("Verify: FST final weight of state {} is invalid", s);
                return false;
            } else if (fst.numArcs(s) != na) {
                logger.error("Verify: FST number of arcs of state {} is {}, but {} were iterated", s, fst.numArcs(s), na);
                return false;
            } else if (fst.numInputEpsilons(s) != nieps) {
                logger.error("Verify: FST number of input epsilons of state {} is {}, but {} were counted",
                    s, fst.numInputEpsilons(s), nieps);
                return false;
            } else if (fst.numOutputEpsilons(s) != noeps) {
                logger.error("Verify: FST number of output epsilons of state {} is {}, but {} were counted",
                    s, fst.numOutputEpsilons(s), noeps);
                return false;
            }
        }

        final long stored = fst.properties(Properties.FST_PROPERTIES, false);
        final long computed = PropertyComputation.compute(fst, Properties.FST_PROPERTIES).getProperties();
        if (!Properties.compatProperties(stored, computed)) {
            logger.error("Verify: stored FST properties incorrect (stored: {}, computed: {})",
                Properties.describe(stored), Properties.describe(computed));
            return false;
        }
        return true;
    }

    private static <W> int countStates(Fst<W> fst) {
        if (fst instanceof ExpandedFst) {
            return ((ExpandedFst<W>) fst).numStates();
        }
        int ns = 0;
        for (StateIterator siter = fst.states(); !siter.done(); siter.next()) {
            ns = Math.max(ns, siter.value() + 1);
        }
        return ns;
    }
}
