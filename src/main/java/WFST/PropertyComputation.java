package WFST;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * Computes trinary properties by scanning a transducer: one strongly-connected-component pass
 * (cyclicity, accessibility, co-accessibility) and one pass over all arcs for the rest.
 */
public final class PropertyComputation {
    private static final Logger logger = LogManager.getLogger(PropertyComputation.class.getSimpleName());

    private PropertyComputation() {
    }

    /**
     * Properties together with the mask of bits that are known.
     */
    public static final class Result {
        private final long properties;
        private final long known;

        Result(long properties, long known) {
            this.properties = properties;
            this.known = known;
        }

        public long getProperties() {
            return properties;
        }

        public long getKnown() {
            return known;
        }
    }

    /**
     * Returns the stored properties if every bit of mask is already known, otherwise computes them.
     * With FstFlags.VERIFY_PROPERTIES set, always computes and logs disagreement with the stored bits.
     */
    public static <W> Result test(Fst<W> fst, long mask) {
        final long stored = fst.properties(Properties.FST_PROPERTIES, false);
        if (FstFlags.VERIFY_PROPERTIES) {
            final Result computed = compute(fst, mask);
            if (!Properties.compatProperties(stored, computed.getProperties())) {
                logger.error("TestProperties: stored properties incorrect (stored: {}, computed: {})",
                    Properties.describe(stored), Properties.describe(computed.getProperties()));
            }
            return computed;
        }
        final long knownStored = Properties.knownProperties(stored);
        if ((mask & knownStored) == mask) {
            return new Result(stored, knownStored);
        }
        return compute(fst, mask);
    }

    /**
     * Scan the transducer. All trinary properties are computed whatever the mask; an errored
     * transducer is not scanned and yields only its binary properties.
     */
    public static <W> Result compute(Fst<W> fst, long mask) {
        final long stored = fst.properties(Properties.FST_PROPERTIES, false);
        if ((stored & Properties.ERROR) != 0) {
            return new Result(stored & Properties.BINARY_PROPERTIES, Properties.BINARY_PROPERTIES);
        }
        final IntArrayList states = new IntArrayList();
        int bound = 0;
        for (StateIterator siter = fst.states(); !siter.done(); siter.next()) {
            final int s = siter.value();
            states.add(s);
            bound = Math.max(bound, s + 1);
        }

        long props = stored & Properties.BINARY_PROPERTIES;
        final int[] scc = new int[bound];
        props |= visitComponents(fst, states, bound, scc);
        props |= scanArcs(fst, states, scc);
        logger.debug("Computed properties for mask {}: {}", Long.toHexString(mask), Properties.describe(props));
        return new Result(props, Properties.knownProperties(props));
    }

    /**
     * Iterative Tarjan over every state, starting with the start state; fills scc[s] with component ids.
     */
    private static <W> long visitComponents(Fst<W> fst, IntArrayList states, int bound, int[] scc) {
        long props = Properties.ACYCLIC | Properties.INITIAL_ACYCLIC | Properties.ACCESSIBLE
            | Properties.CO_ACCESSIBLE;
        final int start = fst.start();
        final W zero = fst.semiring().zero();

        final int[] dfnumber = new int[bound];
        final int[] lowlink = new int[bound];
        Arrays.fill(dfnumber, -1);
        Arrays.fill(scc, -1);
        final boolean[] onStack = new boolean[bound];
        final boolean[] onPath = new boolean[bound];
        final boolean[] coaccess = new boolean[bound];
        final IntArrayList sccStack = new IntArrayList();
        final Deque<Frame<W>> path = new ArrayDeque<>();
        int nextNumber = 0;
        int nextScc = 0;

        final IntArrayList roots = new IntArrayList(states.size() + 1);
        if (start != Arc.NO_STATE_ID) {
            roots.add(start);
        }
        roots.addAll(states);
        for (int r = 0; r < roots.size(); r++) {
            final int root = roots.getInt(r);
            if (dfnumber[root] != -1) {
                continue;
            }
            if (root != start) {
                props |= Properties.NOT_ACCESSIBLE;
                props &= ~Properties.ACCESSIBLE;
            }
            dfnumber[root] = lowlink[root] = nextNumber++;
            coaccess[root] = !fst.finalWeight(root).equals(zero);
            onStack[root] = onPath[root] = true;
            sccStack.add(root);
            path.push(new Frame<>(root, fst.arcs(root)));

            while (!path.isEmpty()) {
                final Frame<W> frame = path.peek();
                final int s = frame.state;
                if (!frame.arcs.done()) {
                    final int t = frame.arcs.value().getNextState();
                    frame.arcs.next();
                    if (dfnumber[t] == -1) {
                        dfnumber[t] = lowlink[t] = nextNumber++;
                        coaccess[t] = !fst.finalWeight(t).equals(zero);
                        onStack[t] = onPath[t] = true;
                        sccStack.add(t);
                        path.push(new Frame<>(t, fst.arcs(t)));
                    } else {
                        if (onPath[t]) {
                            props |= Properties.CYCLIC;
                            props &= ~Properties.ACYCLIC;
                            if (t == start) {
                                props |= Properties.INITIAL_CYCLIC;
                                props &= ~Properties.INITIAL_ACYCLIC;
                            }
                        }
                        if (onStack[t]) {
                            lowlink[s] = Math.min(lowlink[s], dfnumber[t]);
                        }
                        if (coaccess[t]) {
                            coaccess[s] = true;
                        }
                    }
                    continue;
                }

                path.pop();
                onPath[s] = false;
                if (lowlink[s] == dfnumber[s]) {
                    // s is the root of a component
                    boolean sccCoaccess = false;
                    int i = sccStack.size();
                    int t;
                    do {
                        t = sccStack.getInt(--i);
                        if (coaccess[t]) {
                            sccCoaccess = true;
                        }
                    } while (t != s);
                    while (true) {
                        t = sccStack.removeInt(sccStack.size() - 1);
                        scc[t] = nextScc;
                        onStack[t] = false;
                        if (sccCoaccess) {
                            coaccess[t] = true;
                        }
                        if (t == s) {
                            break;
                        }
                    }
                    if (!sccCoaccess) {
                        props |= Properties.NOT_CO_ACCESSIBLE;
                        props &= ~Properties.CO_ACCESSIBLE;
                    }
                    ++nextScc;
                }
                final Frame<W> parent = path.peek();
                if (parent != null) {
                    final int p = parent.state;
                    lowlink[p] = Math.min(lowlink[p], lowlink[s]);
                    if (coaccess[s]) {
                        coaccess[p] = true;
                    }
                }
            }
        }
        return props;
    }

    private static <W> long scanArcs(Fst<W> fst, IntArrayList states, int[] scc) {
        long props = Properties.ACCEPTOR | Properties.I_DETERMINISTIC | Properties.O_DETERMINISTIC
            | Properties.NO_EPSILONS | Properties.NO_I_EPSILONS | Properties.NO_O_EPSILONS
            | Properties.I_LABEL_SORTED | Properties.O_LABEL_SORTED | Properties.UNWEIGHTED
            | Properties.UNWEIGHTED_CYCLES | Properties.TOP_SORTED | Properties.STRING;
        final W zero = fst.semiring().zero();
        final W one = fst.semiring().one();
        final IntSet ilabels = new IntOpenHashSet();
        final IntSet olabels = new IntOpenHashSet();
        int nfinal = 0;

        for (int i = 0; i < states.size(); i++) {
            final int s = states.getInt(i);
            ilabels.clear();
            olabels.clear();
            Arc<W> prevArc = null;
            for (ArcIterator<W> aiter = fst.arcs(s); !aiter.done(); aiter.next()) {
                final Arc<W> arc = aiter.value();
                if (!ilabels.add(arc.getILabel())) {
                    props |= Properties.NON_I_DETERMINISTIC;
                    props &= ~Properties.I_DETERMINISTIC;
                }
                if (!olabels.add(arc.getOLabel())) {
                    props |= Properties.NON_O_DETERMINISTIC;
                    props &= ~Properties.O_DETERMINISTIC;
                }
                if (arc.getILabel() != arc.getOLabel()) {
                    props |= Properties.NOT_ACCEPTOR;
                    props &= ~Properties.ACCEPTOR;
                }
                if (arc.getILabel() == Arc.EPSILON && arc.getOLabel() == Arc.EPSILON) {
                    props |= Properties.EPSILONS;
                    props &= ~Properties.NO_EPSILONS;
                }
                if (arc.getILabel() == Arc.EPSILON) {
                    props |= Properties.I_EPSILONS;
                    props &= ~Properties.NO_I_EPSILONS;
                }
                if (arc.getOLabel() == Arc.EPSILON) {
                    props |= Properties.O_EPSILONS;
                    props &= ~Properties.NO_O_EPSILONS;
                }
                if (prevArc != null) {
                    if (arc.getILabel() < prevArc.getILabel()) {
                        props |= Properties.NOT_I_LABEL_SORTED;
                        props &= ~Properties.I_LABEL_SORTED;
                    }
                    if (arc.getOLabel() < prevArc.getOLabel()) {
                        props |= Properties.NOT_O_LABEL_SORTED;
                        props &= ~Properties.O_LABEL_SORTED;
                    }
                }
                if (!arc.getWeight().equals(one) && !arc.getWeight().equals(zero)) {
                    props |= Properties.WEIGHTED;
                    props &= ~Properties.UNWEIGHTED;
                    if (scc[s] == scc[arc.getNextState()]) {
                        props |= Properties.WEIGHTED_CYCLES;
                        props &= ~Properties.UNWEIGHTED_CYCLES;
                    }
                }
                if (arc.getNextState() <= s) {
                    props |= Properties.NOT_TOP_SORTED;
                    props &= ~Properties.TOP_SORTED;
                }
                if (arc.getNextState() != s + 1) {
                    props |= Properties.NOT_STRING;
                    props &= ~Properties.STRING;
                }
                prevArc = arc;
            }
            // a string has exactly one final state, and it is the last
            if (nfinal > 0) {
                props |= Properties.NOT_STRING;
                props &= ~Properties.STRING;
            }
            final W finalWeight = fst.finalWeight(s);
            if (!finalWeight.equals(zero)) {
                if (!finalWeight.equals(one)) {
                    props |= Properties.WEIGHTED;
                    props &= ~Properties.UNWEIGHTED;
                }
                ++nfinal;
            } else if (fst.numArcs(s) != 1) {
                props |= Properties.NOT_STRING;
                props &= ~Properties.STRING;
            }
        }
        if (fst.start() != Arc.NO_STATE_ID && fst.start() != 0) {
            props |= Properties.NOT_STRING;
            props &= ~Properties.STRING;
        }
        return props;
    }

    private static final class Frame<W> {
        final int state;
        final ArcIterator<W> arcs;

        Frame(int state, ArcIterator<W> arcs) {
            this.state = state;
            this.arcs = arcs;
        }
    }
}
