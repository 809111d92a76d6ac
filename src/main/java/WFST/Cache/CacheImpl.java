package WFST.Cache;

import WFST.Arc;
import WFST.ArcIterator;
import WFST.StateIterator;
import WFST.Model.FstImpl;
import WFST.Model.ListArcIterator;
import WFST.Weight.Semiring;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.BitSet;

/**
 * Base of delayed transducers: computes the start, final weights and arcs of a state on first
 * request and serves them from the cache afterwards. Subclasses supply {@link #computeStart()},
 * {@link #computeFinal(int)} and {@link #expand(int)}; the latter reports arcs through {@link #pushArc(int, Arc)}.
 * <p>
 * Not safe for concurrent use: filling the cache mutates it. Each thread needs its own safe copy.
 * @param <W> weight type
 */
public abstract class CacheImpl<W> extends FstImpl<W> {
    private static final Logger logger = LogManager.getLogger(CacheImpl.class.getSimpleName());

    private final CacheOptions opts;
    private final CacheStore<W> store;
    private final BitSet expanded = new BitSet(); // states expanded at least once
    private boolean hasStart = false;
    private int cacheStart = Arc.NO_STATE_ID;
    private int numKnownStates = 0;
    private int minUnexpandedState = 0;
    private int expandingId = Arc.NO_STATE_ID;
    private CacheState<W> expandingState = null;

    protected CacheImpl(Semiring<W> semiring, CacheOptions opts) {
        super(semiring);
        this.opts = opts;
        this.store = opts.newStore();
    }

    /**
     * Same type, properties, symbols and options as impl, with an empty cache.
     */
    protected CacheImpl(CacheImpl<W> impl) {
        super(impl);
        this.opts = impl.opts;
        this.store = opts.newStore();
    }

    public CacheOptions getCacheOptions() {
        return opts;
    }

    protected abstract int computeStart();

    protected abstract W computeFinal(int s);

    /**
     * Compute the arcs of s, calling pushArc for each in order.
     */
    protected abstract void expand(int s);

    protected final void pushArc(int s, Arc<W> arc) {
        if (s != expandingId) {
            throw new IllegalStateException("Arc pushed to state " + s + " while expanding " + expandingId);
        }
        expandingState.pushArc(arc);
    }

    @Override
    public int start() {
        if (!hasStart) {
            cacheStart = computeStart();
            hasStart = true;
            if (cacheStart >= numKnownStates) {
                numKnownStates = cacheStart + 1;
            }
        }
        return cacheStart;
    }

    @Override
    public W finalWeight(int s) {
        final CacheState<W> cached = store.get(s);
        if (cached != null && cached.hasFinal()) {
            return cached.getFinalWeight();
        }
        final W weight = computeFinal(s);
        store.getOrCreate(s).setFinalWeight(weight);
        return weight;
    }

    @Override
    public int numArcs(int s) {
        return expandedState(s).numArcs();
    }

    @Override
    public int numInputEpsilons(int s) {
        return expandedState(s).numInputEpsilons();
    }

    @Override
    public int numOutputEpsilons(int s) {
        return expandedState(s).numOutputEpsilons();
    }

    @Override
    public ArcIterator<W> arcs(int s) {
        return new ListArcIterator<>(expandedState(s).arcs());
    }

    @Override
    public StateIterator states() {
        return new CacheStateIterator(this);
    }

    public CacheState.Expansion expansionState(int s) {
        final CacheState<W> cached = store.get(s);
        return cached == null ? CacheState.Expansion.UNVISITED : cached.getExpansion();
    }

    /** Number of states currently held in the cache. */
    public int numCachedStates() {
        return store.size();
    }

    /** One more than the largest state id seen so far (start or arc destination). */
    public int numKnownStates() {
        return numKnownStates;
    }

    /** Smallest state id that has never been expanded. */
    public int minUnexpandedState() {
        minUnexpandedState = expanded.nextClearBit(minUnexpandedState);
        return minUnexpandedState;
    }

    CacheState<W> expandedState(int s) {
        final CacheState<W> cached = store.get(s);
        if (cached != null && cached.getExpansion() == CacheState.Expansion.CACHED) {
            return cached;
        }
        final CacheState<W> state = new CacheState<>();
        if (cached != null && cached.hasFinal()) {
            state.setFinalWeight(cached.getFinalWeight());
        }
        state.beginExpansion();
        store.put(s, state);
        expandingId = s;
        expandingState = state;
        try {
            expand(s);
        } finally {
            expandingId = Arc.NO_STATE_ID;
            expandingState = null;
        }
        state.finishExpansion();
        for (Arc<W> arc : state.arcs()) {
            if (arc.getNextState() >= numKnownStates) {
                numKnownStates = arc.getNextState() + 1;
            }
        }
        if (s >= numKnownStates) {
            numKnownStates = s + 1;
        }
        expanded.set(s);
        if (store.get(s) != state) {
            // evicted while expanding
            store.put(s, state);
        }
        logger.debug("Expanded state {} of {} FST: {} arcs", s, type(), state.numArcs());
        return state;
    }
}
