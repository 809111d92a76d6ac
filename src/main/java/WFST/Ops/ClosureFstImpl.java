package WFST.Ops;

import WFST.Arc;
import WFST.ArcIterator;
import WFST.ExpandedFst;
import WFST.Fst;
import WFST.Properties;
import WFST.Cache.CacheImpl;
import WFST.Cache.CacheOptions;

/**
 * State numbering: with the plus closure, and with the star closure of an expanded source, ids are
 * the source ids and the star's new start is numStates(), as in the in-place closure. Otherwise the
 * star's new start is 0 and source state s becomes s + 1.
 */
class ClosureFstImpl<W> extends CacheImpl<W> {
    private final Fst<W> fst;
    private final ClosureType closureType;
    private final int superStart;
    private final int shift;

    ClosureFstImpl(Fst<W> fst, ClosureType closureType, CacheOptions opts) {
        super(fst.semiring(), opts);
        this.fst = fst.copy();
        this.closureType = closureType;
        if (closureType == ClosureType.CLOSURE_PLUS) {
            this.superStart = Arc.NO_STATE_ID;
            this.shift = 0;
        } else if (fst instanceof ExpandedFst) {
            this.superStart = ((ExpandedFst<W>) fst).numStates();
            this.shift = 0;
        } else {
            this.superStart = 0;
            this.shift = 1;
        }
        setType(ClosureFst.TYPE);
        setInputSymbols(fst.inputSymbols() == null ? null : fst.inputSymbols().copy());
        setOutputSymbols(fst.outputSymbols() == null ? null : fst.outputSymbols().copy());
        setProperties(Properties.closureProperties(fst.properties(Properties.FST_PROPERTIES, false),
            closureType == ClosureType.CLOSURE_STAR, true));
    }

    ClosureFstImpl(ClosureFstImpl<W> impl) {
        super(impl);
        this.fst = impl.fst.copy(true);
        this.closureType = impl.closureType;
        this.superStart = impl.superStart;
        this.shift = impl.shift;
    }

    ClosureType getClosureType() {
        return closureType;
    }

    private int toSource(int s) {
        return s - shift;
    }

    private int fromSource(int s) {
        return s + shift;
    }

    @Override
    protected int computeStart() {
        if (closureType == ClosureType.CLOSURE_STAR) {
            return superStart;
        }
        return fst.start();
    }

    @Override
    protected W computeFinal(int s) {
        if (s == superStart) {
            return semiring.one();
        }
        return fst.finalWeight(toSource(s));
    }

    @Override
    protected void expand(int s) {
        final int sourceStart = fst.start();
        if (s == superStart) {
            if (sourceStart != Arc.NO_STATE_ID) {
                pushArc(s, new Arc<>(Arc.EPSILON, Arc.EPSILON, semiring.one(), fromSource(sourceStart)));
            }
            return;
        }
        final int t = toSource(s);
        for (ArcIterator<W> aiter = fst.arcs(t); !aiter.done(); aiter.next()) {
            final Arc<W> arc = aiter.value();
            pushArc(s, shift == 0 ? arc : arc.withNextState(fromSource(arc.getNextState())));
        }
        final W weight = fst.finalWeight(t);
        if (sourceStart != Arc.NO_STATE_ID && !weight.equals(semiring.zero())) {
            pushArc(s, new Arc<>(Arc.EPSILON, Arc.EPSILON, weight, fromSource(sourceStart)));
        }
    }
}
