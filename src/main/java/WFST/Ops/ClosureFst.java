package WFST.Ops;

import WFST.Fst;
import WFST.Cache.CacheFst;
import WFST.Cache.CacheOptions;

/**
 * Delayed closure: the arcs of a state, including its closure arc, are computed on first visit.
 * Only the states actually visited are ever computed from the source.
 * @param <W> weight type
 */
public class ClosureFst<W> extends CacheFst<ClosureFstImpl<W>, W> {
    public static final String TYPE = "closure";

    public ClosureFst(Fst<W> fst, ClosureType closureType, CacheOptions opts) {
        super(new ClosureFstImpl<>(fst, closureType, opts));
    }

    public ClosureFst(Fst<W> fst, ClosureType closureType) {
        this(fst, closureType, new CacheOptions());
    }

    protected ClosureFst(ClosureFst<W> fst, boolean safe) {
        super(fst, safe);
    }

    public ClosureType getClosureType() {
        return getImpl().getClosureType();
    }

    @Override
    public ClosureFst<W> copy(boolean safe) {
        return new ClosureFst<>(this, safe);
    }

    @Override
    public ClosureFst<W> copy() {
        return copy(false);
    }

    @Override
    protected ClosureFstImpl<W> copyImpl() {
        return new ClosureFstImpl<>(getImpl());
    }
}
