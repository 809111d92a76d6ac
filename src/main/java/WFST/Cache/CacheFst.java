package WFST.Cache;

import WFST.Model.ImplToFst;

/**
 * Handle over a delayed implementation. An unsafe copy shares the cache; a safe copy starts
 * an empty cache over a safe copy of the source.
 * @param <I> implementation type
 * @param <W> weight type
 */
public abstract class CacheFst<I extends CacheImpl<W>, W> extends ImplToFst<I, W> {
    protected CacheFst(I impl) {
        super(impl);
    }

    protected CacheFst(CacheFst<I, W> fst, boolean safe) {
        super(fst, safe);
    }

    public CacheState.Expansion expansionState(int s) {
        return getImpl().expansionState(s);
    }

    public int numCachedStates() {
        return getImpl().numCachedStates();
    }

    public CacheOptions getCacheOptions() {
        return getImpl().getCacheOptions();
    }
}
