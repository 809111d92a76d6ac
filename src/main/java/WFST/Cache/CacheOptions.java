package WFST.Cache;

import WFST.FstFlags;

/**
 * Caching policy of a delayed transducer.
 */
public class CacheOptions {
    private final boolean gc;
    private final long gcLimit;

    /**
     * @param gc whether the number of cached states is bounded
     * @param gcLimit maximum number of cached states when gc is set
     */
    public CacheOptions(boolean gc, long gcLimit) {
        if (gcLimit <= 0) {
            throw new IllegalArgumentException("Cache limit must be positive: " + gcLimit);
        }
        this.gc = gc;
        this.gcLimit = gcLimit;
    }

    /**
     * Policy from FstFlags.
     */
    public CacheOptions() {
        this(FstFlags.CACHE_GC, FstFlags.CACHE_GC_LIMIT);
    }

    public boolean isGc() {
        return gc;
    }

    public long getGcLimit() {
        return gcLimit;
    }

    <W> CacheStore<W> newStore() {
        return gc ? new BoundedCacheStore<>(gcLimit) : new VectorCacheStore<>();
    }

    @Override
    public String toString() {
        return "CacheOptions(gc=" + gc + ", gcLimit=" + gcLimit + ")";
    }
}
