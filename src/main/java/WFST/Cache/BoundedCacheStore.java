package WFST.Cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

/**
 * Keeps at most a fixed number of states; evicted states are recomputed when visited again.
 */
final class BoundedCacheStore<W> implements CacheStore<W> {
    private final Cache<Integer, CacheState<W>> states;

    BoundedCacheStore(long limit) {
        // evict on the calling thread so the bound holds as soon as a put returns
        this.states = Caffeine.newBuilder()
            .maximumSize(limit)
            .executor(Runnable::run)
            .build();
    }

    @Override
    public CacheState<W> get(int s) {
        return states.getIfPresent(s);
    }

    @Override
    public CacheState<W> getOrCreate(int s) {
        return states.get(s, k -> new CacheState<>());
    }

    @Override
    public void put(int s, CacheState<W> state) {
        states.put(s, state);
    }

    @Override
    public int size() {
        states.cleanUp();
        return (int) states.estimatedSize();
    }
}
