package WFST.Cache;

import net.automatalib.common.util.array.ArrayStorage;

/**
 * Keeps every state ever cached, indexed by id.
 */
final class VectorCacheStore<W> implements CacheStore<W> {
    private final ArrayStorage<CacheState<W>> states;
    private int bound = 0; // ids below bound fit in the storage
    private int size = 0;

    VectorCacheStore() {
        this.states = new ArrayStorage<>();
    }

    @Override
    public CacheState<W> get(int s) {
        return s < bound ? states.get(s) : null;
    }

    @Override
    public CacheState<W> getOrCreate(int s) {
        CacheState<W> state = get(s);
        if (state == null) {
            state = new CacheState<>();
            put(s, state);
        }
        return state;
    }

    @Override
    public void put(int s, CacheState<W> state) {
        if (s >= bound) {
            states.ensureCapacity(s + 1);
            bound = s + 1;
        }
        if (states.get(s) == null) {
            ++size;
        }
        states.set(s, state);
    }

    @Override
    public int size() {
        return size;
    }
}
