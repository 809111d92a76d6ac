package WFST.Cache;

/**
 * Storage of cached states, keyed by state id.
 */
interface CacheStore<W> {
    /** @return the cached state, or null */
    CacheState<W> get(int s);

    /** @return the cached state, created unvisited if absent */
    CacheState<W> getOrCreate(int s);

    void put(int s, CacheState<W> state);

    /** Number of states currently cached. */
    int size();
}
