package WFST;

import it.unimi.dsi.fastutil.ints.IntCollection;

/**
 * Expanded transducer with mutators. To change arcs in place use {@link #mutableArcs(int)}.
 * @param <W> weight type
 */
public interface MutableFst<W> extends ExpandedFst<W> {
    void setStart(int s);

    void setFinal(int s, W weight);

    default void setFinal(int s) {
        setFinal(s, semiring().one());
    }

    /** Set property bits w.r.t. mask. */
    void setProperties(long props, long mask);

    int addState();

    void addStates(int n);

    void addArc(int s, Arc<W> arc);

    /**
     * Delete some states. Surviving states are renumbered densely, keeping their order;
     * arcs into deleted states are dropped, and the start becomes NO_STATE_ID if deleted.
     */
    void deleteStates(IntCollection states);

    /** Delete all states; symbol tables are kept. */
    void deleteStates();

    /** Delete the last n arcs of state s. */
    void deleteArcs(int s, int n);

    void deleteArcs(int s);

    // Optional, best effort only.
    default void reserveStates(int n) {
    }

    // Optional, best effort only.
    default void reserveArcs(int s, int n) {
    }

    /** Sets input symbols; null removes the table. The table is copied. */
    void setInputSymbols(SymbolTable symbols);

    void setOutputSymbols(SymbolTable symbols);

    MutableArcIterator<W> mutableArcs(int s);

    @Override
    MutableFst<W> copy(boolean safe);

    @Override
    default MutableFst<W> copy() {
        return copy(false);
    }
}
