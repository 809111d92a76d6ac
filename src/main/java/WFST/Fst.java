package WFST;

import WFST.Registry.FstWriteOptions;
import WFST.Weight.Semiring;

import java.io.OutputStream;

/**
 * Read-only weighted transducer. States are non-negative ints; implementations may be
 * computed lazily and need not know how many states they have.
 * @param <W> weight type
 */
public interface Fst<W> {
    Semiring<W> semiring();

    /**
     * @return start state, or Arc.NO_STATE_ID
     */
    int start();

    /**
     * @return final weight of state s; zero for non-final states
     */
    W finalWeight(int s);

    int numArcs(int s);

    int numInputEpsilons(int s);

    int numOutputEpsilons(int s);

    /**
     * Property bits w.r.t. mask.
     * @param mask properties of interest
     * @param test if true, compute unknown properties of interest (may scan the whole transducer);
     *             otherwise return only what is stored, which may leave bits of mask unknown
     */
    long properties(long mask, boolean test);

    /** Representation type tag, e.g. "vector". */
    String type();

    default String arcType() {
        return semiring().arcType();
    }

    /** @return input symbol table, or null */
    SymbolTable inputSymbols();

    /** @return output symbol table, or null */
    SymbolTable outputSymbols();

    /**
     * @param safe if false the copy may share the implementation (copy-on-write);
     *             if true the copy never aliases this one and may be used from another thread
     */
    Fst<W> copy(boolean safe);

    default Fst<W> copy() {
        return copy(false);
    }

    StateIterator states();

    ArcIterator<W> arcs(int s);

    /**
     * Write header and body.
     * @return false (after logging) if the representation cannot be written or the write failed
     */
    boolean write(OutputStream out, FstWriteOptions opts);
}
