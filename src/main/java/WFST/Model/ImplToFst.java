package WFST.Model;

import WFST.ArcIterator;
import WFST.Fst;
import WFST.PropertyComputation;
import WFST.StateIterator;
import WFST.SymbolTable;
import WFST.Registry.FstWriteOptions;
import WFST.Weight.Semiring;

import java.io.OutputStream;

/**
 * Transducer handle over a shared implementation cell. Unsafe copies share the cell;
 * safe copies get their own implementation.
 * <p>
 * Handles are counted explicitly: a handle that is no longer needed should be {@link #release()}d so that
 * the remaining holder can mutate in place. A handle that is dropped without release still counts,
 * which costs at most one unnecessary fork.
 * @param <I> implementation type
 * @param <W> weight type
 */
public abstract class ImplToFst<I extends FstImpl<W>, W> implements Fst<W> {
    private ImplCell<I> cell;

    protected ImplToFst(I impl) {
        this.cell = new ImplCell<>(impl);
    }

    protected ImplToFst(ImplToFst<I, W> fst, boolean safe) {
        if (safe) {
            this.cell = new ImplCell<>(fst.copyImpl());
        } else {
            fst.cell.acquire();
            this.cell = fst.cell;
        }
    }

    /**
     * An implementation equal to the current one that shares nothing mutable with it.
     */
    protected abstract I copyImpl();

    protected I getImpl() {
        if (cell == null) {
            throw new IllegalStateException("Transducer handle has been released");
        }
        return cell.get();
    }

    protected boolean unique() {
        return cell.unique();
    }

    /**
     * Detach from the current cell and hold impl alone.
     */
    protected void setImpl(I impl) {
        cell.release();
        cell = new ImplCell<>(impl);
    }

    /**
     * Give up this handle; it must not be used afterwards.
     */
    public void release() {
        if (cell != null) {
            cell.release();
            cell = null;
        }
    }

    boolean sharesImplWith(ImplToFst<?, ?> other) {
        return cell != null && cell == other.cell;
    }

    int holders() {
        return cell.holders();
    }

    @Override
    public Semiring<W> semiring() {
        return getImpl().semiring();
    }

    @Override
    public int start() {
        return getImpl().start();
    }

    @Override
    public W finalWeight(int s) {
        return getImpl().finalWeight(s);
    }

    @Override
    public int numArcs(int s) {
        return getImpl().numArcs(s);
    }

    @Override
    public int numInputEpsilons(int s) {
        return getImpl().numInputEpsilons(s);
    }

    @Override
    public int numOutputEpsilons(int s) {
        return getImpl().numOutputEpsilons(s);
    }

    @Override
    public long properties(long mask, boolean test) {
        if (test) {
            final PropertyComputation.Result result = PropertyComputation.test(this, mask);
            getImpl().updateProperties(result.getProperties(), result.getKnown());
            return result.getProperties() & mask;
        }
        return getImpl().properties(mask);
    }

    @Override
    public String type() {
        return getImpl().type();
    }

    @Override
    public SymbolTable inputSymbols() {
        return getImpl().inputSymbols();
    }

    @Override
    public SymbolTable outputSymbols() {
        return getImpl().outputSymbols();
    }

    @Override
    public StateIterator states() {
        return getImpl().states();
    }

    @Override
    public ArcIterator<W> arcs(int s) {
        return getImpl().arcs(s);
    }

    @Override
    public boolean write(OutputStream out, FstWriteOptions opts) {
        return getImpl().write(out, opts);
    }

    @Override
    public String toString() {
        return type() + "(" + arcType() + ")";
    }
}
