package WFST.Model;

import WFST.Fst;
import WFST.Registry.FstReadOptions;
import WFST.Weight.Semiring;

import java.io.DataInput;
import java.io.IOException;

/**
 * General-purpose mutable transducer: states in a growable list, arcs in insertion order.
 * <pre>
 *   VectorFst&lt;TropicalWeight&gt; fst = new VectorFst&lt;&gt;(TropicalSemiring.INSTANCE);
 *   int s0 = fst.addState();
 *   int s1 = fst.addState();
 *   fst.setStart(s0);
 *   fst.addArc(s0, new Arc&lt;&gt;(1, 2, TropicalWeight.of(0.5f), s1));
 *   fst.setFinal(s1);
 * </pre>
 * @param <W> weight type
 */
public class VectorFst<W> extends ImplToMutableFst<VectorFstImpl<W>, W> {
    public static final String TYPE = "vector";

    public VectorFst(Semiring<W> semiring) {
        super(new VectorFstImpl<>(semiring));
    }

    /**
     * Copy of any transducer, expanding it if delayed.
     */
    public VectorFst(Fst<W> fst) {
        super(new VectorFstImpl<>(fst));
    }

    public VectorFst(VectorFst<W> fst, boolean safe) {
        super(fst, safe);
    }

    private VectorFst(VectorFstImpl<W> impl) {
        super(impl);
    }

    @Override
    public VectorFst<W> copy(boolean safe) {
        return new VectorFst<>(this, safe);
    }

    @Override
    public VectorFst<W> copy() {
        return copy(false);
    }

    @Override
    protected VectorFstImpl<W> copyImpl() {
        return new VectorFstImpl<>(getImpl());
    }

    @Override
    protected VectorFstImpl<W> emptyImpl() {
        return new VectorFstImpl<>(semiring());
    }

    /**
     * Registry reader for the "vector" type.
     * @return the transducer, or null (after logging) if the input is not a vector transducer
     */
    public static <W> VectorFst<W> read(Semiring<W> semiring, DataInput in, FstReadOptions opts) throws IOException {
        final VectorFstImpl<W> impl = VectorFstImpl.read(semiring, in, opts);
        return impl == null ? null : new VectorFst<>(impl);
    }
}
