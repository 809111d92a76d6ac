package WFST.Model;

import WFST.Fst;
import WFST.Registry.FstReadOptions;
import WFST.Weight.Semiring;

import java.io.DataInput;
import java.io.IOException;

/**
 * Immutable transducer with a compact flat layout. Since nothing can change it,
 * every copy, safe or not, shares the implementation.
 * @param <W> weight type
 */
public class ConstFst<W> extends ImplToExpandedFst<ConstFstImpl<W>, W> {
    public static final String TYPE = "const";

    public ConstFst(Fst<W> fst) {
        super(new ConstFstImpl<>(fst));
    }

    public ConstFst(ConstFst<W> fst, boolean safe) {
        super(fst, false);
    }

    private ConstFst(ConstFstImpl<W> impl) {
        super(impl);
    }

    @Override
    public ConstFst<W> copy(boolean safe) {
        return new ConstFst<>(this, safe);
    }

    @Override
    public ConstFst<W> copy() {
        return copy(false);
    }

    @Override
    protected ConstFstImpl<W> copyImpl() {
        return getImpl();
    }

    /**
     * Registry reader for the "const" type.
     * @return the transducer, or null (after logging) if the input is not a const transducer
     */
    public static <W> ConstFst<W> read(Semiring<W> semiring, DataInput in, FstReadOptions opts) throws IOException {
        final ConstFstImpl<W> impl = ConstFstImpl.read(semiring, in, opts);
        return impl == null ? null : new ConstFst<>(impl);
    }
}
