package WFST.Ops;

import WFST.Fst;
import WFST.Cache.CacheOptions;

/**
 * Delayed inversion. Input symbols of the result are the output symbols of the source and vice versa.
 * @param <W> weight type
 */
public class InvertFst<W> extends ArcMapFst<W> {
    public static final String TYPE = "invert";

    public InvertFst(Fst<W> fst, CacheOptions opts) {
        super(fst, new InvertMapper<>(), opts, TYPE);
        getImpl().setInputSymbols(fst.outputSymbols() == null ? null : fst.outputSymbols().copy());
        getImpl().setOutputSymbols(fst.inputSymbols() == null ? null : fst.inputSymbols().copy());
    }

    public InvertFst(Fst<W> fst) {
        this(fst, new CacheOptions());
    }

    protected InvertFst(InvertFst<W> fst, boolean safe) {
        super(fst, safe);
    }

    @Override
    public InvertFst<W> copy(boolean safe) {
        return new InvertFst<>(this, safe);
    }

    @Override
    public InvertFst<W> copy() {
        return copy(false);
    }
}
