package WFST.Ops;

import WFST.Fst;
import WFST.Cache.CacheFst;
import WFST.Cache.CacheOptions;

/**
 * Delayed arc mapping: a state's arcs are mapped the first time the state is visited.
 * @param <W> weight type
 */
public class ArcMapFst<W> extends CacheFst<ArcMapFstImpl<W>, W> {
    public static final String TYPE = "map";

    public ArcMapFst(Fst<W> fst, ArcMapper<W> mapper, CacheOptions opts) {
        this(fst, mapper, opts, TYPE);
    }

    public ArcMapFst(Fst<W> fst, ArcMapper<W> mapper) {
        this(fst, mapper, new CacheOptions());
    }

    protected ArcMapFst(Fst<W> fst, ArcMapper<W> mapper, CacheOptions opts, String type) {
        super(new ArcMapFstImpl<>(fst, mapper, opts, type));
    }

    protected ArcMapFst(ArcMapFst<W> fst, boolean safe) {
        super(fst, safe);
    }

    @Override
    public ArcMapFst<W> copy(boolean safe) {
        return new ArcMapFst<>(this, safe);
    }

    @Override
    public ArcMapFst<W> copy() {
        return copy(false);
    }

    @Override
    protected ArcMapFstImpl<W> copyImpl() {
        return new ArcMapFstImpl<>(getImpl());
    }
}
