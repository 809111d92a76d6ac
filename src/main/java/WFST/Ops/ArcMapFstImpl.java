package WFST.Ops;

import WFST.Arc;
import WFST.ArcIterator;
import WFST.Fst;
import WFST.Properties;
import WFST.Cache.CacheImpl;
import WFST.Cache.CacheOptions;

class ArcMapFstImpl<W> extends CacheImpl<W> {
    private final Fst<W> fst;
    private final ArcMapper<W> mapper;

    ArcMapFstImpl(Fst<W> fst, ArcMapper<W> mapper, CacheOptions opts, String type) {
        super(fst.semiring(), opts);
        this.fst = fst.copy();
        this.mapper = mapper;
        setType(type);
        if (mapper.inputSymbolsAction() == MapSymbolsAction.COPY && fst.inputSymbols() != null) {
            setInputSymbols(fst.inputSymbols().copy());
        }
        if (mapper.outputSymbolsAction() == MapSymbolsAction.COPY && fst.outputSymbols() != null) {
            setOutputSymbols(fst.outputSymbols().copy());
        }
        setProperties(mapper.properties(fst.properties(Properties.FST_PROPERTIES, false)) & Properties.COPY_PROPERTIES);
    }

    /**
     * Fresh cache over a safe copy of impl's source.
     */
    ArcMapFstImpl(ArcMapFstImpl<W> impl) {
        super(impl);
        this.fst = impl.fst.copy(true);
        this.mapper = impl.mapper;
    }

    @Override
    protected int computeStart() {
        return fst.start();
    }

    @Override
    protected W computeFinal(int s) {
        final W finalWeight = ArcMap.mapFinal(mapper, fst.finalWeight(s), s);
        if (finalWeight == null) {
            setProperties(Properties.ERROR, Properties.ERROR);
            return semiring.noWeight();
        }
        return finalWeight;
    }

    @Override
    protected void expand(int s) {
        for (ArcIterator<W> aiter = fst.arcs(s); !aiter.done(); aiter.next()) {
            pushArc(s, mapper.map(aiter.value()));
        }
    }
}
