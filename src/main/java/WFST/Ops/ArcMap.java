package WFST.Ops;

import WFST.Arc;
import WFST.ArcIterator;
import WFST.ExpandedFst;
import WFST.Fst;
import WFST.MutableArcIterator;
import WFST.MutableFst;
import WFST.Properties;
import WFST.StateIterator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Eager arc mapping, in place or into a separate output.
 */
public final class ArcMap {
    private static final Logger logger = LogManager.getLogger(ArcMap.class.getSimpleName());

    private ArcMap() {
    }

    /**
     * Map every arc and final weight of fst in place.
     */
    public static <W> void map(MutableFst<W> fst, ArcMapper<W> mapper) {
        if (mapper.inputSymbolsAction() == MapSymbolsAction.CLEAR) {
            fst.setInputSymbols(null);
        }
        if (mapper.outputSymbolsAction() == MapSymbolsAction.CLEAR) {
            fst.setOutputSymbols(null);
        }
        if (fst.start() == Arc.NO_STATE_ID) {
            return;
        }
        final long props = fst.properties(Properties.FST_PROPERTIES, false);
        boolean error = false;
        for (StateIterator siter = fst.states(); !siter.done(); siter.next()) {
            final int s = siter.value();
            for (MutableArcIterator<W> aiter = fst.mutableArcs(s); !aiter.done(); aiter.next()) {
                aiter.setValue(mapper.map(aiter.value()));
            }
            final W finalWeight = mapFinal(mapper, fst.finalWeight(s), s);
            if (finalWeight == null) {
                error = true;
            } else {
                fst.setFinal(s, finalWeight);
            }
        }
        fst.setProperties(mapper.properties(props), Properties.COPY_PROPERTIES);
        if (error) {
            fst.setProperties(Properties.ERROR, Properties.ERROR);
        }
    }

    /**
     * Replace the contents of ofst with the mapping of ifst.
     */
    public static <W> void map(Fst<W> ifst, MutableFst<W> ofst, ArcMapper<W> mapper) {
        ofst.deleteStates();
        if (mapper.inputSymbolsAction() == MapSymbolsAction.COPY) {
            ofst.setInputSymbols(ifst.inputSymbols());
        } else if (mapper.inputSymbolsAction() == MapSymbolsAction.CLEAR) {
            ofst.setInputSymbols(null);
        }
        if (mapper.outputSymbolsAction() == MapSymbolsAction.COPY) {
            ofst.setOutputSymbols(ifst.outputSymbols());
        } else if (mapper.outputSymbolsAction() == MapSymbolsAction.CLEAR) {
            ofst.setOutputSymbols(null);
        }
        final long iprops = ifst.properties(Properties.FST_PROPERTIES, false);
        if (ifst.start() == Arc.NO_STATE_ID) {
            if ((iprops & Properties.ERROR) != 0) {
                ofst.setProperties(Properties.ERROR, Properties.ERROR);
            }
            return;
        }
        if (ifst instanceof ExpandedFst) {
            ofst.reserveStates(((ExpandedFst<W>) ifst).numStates());
        }
        boolean error = false;
        for (StateIterator siter = ifst.states(); !siter.done(); siter.next()) {
            final int s = siter.value();
            while (ofst.numStates() <= s) {
                ofst.addState();
            }
            ofst.reserveArcs(s, ifst.numArcs(s));
            for (ArcIterator<W> aiter = ifst.arcs(s); !aiter.done(); aiter.next()) {
                ofst.addArc(s, mapper.map(aiter.value()));
            }
            final W finalWeight = mapFinal(mapper, ifst.finalWeight(s), s);
            if (finalWeight == null) {
                error = true;
            } else {
                ofst.setFinal(s, finalWeight);
            }
        }
        ofst.setStart(ifst.start());
        ofst.setProperties(mapper.properties(iprops), Properties.COPY_PROPERTIES);
        if (error) {
            ofst.setProperties(Properties.ERROR, Properties.ERROR);
        }
    }

    /**
     * @return the mapped final weight, or null (after logging) if the mapper asked for a superfinal state
     */
    static <W> W mapFinal(ArcMapper<W> mapper, W finalWeight, int s) {
        final Arc<W> finalArc = mapper.map(new Arc<>(Arc.EPSILON, Arc.EPSILON, finalWeight, Arc.NO_STATE_ID));
        if (finalArc.getILabel() != Arc.EPSILON || finalArc.getOLabel() != Arc.EPSILON
            || finalArc.getNextState() != Arc.NO_STATE_ID) {
            logger.error("ArcMap: Non-zero arc labels for superfinal arc at state {}", s);
            return null;
        }
        return finalArc.getWeight();
    }
}
