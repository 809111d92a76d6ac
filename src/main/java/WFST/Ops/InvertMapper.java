package WFST.Ops;

import WFST.Arc;
import WFST.Properties;

/**
 * Swaps input and output labels.
 */
public class InvertMapper<W> implements ArcMapper<W> {
    @Override
    public Arc<W> map(Arc<W> arc) {
        return arc.withLabels(arc.getOLabel(), arc.getILabel());
    }

    @Override
    public MapSymbolsAction inputSymbolsAction() {
        return MapSymbolsAction.CLEAR;
    }

    @Override
    public MapSymbolsAction outputSymbolsAction() {
        return MapSymbolsAction.CLEAR;
    }

    @Override
    public long properties(long inprops) {
        return Properties.invertProperties(inprops);
    }
}
