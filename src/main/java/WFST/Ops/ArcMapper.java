package WFST.Ops;

import WFST.Arc;

/**
 * Per-arc transformation applied by {@link ArcMap} and {@link ArcMapFst}.
 * <p>
 * Final weights are mapped as the weight of an arc (0, 0, final, NO_STATE_ID); the mapped arc must
 * keep epsilon labels and no next state, since no superfinal state is ever introduced.
 * @param <W> weight type
 */
public interface ArcMapper<W> {
    Arc<W> map(Arc<W> arc);

    MapSymbolsAction inputSymbolsAction();

    MapSymbolsAction outputSymbolsAction();

    /**
     * Properties of the result given the properties of the input.
     */
    long properties(long inprops);
}
