package WFST;

/**
 * Arc iterator that can overwrite the arc at the current position.
 * Iteration order and other positions are unaffected.
 * <pre>
 *   for (MutableArcIterator&lt;W&gt; aiter = fst.mutableArcs(s); !aiter.done(); aiter.next()) {
 *     aiter.setValue(aiter.value().withLabels(7, 7));
 *   }
 * </pre>
 * @param <W> weight type
 */
public interface MutableArcIterator<W> extends ArcIterator<W> {
    /**
     * Replace the current arc. If the transducer shares its implementation, it is forked first.
     */
    void setValue(Arc<W> arc);
}
