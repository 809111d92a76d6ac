package WFST.Model;

import WFST.StateIterator;
import WFST.Weight.Semiring;

/**
 * Implementation whose states are exactly [0, numStates()).
 * @param <W> weight type
 */
public abstract class ExpandedFstImpl<W> extends FstImpl<W> {
    protected ExpandedFstImpl(Semiring<W> semiring) {
        super(semiring);
    }

    protected ExpandedFstImpl(FstImpl<W> impl) {
        super(impl);
    }

    public abstract int numStates();

    @Override
    public StateIterator states() {
        return new ExpandedStateIterator(this);
    }
}
