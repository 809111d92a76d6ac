package WFST.Model;

import WFST.Arc;
import WFST.Weight.Semiring;
import it.unimi.dsi.fastutil.ints.IntCollection;

/**
 * Implementation with in-place mutators. Each mutator keeps the stored properties current
 * through the transfer functions in {@link WFST.Properties}.
 * @param <W> weight type
 */
public abstract class MutableFstImpl<W> extends ExpandedFstImpl<W> {
    protected MutableFstImpl(Semiring<W> semiring) {
        super(semiring);
    }

    protected MutableFstImpl(FstImpl<W> impl) {
        super(impl);
    }

    public abstract void setStart(int s);

    public abstract void setFinal(int s, W weight);

    public abstract int addState();

    public abstract void addStates(int n);

    public abstract void addArc(int s, Arc<W> arc);

    public abstract void deleteStates(IntCollection dstates);

    public abstract void deleteStates();

    public abstract void deleteArcs(int s, int n);

    public abstract void deleteArcs(int s);

    public void reserveStates(int n) {
    }

    public void reserveArcs(int s, int n) {
    }

    /** Arc at position pos of state s. */
    public abstract Arc<W> arc(int s, int pos);

    /** Replace the arc at position pos of state s. */
    public abstract void setArc(int s, int pos, Arc<W> arc);
}
