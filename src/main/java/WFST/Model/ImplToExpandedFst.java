package WFST.Model;

import WFST.ExpandedFst;

public abstract class ImplToExpandedFst<I extends ExpandedFstImpl<W>, W> extends ImplToFst<I, W>
    implements ExpandedFst<W> {

    protected ImplToExpandedFst(I impl) {
        super(impl);
    }

    protected ImplToExpandedFst(ImplToExpandedFst<I, W> fst, boolean safe) {
        super(fst, safe);
    }

    @Override
    public int numStates() {
        return getImpl().numStates();
    }
}
