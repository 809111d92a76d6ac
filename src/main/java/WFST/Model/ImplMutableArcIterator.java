package WFST.Model;

import WFST.Arc;
import WFST.MutableArcIterator;

/**
 * Arc iterator over one state of a mutable handle. Reads go to whatever implementation the handle
 * currently holds, so a fork caused by setValue (or by another mutator) is followed transparently.
 */
final class ImplMutableArcIterator<W> implements MutableArcIterator<W> {
    private final ImplToMutableFst<?, W> fst;
    private final int s;
    private int pos = 0;
    private int flags = VALUE_FLAGS;

    ImplMutableArcIterator(ImplToMutableFst<?, W> fst, int s) {
        this.fst = fst;
        this.s = s;
    }

    @Override
    public boolean done() {
        return pos >= fst.numArcs(s);
    }

    @Override
    public Arc<W> value() {
        return fst.arcAt(s, pos);
    }

    @Override
    public void next() {
        ++pos;
    }

    @Override
    public void reset() {
        pos = 0;
    }

    @Override
    public int position() {
        return pos;
    }

    @Override
    public void seek(int position) {
        pos = position;
    }

    @Override
    public void setValue(Arc<W> arc) {
        fst.setArcAt(s, pos, arc);
    }

    @Override
    public int flags() {
        return flags;
    }

    @Override
    public void setFlags(int flags, int mask) {
        this.flags = (this.flags & ~mask) | (flags & mask);
    }
}
