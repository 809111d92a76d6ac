package WFST.Model;

import WFST.Arc;
import WFST.ArcIterator;

import java.util.List;

/**
 * Read-only arc iterator over a list of arcs.
 */
public final class ListArcIterator<W> implements ArcIterator<W> {
    private final List<Arc<W>> arcs;
    private int pos = 0;
    private int flags = VALUE_FLAGS;

    public ListArcIterator(List<Arc<W>> arcs) {
        this.arcs = arcs;
    }

    @Override
    public boolean done() {
        return pos >= arcs.size();
    }

    @Override
    public Arc<W> value() {
        return arcs.get(pos);
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
    public int flags() {
        return flags;
    }

    @Override
    public void setFlags(int flags, int mask) {
        this.flags = (this.flags & ~mask) | (flags & mask);
    }
}
