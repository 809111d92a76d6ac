package WFST.Model;

import WFST.StateIterator;

final class ExpandedStateIterator implements StateIterator {
    private final ExpandedFstImpl<?> impl;
    private int s = 0;

    ExpandedStateIterator(ExpandedFstImpl<?> impl) {
        this.impl = impl;
    }

    @Override
    public boolean done() {
        return s >= impl.numStates();
    }

    @Override
    public int value() {
        return s;
    }

    @Override
    public void next() {
        ++s;
    }

    @Override
    public void reset() {
        s = 0;
    }
}
