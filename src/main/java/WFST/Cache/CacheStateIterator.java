package WFST.Cache;

import WFST.StateIterator;

/**
 * Visits the states of a delayed transducer in id order, expanding unexpanded states
 * only as far as needed to discover the next id.
 */
final class CacheStateIterator implements StateIterator {
    private final CacheImpl<?> impl;
    private int s = 0;

    CacheStateIterator(CacheImpl<?> impl) {
        this.impl = impl;
        impl.start();
    }

    @Override
    public boolean done() {
        if (s < impl.numKnownStates()) {
            return false;
        }
        for (int u = impl.minUnexpandedState(); u < impl.numKnownStates(); u = impl.minUnexpandedState()) {
            impl.expandedState(u);
            if (s < impl.numKnownStates()) {
                return false;
            }
        }
        return true;
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
