package WFST;

import net.automatalib.automaton.concept.FiniteRepresentation;

/**
 * Fully instantiated transducer: every id in [0, numStates()) is a state.
 */
public interface ExpandedFst<W> extends Fst<W>, FiniteRepresentation {
    int numStates();

    @Override
    default int size() {
        return numStates();
    }

    @Override
    ExpandedFst<W> copy(boolean safe);
}
