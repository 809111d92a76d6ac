package WFST;

import java.util.Objects;

/**
 * Transition (ilabel, olabel, weight, nextstate). Immutable; arcs are owned by the state holding them.
 * @param <W> weight type
 */
public final class Arc<W> {
    /** The reserved no-symbol label. */
    public static final int EPSILON = 0;
    public static final int NO_LABEL = -1;
    public static final int NO_STATE_ID = -1;

    private final int ilabel;
    private final int olabel;
    private final W weight;
    private final int nextState;

    public Arc(int ilabel, int olabel, W weight, int nextState) {
        this.ilabel = ilabel;
        this.olabel = olabel;
        this.weight = Objects.requireNonNull(weight);
        this.nextState = nextState;
    }

    public int getILabel() {
        return ilabel;
    }

    public int getOLabel() {
        return olabel;
    }

    public W getWeight() {
        return weight;
    }

    public int getNextState() {
        return nextState;
    }

    public Arc<W> withLabels(int ilabel, int olabel) {
        return new Arc<>(ilabel, olabel, weight, nextState);
    }

    public Arc<W> withWeight(W weight) {
        return new Arc<>(ilabel, olabel, weight, nextState);
    }

    public Arc<W> withNextState(int nextState) {
        return new Arc<>(ilabel, olabel, weight, nextState);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Arc)) {
            return false;
        }
        final Arc<?> arc = (Arc<?>) o;
        return ilabel == arc.ilabel && olabel == arc.olabel && nextState == arc.nextState && weight.equals(arc.weight);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ilabel, olabel, weight, nextState);
    }

    @Override
    public String toString() {
        return "(" + ilabel + ":" + olabel + "/" + weight + " -> " + nextState + ")";
    }
}
