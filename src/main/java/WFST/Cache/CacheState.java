package WFST.Cache;

import WFST.Arc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Cached final weight and arcs of one state of a delayed transducer.
 */
public final class CacheState<W> {
    public enum Expansion {
        UNVISITED,
        EXPANDING,
        CACHED
    }

    private W finalWeight; // null until computed
    private final List<Arc<W>> arcs = new ArrayList<>();
    private int niepsilons = 0;
    private int noepsilons = 0;
    private Expansion expansion = Expansion.UNVISITED;

    public Expansion getExpansion() {
        return expansion;
    }

    boolean hasFinal() {
        return finalWeight != null;
    }

    W getFinalWeight() {
        return finalWeight;
    }

    void setFinalWeight(W finalWeight) {
        this.finalWeight = finalWeight;
    }

    void beginExpansion() {
        if (expansion != Expansion.UNVISITED) {
            throw new IllegalStateException("State expansion already " + expansion);
        }
        expansion = Expansion.EXPANDING;
    }

    void pushArc(Arc<W> arc) {
        if (expansion != Expansion.EXPANDING) {
            throw new IllegalStateException("Arc pushed to a state that is " + expansion);
        }
        if (arc.getILabel() == Arc.EPSILON) {
            ++niepsilons;
        }
        if (arc.getOLabel() == Arc.EPSILON) {
            ++noepsilons;
        }
        arcs.add(arc);
    }

    void finishExpansion() {
        expansion = Expansion.CACHED;
    }

    int numArcs() {
        return arcs.size();
    }

    int numInputEpsilons() {
        return niepsilons;
    }

    int numOutputEpsilons() {
        return noepsilons;
    }

    List<Arc<W>> arcs() {
        return Collections.unmodifiableList(arcs);
    }
}
