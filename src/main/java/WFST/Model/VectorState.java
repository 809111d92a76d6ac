package WFST.Model;

import WFST.Arc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One state of a vector transducer: final weight, arcs in insertion order, and epsilon counts.
 */
public final class VectorState<W> {
    private W finalWeight;
    private final ArrayList<Arc<W>> arcs;
    private int niepsilons = 0;
    private int noepsilons = 0;

    VectorState(W finalWeight) {
        this.finalWeight = finalWeight;
        this.arcs = new ArrayList<>();
    }

    VectorState(VectorState<W> state) {
        this.finalWeight = state.finalWeight;
        this.arcs = new ArrayList<>(state.arcs);
        this.niepsilons = state.niepsilons;
        this.noepsilons = state.noepsilons;
    }

    public W getFinalWeight() {
        return finalWeight;
    }

    void setFinalWeight(W finalWeight) {
        this.finalWeight = finalWeight;
    }

    public int numArcs() {
        return arcs.size();
    }

    public int numInputEpsilons() {
        return niepsilons;
    }

    public int numOutputEpsilons() {
        return noepsilons;
    }

    public Arc<W> getArc(int pos) {
        return arcs.get(pos);
    }

    /** @return the last arc, or null */
    Arc<W> lastArc() {
        return arcs.isEmpty() ? null : arcs.get(arcs.size() - 1);
    }

    List<Arc<W>> arcs() {
        return Collections.unmodifiableList(arcs);
    }

    void addArc(Arc<W> arc) {
        countEpsilons(arc, 1);
        arcs.add(arc);
    }

    void setArc(int pos, Arc<W> arc) {
        countEpsilons(arcs.get(pos), -1);
        countEpsilons(arc, 1);
        arcs.set(pos, arc);
    }

    /** Delete the last n arcs. */
    void deleteArcs(int n) {
        for (int i = 0; i < n; i++) {
            countEpsilons(arcs.remove(arcs.size() - 1), -1);
        }
    }

    void deleteArcs() {
        arcs.clear();
        niepsilons = 0;
        noepsilons = 0;
    }

    void reserveArcs(int n) {
        arcs.ensureCapacity(n);
    }

    /**
     * Renumber next states through newId, dropping arcs whose target maps to NO_STATE_ID.
     */
    void renumber(int[] newId) {
        int narcs = 0;
        for (int i = 0; i < arcs.size(); i++) {
            final Arc<W> arc = arcs.get(i);
            final int t = newId[arc.getNextState()];
            if (t != Arc.NO_STATE_ID) {
                arcs.set(narcs++, t == arc.getNextState() ? arc : arc.withNextState(t));
            } else {
                countEpsilons(arc, -1);
            }
        }
        arcs.subList(narcs, arcs.size()).clear();
    }

    private void countEpsilons(Arc<W> arc, int delta) {
        if (arc.getILabel() == Arc.EPSILON) {
            niepsilons += delta;
        }
        if (arc.getOLabel() == Arc.EPSILON) {
            noepsilons += delta;
        }
    }
}
