package WFST.Model;

import WFST.Arc;
import WFST.ArcIterator;
import WFST.ExpandedFst;
import WFST.Fst;
import WFST.Properties;
import WFST.StateIterator;
import WFST.Registry.FstHeader;
import WFST.Registry.FstReadOptions;
import WFST.Registry.FstWriteOptions;
import WFST.Weight.Semiring;
import it.unimi.dsi.fastutil.ints.IntCollection;
import it.unimi.dsi.fastutil.ints.IntIterator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.DataInput;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;

/**
 * States kept in a list of {@link VectorState}s. State ids are bounds-checked by the list.
 */
public class VectorFstImpl<W> extends MutableFstImpl<W> {
    private static final Logger logger = LogManager.getLogger(VectorFstImpl.class.getSimpleName());

    public static final long STATIC_PROPERTIES = Properties.EXPANDED | Properties.MUTABLE;
    // First version that wrote symbol tables after the header
    static final int MIN_FILE_VERSION = 2;
    static final int FILE_VERSION = 2;

    private final ArrayList<VectorState<W>> states;
    private int start = Arc.NO_STATE_ID;

    public VectorFstImpl(Semiring<W> semiring) {
        super(semiring);
        this.states = new ArrayList<>();
        setType(VectorFst.TYPE);
        setProperties(Properties.NULL_PROPERTIES | STATIC_PROPERTIES);
    }

    /**
     * Deep copy of impl.
     */
    public VectorFstImpl(VectorFstImpl<W> impl) {
        super(impl);
        this.states = new ArrayList<>(impl.states.size());
        for (VectorState<W> state : impl.states) {
            this.states.add(new VectorState<>(state));
        }
        this.start = impl.start;
    }

    /**
     * Copy of any transducer; a delayed one is expanded completely.
     */
    public VectorFstImpl(Fst<W> fst) {
        super(fst.semiring());
        this.states = new ArrayList<>();
        setType(VectorFst.TYPE);
        setInputSymbols(fst.inputSymbols() == null ? null : fst.inputSymbols().copy());
        setOutputSymbols(fst.outputSymbols() == null ? null : fst.outputSymbols().copy());
        if (fst instanceof ExpandedFst) {
            states.ensureCapacity(((ExpandedFst<W>) fst).numStates());
        }
        for (StateIterator siter = fst.states(); !siter.done(); siter.next()) {
            final int s = siter.value();
            while (states.size() <= s) {
                states.add(new VectorState<>(semiring.zero()));
            }
            final VectorState<W> state = states.get(s);
            state.setFinalWeight(fst.finalWeight(s));
            state.reserveArcs(fst.numArcs(s));
            for (ArcIterator<W> aiter = fst.arcs(s); !aiter.done(); aiter.next()) {
                state.addArc(aiter.value());
            }
        }
        this.start = fst.start();
        setProperties(fst.properties(Properties.COPY_PROPERTIES, false) | STATIC_PROPERTIES);
    }

    @Override
    protected long staticProperties() {
        return STATIC_PROPERTIES;
    }

    VectorState<W> getState(int s) {
        return states.get(s);
    }

    @Override
    public int start() {
        return start;
    }

    @Override
    public W finalWeight(int s) {
        return states.get(s).getFinalWeight();
    }

    @Override
    public int numStates() {
        return states.size();
    }

    @Override
    public int numArcs(int s) {
        return states.get(s).numArcs();
    }

    @Override
    public int numInputEpsilons(int s) {
        return states.get(s).numInputEpsilons();
    }

    @Override
    public int numOutputEpsilons(int s) {
        return states.get(s).numOutputEpsilons();
    }

    @Override
    public ArcIterator<W> arcs(int s) {
        return new ListArcIterator<>(states.get(s).arcs());
    }

    @Override
    public Arc<W> arc(int s, int pos) {
        return states.get(s).getArc(pos);
    }

    @Override
    public void setStart(int s) {
        if (s != Arc.NO_STATE_ID && (s < 0 || s >= states.size())) {
            throw new IndexOutOfBoundsException("Start state " + s + " out of range [0, " + states.size() + ")");
        }
        start = s;
        setProperties(Properties.setStartProperties(properties()));
    }

    @Override
    public void setFinal(int s, W weight) {
        final VectorState<W> state = states.get(s);
        final W oldWeight = state.getFinalWeight();
        state.setFinalWeight(weight);
        setProperties(Properties.setFinalProperties(properties(), oldWeight, weight, semiring.zero(), semiring.one()));
    }

    @Override
    public int addState() {
        states.add(new VectorState<>(semiring.zero()));
        setProperties(Properties.addStateProperties(properties()));
        return states.size() - 1;
    }

    @Override
    public void addStates(int n) {
        states.ensureCapacity(states.size() + n);
        for (int i = 0; i < n; i++) {
            states.add(new VectorState<>(semiring.zero()));
        }
        setProperties(Properties.addStateProperties(properties()));
    }

    @Override
    public void addArc(int s, Arc<W> arc) {
        final VectorState<W> state = states.get(s);
        final Arc<W> prevArc = state.lastArc();
        state.addArc(arc);
        setProperties(Properties.addArcProperties(properties(), s, arc, prevArc, semiring.zero(), semiring.one()));
    }

    /**
     * Survivors keep their relative order and are renumbered densely.
     */
    @Override
    public void deleteStates(IntCollection dstates) {
        final int[] newId = new int[states.size()];
        for (IntIterator it = dstates.iterator(); it.hasNext(); ) {
            newId[it.nextInt()] = Arc.NO_STATE_ID;
        }
        int nstates = 0;
        for (int s = 0; s < states.size(); ++s) {
            if (newId[s] != Arc.NO_STATE_ID) {
                newId[s] = nstates;
                if (s != nstates) {
                    states.set(nstates, states.get(s));
                }
                ++nstates;
            }
        }
        states.subList(nstates, states.size()).clear();
        for (VectorState<W> state : states) {
            state.renumber(newId);
        }
        if (start != Arc.NO_STATE_ID) {
            start = newId[start];
        }
        setProperties(Properties.deleteStatesProperties(properties()));
    }

    @Override
    public void deleteStates() {
        states.clear();
        start = Arc.NO_STATE_ID;
        setProperties(Properties.deleteAllStatesProperties(properties(), STATIC_PROPERTIES));
    }

    @Override
    public void deleteArcs(int s, int n) {
        states.get(s).deleteArcs(n);
        setProperties(Properties.deleteArcsProperties(properties()));
    }

    @Override
    public void deleteArcs(int s) {
        states.get(s).deleteArcs();
        setProperties(Properties.deleteArcsProperties(properties()));
    }

    @Override
    public void reserveStates(int n) {
        states.ensureCapacity(n);
    }

    @Override
    public void reserveArcs(int s, int n) {
        states.get(s).reserveArcs(n);
    }

    @Override
    public void setArc(int s, int pos, Arc<W> arc) {
        final VectorState<W> state = states.get(s);
        final Arc<W> oldArc = state.getArc(pos);
        state.setArc(pos, arc);
        setProperties(Properties.setArcProperties(properties(), oldArc, arc, semiring.zero(), semiring.one()));
    }

    /**
     * Body: per state, the final weight, the arc count, then each arc's ilabel, olabel, weight and next state.
     */
    @Override
    public boolean write(OutputStream out, FstWriteOptions opts) {
        try {
            final DataOutputStream dout = new DataOutputStream(out);
            final FstHeader hdr = new FstHeader();
            long narcs = 0;
            for (VectorState<W> state : states) {
                narcs += state.numArcs();
            }
            hdr.setStart(start);
            hdr.setNumStates(states.size());
            hdr.setNumArcs(narcs);
            writeHeader(dout, opts, FILE_VERSION, hdr);
            for (VectorState<W> state : states) {
                semiring.write(state.getFinalWeight(), dout);
                dout.writeLong(state.numArcs());
                for (int i = 0; i < state.numArcs(); i++) {
                    final Arc<W> arc = state.getArc(i);
                    dout.writeInt(arc.getILabel());
                    dout.writeInt(arc.getOLabel());
                    semiring.write(arc.getWeight(), dout);
                    dout.writeInt(arc.getNextState());
                }
            }
            dout.flush();
            return true;
        } catch (IOException e) {
            logger.error("VectorFst::Write: Write failed: {}", opts.getSource(), e);
            return false;
        }
    }

    /**
     * @return the implementation, or null (after logging) if the header does not describe a vector transducer
     */
    static <W> VectorFstImpl<W> read(Semiring<W> semiring, DataInput in, FstReadOptions opts) throws IOException {
        final VectorFstImpl<W> impl = new VectorFstImpl<>(semiring);
        final FstHeader hdr = impl.readHeader(in, opts, MIN_FILE_VERSION);
        if (hdr == null) {
            return null;
        }
        final long numStates = hdr.getNumStates();
        if (numStates < 0 || numStates > Integer.MAX_VALUE) {
            logger.error("VectorFst::Read: Bad number of states {}: {}", numStates, opts.getSource());
            return null;
        }
        impl.states.ensureCapacity((int) Math.min(numStates, ConstFstImpl.MAX_PREALLOCATED));
        for (int s = 0; s < numStates; s++) {
            final VectorState<W> state = new VectorState<>(semiring.read(in));
            final long narcs = in.readLong();
            for (long i = 0; i < narcs; i++) {
                final int ilabel = in.readInt();
                final int olabel = in.readInt();
                final W weight = semiring.read(in);
                final int nextState = in.readInt();
                state.addArc(new Arc<>(ilabel, olabel, weight, nextState));
            }
            impl.states.add(state);
        }
        impl.start = (int) hdr.getStart();
        return impl;
    }
}
