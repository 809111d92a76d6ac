package WFST.Model;

import WFST.Arc;
import WFST.ArcIterator;
import WFST.Fst;
import WFST.Properties;
import WFST.StateIterator;
import WFST.Registry.FstHeader;
import WFST.Registry.FstReadOptions;
import WFST.Registry.FstWriteOptions;
import WFST.Weight.Semiring;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.DataInput;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable flat layout: all arcs in one array, each state owning the slice
 * [arcOffsets[s], arcOffsets[s + 1]).
 */
public class ConstFstImpl<W> extends ExpandedFstImpl<W> {
    private static final Logger logger = LogManager.getLogger(ConstFstImpl.class.getSimpleName());

    public static final long STATIC_PROPERTIES = Properties.EXPANDED;
    static final int MIN_FILE_VERSION = 2;
    static final int FILE_VERSION = 2;
    // Largest capacity reserved from header counts before the body confirms them
    static final int MAX_PREALLOCATED = 1 << 16;

    private final int start;
    private final List<W> finals;
    private final int[] arcOffsets;
    private final int[] niepsilons;
    private final int[] noepsilons;
    private final List<Arc<W>> arcs;

    /**
     * Copy of any transducer; a delayed one is expanded completely.
     */
    public ConstFstImpl(Fst<W> fst) {
        super(fst.semiring());
        setType(ConstFst.TYPE);
        setInputSymbols(fst.inputSymbols() == null ? null : fst.inputSymbols().copy());
        setOutputSymbols(fst.outputSymbols() == null ? null : fst.outputSymbols().copy());

        final List<W> finalList = new ArrayList<>();
        final List<Arc<W>> arcList = new ArrayList<>();
        final IntArrayList offsets = new IntArrayList();
        final IntArrayList ieps = new IntArrayList();
        final IntArrayList oeps = new IntArrayList();
        for (StateIterator siter = fst.states(); !siter.done(); siter.next()) {
            final int s = siter.value();
            while (finalList.size() < s) {
                // gap in the source numbering: a non-final state without arcs
                finalList.add(semiring.zero());
                offsets.add(arcList.size());
                ieps.add(0);
                oeps.add(0);
            }
            finalList.add(fst.finalWeight(s));
            offsets.add(arcList.size());
            ieps.add(fst.numInputEpsilons(s));
            oeps.add(fst.numOutputEpsilons(s));
            for (ArcIterator<W> aiter = fst.arcs(s); !aiter.done(); aiter.next()) {
                arcList.add(aiter.value());
            }
        }
        offsets.add(arcList.size());

        this.start = fst.start();
        this.finals = Collections.unmodifiableList(finalList);
        this.arcOffsets = offsets.toIntArray();
        this.niepsilons = ieps.toIntArray();
        this.noepsilons = oeps.toIntArray();
        this.arcs = Collections.unmodifiableList(arcList);
        setProperties(fst.properties(Properties.COPY_PROPERTIES, false) | STATIC_PROPERTIES);
    }

    private ConstFstImpl(Semiring<W> semiring, int start, List<W> finals, int[] arcOffsets,
                         int[] niepsilons, int[] noepsilons, List<Arc<W>> arcs) {
        super(semiring);
        setType(ConstFst.TYPE);
        this.start = start;
        this.finals = finals;
        this.arcOffsets = arcOffsets;
        this.niepsilons = niepsilons;
        this.noepsilons = noepsilons;
        this.arcs = arcs;
    }

    @Override
    protected long staticProperties() {
        return STATIC_PROPERTIES;
    }

    @Override
    public int start() {
        return start;
    }

    @Override
    public W finalWeight(int s) {
        return finals.get(s);
    }

    @Override
    public int numStates() {
        return finals.size();
    }

    @Override
    public int numArcs(int s) {
        return arcOffsets[s + 1] - arcOffsets[s];
    }

    @Override
    public int numInputEpsilons(int s) {
        return niepsilons[s];
    }

    @Override
    public int numOutputEpsilons(int s) {
        return noepsilons[s];
    }

    @Override
    public ArcIterator<W> arcs(int s) {
        return new ListArcIterator<>(arcs.subList(arcOffsets[s], arcOffsets[s + 1]));
    }

    /**
     * Body: per state the final weight, arc offset, arc count and epsilon counts; then every arc.
     */
    @Override
    public boolean write(OutputStream out, FstWriteOptions opts) {
        try {
            final DataOutputStream dout = new DataOutputStream(out);
            final FstHeader hdr = new FstHeader();
            hdr.setStart(start);
            hdr.setNumStates(numStates());
            hdr.setNumArcs(arcs.size());
            writeHeader(dout, opts, FILE_VERSION, hdr);
            for (int s = 0; s < numStates(); s++) {
                semiring.write(finals.get(s), dout);
                dout.writeInt(arcOffsets[s]);
                dout.writeInt(numArcs(s));
                dout.writeInt(niepsilons[s]);
                dout.writeInt(noepsilons[s]);
            }
            for (Arc<W> arc : arcs) {
                dout.writeInt(arc.getILabel());
                dout.writeInt(arc.getOLabel());
                semiring.write(arc.getWeight(), dout);
                dout.writeInt(arc.getNextState());
            }
            dout.flush();
            return true;
        } catch (IOException e) {
            logger.error("ConstFst::Write: Write failed: {}", opts.getSource(), e);
            return false;
        }
    }

    /**
     * @return the implementation, or null (after logging) if the input is not a consistent const transducer
     */
    static <W> ConstFstImpl<W> read(Semiring<W> semiring, DataInput in, FstReadOptions opts) throws IOException {
        final ConstFstImpl<W> probe = new ConstFstImpl<>(semiring, Arc.NO_STATE_ID, Collections.emptyList(),
            new int[]{0}, new int[0], new int[0], Collections.emptyList());
        final FstHeader hdr = probe.readHeader(in, opts, MIN_FILE_VERSION);
        if (hdr == null) {
            return null;
        }
        final long numStates = hdr.getNumStates();
        final long numArcs = hdr.getNumArcs();
        if (numStates < 0 || numStates >= Integer.MAX_VALUE || numArcs < 0 || numArcs > Integer.MAX_VALUE) {
            logger.error("ConstFst::Read: Bad state or arc count in header: {}", opts.getSource());
            return null;
        }
        // header counts are unverified until the body has been read
        final int ns = (int) numStates;
        final List<W> finals = new ArrayList<>(Math.min(ns, MAX_PREALLOCATED));
        final IntArrayList arcOffsets = new IntArrayList(Math.min(ns + 1, MAX_PREALLOCATED));
        final IntArrayList niepsilons = new IntArrayList(Math.min(ns, MAX_PREALLOCATED));
        final IntArrayList noepsilons = new IntArrayList(Math.min(ns, MAX_PREALLOCATED));
        long expectedOffset = 0;
        for (int s = 0; s < ns; s++) {
            finals.add(semiring.read(in));
            final int offset = in.readInt();
            final int narcs = in.readInt();
            niepsilons.add(in.readInt());
            noepsilons.add(in.readInt());
            if (offset != expectedOffset || narcs < 0 || expectedOffset + narcs > numArcs) {
                logger.error("ConstFst::Read: Inconsistent arc offsets at state {}: {}", s, opts.getSource());
                return null;
            }
            arcOffsets.add(offset);
            expectedOffset += narcs;
        }
        if (expectedOffset != numArcs) {
            logger.error("ConstFst::Read: Unexpected number of arcs {}, header says {}: {}",
                expectedOffset, numArcs, opts.getSource());
            return null;
        }
        arcOffsets.add((int) expectedOffset);
        final List<Arc<W>> arcs = new ArrayList<>((int) Math.min(expectedOffset, MAX_PREALLOCATED));
        for (long i = 0; i < expectedOffset; i++) {
            final int ilabel = in.readInt();
            final int olabel = in.readInt();
            final W weight = semiring.read(in);
            final int nextState = in.readInt();
            arcs.add(new Arc<>(ilabel, olabel, weight, nextState));
        }
        final ConstFstImpl<W> impl = new ConstFstImpl<>(semiring, (int) hdr.getStart(),
            Collections.unmodifiableList(finals), arcOffsets.toIntArray(), niepsilons.toIntArray(),
            noepsilons.toIntArray(), Collections.unmodifiableList(arcs));
        impl.setProperties(probe.properties());
        impl.setInputSymbols(probe.inputSymbols());
        impl.setOutputSymbols(probe.outputSymbols());
        return impl;
    }
}
