package WFST;

import java.util.ArrayList;
import java.util.List;

/**
 * Transducer property bits and the transfer functions that keep them current under mutation.
 * <p>
 * Binary properties hold or not. Trinary properties come in (positive, negative) pairs; a property is
 * known only when one of its two bits is set. Stored properties are a performance hint: anything not
 * known must be computed (see {@link PropertyComputation}) rather than assumed.
 */
public final class Properties {
    // Binary properties
    /** The transducer is an ExpandedFst. */
    public static final long EXPANDED = 0x0000000000000001L;
    /** The transducer is a MutableFst. */
    public static final long MUTABLE = 0x0000000000000002L;
    /** An error was detected while constructing or using the transducer. */
    public static final long ERROR = 0x0000000000000004L;

    // Trinary properties
    /** ilabel == olabel on every arc. */
    public static final long ACCEPTOR = 0x0000000000010000L;
    public static final long NOT_ACCEPTOR = 0x0000000000020000L;
    /** ilabels unique leaving each state. */
    public static final long I_DETERMINISTIC = 0x0000000000040000L;
    public static final long NON_I_DETERMINISTIC = 0x0000000000080000L;
    /** olabels unique leaving each state. */
    public static final long O_DETERMINISTIC = 0x0000000000100000L;
    public static final long NON_O_DETERMINISTIC = 0x0000000000200000L;
    /** Some arc has ilabel == olabel == epsilon. */
    public static final long EPSILONS = 0x0000000000400000L;
    public static final long NO_EPSILONS = 0x0000000000800000L;
    /** Some arc has an epsilon ilabel. */
    public static final long I_EPSILONS = 0x0000000001000000L;
    public static final long NO_I_EPSILONS = 0x0000000002000000L;
    /** Some arc has an epsilon olabel. */
    public static final long O_EPSILONS = 0x0000000004000000L;
    public static final long NO_O_EPSILONS = 0x0000000008000000L;
    /** ilabels sorted within each state. */
    public static final long I_LABEL_SORTED = 0x0000000010000000L;
    public static final long NOT_I_LABEL_SORTED = 0x0000000020000000L;
    /** olabels sorted within each state. */
    public static final long O_LABEL_SORTED = 0x0000000040000000L;
    public static final long NOT_O_LABEL_SORTED = 0x0000000080000000L;
    /** Some non-trivial (neither zero nor one) arc or final weight. */
    public static final long WEIGHTED = 0x0000000100000000L;
    public static final long UNWEIGHTED = 0x0000000200000000L;
    public static final long CYCLIC = 0x0000000400000000L;
    public static final long ACYCLIC = 0x0000000800000000L;
    /** Has a cycle through the start state. */
    public static final long INITIAL_CYCLIC = 0x0000001000000000L;
    public static final long INITIAL_ACYCLIC = 0x0000002000000000L;
    /** Every arc goes to a higher state id. */
    public static final long TOP_SORTED = 0x0000004000000000L;
    public static final long NOT_TOP_SORTED = 0x0000008000000000L;
    /** All states reachable from the start. */
    public static final long ACCESSIBLE = 0x0000010000000000L;
    public static final long NOT_ACCESSIBLE = 0x0000020000000000L;
    /** All states can reach a final state. */
    public static final long CO_ACCESSIBLE = 0x0000040000000000L;
    public static final long NOT_CO_ACCESSIBLE = 0x0000080000000000L;
    /** A single path 0 -> 1 -> ... ending in the only final state (or empty). */
    public static final long STRING = 0x0000100000000000L;
    public static final long NOT_STRING = 0x0000200000000000L;
    public static final long WEIGHTED_CYCLES = 0x0000400000000000L;
    public static final long UNWEIGHTED_CYCLES = 0x0000800000000000L;

    /** Properties of the empty transducer. */
    public static final long NULL_PROPERTIES = ACCEPTOR | I_DETERMINISTIC | O_DETERMINISTIC | NO_EPSILONS
        | NO_I_EPSILONS | NO_O_EPSILONS | I_LABEL_SORTED | O_LABEL_SORTED | UNWEIGHTED | ACYCLIC
        | INITIAL_ACYCLIC | TOP_SORTED | ACCESSIBLE | CO_ACCESSIBLE | STRING | UNWEIGHTED_CYCLES;

    public static final long BINARY_PROPERTIES = 0x0000000000000007L;
    public static final long TRINARY_PROPERTIES = 0x0000ffffffff0000L;
    public static final long POS_TRINARY_PROPERTIES = TRINARY_PROPERTIES & 0x5555555555555555L;
    public static final long NEG_TRINARY_PROPERTIES = TRINARY_PROPERTIES & 0xaaaaaaaaaaaaaaaaL;
    public static final long FST_PROPERTIES = BINARY_PROPERTIES | TRINARY_PROPERTIES;

    /** Properties a copy (or a written file) inherits. */
    public static final long COPY_PROPERTIES = ERROR | TRINARY_PROPERTIES;
    /** Properties describing structure; identical for all aliases of one implementation. */
    public static final long INTRINSIC_PROPERTIES = EXPANDED | MUTABLE | TRINARY_PROPERTIES;
    /** Properties that may differ between aliases. */
    public static final long EXTRINSIC_PROPERTIES = ERROR;

    // Masks of properties preserved by mutations
    static final long SET_START_PROPERTIES = EXPANDED | MUTABLE | ERROR | ACCEPTOR | NOT_ACCEPTOR
        | I_DETERMINISTIC | NON_I_DETERMINISTIC | O_DETERMINISTIC | NON_O_DETERMINISTIC | EPSILONS | NO_EPSILONS
        | I_EPSILONS | NO_I_EPSILONS | O_EPSILONS | NO_O_EPSILONS | I_LABEL_SORTED | NOT_I_LABEL_SORTED
        | O_LABEL_SORTED | NOT_O_LABEL_SORTED | WEIGHTED | UNWEIGHTED | CYCLIC | ACYCLIC | TOP_SORTED
        | NOT_TOP_SORTED | CO_ACCESSIBLE | NOT_CO_ACCESSIBLE | WEIGHTED_CYCLES | UNWEIGHTED_CYCLES;

    static final long SET_FINAL_PROPERTIES = EXPANDED | MUTABLE | ERROR | ACCEPTOR | NOT_ACCEPTOR
        | I_DETERMINISTIC | NON_I_DETERMINISTIC | O_DETERMINISTIC | NON_O_DETERMINISTIC | EPSILONS | NO_EPSILONS
        | I_EPSILONS | NO_I_EPSILONS | O_EPSILONS | NO_O_EPSILONS | I_LABEL_SORTED | NOT_I_LABEL_SORTED
        | O_LABEL_SORTED | NOT_O_LABEL_SORTED | CYCLIC | ACYCLIC | INITIAL_CYCLIC | INITIAL_ACYCLIC | TOP_SORTED
        | NOT_TOP_SORTED | ACCESSIBLE | NOT_ACCESSIBLE | WEIGHTED_CYCLES | UNWEIGHTED_CYCLES;

    static final long ADD_STATE_PROPERTIES = EXPANDED | MUTABLE | ERROR | ACCEPTOR | NOT_ACCEPTOR
        | I_DETERMINISTIC | NON_I_DETERMINISTIC | O_DETERMINISTIC | NON_O_DETERMINISTIC | EPSILONS | NO_EPSILONS
        | I_EPSILONS | NO_I_EPSILONS | O_EPSILONS | NO_O_EPSILONS | I_LABEL_SORTED | NOT_I_LABEL_SORTED
        | O_LABEL_SORTED | NOT_O_LABEL_SORTED | WEIGHTED | UNWEIGHTED | CYCLIC | ACYCLIC | INITIAL_CYCLIC
        | INITIAL_ACYCLIC | TOP_SORTED | NOT_TOP_SORTED | NOT_ACCESSIBLE | NOT_CO_ACCESSIBLE | NOT_STRING
        | WEIGHTED_CYCLES | UNWEIGHTED_CYCLES;

    static final long ADD_ARC_PROPERTIES = EXPANDED | MUTABLE | ERROR | NOT_ACCEPTOR | NON_I_DETERMINISTIC
        | NON_O_DETERMINISTIC | EPSILONS | I_EPSILONS | O_EPSILONS | NOT_I_LABEL_SORTED | NOT_O_LABEL_SORTED
        | WEIGHTED | CYCLIC | INITIAL_CYCLIC | NOT_TOP_SORTED | ACCESSIBLE | CO_ACCESSIBLE | WEIGHTED_CYCLES;

    static final long SET_ARC_PROPERTIES = EXPANDED | MUTABLE | ERROR;

    static final long DELETE_STATES_PROPERTIES = EXPANDED | MUTABLE | ERROR | ACCEPTOR | I_DETERMINISTIC
        | O_DETERMINISTIC | NO_EPSILONS | NO_I_EPSILONS | NO_O_EPSILONS | I_LABEL_SORTED | O_LABEL_SORTED
        | UNWEIGHTED | ACYCLIC | INITIAL_ACYCLIC | TOP_SORTED | UNWEIGHTED_CYCLES;

    static final long DELETE_ARCS_PROPERTIES = EXPANDED | MUTABLE | ERROR | ACCEPTOR | I_DETERMINISTIC
        | O_DETERMINISTIC | NO_EPSILONS | NO_I_EPSILONS | NO_O_EPSILONS | I_LABEL_SORTED | O_LABEL_SORTED
        | UNWEIGHTED | ACYCLIC | INITIAL_ACYCLIC | TOP_SORTED | UNWEIGHTED_CYCLES;

    private static final String[] NAMES = {
        "expanded", "mutable", "error", "", "", "", "", "", "", "", "", "", "", "", "", "",
        "acceptor", "not acceptor", "input deterministic", "non input deterministic",
        "output deterministic", "non output deterministic", "input/output epsilons",
        "no input/output epsilons", "input epsilons", "no input epsilons", "output epsilons",
        "no output epsilons", "input label sorted", "not input label sorted",
        "output label sorted", "not output label sorted", "weighted", "unweighted", "cyclic",
        "acyclic", "cyclic at initial state", "acyclic at initial state", "top sorted",
        "not top sorted", "accessible", "not accessible", "coaccessible", "not coaccessible",
        "string", "not string", "weighted cycles", "unweighted cycles"
    };

    private Properties() {
    }

    /**
     * Bits that are known given props: all binary bits, and both bits of each trinary pair that has one set.
     */
    public static long knownProperties(long props) {
        return BINARY_PROPERTIES | (props & TRINARY_PROPERTIES)
            | ((props & POS_TRINARY_PROPERTIES) << 1) | ((props & NEG_TRINARY_PROPERTIES) >>> 1);
    }

    /**
     * Whether two property sets agree on every property known in both.
     */
    public static boolean compatProperties(long props1, long props2) {
        final long knownProps1 = knownProperties(props1);
        final long knownProps2 = knownProperties(props2);
        final long knownProps = knownProps1 & knownProps2;
        final long incompatProps = (props1 & knownProps) ^ (props2 & knownProps);
        return incompatProps == 0;
    }

    /** Comma-separated names of the set bits. */
    public static String describe(long props) {
        final List<String> names = new ArrayList<>();
        for (int i = 0; i < NAMES.length; i++) {
            if ((props & (1L << i)) != 0 && !NAMES[i].isEmpty()) {
                names.add(NAMES[i]);
            }
        }
        return String.join(", ", names);
    }

    public static long setStartProperties(long inprops) {
        long outprops = inprops & SET_START_PROPERTIES;
        if ((inprops & ACYCLIC) != 0) {
            outprops |= INITIAL_ACYCLIC;
        }
        return outprops;
    }

    public static <W> long setFinalProperties(long inprops, W oldWeight, W newWeight, W zero, W one) {
        long outprops = inprops;
        if (!oldWeight.equals(zero) && !oldWeight.equals(one)) {
            outprops &= ~WEIGHTED;
        }
        if (!newWeight.equals(zero) && !newWeight.equals(one)) {
            outprops |= WEIGHTED;
            outprops &= ~UNWEIGHTED;
        }
        outprops &= SET_FINAL_PROPERTIES | WEIGHTED | UNWEIGHTED;
        return outprops;
    }

    public static long addStateProperties(long inprops) {
        return inprops & ADD_STATE_PROPERTIES;
    }

    /**
     * @param prevArc the arc preceding the new one at state s, or null
     */
    public static <W> long addArcProperties(long inprops, int s, Arc<W> arc, Arc<W> prevArc, W zero, W one) {
        long outprops = inprops;
        if (arc.getILabel() != arc.getOLabel()) {
            outprops |= NOT_ACCEPTOR;
            outprops &= ~ACCEPTOR;
        }
        if (arc.getILabel() == Arc.EPSILON) {
            outprops |= I_EPSILONS;
            outprops &= ~NO_I_EPSILONS;
            if (arc.getOLabel() == Arc.EPSILON) {
                outprops |= EPSILONS;
                outprops &= ~NO_EPSILONS;
            }
        }
        if (arc.getOLabel() == Arc.EPSILON) {
            outprops |= O_EPSILONS;
            outprops &= ~NO_O_EPSILONS;
        }
        if (prevArc != null) {
            if (prevArc.getILabel() > arc.getILabel()) {
                outprops |= NOT_I_LABEL_SORTED;
                outprops &= ~I_LABEL_SORTED;
            }
            if (prevArc.getOLabel() > arc.getOLabel()) {
                outprops |= NOT_O_LABEL_SORTED;
                outprops &= ~O_LABEL_SORTED;
            }
        }
        if (!arc.getWeight().equals(zero) && !arc.getWeight().equals(one)) {
            outprops |= WEIGHTED;
            outprops &= ~UNWEIGHTED;
        }
        if (arc.getNextState() <= s) {
            outprops |= NOT_TOP_SORTED;
            outprops &= ~TOP_SORTED;
        }
        outprops &= ADD_ARC_PROPERTIES | ACCEPTOR | NO_EPSILONS | NO_I_EPSILONS | NO_O_EPSILONS
            | I_LABEL_SORTED | O_LABEL_SORTED | UNWEIGHTED | TOP_SORTED;
        if ((outprops & TOP_SORTED) != 0) {
            outprops |= ACYCLIC | INITIAL_ACYCLIC;
        }
        return outprops;
    }

    /**
     * Properties after replacing oldArc by newArc in place.
     */
    public static <W> long setArcProperties(long inprops, Arc<W> oldArc, Arc<W> newArc, W zero, W one) {
        long props = inprops;
        if (oldArc.getILabel() != oldArc.getOLabel()) {
            props &= ~NOT_ACCEPTOR;
        }
        if (oldArc.getILabel() == Arc.EPSILON) {
            props &= ~I_EPSILONS;
            if (oldArc.getOLabel() == Arc.EPSILON) {
                props &= ~EPSILONS;
            }
        }
        if (oldArc.getOLabel() == Arc.EPSILON) {
            props &= ~O_EPSILONS;
        }
        if (!oldArc.getWeight().equals(zero) && !oldArc.getWeight().equals(one)) {
            props &= ~WEIGHTED;
        }
        if (newArc.getILabel() != newArc.getOLabel()) {
            props |= NOT_ACCEPTOR;
            props &= ~ACCEPTOR;
        }
        if (newArc.getILabel() == Arc.EPSILON) {
            props |= I_EPSILONS;
            props &= ~NO_I_EPSILONS;
            if (newArc.getOLabel() == Arc.EPSILON) {
                props |= EPSILONS;
                props &= ~NO_EPSILONS;
            }
        }
        if (newArc.getOLabel() == Arc.EPSILON) {
            props |= O_EPSILONS;
            props &= ~NO_O_EPSILONS;
        }
        if (!newArc.getWeight().equals(zero) && !newArc.getWeight().equals(one)) {
            props |= WEIGHTED;
            props &= ~UNWEIGHTED;
        }
        props &= SET_ARC_PROPERTIES | ACCEPTOR | NOT_ACCEPTOR | EPSILONS | NO_EPSILONS | I_EPSILONS
            | NO_I_EPSILONS | O_EPSILONS | NO_O_EPSILONS | WEIGHTED | UNWEIGHTED;
        return props;
    }

    public static long deleteStatesProperties(long inprops) {
        return inprops & DELETE_STATES_PROPERTIES;
    }

    /**
     * @param staticProps properties fixed by the representation, e.g. EXPANDED | MUTABLE
     */
    public static long deleteAllStatesProperties(long inprops, long staticProps) {
        return (inprops & ERROR) | NULL_PROPERTIES | staticProps;
    }

    public static long deleteArcsProperties(long inprops) {
        return inprops & DELETE_ARCS_PROPERTIES;
    }

    /**
     * Properties of the closure of a transducer with properties inprops.
     * @param delayed whether the closure is a delayed transducer (which is neither expanded nor mutable)
     */
    public static long closureProperties(long inprops, boolean star, boolean delayed) {
        long outprops = (ERROR | ACCEPTOR | UNWEIGHTED | ACCESSIBLE) & inprops;
        if ((inprops & UNWEIGHTED) != 0) {
            outprops |= UNWEIGHTED_CYCLES;
        }
        if (!delayed) {
            outprops |= (EXPANDED | MUTABLE | CO_ACCESSIBLE | NOT_TOP_SORTED | NOT_STRING) & inprops;
        }
        if (!delayed || (inprops & ACCESSIBLE) != 0) {
            outprops |= (NOT_ACCEPTOR | NON_I_DETERMINISTIC | NON_O_DETERMINISTIC | NOT_I_LABEL_SORTED
                | NOT_O_LABEL_SORTED | WEIGHTED | WEIGHTED_CYCLES | NOT_ACCESSIBLE | NOT_CO_ACCESSIBLE) & inprops;
        }
        return outprops;
    }

    /**
     * Properties after exchanging input and output labels.
     */
    public static long invertProperties(long inprops) {
        long outprops = (EXPANDED | MUTABLE | ERROR | ACCEPTOR | NOT_ACCEPTOR | EPSILONS | NO_EPSILONS
            | WEIGHTED | UNWEIGHTED | WEIGHTED_CYCLES | UNWEIGHTED_CYCLES | CYCLIC | ACYCLIC | INITIAL_CYCLIC
            | INITIAL_ACYCLIC | TOP_SORTED | NOT_TOP_SORTED | ACCESSIBLE | NOT_ACCESSIBLE | CO_ACCESSIBLE
            | NOT_CO_ACCESSIBLE | STRING | NOT_STRING) & inprops;
        if ((I_DETERMINISTIC & inprops) != 0) outprops |= O_DETERMINISTIC;
        if ((NON_I_DETERMINISTIC & inprops) != 0) outprops |= NON_O_DETERMINISTIC;
        if ((O_DETERMINISTIC & inprops) != 0) outprops |= I_DETERMINISTIC;
        if ((NON_O_DETERMINISTIC & inprops) != 0) outprops |= NON_I_DETERMINISTIC;
        if ((I_EPSILONS & inprops) != 0) outprops |= O_EPSILONS;
        if ((NO_I_EPSILONS & inprops) != 0) outprops |= NO_O_EPSILONS;
        if ((O_EPSILONS & inprops) != 0) outprops |= I_EPSILONS;
        if ((NO_O_EPSILONS & inprops) != 0) outprops |= NO_I_EPSILONS;
        if ((I_LABEL_SORTED & inprops) != 0) outprops |= O_LABEL_SORTED;
        if ((NOT_I_LABEL_SORTED & inprops) != 0) outprops |= NOT_O_LABEL_SORTED;
        if ((O_LABEL_SORTED & inprops) != 0) outprops |= I_LABEL_SORTED;
        if ((NOT_O_LABEL_SORTED & inprops) != 0) outprops |= NOT_I_LABEL_SORTED;
        return outprops;
    }
}
