package WFST.Weight;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;

/**
 * Algebra of a weight type W: (W, plus, times, zero, one).
 * Implementations must keep plus and times associative, times distributive over plus,
 * zero and one the respective identities, and zero annihilating for times;
 * shortest-distance style algorithms rely on these laws.
 * Weights themselves are immutable values with value equality.
 * @param <W> weight type
 */
public interface Semiring<W> {
    /** Default quantization / approximate equality tolerance. */
    float DELTA = 1.0f / 1024.0f;

    // Semiring property bits
    long LEFT_SEMIRING = 0x1L;  // times distributes on the left
    long RIGHT_SEMIRING = 0x2L; // times distributes on the right
    long SEMIRING = LEFT_SEMIRING | RIGHT_SEMIRING;
    long COMMUTATIVE = 0x4L;
    long IDEMPOTENT = 0x8L;     // plus(a, a) == a
    long PATH = 0x10L;          // plus(a, b) is either a or b

    W zero();

    W one();

    /** The reserved non-member element used to signal errors. */
    W noWeight();

    W plus(W a, W b);

    W times(W a, W b);

    /**
     * Whether w is a valid element; some encodings reserve values for error signalling.
     */
    boolean member(W w);

    W quantize(W w, float delta);

    boolean approxEqual(W a, W b, float delta);

    default boolean approxEqual(W a, W b) {
        return approxEqual(a, b, DELTA);
    }

    /** Name of the weight type, e.g. "tropical". */
    String weightType();

    /** Name of the arc type built over this weight; keys the registry together with the transducer type. */
    default String arcType() {
        return "tropical".equals(weightType()) ? "standard" : weightType();
    }

    /** Semiring property bits. */
    long properties();

    void write(W w, DataOutput out) throws IOException;

    W read(DataInput in) throws IOException;

    /**
     * Text form of w.
     * @throws WFST.FstException if a composite weight's text I/O is misconfigured
     */
    String format(W w);

    /**
     * Parse the text form of a weight; surrounding whitespace is ignored.
     * @throws WFST.FstException on malformed input; a partial weight is never returned
     */
    W parse(String text);
}
