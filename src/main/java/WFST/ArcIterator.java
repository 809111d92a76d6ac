package WFST;

/**
 * Iterates over the arcs leaving one state, with random access through seek().
 * Flags let a consumer promise not to read some arc fields, so a representation may skip decoding them.
 * @param <W> weight type
 */
public interface ArcIterator<W> {
    int ILABEL_VALUE = 0x01;
    int OLABEL_VALUE = 0x02;
    int WEIGHT_VALUE = 0x04;
    int NEXT_STATE_VALUE = 0x08;
    /** Delayed transducers need not cache the arcs visited. */
    int NO_CACHE = 0x10;
    int VALUE_FLAGS = ILABEL_VALUE | OLABEL_VALUE | WEIGHT_VALUE | NEXT_STATE_VALUE;
    int FLAGS = VALUE_FLAGS | NO_CACHE;

    boolean done();

    Arc<W> value();

    void next();

    void reset();

    int position();

    void seek(int position);

    default int flags() {
        return VALUE_FLAGS;
    }

    default void setFlags(int flags, int mask) {
    }
}
