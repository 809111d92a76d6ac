package WFST.Registry;

import WFST.Fst;

import java.io.DataInput;
import java.io.IOException;

/**
 * Reads a transducer body (and the header, unless opts carries one already).
 * @param <W> weight type
 */
@FunctionalInterface
public interface FstReader<W> {
    /**
     * @return the transducer, or null (after logging) if the input does not describe one of this type
     */
    Fst<W> read(DataInput in, FstReadOptions opts) throws IOException;
}
