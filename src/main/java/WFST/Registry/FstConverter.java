package WFST.Registry;

import WFST.Fst;

/**
 * Rebuilds any transducer into a particular representation.
 * @param <W> weight type
 */
@FunctionalInterface
public interface FstConverter<W> {
    Fst<W> convert(Fst<W> fst);
}
