package WFST.Registry;

import WFST.Weight.Semiring;

/**
 * Reader and converter for one (arc type, transducer type) pair.
 * @param <W> weight type
 */
public final class FstRegistration<W> {
    private final Semiring<W> semiring;
    private final String fstType;
    private final FstReader<W> reader;
    private final FstConverter<W> converter;

    public FstRegistration(Semiring<W> semiring, String fstType, FstReader<W> reader, FstConverter<W> converter) {
        this.semiring = semiring;
        this.fstType = fstType;
        this.reader = reader;
        this.converter = converter;
    }

    public Semiring<W> getSemiring() {
        return semiring;
    }

    public String getArcType() {
        return semiring.arcType();
    }

    public String getFstType() {
        return fstType;
    }

    public FstReader<W> getReader() {
        return reader;
    }

    public FstConverter<W> getConverter() {
        return converter;
    }

    @Override
    public String toString() {
        return fstType + "/" + getArcType();
    }
}
