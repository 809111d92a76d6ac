package WFST.Weight;

import WFST.FstException;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;

/**
 * Cartesian product of two semirings with component-wise operations.
 * Text I/O goes through the composite weight reader/writer; nesting a product inside
 * another product needs parentheses configured to be unambiguous.
 * @param <W1> first component weight
 * @param <W2> second component weight
 */
public final class ProductSemiring<W1, W2> implements Semiring<PairWeight<W1, W2>> {
    private final Semiring<W1> first;
    private final Semiring<W2> second;
    private final CompositeWeightIO config;

    /**
     * Text configuration taken from FstFlags as they are now; a misconfiguration is logged here.
     */
    public ProductSemiring(Semiring<W1> first, Semiring<W2> second) {
        this(first, second, new CompositeWeightIO());
    }

    /**
     * @param config separator/parenthesis configuration; if errored, every format or parse fails
     */
    public ProductSemiring(Semiring<W1> first, Semiring<W2> second, CompositeWeightIO config) {
        this.first = first;
        this.second = second;
        this.config = config;
    }

    public Semiring<W1> getFirst() {
        return first;
    }

    public Semiring<W2> getSecond() {
        return second;
    }

    public CompositeWeightIO getConfig() {
        return config;
    }

    @Override
    public PairWeight<W1, W2> zero() {
        return new PairWeight<>(first.zero(), second.zero());
    }

    @Override
    public PairWeight<W1, W2> one() {
        return new PairWeight<>(first.one(), second.one());
    }

    @Override
    public PairWeight<W1, W2> noWeight() {
        return new PairWeight<>(first.noWeight(), second.noWeight());
    }

    @Override
    public PairWeight<W1, W2> plus(PairWeight<W1, W2> a, PairWeight<W1, W2> b) {
        return new PairWeight<>(first.plus(a.getValue1(), b.getValue1()), second.plus(a.getValue2(), b.getValue2()));
    }

    @Override
    public PairWeight<W1, W2> times(PairWeight<W1, W2> a, PairWeight<W1, W2> b) {
        return new PairWeight<>(first.times(a.getValue1(), b.getValue1()), second.times(a.getValue2(), b.getValue2()));
    }

    @Override
    public boolean member(PairWeight<W1, W2> w) {
        return first.member(w.getValue1()) && second.member(w.getValue2());
    }

    @Override
    public PairWeight<W1, W2> quantize(PairWeight<W1, W2> w, float delta) {
        return new PairWeight<>(first.quantize(w.getValue1(), delta), second.quantize(w.getValue2(), delta));
    }

    @Override
    public boolean approxEqual(PairWeight<W1, W2> a, PairWeight<W1, W2> b, float delta) {
        return first.approxEqual(a.getValue1(), b.getValue1(), delta)
            && second.approxEqual(a.getValue2(), b.getValue2(), delta);
    }

    @Override
    public String weightType() {
        return first.weightType() + "_X_" + second.weightType();
    }

    @Override
    public long properties() {
        return first.properties() & second.properties() & (SEMIRING | COMMUTATIVE | IDEMPOTENT);
    }

    @Override
    public void write(PairWeight<W1, W2> w, DataOutput out) throws IOException {
        first.write(w.getValue1(), out);
        second.write(w.getValue2(), out);
    }

    @Override
    public PairWeight<W1, W2> read(DataInput in) throws IOException {
        final W1 w1 = first.read(in);
        final W2 w2 = second.read(in);
        return new PairWeight<>(w1, w2);
    }

    @Override
    public String format(PairWeight<W1, W2> w) {
        final StringBuilder sb = new StringBuilder();
        final CompositeWeightWriter writer = new CompositeWeightWriter(sb, config);
        writer.writeBegin();
        writer.writeElement(first.format(w.getValue1()));
        writer.writeElement(second.format(w.getValue2()));
        writer.writeEnd();
        if (writer.bad()) {
            throw new FstException(FstException.Code.CONFIGURATION, "Cannot write " + weightType() + " weight");
        }
        return sb.toString();
    }

    @Override
    public PairWeight<W1, W2> parse(String text) {
        final CompositeWeightReader reader = new CompositeWeightReader(text, config);
        reader.readBegin();
        final String e1 = reader.readElement(false);
        final String e2 = reader.readElement(true);
        reader.readEnd();
        if (reader.bad()) {
            throw new FstException(FstException.Code.MALFORMED_WEIGHT,
                "Not a " + weightType() + " weight: \"" + text + "\"");
        }
        return new PairWeight<>(first.parse(e1), second.parse(e2));
    }

    @Override
    public String toString() {
        return weightType();
    }
}
