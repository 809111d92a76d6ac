package WFST.Weight;

import WFST.FstException;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;

/**
 * Tropical semiring: (min, +, +inf, 0).
 */
public final class TropicalSemiring implements Semiring<TropicalWeight> {
    public static final TropicalSemiring INSTANCE = new TropicalSemiring();

    private TropicalSemiring() {
    }

    @Override
    public TropicalWeight zero() {
        return TropicalWeight.ZERO;
    }

    @Override
    public TropicalWeight one() {
        return TropicalWeight.ONE;
    }

    @Override
    public TropicalWeight noWeight() {
        return TropicalWeight.NO_WEIGHT;
    }

    @Override
    public TropicalWeight plus(TropicalWeight a, TropicalWeight b) {
        if (!member(a) || !member(b)) {
            return noWeight();
        }
        return a.value < b.value ? a : b;
    }

    @Override
    public TropicalWeight times(TropicalWeight a, TropicalWeight b) {
        if (!member(a) || !member(b)) {
            return noWeight();
        }
        if (a.value == Float.POSITIVE_INFINITY) {
            return a;
        } else if (b.value == Float.POSITIVE_INFINITY) {
            return b;
        }
        return new TropicalWeight(a.value + b.value);
    }

    @Override
    public boolean member(TropicalWeight w) {
        return !Float.isNaN(w.value) && w.value != Float.NEGATIVE_INFINITY;
    }

    @Override
    public TropicalWeight quantize(TropicalWeight w, float delta) {
        return new TropicalWeight(FloatWeight.quantize(w.value, delta));
    }

    @Override
    public boolean approxEqual(TropicalWeight a, TropicalWeight b, float delta) {
        return FloatWeight.approxEqual(a.value, b.value, delta);
    }

    @Override
    public String weightType() {
        return "tropical";
    }

    @Override
    public long properties() {
        return SEMIRING | COMMUTATIVE | IDEMPOTENT | PATH;
    }

    @Override
    public void write(TropicalWeight w, DataOutput out) throws IOException {
        out.writeFloat(w.value);
    }

    @Override
    public TropicalWeight read(DataInput in) throws IOException {
        return new TropicalWeight(in.readFloat());
    }

    @Override
    public String format(TropicalWeight w) {
        return w.toString();
    }

    @Override
    public TropicalWeight parse(String text) {
        try {
            return new TropicalWeight(FloatWeight.parse(text));
        } catch (NumberFormatException e) {
            throw new FstException(FstException.Code.MALFORMED_WEIGHT, "Not a tropical weight: \"" + text + "\"", e);
        }
    }

    @Override
    public String toString() {
        return weightType();
    }
}
