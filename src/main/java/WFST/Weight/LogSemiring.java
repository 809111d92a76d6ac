package WFST.Weight;

import WFST.FstException;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;

/**
 * Log semiring: (-log(e^-a + e^-b), +, +inf, 0).
 */
public final class LogSemiring implements Semiring<LogWeight> {
    public static final LogSemiring INSTANCE = new LogSemiring();

    private LogSemiring() {
    }

    @Override
    public LogWeight zero() {
        return LogWeight.ZERO;
    }

    @Override
    public LogWeight one() {
        return LogWeight.ONE;
    }

    @Override
    public LogWeight noWeight() {
        return LogWeight.NO_WEIGHT;
    }

    @Override
    public LogWeight plus(LogWeight a, LogWeight b) {
        if (!member(a) || !member(b)) {
            return noWeight();
        }
        final float f1 = a.value;
        final float f2 = b.value;
        if (f1 == Float.POSITIVE_INFINITY) {
            return b;
        } else if (f2 == Float.POSITIVE_INFINITY) {
            return a;
        } else if (f1 > f2) {
            return new LogWeight((float) (f2 - logPosExp(f1 - f2)));
        }
        return new LogWeight((float) (f1 - logPosExp(f2 - f1)));
    }

    // log(1 + e^-x) for x >= 0
    private static double logPosExp(double x) {
        return Math.log1p(Math.exp(-x));
    }

    @Override
    public LogWeight times(LogWeight a, LogWeight b) {
        if (!member(a) || !member(b)) {
            return noWeight();
        }
        if (a.value == Float.POSITIVE_INFINITY) {
            return a;
        } else if (b.value == Float.POSITIVE_INFINITY) {
            return b;
        }
        return new LogWeight(a.value + b.value);
    }

    @Override
    public boolean member(LogWeight w) {
        return !Float.isNaN(w.value) && w.value != Float.NEGATIVE_INFINITY;
    }

    @Override
    public LogWeight quantize(LogWeight w, float delta) {
        return new LogWeight(FloatWeight.quantize(w.value, delta));
    }

    @Override
    public boolean approxEqual(LogWeight a, LogWeight b, float delta) {
        return FloatWeight.approxEqual(a.value, b.value, delta);
    }

    @Override
    public String weightType() {
        return "log";
    }

    @Override
    public long properties() {
        return SEMIRING | COMMUTATIVE;
    }

    @Override
    public void write(LogWeight w, DataOutput out) throws IOException {
        out.writeFloat(w.value);
    }

    @Override
    public LogWeight read(DataInput in) throws IOException {
        return new LogWeight(in.readFloat());
    }

    @Override
    public String format(LogWeight w) {
        return w.toString();
    }

    @Override
    public LogWeight parse(String text) {
        try {
            return new LogWeight(FloatWeight.parse(text));
        } catch (NumberFormatException e) {
            throw new FstException(FstException.Code.MALFORMED_WEIGHT, "Not a log weight: \"" + text + "\"", e);
        }
    }

    @Override
    public String toString() {
        return weightType();
    }
}
