package WFST.Weight;

/**
 * Weight holding a single float. Equality is exact on the stored value (NaN equals NaN).
 */
public abstract class FloatWeight {
    private static final int NEGATIVE_ZERO_BITS = Float.floatToIntBits(-0.0f);

    protected final float value;

    protected FloatWeight(float value) {
        this.value = value;
    }

    public float getValue() {
        return value;
    }

    /**
     * Text form: "Infinity", "-Infinity", "BadNumber" (NaN), integral values without a fraction.
     */
    public static String format(float f) {
        if (f == Float.POSITIVE_INFINITY) {
            return "Infinity";
        } else if (f == Float.NEGATIVE_INFINITY) {
            return "-Infinity";
        } else if (Float.isNaN(f)) {
            return "BadNumber";
        } else if (f == Math.rint(f) && Math.abs(f) < 1e7f) {
            // (int) drops the sign of -0.0
            return Float.floatToIntBits(f) == NEGATIVE_ZERO_BITS ? "-0" : Integer.toString((int) f);
        }
        return Float.toString(f);
    }

    /**
     * @throws NumberFormatException if text is not a float
     */
    public static float parse(String text) {
        final String t = text.trim();
        if ("BadNumber".equals(t)) {
            return Float.NaN;
        }
        return Float.parseFloat(t);
    }

    static float quantize(float f, float delta) {
        if (Float.isInfinite(f) || Float.isNaN(f)) {
            return f;
        }
        return (float) (Math.floor(f / delta + 0.5f) * delta);
    }

    static boolean approxEqual(float a, float b, float delta) {
        return a <= b + delta && b <= a + delta;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Float.compare(value, ((FloatWeight) o).value) == 0;
    }

    @Override
    public int hashCode() {
        return Float.hashCode(value);
    }

    @Override
    public String toString() {
        return format(value);
    }
}
