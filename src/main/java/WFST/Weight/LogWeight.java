package WFST.Weight;

/**
 * Negative log probability.
 */
public final class LogWeight extends FloatWeight {
    public static final LogWeight ZERO = new LogWeight(Float.POSITIVE_INFINITY);
    public static final LogWeight ONE = new LogWeight(0.0f);
    public static final LogWeight NO_WEIGHT = new LogWeight(Float.NaN);

    public LogWeight(float value) {
        super(value);
    }

    public static LogWeight of(float value) {
        return new LogWeight(value);
    }
}
