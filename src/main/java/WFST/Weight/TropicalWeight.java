package WFST.Weight;

public final class TropicalWeight extends FloatWeight {
    public static final TropicalWeight ZERO = new TropicalWeight(Float.POSITIVE_INFINITY);
    public static final TropicalWeight ONE = new TropicalWeight(0.0f);
    public static final TropicalWeight NO_WEIGHT = new TropicalWeight(Float.NaN);

    public TropicalWeight(float value) {
        super(value);
    }

    public static TropicalWeight of(float value) {
        return new TropicalWeight(value);
    }
}
