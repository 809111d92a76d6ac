package WFST.Weight;

import java.util.Objects;

/**
 * Immutable pair of component weights.
 */
public final class PairWeight<W1, W2> {
    private final W1 value1;
    private final W2 value2;

    public PairWeight(W1 value1, W2 value2) {
        this.value1 = Objects.requireNonNull(value1);
        this.value2 = Objects.requireNonNull(value2);
    }

    public static <W1, W2> PairWeight<W1, W2> of(W1 value1, W2 value2) {
        return new PairWeight<>(value1, value2);
    }

    public W1 getValue1() {
        return value1;
    }

    public W2 getValue2() {
        return value2;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PairWeight)) {
            return false;
        }
        final PairWeight<?, ?> other = (PairWeight<?, ?>) o;
        return value1.equals(other.value1) && value2.equals(other.value2);
    }

    @Override
    public int hashCode() {
        return 31 * value1.hashCode() + value2.hashCode();
    }

    @Override
    public String toString() {
        return value1 + "," + value2;
    }
}
