package nl.bytesoflife.heaterrisk.model;

/**
 * An installed-cost estimate in whole dollars.
 *
 * @param min low end of the estimate
 * @param max high end of the estimate
 */
public record CostRange(int min, int max) {

    public static final CostRange ZERO = new CostRange(0, 0);

    public CostRange {
        if (min < 0) {
            throw new IllegalArgumentException("Cost must be >= 0");
        }
        if (max < min) {
            throw new IllegalArgumentException("Cost max must be >= min, got " + min + ".." + max);
        }
    }

    public static CostRange of(int min, int max) {
        return new CostRange(min, max);
    }

    public CostRange plus(CostRange other) {
        return new CostRange(min + other.min, max + other.max);
    }

    public double midpoint() {
        return (min + max) / 2.0;
    }

    @Override
    public String toString() {
        return "$" + min + "-$" + max;
    }
}
