package nl.bytesoflife.heaterrisk.quote;

import nl.bytesoflife.heaterrisk.model.CostRange;

/**
 * A quoted price band in whole dollars.
 */
public record PriceRange(int low, int high, int median) {

    public PriceRange {
        if (high < low) {
            throw new IllegalArgumentException("Price high must be >= low, got " + low + ".." + high);
        }
    }

    public static PriceRange point(int price) {
        return new PriceRange(price, price, price);
    }

    /**
     * Adds an issue cost band: ends add to ends, and the median moves by the band's midpoint.
     */
    public PriceRange plus(CostRange cost) {
        return new PriceRange(
                low + cost.min(),
                high + cost.max(),
                median + (int) Math.round(cost.midpoint()));
    }

    @Override
    public String toString() {
        return low == high ? "$" + median : "$" + low + "-$" + high + " (median $" + median + ")";
    }
}
