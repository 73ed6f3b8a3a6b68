package nl.bytesoflife.heaterrisk.quote;

import java.util.Objects;

/**
 * A provider's price for supplying and installing one unit.
 *
 * @param unitPrice       price of the unit itself
 * @param install         installation preset used
 * @param grandTotal      unit plus installation
 * @param grandTotalRange price band when the provider quotes one, otherwise null
 */
public record TotalQuote(int unitPrice, InstallPreset install, int grandTotal, PriceRange grandTotalRange) {

    public TotalQuote {
        Objects.requireNonNull(install, "install");
    }

    public static TotalQuote of(int unitPrice, InstallPreset install) {
        return new TotalQuote(unitPrice, install, unitPrice + install.totalCost(), null);
    }

    /**
     * The quoted band, or the grand total as a single point.
     */
    public PriceRange range() {
        return grandTotalRange != null ? grandTotalRange : PriceRange.point(grandTotal);
    }
}
