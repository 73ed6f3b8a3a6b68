package nl.bytesoflife.heaterrisk.model;

/**
 * Quality tiers a replacement can be quoted in, ordered from cheapest to most expensive.
 */
public enum QualityTier {
    BUILDER("Good"),
    STANDARD("Better"),
    PROFESSIONAL("Best"),
    PREMIUM("Premium");

    private final String label;

    QualityTier(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean includes(QualityTier minimum) {
        return this.compareTo(minimum) >= 0;
    }
}
