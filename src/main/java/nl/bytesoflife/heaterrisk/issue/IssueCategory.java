package nl.bytesoflife.heaterrisk.issue;

import nl.bytesoflife.heaterrisk.model.QualityTier;

/**
 * How binding an issue is, which also decides from which quality tier upward it is bundled
 * into a replacement quote.
 */
public enum IssueCategory {
    /** Code or safety violation. Bundled into every tier. */
    VIOLATION(QualityTier.BUILDER),
    /** Supporting equipment that needs work. Bundled from the standard tier up. */
    INFRASTRUCTURE(QualityTier.STANDARD),
    /** Improvement that extends service life. Bundled from the professional tier up. */
    RECOMMENDATION(QualityTier.PROFESSIONAL);

    private final QualityTier minimumTier;

    IssueCategory(QualityTier minimumTier) {
        this.minimumTier = minimumTier;
    }

    public QualityTier minimumTier() {
        return minimumTier;
    }
}
