package nl.bytesoflife.heaterrisk.quote;

import nl.bytesoflife.heaterrisk.model.QualityTier;

/**
 * Where one tier's quote stands. Each tier moves from loading to priced or failed on its own.
 */
public sealed interface TierResult permits TierResult.Loading, TierResult.Priced, TierResult.Failed {

    QualityTier tier();

    record Loading(QualityTier tier) implements TierResult {
    }

    record Priced(TierQuote quote) implements TierResult {
        @Override
        public QualityTier tier() {
            return quote.tier();
        }
    }

    record Failed(QualityTier tier, String message) implements TierResult {
    }
}
