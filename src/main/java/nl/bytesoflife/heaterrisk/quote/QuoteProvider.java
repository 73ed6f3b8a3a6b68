package nl.bytesoflife.heaterrisk.quote;

import nl.bytesoflife.heaterrisk.model.InspectionRecord;

/**
 * External pricing source. Implementations may block on I/O; the bundler calls them off the
 * caller's thread, once per tier.
 */
public interface QuoteProvider {

    /**
     * Prices a replacement for the given record. The record's warranty years identify the tier
     * being priced.
     */
    TotalQuote generateQuote(InspectionRecord record, String contractorId, InstallComplexity complexity)
            throws QuoteException;
}
