package nl.bytesoflife.heaterrisk.quote;

import nl.bytesoflife.heaterrisk.issue.InfrastructureIssue;
import nl.bytesoflife.heaterrisk.model.CostRange;
import nl.bytesoflife.heaterrisk.model.QualityTier;

import java.util.List;

/**
 * The priced replacement for one quality tier, with the infrastructure fixes bundled into it.
 *
 * @param tier           quality tier
 * @param label          product line name
 * @param warrantyYears  warranty the tier was priced at
 * @param base           provider's price for unit and installation
 * @param includedIssues issues bundled at this tier
 * @param issuesCost     summed cost of the bundled issues
 * @param total          base plus bundled issues
 */
public record TierQuote(
        QualityTier tier,
        String label,
        int warrantyYears,
        PriceRange base,
        List<InfrastructureIssue> includedIssues,
        CostRange issuesCost,
        PriceRange total
) {
    public TierQuote {
        includedIssues = List.copyOf(includedIssues);
    }
}
