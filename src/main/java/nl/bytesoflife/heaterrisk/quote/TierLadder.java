package nl.bytesoflife.heaterrisk.quote;

import nl.bytesoflife.heaterrisk.model.QualityTier;

import java.util.Comparator;
import java.util.List;

/**
 * A product ladder, ordered from cheapest to most expensive tier.
 */
public class TierLadder {

    private final String name;
    private final List<TierProfile> tiers;

    public TierLadder(String name, List<TierProfile> tiers) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Ladder name must not be blank");
        }
        if (tiers == null || tiers.isEmpty()) {
            throw new IllegalArgumentException("Ladder must have at least one tier");
        }
        this.name = name;
        this.tiers = tiers.stream()
                .sorted(Comparator.comparing(TierProfile::tier))
                .toList();
    }

    public String getName() {
        return name;
    }

    public List<TierProfile> getTiers() {
        return tiers;
    }

    public TierProfile getTier(QualityTier tier) {
        for (TierProfile profile : tiers) {
            if (profile.tier() == tier) {
                return profile;
            }
        }
        throw new IllegalArgumentException("Ladder " + name + " has no " + tier + " tier");
    }

    public boolean hasTier(QualityTier tier) {
        return tiers.stream().anyMatch(p -> p.tier() == tier);
    }

    /**
     * The most expensive tier whose warranty the given warranty meets, or the cheapest tier
     * when the warranty is below all of them.
     */
    public TierProfile classifyByWarranty(int warrantyYears) {
        TierProfile match = tiers.get(0);
        for (TierProfile profile : tiers) {
            if (warrantyYears >= profile.warrantyYears()) {
                match = profile;
            }
        }
        return match;
    }
}
