package nl.bytesoflife.heaterrisk.quote;

import nl.bytesoflife.heaterrisk.model.QualityTier;
import nl.bytesoflife.heaterrisk.model.UnitType;

import java.util.List;
import java.util.Objects;

/**
 * One rung of a replacement product ladder.
 *
 * @param tier              quality tier
 * @param label             product line name shown to the homeowner
 * @param warrantyYears     nameplate warranty of units in this tier
 * @param expectedLifeYears typical service life
 * @param baseCostGas       unit price for gas-fired units, 0 when not offered
 * @param baseCostElectric  unit price for electric units
 * @param baseCostHybrid    unit price for heat pump units, 0 when not offered
 * @param features          selling points
 */
public record TierProfile(
        QualityTier tier,
        String label,
        int warrantyYears,
        int expectedLifeYears,
        int baseCostGas,
        int baseCostElectric,
        int baseCostHybrid,
        List<String> features
) {
    public TierProfile {
        Objects.requireNonNull(tier, "tier");
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Tier label must not be blank");
        }
        if (warrantyYears <= 0) {
            throw new IllegalArgumentException("Tier warranty must be > 0");
        }
        features = features == null ? List.of() : List.copyOf(features);
    }

    public int baseCost(UnitType unitType) {
        return switch (unitType) {
            case TANK_GAS, TANKLESS_GAS -> baseCostGas;
            case TANK_ELECTRIC, TANKLESS_ELECTRIC -> baseCostElectric;
            case HYBRID_HEAT_PUMP -> baseCostHybrid;
        };
    }
}
