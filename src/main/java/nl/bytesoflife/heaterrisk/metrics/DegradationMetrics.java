package nl.bytesoflife.heaterrisk.metrics;

/**
 * Derived health picture of one unit. Computed once per record and never mutated.
 *
 * @param bioAge           biological age in years, capped at the display ceiling
 * @param failProb         percent chance of failure within a year, 0-100
 * @param healthScore      0-100, higher is healthier
 * @param sedimentLbs      estimated sediment load on the tank floor
 * @param shieldLife       years of anode protection left; negative once the anode is spent
 * @param stress           individual stress factors
 * @param riskLevel        consequence of a leak at the install location
 * @param anodeStatus      anode band derived from shield life
 * @param sediment         accumulation rate and flush band
 * @param aging            current and optimized aging rates
 * @param scale            tankless scale picture, null for tank-bearing units
 * @param hybridEfficiency heat pump efficiency percent, null for non-hybrids
 */
public record DegradationMetrics(
        double bioAge,
        double failProb,
        int healthScore,
        double sedimentLbs,
        double shieldLife,
        StressFactors stress,
        RiskLevel riskLevel,
        AnodeStatus anodeStatus,
        SedimentOutlook sediment,
        AgingOutlook aging,
        ScaleOutlook scale,
        Double hybridEfficiency
) {

    public double totalStress() {
        return stress.total();
    }

    public FlushStatus flushStatus() {
        return sediment.flushStatus();
    }

    DegradationMetrics withHybridEfficiency(double efficiency, int adjustedScore) {
        return new DegradationMetrics(bioAge, failProb, adjustedScore, sedimentLbs, shieldLife, stress,
                riskLevel, anodeStatus, sediment, aging, scale, efficiency);
    }
}
