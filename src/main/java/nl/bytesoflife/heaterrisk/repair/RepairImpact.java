package nl.bytesoflife.heaterrisk.repair;

/**
 * Nominal effect of one repair done on its own.
 *
 * @param healthScoreBoost       points added to the health score
 * @param agingFactorReduction   percent taken off the aging rate
 * @param failureProbReduction   percent taken off the failure probability
 */
public record RepairImpact(double healthScoreBoost, double agingFactorReduction, double failureProbReduction) {

    public static final RepairImpact AS_NEW = new RepairImpact(100, 100, 100);

    public RepairImpact {
        if (healthScoreBoost < 0 || agingFactorReduction < 0 || failureProbReduction < 0) {
            throw new IllegalArgumentException("Repair impact must not be negative");
        }
    }
}
