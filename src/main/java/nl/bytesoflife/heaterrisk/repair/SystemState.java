package nl.bytesoflife.heaterrisk.repair;

import nl.bytesoflife.heaterrisk.metrics.DegradationMetrics;

/**
 * The three numbers the repair simulator works on.
 *
 * @param healthScore 0-100
 * @param agingFactor biological years per calendar year
 * @param failProb    percent chance of failure within a year
 */
public record SystemState(int healthScore, double agingFactor, double failProb) {

    public static SystemState from(DegradationMetrics metrics) {
        return new SystemState(metrics.healthScore(), metrics.aging().agingRate(), metrics.failProb());
    }
}
