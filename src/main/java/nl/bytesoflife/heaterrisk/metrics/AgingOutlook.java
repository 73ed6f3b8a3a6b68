package nl.bytesoflife.heaterrisk.metrics;

/**
 * How fast the unit ages now, and how fast it would age with pressure and expansion corrected.
 *
 * @param agingRate          biological years per calendar year at current stress
 * @param optimizedRate      the same with pressure and loop factors at 1.0
 * @param yearsLeftCurrent   calendar years until the biological ceiling at the current rate
 * @param yearsLeftOptimized calendar years until the ceiling at the optimized rate
 * @param primaryStressor    the largest individual stress factor
 */
public record AgingOutlook(double agingRate, double optimizedRate,
                           double yearsLeftCurrent, double yearsLeftOptimized,
                           Stressor primaryStressor) {

    public double lifeExtension() {
        return Math.max(0, yearsLeftOptimized - yearsLeftCurrent);
    }
}
