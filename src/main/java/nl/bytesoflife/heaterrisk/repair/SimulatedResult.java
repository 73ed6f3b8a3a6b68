package nl.bytesoflife.heaterrisk.repair;

import nl.bytesoflife.heaterrisk.model.CostRange;

import java.util.List;

/**
 * Projected state after a set of repairs.
 *
 * @param healthScore   projected score
 * @param status        band the projected score falls in
 * @param agingFactor   projected aging rate
 * @param failProb      projected failure probability
 * @param totalCost     summed cost of the selection
 * @param appliedBoosts score points each selected repair contributed, in selection order
 */
public record SimulatedResult(int healthScore, HealthStatus status, double agingFactor, double failProb,
                              CostRange totalCost, List<Double> appliedBoosts) {

    public SimulatedResult {
        appliedBoosts = List.copyOf(appliedBoosts);
    }
}
