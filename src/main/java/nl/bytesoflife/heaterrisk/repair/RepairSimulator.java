package nl.bytesoflife.heaterrisk.repair;

import nl.bytesoflife.heaterrisk.model.CostRange;

import java.util.ArrayList;
import java.util.List;

/**
 * Projects the effect of a selection of repairs. Each further repair is worth less than the one
 * before it, and short of a full replacement the unit never scores as new.
 */
public class RepairSimulator {

    static final int REPAIRED_SCORE_CEILING = 85;
    static final double AGING_FLOOR = 1.0;
    static final double FAIL_PROB_FLOOR = 2.0;
    static final double DIMINISHING_STEP = 0.2;

    static final int REPLACED_SCORE = 100;
    static final double REPLACED_AGING = 1.0;
    static final double REPLACED_FAIL_PROB = 0.5;

    public SimulatedResult simulate(SystemState current, List<RepairOption> selection) {
        if (selection.isEmpty()) {
            return new SimulatedResult(current.healthScore(), HealthStatus.fromScore(current.healthScore()),
                    current.agingFactor(), current.failProb(), CostRange.ZERO, List.of());
        }

        for (RepairOption option : selection) {
            if (option.isFullReplacement()) {
                return new SimulatedResult(REPLACED_SCORE, HealthStatus.OPTIMAL, REPLACED_AGING,
                        REPLACED_FAIL_PROB, option.cost(), List.of());
            }
        }

        double scoreBoost = 0;
        double agingReduction = 0;
        double failProbReduction = 0;
        CostRange cost = CostRange.ZERO;
        List<Double> applied = new ArrayList<>();

        for (int i = 0; i < selection.size(); i++) {
            RepairOption option = selection.get(i);
            double factor = 1.0 / (1.0 + DIMINISHING_STEP * i);
            double boost = option.impact().healthScoreBoost() * factor;

            scoreBoost += boost;
            agingReduction += option.impact().agingFactorReduction() * factor;
            failProbReduction += option.impact().failureProbReduction() * factor;
            cost = cost.plus(option.cost());
            applied.add(boost);
        }

        int score = (int) Math.round(Math.min(REPAIRED_SCORE_CEILING, current.healthScore() + scoreBoost));
        score = Math.max(score, current.healthScore());

        double aging = reduce(current.agingFactor(), agingReduction, AGING_FLOOR);
        double failProb = reduce(current.failProb(), failProbReduction, FAIL_PROB_FLOOR);

        return new SimulatedResult(score, HealthStatus.fromScore(score), round1(aging), round1(failProb), cost, applied);
    }

    /**
     * Applies a percent reduction without going under the floor. A value already below the floor stays put.
     */
    private static double reduce(double value, double reductionPercent, double floor) {
        if (value <= floor) {
            return value;
        }
        double reduced = value * (1.0 - Math.min(100.0, reductionPercent) / 100.0);
        return Math.max(floor, reduced);
    }

    private static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
