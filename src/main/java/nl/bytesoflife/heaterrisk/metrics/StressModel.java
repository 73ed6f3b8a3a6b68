package nl.bytesoflife.heaterrisk.metrics;

import nl.bytesoflife.heaterrisk.model.InspectionRecord;
import nl.bytesoflife.heaterrisk.model.ThermostatSetting;

import static nl.bytesoflife.heaterrisk.metrics.RiskConstants.*;

/**
 * Stateless stress and reliability formulas shared by all unit families.
 */
public final class StressModel {

    private StressModel() {
    }

    /**
     * Buffer zone model: no penalty up to the safe limit, quadratic growth above it.
     */
    public static double pressureStress(double psi) {
        if (psi <= PSI_SAFE_LIMIT) {
            return 1.0;
        }
        double excess = (psi - PSI_SAFE_LIMIT) / PSI_SCALAR;
        return 1.0 + excess * excess;
    }

    public static double thermalStress(ThermostatSetting setting) {
        return switch (setting) {
            case LOW -> THERMAL_LOW;
            case NORMAL -> THERMAL_NORMAL;
            case HOT -> THERMAL_HOT;
        };
    }

    public static double circulationStress(InspectionRecord record) {
        return record.hasContinuousCirculation() ? CIRCULATION_CONTINUOUS : 1.0;
    }

    public static double loopStress(InspectionRecord record) {
        return record.isClosedSystem() && !record.hasFunctionalExpansionTank() ? LOOP_PENALTY : 1.0;
    }

    public static double sedimentStress(double sedimentLbs) {
        return 1.0 + SEDIMENT_STRESS_PER_LB * Math.max(0, sedimentLbs);
    }

    /**
     * Probability (percent) that a unit of the given biological age fails within the next year,
     * from a Weibull survival curve. Non-decreasing in age and capped at the statistical limit.
     */
    public static double weibullFailProb(double bioAge) {
        double t = Math.min(Math.max(0, bioAge), MAX_RAW_BIO_AGE);
        double hazardNow = Math.pow(t / WEIBULL_ETA, WEIBULL_BETA);
        double hazardNext = Math.pow((t + 1) / WEIBULL_ETA, WEIBULL_BETA);
        double prob = (1.0 - Math.exp(hazardNow - hazardNext)) * 100.0;
        return Math.min(prob, MAX_STATISTICAL_FAIL_PROB);
    }

    public static int healthScore(double failProb) {
        long score = Math.round(100.0 * Math.exp(-HEALTH_DECAY * failProb));
        return (int) Math.max(0, Math.min(100, score));
    }

    static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
