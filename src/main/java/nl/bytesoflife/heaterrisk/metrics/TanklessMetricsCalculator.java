package nl.bytesoflife.heaterrisk.metrics;

import nl.bytesoflife.heaterrisk.model.InspectionRecord;
import nl.bytesoflife.heaterrisk.model.MaintenanceHistory;
import nl.bytesoflife.heaterrisk.model.ServiceEventType;
import nl.bytesoflife.heaterrisk.model.UnitFamily;
import nl.bytesoflife.heaterrisk.model.VentCondition;

import java.util.OptionalDouble;

import static nl.bytesoflife.heaterrisk.metrics.RiskConstants.*;

/**
 * Gate model for tankless units. There is no stored volume and no anode; the heat exchanger
 * fails from scale, electronics or age. The first matching gate sets the baseline score and
 * failure probability, and the statistical curve can only raise the probability further.
 */
public class TanklessMetricsCalculator implements MetricsCalculator {

    static final double MAX_SERVICE_AGE = 15.0;
    static final double SCALE_PER_GPG_YEAR = 0.8;
    static final double RUN_TO_FAILURE_AGE = 6.0;
    static final double NEGLECT_AGE = 2.0;

    static final double SCALE_LOCKOUT = 60.0;
    static final double SCALE_CRITICAL = 25.0;
    static final double SCALE_DUE = 10.0;

    private record Gate(double failProb, int healthScore) {
    }

    @Override
    public DegradationMetrics calculate(InspectionRecord record) {
        double age = Math.max(0, record.getCalendarAge());

        StressFactors stress = new StressFactors(
                StressModel.pressureStress(record.getHousePsi()),
                StressModel.thermalStress(record.getThermostat()),
                StressModel.circulationStress(record),
                1.0,
                1.0);

        double rawBioAge = Math.min(MAX_RAW_BIO_AGE, age * stress.total());
        double bioAge = Math.min(BIO_AGE_CEILING, rawBioAge);

        OptionalDouble sinceDescale = record.getServiceHistory().isEmpty()
                ? OptionalDouble.empty()
                : MaintenanceHistory.yearsSinceLast(record.getServiceHistory(), ServiceEventType.DESCALE,
                        record.getInspectionDate());
        boolean neverDescaled = sinceDescale.isEmpty();
        double yearsSinceDescale = sinceDescale.orElse(age);
        double hardness = Math.max(0, record.getHardnessGpg());

        double scale = record.getScaleBuildupScore() != null
                ? clamp(record.getScaleBuildupScore(), 0, 100)
                : Math.min(100, hardness * yearsSinceDescale * SCALE_PER_GPG_YEAR);

        boolean hardWater = hardness > HARD_WATER_GPG;
        DescaleStatus descaleStatus = descaleStatus(hardWater, neverDescaled, age, scale);
        Gate gate = gate(record, age, descaleStatus, hardWater && neverDescaled);

        double statistical = StressModel.weibullFailProb(rawBioAge);
        double failProb = Math.max(gate.failProb(), statistical);
        int healthScore = Math.min(gate.healthScore(), StressModel.healthScore(statistical));

        double rate = stress.total();
        double remaining = Math.max(0, BIO_AGE_CEILING - bioAge);
        double optimizedRate = stress.thermal() * stress.circulation();
        AgingOutlook aging = new AgingOutlook(
                StressModel.round1(rate),
                StressModel.round1(optimizedRate),
                StressModel.round1(remaining / rate),
                StressModel.round1(remaining / optimizedRate),
                stress.primary());

        return new DegradationMetrics(
                bioAge,
                failProb,
                healthScore,
                0.0,
                0.0,
                stress,
                RiskLevel.forLocation(record.getLocation(), record.isFinishedArea()),
                AnodeStatus.NOT_APPLICABLE,
                new SedimentOutlook(0.0, FlushStatus.fromDescale(descaleStatus), null),
                aging,
                new ScaleOutlook(scale, Math.max(0, record.getFlowDegradationPercent()), descaleStatus),
                null);
    }

    @Override
    public UnitFamily getSupportedFamily() {
        return UnitFamily.TANKLESS;
    }

    /**
     * A hard-water unit that was never descaled past six years is left alone: descaling it now
     * strips the scale that is holding the exchanger together.
     */
    static DescaleStatus descaleStatus(boolean hardWater, boolean neverDescaled, double age, double scale) {
        if (hardWater && neverDescaled && age > RUN_TO_FAILURE_AGE) return DescaleStatus.RUN_TO_FAILURE;
        if (hardWater && neverDescaled && age > NEGLECT_AGE) return DescaleStatus.DUE;
        if (scale > SCALE_LOCKOUT) return DescaleStatus.LOCKOUT;
        if (scale > SCALE_CRITICAL) return DescaleStatus.CRITICAL;
        if (scale > SCALE_DUE) return DescaleStatus.DUE;
        return DescaleStatus.OPTIMAL;
    }

    private static Gate gate(InspectionRecord record, double age, DescaleStatus descaleStatus, boolean neglected) {
        if (record.hasActiveLeak() || record.hasVisibleRust()) return new Gate(BREACH_FAIL_PROB, 0);
        if (record.getTanklessVent() == VentCondition.BLOCKED) return new Gate(BREACH_FAIL_PROB, 0);
        if (record.getErrorCodeCount() > 0) return new Gate(75.0, 35);
        if (age > MAX_SERVICE_AGE) return new Gate(85.0, 20);

        return switch (descaleStatus) {
            case RUN_TO_FAILURE -> new Gate(40.0, 60);
            case LOCKOUT -> new Gate(50.0, 50);
            case CRITICAL -> new Gate(25.0, 70);
            case DUE -> neglected && age > NEGLECT_AGE ? new Gate(30.0, 75) : new Gate(15.0, 85);
            case OPTIMAL -> new Gate(5.0, 95);
        };
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
