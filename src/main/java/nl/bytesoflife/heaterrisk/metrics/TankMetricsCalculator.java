package nl.bytesoflife.heaterrisk.metrics;

import nl.bytesoflife.heaterrisk.model.InspectionRecord;
import nl.bytesoflife.heaterrisk.model.MaintenanceHistory;
import nl.bytesoflife.heaterrisk.model.ServiceEventType;
import nl.bytesoflife.heaterrisk.model.UnitFamily;
import nl.bytesoflife.heaterrisk.model.UnitType;

import java.util.OptionalDouble;

import static nl.bytesoflife.heaterrisk.metrics.RiskConstants.*;

/**
 * Degradation physics for storage tanks.
 * <p>
 * The anode shields the steel for a number of years that depends on the nameplate warranty and
 * on how hard the water chemistry works it. While shielded, the tank ages with mechanical stress
 * only; once the anode is spent, corrosion stress compounds on top.
 */
public class TankMetricsCalculator implements MetricsCalculator {

    @Override
    public DegradationMetrics calculate(InspectionRecord record) {
        double age = Math.max(0, record.getCalendarAge());

        // Sediment
        double ratePerYear = Math.max(0, record.getHardnessGpg()) * sedimentCoefficient(record.getUnitType());
        double flushCredit = credit(record, ServiceEventType.FLUSH);
        double sedimentLbs = age * ratePerYear * (1.0 - FLUSH_EFFICIENCY * flushCredit);

        StressFactors stress = new StressFactors(
                StressModel.pressureStress(record.getHousePsi()),
                StressModel.thermalStress(record.getThermostat()),
                StressModel.circulationStress(record),
                StressModel.loopStress(record),
                StressModel.sedimentStress(sedimentLbs));

        // Anode
        double shieldDuration = shieldDuration(record);
        OptionalDouble sinceAnode = yearsSince(record, ServiceEventType.ANODE_REPLACEMENT);
        double yearsOnCurrentAnode = sinceAnode.isPresent() ? Math.min(age, sinceAnode.getAsDouble()) : age;
        double shieldLife = shieldDuration - yearsOnCurrentAnode;

        double nakedYears = nakedYears(age, shieldDuration, sinceAnode.isPresent() ? age - yearsOnCurrentAnode : null);
        double protectedYears = age - nakedYears;

        double protectedRate = protectedRate(stress.pressure(), stress.corrosion());
        double nakedRate = nakedRate(stress.pressure(), stress.corrosion());
        double rawBioAge = Math.min(MAX_RAW_BIO_AGE, protectedYears * protectedRate + nakedYears * nakedRate);
        double bioAge = Math.min(BIO_AGE_CEILING, rawBioAge);

        double failProb = record.hasVisibleRust() || record.hasActiveLeak()
                ? BREACH_FAIL_PROB
                : StressModel.weibullFailProb(rawBioAge);

        // Outlook
        boolean shielded = shieldLife > 0;
        double agingRate = shielded ? protectedRate : nakedRate;
        double optimizedCorrosion = stress.thermal() * stress.circulation() * stress.sediment();
        double optimizedRate = shielded ? protectedRate(1.0, optimizedCorrosion) : nakedRate(1.0, optimizedCorrosion);
        double remaining = Math.max(0, BIO_AGE_CEILING - bioAge);

        AgingOutlook aging = new AgingOutlook(
                StressModel.round1(agingRate),
                StressModel.round1(optimizedRate),
                StressModel.round1(remaining / agingRate),
                StressModel.round1(remaining / optimizedRate),
                stress.primary());

        SedimentOutlook sediment = new SedimentOutlook(
                ratePerYear,
                FlushStatus.fromSediment(sedimentLbs),
                monthsToLockout(sedimentLbs, ratePerYear));

        return new DegradationMetrics(
                bioAge,
                failProb,
                StressModel.healthScore(failProb),
                sedimentLbs,
                shieldLife,
                stress,
                RiskLevel.forLocation(record.getLocation(), record.isFinishedArea()),
                AnodeStatus.fromShieldLife(shieldLife),
                sediment,
                aging,
                null,
                null);
    }

    @Override
    public UnitFamily getSupportedFamily() {
        return UnitFamily.TANK;
    }

    static double sedimentCoefficient(UnitType unitType) {
        return switch (unitType) {
            case TANK_GAS -> SEDIMENT_COEF_GAS;
            case TANK_ELECTRIC -> SEDIMENT_COEF_ELECTRIC;
            case HYBRID_HEAT_PUMP -> SEDIMENT_COEF_HYBRID;
            case TANKLESS_GAS, TANKLESS_ELECTRIC -> 0.0;
        };
    }

    /**
     * Years one anode lasts. Softened water and continuous circulation both eat the rod faster.
     */
    static double shieldDuration(InspectionRecord record) {
        double baseLife = record.getWarrantyYears() > 0 ? record.getWarrantyYears() : DEFAULT_ANODE_LIFE;
        double decay = 1.0;
        if (record.hasSoftener()) decay += ANODE_DECAY_SOFTENER;
        if (record.hasContinuousCirculation()) decay += ANODE_DECAY_CIRCULATION;
        return baseLife / decay;
    }

    /**
     * Years the steel spent without anode protection.
     *
     * @param age            calendar age
     * @param shieldDuration years one anode lasts
     * @param replacedAt     calendar age at which the anode was last replaced, or null if never
     */
    static double nakedYears(double age, double shieldDuration, Double replacedAt) {
        if (replacedAt == null) {
            return Math.max(0, age - shieldDuration);
        }
        double gapBeforeReplacement = Math.max(0, replacedAt - shieldDuration);
        double afterSecondRod = Math.max(0, age - replacedAt - shieldDuration);
        return gapBeforeReplacement + afterSecondRod;
    }

    private static double protectedRate(double pressure, double corrosion) {
        return pressure * (1.0 + PROTECTED_CORROSION_WEIGHT * (corrosion - 1.0));
    }

    private static double nakedRate(double pressure, double corrosion) {
        return Math.min(pressure * corrosion, MAX_NAKED_STRESS);
    }

    private static Integer monthsToLockout(double sedimentLbs, double ratePerYear) {
        if (sedimentLbs >= SEDIMENT_LOCKOUT) {
            return 0;
        }
        if (ratePerYear <= 0) {
            return null;
        }
        return (int) Math.ceil((SEDIMENT_LOCKOUT - sedimentLbs) / ratePerYear * 12.0);
    }

    private static OptionalDouble yearsSince(InspectionRecord record, ServiceEventType type) {
        if (record.getServiceHistory().isEmpty()) {
            return OptionalDouble.empty();
        }
        return MaintenanceHistory.yearsSinceLast(record.getServiceHistory(), type, record.getInspectionDate());
    }

    private static double credit(InspectionRecord record, ServiceEventType type) {
        if (record.getServiceHistory().isEmpty()) {
            return 0.0;
        }
        return MaintenanceHistory.creditFor(record.getServiceHistory(), type, record.getInspectionDate());
    }
}
