package nl.bytesoflife.heaterrisk.repair;

import nl.bytesoflife.heaterrisk.metrics.DegradationMetrics;
import nl.bytesoflife.heaterrisk.metrics.ScaleOutlook;
import nl.bytesoflife.heaterrisk.metrics.ServiceWindows;
import nl.bytesoflife.heaterrisk.model.FilterCondition;
import nl.bytesoflife.heaterrisk.model.FlameRodCondition;
import nl.bytesoflife.heaterrisk.model.InspectionRecord;
import nl.bytesoflife.heaterrisk.model.VentCondition;
import nl.bytesoflife.heaterrisk.verdict.Verdict;

import java.util.ArrayList;
import java.util.List;

import static nl.bytesoflife.heaterrisk.metrics.RiskConstants.*;

/**
 * Decides which repairs may be offered for a unit. A repair that would do harm in the unit's
 * current state is never offered, and a replacement verdict offers the replacement alone.
 */
public class RepairEligibilityEngine {

    static final double COMPRESSOR_SERVICE_BELOW = 70.0;
    static final double REFRIGERANT_CHECK_BELOW = 90.0;
    static final double IGNITER_SERVICE_BELOW = 70.0;
    static final double INLET_FILTER_FLOW_LOSS = 15.0;
    static final double FLOW_SENSOR_FLOW_LOSS = 25.0;
    static final double FLOW_SENSOR_MAX_SCALE = 20.0;
    static final double RECIRCULATION_SERVICE_AGE = 3.0;

    private final RepairCatalog catalog;

    public RepairEligibilityEngine(RepairCatalog catalog) {
        this.catalog = catalog;
    }

    public List<RepairOption> eligibleRepairs(InspectionRecord record, DegradationMetrics metrics, Verdict verdict) {
        if (verdict.isReplacement()) {
            return List.of(catalog.replacementFor(record.getUnitFamily()));
        }

        List<RepairOption> eligible = new ArrayList<>();
        switch (record.getUnitFamily()) {
            case TANK -> {
                addPressureRepairs(record, eligible);
                addTankMaintenance(record, metrics, eligible);
            }
            case HYBRID -> {
                addHeatPumpRepairs(record, eligible);
                addPressureRepairs(record, eligible);
                addTankMaintenance(record, metrics, eligible);
            }
            case TANKLESS -> addTanklessRepairs(record, metrics, eligible);
        }
        return List.copyOf(eligible);
    }

    private void addPressureRepairs(InspectionRecord record, List<RepairOption> eligible) {
        ExpansionProtection protection = ExpansionProtection.assess(record);
        double psi = record.getHousePsi();
        boolean expansionCovered = false;

        if (!record.hasPrv() && psi >= PSI_REGULATOR_RECOMMENDED) {
            RepairOption regulator = catalog.pressureRegulator(protection);
            eligible.add(regulator);
            expansionCovered = regulator.isBundle();
        } else if (record.hasPrv() && psi > PSI_REGULATOR_WORN) {
            RepairOption regulator = catalog.regulatorReplacement(protection);
            eligible.add(regulator);
            expansionCovered = regulator.isBundle();
        }

        if (!expansionCovered && record.isClosedSystem() && !record.hasFunctionalExpansionTank()) {
            eligible.add(catalog.get(record.hasExpansionTank()
                    ? RepairKind.REPLACE_EXPANSION_TANK
                    : RepairKind.EXPANSION_TANK));
        }
    }

    private void addTankMaintenance(InspectionRecord record, DegradationMetrics metrics, List<RepairOption> eligible) {
        double age = record.getCalendarAge();

        if (!ServiceWindows.isFragile(age, metrics.failProb())
                && ServiceWindows.isServiceableSediment(metrics.sedimentLbs())) {
            eligible.add(catalog.get(RepairKind.FLUSH));
        }
        if (ServiceWindows.isAnodeRefreshWindow(metrics.shieldLife(), age)) {
            eligible.add(catalog.get(RepairKind.ANODE));
        }
    }

    private void addHeatPumpRepairs(InspectionRecord record, List<RepairOption> eligible) {
        if (record.getAirFilter().needsService()) {
            eligible.add(catalog.get(RepairKind.AIR_FILTER_SERVICE));
        }
        if (!record.isCondensateClear()) {
            eligible.add(catalog.get(RepairKind.CONDENSATE_CLEAR));
        }

        double compressor = record.getCompressorHealthPercent();
        if (compressor < COMPRESSOR_SERVICE_BELOW) {
            eligible.add(catalog.get(RepairKind.COMPRESSOR_SERVICE));
        } else if (compressor < REFRIGERANT_CHECK_BELOW) {
            eligible.add(catalog.get(RepairKind.REFRIGERANT_CHECK));
        }
    }

    private void addTanklessRepairs(InspectionRecord record, DegradationMetrics metrics, List<RepairOption> eligible) {
        ScaleOutlook scale = metrics.scale();
        double flowLoss = scale.flowDegradation();

        // Valves come first: nothing can be descaled without them
        if (!record.hasIsolationValves()) {
            eligible.add(catalog.get(RepairKind.ISOLATION_VALVES));
        } else if (scale.descaleStatus().isServiceable()) {
            eligible.add(catalog.get(RepairKind.DESCALE));
        }

        if (record.getInletFilter().needsService() || flowLoss > INLET_FILTER_FLOW_LOSS) {
            eligible.add(catalog.get(RepairKind.INLET_FILTER));
        }

        if (record.isGasFired()) {
            FlameRodCondition rod = record.getFlameRod();
            if (record.getIgniterHealthPercent() < IGNITER_SERVICE_BELOW || rod != FlameRodCondition.GOOD) {
                eligible.add(catalog.get(RepairKind.IGNITER_SERVICE));
            }
            if (record.getTanklessVent() != VentCondition.CLEAR) {
                eligible.add(catalog.get(RepairKind.VENT_CLEANING));
            }
        }

        if (flowLoss > FLOW_SENSOR_FLOW_LOSS
                && record.getInletFilter() == FilterCondition.CLEAN
                && scale.scaleBuildupScore() < FLOW_SENSOR_MAX_SCALE) {
            eligible.add(catalog.get(RepairKind.FLOW_SENSOR));
        }

        if (record.hasCircPump() && record.getCalendarAge() > RECIRCULATION_SERVICE_AGE) {
            eligible.add(catalog.get(RepairKind.RECIRCULATION_SERVICE));
        }

        if (record.getHousePsi() > PSI_SAFE_LIMIT) {
            ExpansionProtection protection = ExpansionProtection.assess(record);
            eligible.add(record.hasPrv()
                    ? catalog.regulatorReplacement(protection)
                    : catalog.pressureRegulator(protection));
        }
    }
}
