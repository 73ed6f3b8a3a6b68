package nl.bytesoflife.heaterrisk.maintenance;

import nl.bytesoflife.heaterrisk.issue.InfrastructureIssue;
import nl.bytesoflife.heaterrisk.metrics.DegradationMetrics;
import nl.bytesoflife.heaterrisk.metrics.DescaleStatus;
import nl.bytesoflife.heaterrisk.metrics.FlushStatus;
import nl.bytesoflife.heaterrisk.metrics.ScaleOutlook;
import nl.bytesoflife.heaterrisk.metrics.StressFactors;
import nl.bytesoflife.heaterrisk.model.FilterCondition;
import nl.bytesoflife.heaterrisk.model.InspectionRecord;
import nl.bytesoflife.heaterrisk.model.MaintenanceHistory;
import nl.bytesoflife.heaterrisk.model.ServiceEventType;
import nl.bytesoflife.heaterrisk.model.UnitFamily;
import nl.bytesoflife.heaterrisk.verdict.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;

import static nl.bytesoflife.heaterrisk.metrics.RiskConstants.HARD_WATER_GPG;
import static nl.bytesoflife.heaterrisk.metrics.RiskConstants.SEDIMENT_SERVICEABLE;

/**
 * Builds the maintenance schedule that goes with a verdict.
 * <p>
 * A passing unit gets a monitor-only schedule and a unit that is being replaced (or must first
 * be made safe) gets an empty one. Every other verdict produces the routine tasks for the unit
 * family, preceded by any infrastructure fixes the issue detector found.
 *
 * <pre>
 * MaintenanceSchedule schedule = new MaintenancePlanner()
 *     .schedule(record, metrics, verdict, issues);
 * </pre>
 */
public class MaintenancePlanner {

    private static final Logger log = LoggerFactory.getLogger(MaintenancePlanner.class);

    static final int MAX_MONTHS = 36;
    static final int BUNDLE_WINDOW_MONTHS = 2;
    static final int TANK_FLUSH_FALLBACK_MONTHS = 6;
    static final int HYBRID_FLUSH_FALLBACK_MONTHS = 12;
    static final int HARD_WATER_DESCALE_MONTHS = 12;
    static final int SOFT_WATER_DESCALE_MONTHS = 18;
    static final int INLET_FILTER_MONTHS = 6;
    static final int AIR_FILTER_MONTHS = 3;
    static final int CONDENSATE_MONTHS = 6;
    static final double VISIBLE_SCALE = 5.0;

    public MaintenanceSchedule schedule(InspectionRecord record, DegradationMetrics metrics, Verdict verdict,
                                        List<InfrastructureIssue> issues) {
        UnitFamily family = record.getUnitFamily();

        switch (verdict.action()) {
            case PASS -> {
                return MaintenanceSchedule.monitorOnly(family);
            }
            case REPLACE, URGENT -> {
                return MaintenanceSchedule.empty(family);
            }
            default -> {
                // routine schedule below
            }
        }

        MaintenanceSchedule routine = switch (family) {
            case TANK -> tankSchedule(record, metrics);
            case TANKLESS -> tanklessSchedule(record, metrics);
            case HYBRID -> hybridSchedule(record, metrics);
        };
        MaintenanceSchedule schedule = routine.withInfrastructureTasks(infrastructureTasks(record, metrics, issues));

        log.debug("Scheduled {} maintenance tasks for {} ({} verdict)",
                schedule.allTasks().size(), record.getUnitType(), verdict.action());
        return schedule;
    }

    /**
     * Turns pressure and expansion issues into tasks that must be done before routine work.
     */
    public List<MaintenanceTask> infrastructureTasks(InspectionRecord record, DegradationMetrics metrics,
                                                     List<InfrastructureIssue> issues) {
        StressFactors stress = metrics.stress();
        double pressureStress = stress.pressure();
        Double pressureMultiplier = pressureStress > 1.0 ? round1(pressureStress) : null;
        String psi = String.format(Locale.US, "%.0f", record.getHousePsi());

        List<MaintenanceTask> tasks = new ArrayList<>();
        for (InfrastructureIssue issue : issues) {
            switch (issue.kind()) {
                case EXPANSION_TANK_REQUIRED -> {
                    double multiplier = round1(pressureStress * stress.loop());
                    tasks.add(new MaintenanceTask(TaskType.EXPANSION_TANK_INSTALL,
                            "Unmanaged thermal expansion on a closed system", 0, TaskUrgency.OVERDUE,
                            "Reduce aging rate by " + multiplier + "x", multiplier));
                }
                case EXPANSION_TANK_REPLACE -> tasks.add(new MaintenanceTask(TaskType.EXPANSION_TANK_REPLACE,
                        "Tank appears waterlogged (dead bladder)", 0, TaskUrgency.DUE,
                        "Restore thermal expansion protection"));
                case PRV_FAILED -> tasks.add(new MaintenanceTask(TaskType.PRV_REPLACE,
                        "Pressure at " + psi + " PSI behind a failed regulator", 0, TaskUrgency.OVERDUE,
                        "Stop excessive pressure damage", pressureMultiplier));
                case PRV_REQUIRED -> tasks.add(new MaintenanceTask(TaskType.PRV_INSTALL,
                        "Pressure at " + psi + " PSI with no regulator", 0, TaskUrgency.OVERDUE,
                        "Stop excessive pressure damage", pressureMultiplier));
                default -> {
                    // other issues are quoted, not scheduled
                }
            }
        }
        return tasks;
    }

    MaintenanceSchedule tankSchedule(InspectionRecord record, DegradationMetrics metrics) {
        int flushMonths = monthsToFlush(metrics, TANK_FLUSH_FALLBACK_MONTHS);
        int anodeMonths = metrics.shieldLife() > 1
                ? capMonths(Math.round((metrics.shieldLife() - 1) * 12))
                : 0;

        MaintenanceTask flush = new MaintenanceTask(TaskType.FLUSH, flushDescription(record),
                flushMonths, TaskUrgency.fromFlushStatus(metrics.flushStatus()),
                metrics.sedimentLbs() > 0
                        ? "Restore up to " + Math.min(100, Math.round(metrics.sedimentLbs() * 3)) + "% efficiency"
                        : "Maintain peak efficiency");
        MaintenanceTask anode = new MaintenanceTask(TaskType.ANODE, "Check the sacrificial anode rod",
                anodeMonths,
                anodeMonths == 0 ? TaskUrgency.DUE : anodeMonths <= 6 ? TaskUrgency.SCHEDULE : TaskUrgency.OPTIMAL,
                "Prevent tank corrosion");

        boolean flushFirst = flushMonths <= anodeMonths;
        MaintenanceTask primary = flushFirst ? flush : anode;
        if (Math.abs(flushMonths - anodeMonths) <= BUNDLE_WINDOW_MONTHS) {
            return MaintenanceSchedule.bundled(UnitFamily.TANK, primary, List.of(flush, anode), List.of(),
                    bundleReason(Math.min(flushMonths, anodeMonths)));
        }
        return MaintenanceSchedule.sequential(UnitFamily.TANK, primary, flushFirst ? anode : flush, List.of());
    }

    MaintenanceSchedule tanklessSchedule(InspectionRecord record, DegradationMetrics metrics) {
        ScaleOutlook scale = metrics.scale();
        DescaleStatus descaleStatus = scale != null ? scale.descaleStatus() : DescaleStatus.OPTIMAL;
        double scaleScore = scale != null ? scale.scaleBuildupScore() : 0.0;
        double flowLoss = scale != null ? scale.flowDegradation() : 0.0;

        if (descaleStatus == DescaleStatus.LOCKOUT) {
            MaintenanceTask consult = new MaintenanceTask(TaskType.REPLACEMENT_CONSULT,
                    "Scale damage too severe for maintenance", 0, TaskUrgency.OVERDUE, "Avoid system failure");
            return MaintenanceSchedule.sequential(UnitFamily.TANKLESS, consult, null, List.of());
        }

        boolean valves = record.hasIsolationValves();
        boolean descalable = descaleStatus != DescaleStatus.RUN_TO_FAILURE;

        MaintenanceTask descale = new MaintenanceTask(TaskType.DESCALE, "Flush the heat exchanger with descaler",
                valves ? monthsToDescale(record) : 0,
                descaleUrgency(valves, descaleStatus, scaleScore),
                scaleScore > VISIBLE_SCALE
                        ? "Remove " + Math.round(scaleScore) + "% scale buildup"
                        : "Maintain heat transfer efficiency");

        FilterCondition inlet = record.getInletFilter();
        MaintenanceTask filter = new MaintenanceTask(TaskType.INLET_FILTER, "Remove debris from the inlet screen",
                filterMonths(record, inlet, INLET_FILTER_MONTHS), filterUrgency(inlet, record, INLET_FILTER_MONTHS),
                flowLoss > 10
                        ? "Restore " + Math.round(flowLoss) + "% flow capacity"
                        : "Maintain optimal water flow");

        if (!valves) {
            MaintenanceTask valveTask = new MaintenanceTask(TaskType.ISOLATION_VALVES,
                    "Add service valves so the unit can be descaled", 0, TaskUrgency.DUE,
                    "Enable descaling maintenance");
            return MaintenanceSchedule.sequential(UnitFamily.TANKLESS, valveTask, filter, List.of());
        }
        if (!descalable) {
            return MaintenanceSchedule.sequential(UnitFamily.TANKLESS, filter, null, List.of());
        }

        MaintenanceTask primary = inlet.needsService() ? filter : descale;
        if (Math.abs(descale.monthsUntilDue() - filter.monthsUntilDue()) <= BUNDLE_WINDOW_MONTHS) {
            return MaintenanceSchedule.bundled(UnitFamily.TANKLESS, primary, List.of(descale, filter), List.of(),
                    bundleReason(Math.min(descale.monthsUntilDue(), filter.monthsUntilDue())));
        }
        return MaintenanceSchedule.sequential(UnitFamily.TANKLESS, primary, primary == filter ? descale : filter,
                List.of());
    }

    MaintenanceSchedule hybridSchedule(InspectionRecord record, DegradationMetrics metrics) {
        FilterCondition airFilter = record.getAirFilter();
        MaintenanceTask air = new MaintenanceTask(TaskType.AIR_FILTER, "Wash or replace the heat pump air filter",
                filterMonths(record, airFilter, AIR_FILTER_MONTHS), filterUrgency(airFilter, record, AIR_FILTER_MONTHS),
                "Maximize heat pump efficiency");

        boolean condensateClear = record.isCondensateClear();
        MaintenanceTask condensate = new MaintenanceTask(TaskType.CONDENSATE,
                "Make sure the condensate line drains freely",
                condensateClear ? CONDENSATE_MONTHS : 0,
                condensateClear ? TaskUrgency.OPTIMAL : TaskUrgency.DUE,
                "Prevent water damage");

        int flushMonths = monthsToFlush(metrics, HYBRID_FLUSH_FALLBACK_MONTHS);
        MaintenanceTask flush = new MaintenanceTask(TaskType.FLUSH, flushDescription(record),
                flushMonths, TaskUrgency.fromFlushStatus(metrics.flushStatus()),
                metrics.sedimentLbs() > 0
                        ? String.format(Locale.US, "Remove %.1f lbs sediment", metrics.sedimentLbs())
                        : "Maintain tank health");

        MaintenanceTask primary = air;
        MaintenanceTask secondary = condensate;
        List<MaintenanceTask> additional = List.of(flush);
        if (!condensateClear) {
            primary = condensate;
            secondary = air;
        } else if (airFilter == FilterCondition.CLEAN && flushMonths < 3) {
            primary = flush;
            secondary = air;
            additional = List.of(condensate);
        }

        int earliest = Math.min(air.monthsUntilDue(), condensate.monthsUntilDue());
        if (Math.abs(air.monthsUntilDue() - condensate.monthsUntilDue()) <= BUNDLE_WINDOW_MONTHS && earliest <= 3) {
            return MaintenanceSchedule.bundled(UnitFamily.HYBRID, primary, List.of(air, condensate),
                    List.of(flush), bundleReason(earliest));
        }
        return MaintenanceSchedule.sequential(UnitFamily.HYBRID, primary, secondary, additional);
    }

    /**
     * Months until sediment reaches the serviceable band, 0 once it is there.
     */
    static int monthsToFlush(DegradationMetrics metrics, int fallbackMonths) {
        FlushStatus status = metrics.flushStatus();
        if (status == FlushStatus.DUE || status == FlushStatus.CRITICAL || status == FlushStatus.LOCKOUT) {
            return 0;
        }
        double ratePerYear = metrics.sediment().ratePerYear();
        if (ratePerYear <= 0) {
            return fallbackMonths;
        }
        double years = (SEDIMENT_SERVICEABLE - metrics.sedimentLbs()) / ratePerYear;
        return capMonths(Math.round(years * 12));
    }

    static int monthsToDescale(InspectionRecord record) {
        int interval = record.getHardnessGpg() > HARD_WATER_GPG ? HARD_WATER_DESCALE_MONTHS : SOFT_WATER_DESCALE_MONTHS;
        double yearsSince = yearsSince(record, ServiceEventType.DESCALE).orElse(Math.max(0, record.getCalendarAge()));
        return capMonths(Math.round(interval - yearsSince * 12));
    }

    private static TaskUrgency descaleUrgency(boolean valves, DescaleStatus status, double scaleScore) {
        if (!valves || status == DescaleStatus.RUN_TO_FAILURE) return TaskUrgency.IMPOSSIBLE;
        if (status == DescaleStatus.CRITICAL) return TaskUrgency.OVERDUE;
        if (status == DescaleStatus.DUE) return TaskUrgency.DUE;
        if (scaleScore > VISIBLE_SCALE) return TaskUrgency.SCHEDULE;
        return TaskUrgency.OPTIMAL;
    }

    /**
     * A clean filter is next due one interval after its last logged cleaning, or one interval
     * from now when no cleaning was ever logged.
     */
    private static int filterMonths(InspectionRecord record, FilterCondition condition, int intervalMonths) {
        return switch (condition) {
            case CLOGGED -> 0;
            case DIRTY -> 1;
            case CLEAN -> {
                OptionalDouble since = yearsSince(record, ServiceEventType.FILTER_CLEAN);
                yield since.isPresent()
                        ? capMonths(Math.round(intervalMonths - since.getAsDouble() * 12))
                        : intervalMonths;
            }
        };
    }

    private static TaskUrgency filterUrgency(FilterCondition condition, InspectionRecord record, int intervalMonths) {
        return switch (condition) {
            case CLOGGED -> TaskUrgency.OVERDUE;
            case DIRTY -> TaskUrgency.DUE;
            case CLEAN -> filterMonths(record, condition, intervalMonths) == 0 ? TaskUrgency.DUE : TaskUrgency.OPTIMAL;
        };
    }

    private static OptionalDouble yearsSince(InspectionRecord record, ServiceEventType type) {
        if (record.getServiceHistory().isEmpty()) {
            return OptionalDouble.empty();
        }
        return MaintenanceHistory.yearsSinceLast(record.getServiceHistory(), type, record.getInspectionDate());
    }

    private static String flushDescription(InspectionRecord record) {
        return "Drain sediment from the bottom of the " + record.getTankCapacityGallons() + "-gallon tank";
    }

    private static String bundleReason(int earliestMonths) {
        return earliestMonths <= 0
                ? "Complete both in one service visit"
                : "Both due within " + BUNDLE_WINDOW_MONTHS + " months";
    }

    private static int capMonths(long months) {
        return (int) Math.max(0, Math.min(MAX_MONTHS, months));
    }

    private static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
