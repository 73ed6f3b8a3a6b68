package nl.bytesoflife.heaterrisk.maintenance;

import nl.bytesoflife.heaterrisk.issue.InfrastructureIssue;
import nl.bytesoflife.heaterrisk.issue.IssueDetector;
import nl.bytesoflife.heaterrisk.metrics.DegradationMetrics;
import nl.bytesoflife.heaterrisk.metrics.MetricsEngine;
import nl.bytesoflife.heaterrisk.model.FilterCondition;
import nl.bytesoflife.heaterrisk.model.InspectionRecord;
import nl.bytesoflife.heaterrisk.model.ServiceEventType;
import nl.bytesoflife.heaterrisk.model.UnitType;
import nl.bytesoflife.heaterrisk.verdict.Action;
import nl.bytesoflife.heaterrisk.verdict.Verdict;
import nl.bytesoflife.heaterrisk.verdict.VerdictEngine;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MaintenancePlannerTest {

    private static final LocalDate INSPECTED = LocalDate.of(2026, 1, 1);

    private final MetricsEngine metricsEngine = MetricsEngine.withDefaultCalculators();
    private final IssueDetector issueDetector = IssueDetector.withDefaultChecks();
    private final VerdictEngine verdictEngine = VerdictEngine.withDefaultRules(issueDetector);
    private final MaintenancePlanner planner = new MaintenancePlanner();

    private final Verdict routineRepair = Verdict.repair(false, "Routine Service", "Scheduled visit");

    private MaintenanceSchedule plan(InspectionRecord record) {
        DegradationMetrics metrics = metricsEngine.compute(record);
        List<InfrastructureIssue> issues = issueDetector.detect(record, metrics);
        return planner.schedule(record, metrics, verdictEngine.evaluate(record, metrics, issues), issues);
    }

    private MaintenanceSchedule plan(InspectionRecord record, Verdict verdict) {
        DegradationMetrics metrics = metricsEngine.compute(record);
        return planner.schedule(record, metrics, verdict, issueDetector.detect(record, metrics));
    }

    private static List<TaskType> types(List<MaintenanceTask> tasks) {
        return tasks.stream().map(MaintenanceTask::type).toList();
    }

    @Test
    void passingUnitIsMonitorOnly() {
        MaintenanceSchedule schedule = plan(InspectionRecord.builder(UnitType.TANK_GAS)
                .withAge(3)
                .withPsi(50)
                .withHardness(5)
                .build());

        assertTrue(schedule.isMonitorOnly());
        assertTrue(schedule.isEmpty());
        assertNull(schedule.getPrimaryTask());
    }

    @Test
    void replacementSkipsMaintenance() {
        MaintenanceSchedule schedule = plan(InspectionRecord.builder(UnitType.TANK_GAS)
                .withAge(20)
                .withHardness(5)
                .build());

        assertFalse(schedule.isMonitorOnly());
        assertTrue(schedule.isEmpty());
        assertTrue(schedule.allTasks().isEmpty());
    }

    @Test
    void urgentHazardSkipsMaintenance() {
        InspectionRecord record = InspectionRecord.builder(UnitType.TANK_GAS)
                .withAge(1)
                .withPsi(160)
                .build();
        DegradationMetrics metrics = metricsEngine.compute(record);
        List<InfrastructureIssue> issues = issueDetector.detect(record, metrics);
        Verdict verdict = verdictEngine.evaluate(record, metrics, issues);
        assertEquals(Action.URGENT, verdict.action());

        MaintenanceSchedule schedule = planner.schedule(record, metrics, verdict, issues);

        assertTrue(schedule.isEmpty());
        assertFalse(schedule.isMonitorOnly());
    }

    @Test
    void dueFlushAndSpentAnodeShareOneVisit() {
        // 15 gpg on an electric tank: 6 lbs of sediment after five years, one year of shield left
        MaintenanceSchedule schedule = plan(InspectionRecord.builder(UnitType.TANK_ELECTRIC)
                .withAge(5)
                .withPsi(50)
                .withHardness(15)
                .build());

        assertTrue(schedule.isBundled());
        assertEquals(TaskType.FLUSH, schedule.getPrimaryTask().type());
        assertEquals(List.of(TaskType.FLUSH, TaskType.ANODE), types(schedule.getBundledTasks()));
        assertEquals("Complete both in one service visit", schedule.getBundleReason());
        assertEquals(TaskUrgency.DUE, schedule.getPrimaryTask().urgency());
        assertEquals(0, schedule.getPrimaryTask().monthsUntilDue());
        assertEquals("Drain sediment from the bottom of the 50-gallon tank",
                schedule.getPrimaryTask().description());
    }

    @Test
    void anodeComesFirstWhenSedimentIsLight() {
        MaintenanceSchedule schedule = plan(InspectionRecord.builder(UnitType.TANK_GAS)
                .withAge(4)
                .withPsi(50)
                .withHardness(10)
                .build(), routineRepair);

        assertFalse(schedule.isBundled());
        assertEquals(TaskType.ANODE, schedule.getPrimaryTask().type());
        assertEquals(12, schedule.getPrimaryTask().monthsUntilDue());
        assertEquals(TaskType.FLUSH, schedule.getSecondaryTask().type());
        assertEquals(MaintenancePlanner.MAX_MONTHS, schedule.getSecondaryTask().monthsUntilDue());
    }

    @Test
    void tanklessWithoutValvesNeedsValvesBeforeDescaling() {
        MaintenanceSchedule schedule = plan(InspectionRecord.builder(UnitType.TANKLESS_GAS)
                .withAge(4)
                .withPsi(50)
                .withHardness(5)
                .build(), routineRepair);

        assertEquals(TaskType.ISOLATION_VALVES, schedule.getPrimaryTask().type());
        assertEquals(TaskType.INLET_FILTER, schedule.getSecondaryTask().type());
        assertFalse(types(schedule.allTasks()).contains(TaskType.DESCALE));
    }

    @Test
    void descaleFollowsLastLoggedDescale() {
        MaintenanceSchedule schedule = plan(InspectionRecord.builder(UnitType.TANKLESS_GAS)
                .withAge(4)
                .withPsi(50)
                .withHardness(12)
                .withIsolationValves(true)
                .withInspectionDate(INSPECTED)
                .addServiceEvent(ServiceEventType.DESCALE, LocalDate.of(2025, 7, 1))
                .build(), routineRepair);

        // hard water descales yearly; half a year has passed
        assertTrue(schedule.isBundled());
        assertEquals(TaskType.DESCALE, schedule.getPrimaryTask().type());
        assertEquals(6, schedule.getPrimaryTask().monthsUntilDue());
        assertEquals(TaskUrgency.OPTIMAL, schedule.getPrimaryTask().urgency());
        assertEquals("Both due within 2 months", schedule.getBundleReason());
    }

    @Test
    void inletFilterFallsDueAfterItsInterval() {
        MaintenanceSchedule schedule = plan(InspectionRecord.builder(UnitType.TANKLESS_GAS)
                .withAge(4)
                .withPsi(50)
                .withHardness(12)
                .withIsolationValves(true)
                .withInspectionDate(INSPECTED)
                .addServiceEvent(ServiceEventType.DESCALE, LocalDate.of(2025, 7, 1))
                .addServiceEvent(ServiceEventType.FILTER_CLEAN, LocalDate.of(2025, 3, 1))
                .build(), routineRepair);

        assertFalse(schedule.isBundled());
        MaintenanceTask filter = schedule.getSecondaryTask();
        assertEquals(TaskType.INLET_FILTER, filter.type());
        assertEquals(0, filter.monthsUntilDue());
        assertEquals(TaskUrgency.DUE, filter.urgency());
        assertEquals(ServiceEventType.FILTER_CLEAN, filter.type().completedBy());
    }

    @Test
    void cloggedInletFilterLeadsTanklessSchedule() {
        MaintenanceSchedule schedule = plan(InspectionRecord.builder(UnitType.TANKLESS_ELECTRIC)
                .withAge(1)
                .withPsi(50)
                .withIsolationValves(true)
                .withInletFilter(FilterCondition.CLOGGED)
                .build(), routineRepair);

        assertEquals(TaskType.INLET_FILTER, schedule.getPrimaryTask().type());
        assertEquals(TaskUrgency.OVERDUE, schedule.getPrimaryTask().urgency());
    }

    @Test
    void blockedCondensateLeadsHybridSchedule() {
        MaintenanceSchedule schedule = plan(InspectionRecord.builder(UnitType.HYBRID_HEAT_PUMP)
                .withAge(3)
                .withPsi(50)
                .withCondensateClear(false)
                .build(), routineRepair);

        assertFalse(schedule.isBundled());
        assertEquals(TaskType.CONDENSATE, schedule.getPrimaryTask().type());
        assertEquals(TaskType.AIR_FILTER, schedule.getSecondaryTask().type());
        assertEquals(List.of(TaskType.FLUSH), types(schedule.getAdditionalTasks()));
        assertEquals(MaintenancePlanner.HYBRID_FLUSH_FALLBACK_MONTHS,
                schedule.getAdditionalTasks().get(0).monthsUntilDue());
    }

    @Test
    void cloggedFilterAndBlockedDrainAreBundled() {
        MaintenanceSchedule schedule = plan(InspectionRecord.builder(UnitType.HYBRID_HEAT_PUMP)
                .withAge(3)
                .withPsi(50)
                .withCondensateClear(false)
                .withAirFilter(FilterCondition.CLOGGED)
                .build(), routineRepair);

        assertTrue(schedule.isBundled());
        assertEquals(TaskType.CONDENSATE, schedule.getPrimaryTask().type());
        assertEquals(List.of(TaskType.AIR_FILTER, TaskType.CONDENSATE), types(schedule.getBundledTasks()));
        assertEquals(List.of(TaskType.CONDENSATE, TaskType.AIR_FILTER, TaskType.FLUSH),
                types(schedule.allTasks()));
    }

    @Test
    void closedSystemPutsExpansionTankFirst() {
        MaintenanceSchedule schedule = plan(InspectionRecord.builder(UnitType.TANK_GAS)
                .withAge(4)
                .withPsi(88)
                .withClosedLoop(true)
                .build());

        List<MaintenanceTask> infrastructure = schedule.getInfrastructureTasks();
        assertFalse(infrastructure.isEmpty());
        MaintenanceTask expansion = infrastructure.get(0);
        assertEquals(TaskType.EXPANSION_TANK_INSTALL, expansion.type());
        assertEquals(TaskUrgency.OVERDUE, expansion.urgency());
        // 1.16 pressure stress times the 1.5 loop penalty
        assertEquals(1.7, expansion.agingMultiplier(), 1e-9);
        assertEquals(expansion, schedule.allTasks().get(0));
        assertTrue(infrastructure.stream().allMatch(MaintenanceTask::isInfrastructure));
    }

    @Test
    void taskRejectsNegativeMonths() {
        assertThrows(IllegalArgumentException.class, () -> new MaintenanceTask(TaskType.FLUSH, "Flush", -1,
                TaskUrgency.DUE, "Benefit", null));
    }
}
