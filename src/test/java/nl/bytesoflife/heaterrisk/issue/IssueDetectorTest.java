package nl.bytesoflife.heaterrisk.issue;

import nl.bytesoflife.heaterrisk.metrics.DegradationMetrics;
import nl.bytesoflife.heaterrisk.metrics.MetricsEngine;
import nl.bytesoflife.heaterrisk.model.CostRange;
import nl.bytesoflife.heaterrisk.model.ExpansionTankStatus;
import nl.bytesoflife.heaterrisk.model.InspectionRecord;
import nl.bytesoflife.heaterrisk.model.InstallLocation;
import nl.bytesoflife.heaterrisk.model.QualityTier;
import nl.bytesoflife.heaterrisk.model.UnitType;
import nl.bytesoflife.heaterrisk.model.VentType;
import nl.bytesoflife.heaterrisk.model.VentingScenario;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IssueDetectorTest {

    private final MetricsEngine metricsEngine = MetricsEngine.withDefaultCalculators();
    private final IssueDetector detector = IssueDetector.withDefaultChecks();

    private List<InfrastructureIssue> detect(InspectionRecord record) {
        DegradationMetrics metrics = metricsEngine.compute(record);
        return detector.detect(record, metrics);
    }

    private List<IssueKind> kinds(List<InfrastructureIssue> issues) {
        return issues.stream().map(InfrastructureIssue::kind).toList();
    }

    @Test
    void quietHouseHasNoIssues() {
        InspectionRecord record = InspectionRecord.builder(UnitType.TANK_GAS).withAge(3).withPsi(50).build();
        assertTrue(detect(record).isEmpty());
    }

    @Test
    void pressureAboveCodeLimitWithoutRegulatorIsViolation() {
        InspectionRecord record = InspectionRecord.builder(UnitType.TANK_GAS).withPsi(95).build();

        List<InfrastructureIssue> issues = detect(record);

        assertEquals(List.of(IssueKind.PRV_REQUIRED), kinds(issues));
        assertEquals("prv_critical", issues.get(0).id());
        assertTrue(issues.get(0).isViolation());
        assertTrue(issues.get(0).finding().contains("95 PSI"));
    }

    @Test
    void pressureBandsDoNotOverlap() {
        assertEquals(List.of(IssueKind.PRV_RECOMMENDED),
                kinds(detect(InspectionRecord.builder(UnitType.TANK_GAS).withPsi(75).build())));
        assertEquals(List.of(IssueKind.PRV_LONGEVITY),
                kinds(detect(InspectionRecord.builder(UnitType.TANK_GAS).withPsi(65).build())));
    }

    @Test
    void highPressureBehindRegulatorMeansFailedRegulator() {
        InspectionRecord record = InspectionRecord.builder(UnitType.TANK_GAS)
                .withPsi(90)
                .withPrv(true)
                .withExpansionTank(true)
                .build();

        assertEquals(List.of(IssueKind.PRV_FAILED), kinds(detect(record)));
    }

    @Test
    void closedLoopWithoutExpansionTankIsViolation() {
        InspectionRecord record = InspectionRecord.builder(UnitType.TANK_ELECTRIC)
                .withPsi(50)
                .withClosedLoop(true)
                .build();

        assertEquals(List.of(IssueKind.EXPANSION_TANK_REQUIRED), kinds(detect(record)));
    }

    @Test
    void waterloggedExpansionTankNeedsReplacing() {
        InspectionRecord record = InspectionRecord.builder(UnitType.TANK_ELECTRIC)
                .withPsi(50)
                .withClosedLoop(true)
                .withExpansionTank(true)
                .withExpansionTankStatus(ExpansionTankStatus.WATERLOGGED)
                .build();

        List<InfrastructureIssue> issues = detect(record);
        assertEquals(List.of(IssueKind.EXPANSION_TANK_REPLACE), kinds(issues));
        assertFalse(issues.get(0).isViolation());
    }

    @Test
    void tanklessIgnoresExpansionButNeedsIsolationValves() {
        InspectionRecord record = InspectionRecord.builder(UnitType.TANKLESS_GAS)
                .withPsi(50)
                .withClosedLoop(true)
                .build();

        assertEquals(List.of(IssueKind.ISOLATION_VALVES), kinds(detect(record)));
    }

    @Test
    void hardWaterIssuesDependOnSoftener() {
        assertEquals(List.of(IssueKind.SOFTENER_NEW), kinds(detect(
                InspectionRecord.builder(UnitType.TANK_GAS).withPsi(50).withHardness(12).build())));
        assertEquals(List.of(IssueKind.SOFTENER_SERVICE), kinds(detect(
                InspectionRecord.builder(UnitType.TANK_GAS).withPsi(50).withHardness(12).withSoftener(true).build())));
        assertEquals(List.of(IssueKind.SOFTENER_REPLACE), kinds(detect(
                InspectionRecord.builder(UnitType.TANK_GAS).withPsi(50).withHardness(18).withSoftener(true).build())));
    }

    @Test
    void orphanedFlueOnlyMattersForAtmosphericGas() {
        InspectionRecord atmospheric = InspectionRecord.builder(UnitType.TANK_GAS)
                .withPsi(50)
                .withVentingScenario(VentingScenario.ORPHANED_FLUE)
                .build();
        InspectionRecord powerVent = atmospheric.toBuilder().withVentType(VentType.POWER_VENT).build();
        InspectionRecord electric = InspectionRecord.builder(UnitType.TANK_ELECTRIC)
                .withPsi(50)
                .withVentingScenario(VentingScenario.ORPHANED_FLUE)
                .build();

        assertEquals(List.of(IssueKind.ORPHANED_FLUE), kinds(detect(atmospheric)));
        assertTrue(detect(powerVent).isEmpty());
        assertTrue(detect(electric).isEmpty());
    }

    @Test
    void tankOverLivingSpaceNeedsDrainPan() {
        InspectionRecord record = InspectionRecord.builder(UnitType.TANK_GAS)
                .withPsi(50)
                .withLocation(InstallLocation.ATTIC)
                .withDrainPan(false)
                .build();

        assertEquals(List.of(IssueKind.DRAIN_PAN_REQUIRED), kinds(detect(record)));
    }

    @Test
    void issuesAreReportedInFixedOrderRegardlessOfCheckRegistration() {
        InspectionRecord record = InspectionRecord.builder(UnitType.TANK_GAS)
                .withPsi(95)
                .withHardness(20)
                .withClosedLoop(true)
                .withLocation(InstallLocation.ATTIC)
                .withDrainPan(false)
                .build();
        DegradationMetrics metrics = metricsEngine.compute(record);

        IssueDetector reversed = new IssueDetector()
                .registerCheck(new IsolationValveCheck())
                .registerCheck(new WaterTreatmentCheck())
                .registerCheck(new DrainPanCheck())
                .registerCheck(new VentingCheck())
                .registerCheck(new PressureRegulatorCheck())
                .registerCheck(new ExpansionTankCheck());

        List<InfrastructureIssue> issues = detector.detect(record, metrics);

        assertEquals(List.of(IssueKind.EXPANSION_TANK_REQUIRED, IssueKind.PRV_REQUIRED,
                IssueKind.DRAIN_PAN_REQUIRED, IssueKind.SOFTENER_NEW), kinds(issues));
        assertEquals(issues, reversed.detect(record, metrics));
        assertEquals(issues, detector.detect(record, metrics));
    }

    @Test
    void tiersIncludeIssuesFromTheirCategoryUp() {
        List<InfrastructureIssue> issues = List.of(
                new InfrastructureIssue(IssueKind.PRV_REQUIRED, "95 PSI"),
                new InfrastructureIssue(IssueKind.EXPANSION_TANK_REPLACE, "waterlogged"),
                new InfrastructureIssue(IssueKind.SOFTENER_NEW, "hard water"));

        assertEquals(1, IssueDetector.forTier(issues, QualityTier.BUILDER).size());
        assertEquals(2, IssueDetector.forTier(issues, QualityTier.STANDARD).size());
        assertEquals(3, IssueDetector.forTier(issues, QualityTier.PROFESSIONAL).size());
        assertEquals(3, IssueDetector.forTier(issues, QualityTier.PREMIUM).size());
    }

    @Test
    void totalCostSumsBothEnds() {
        List<InfrastructureIssue> issues = List.of(
                new InfrastructureIssue(IssueKind.PRV_REQUIRED, "95 PSI"),
                new InfrastructureIssue(IssueKind.EXPANSION_TANK_REQUIRED, "closed loop"));

        assertEquals(CostRange.of(600, 950), IssueDetector.totalCost(issues));
        assertEquals(CostRange.ZERO, IssueDetector.totalCost(List.of()));
    }
}
