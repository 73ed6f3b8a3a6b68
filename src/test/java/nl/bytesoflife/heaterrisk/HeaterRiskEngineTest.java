package nl.bytesoflife.heaterrisk;

import nl.bytesoflife.heaterrisk.issue.IssueKind;
import nl.bytesoflife.heaterrisk.model.InspectionRecord;
import nl.bytesoflife.heaterrisk.model.InstallLocation;
import nl.bytesoflife.heaterrisk.model.QualityTier;
import nl.bytesoflife.heaterrisk.model.UnitType;
import nl.bytesoflife.heaterrisk.quote.PresetQuoteProvider;
import nl.bytesoflife.heaterrisk.quote.QuoteBatch;
import nl.bytesoflife.heaterrisk.quote.TierResult;
import nl.bytesoflife.heaterrisk.quote.TieredQuoteBundler;
import nl.bytesoflife.heaterrisk.repair.HealthStatus;
import nl.bytesoflife.heaterrisk.repair.RepairKind;
import nl.bytesoflife.heaterrisk.repair.SimulatedResult;
import nl.bytesoflife.heaterrisk.verdict.Action;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class HeaterRiskEngineTest {

    private final HeaterRiskEngine engine = new HeaterRiskEngine();

    @AfterEach
    void closeEngine() {
        engine.close();
    }

    @Test
    void assessesHealthyUnit() {
        InspectionRecord record = InspectionRecord.builder(UnitType.TANK_GAS)
                .withAge(3)
                .withPsi(50)
                .withHardness(5)
                .build();

        AssessmentReport report = engine.assess(record);

        assertEquals(Action.PASS, report.getVerdict().action());
        assertTrue(report.getIssues().isEmpty());
        assertTrue(report.getRepairs().isEmpty());
        assertFalse(report.hasViolations());
        assertEquals(95, report.getMetrics().healthScore());
    }

    @Test
    void assessmentOfClosedHighPressureSystemOffersBundle() {
        InspectionRecord record = InspectionRecord.builder(UnitType.TANK_GAS)
                .withAge(4)
                .withPsi(88)
                .withClosedLoop(true)
                .build();

        AssessmentReport report = engine.assess(record);

        assertEquals(Action.REPAIR, report.getVerdict().action());
        assertTrue(report.hasViolations());
        assertEquals(IssueKind.EXPANSION_TANK_REQUIRED, report.getIssues().get(0).kind());
        assertEquals(RepairKind.PRV_WITH_EXPANSION_TANK, report.getRepairs().get(0).kind());
        assertEquals(1, report.getRepairs().size());
    }

    @Test
    void simulatingOfferedRepairsImprovesScore() {
        InspectionRecord record = InspectionRecord.builder(UnitType.TANK_GAS)
                .withAge(4)
                .withPsi(88)
                .withClosedLoop(true)
                .build();
        AssessmentReport report = engine.assess(record);

        SimulatedResult result = engine.simulate(report.currentState(), report.getRepairs());

        assertTrue(result.healthScore() >= report.getMetrics().healthScore());
        assertTrue(result.failProb() <= report.getMetrics().failProb());
        assertEquals(report.getRepairs().get(0).cost(), result.totalCost());
    }

    @Test
    void replacementAssessmentSimulatesToNew() {
        InspectionRecord record = InspectionRecord.builder(UnitType.TANK_GAS)
                .withAge(15)
                .withPsi(50)
                .withLocation(InstallLocation.ATTIC)
                .build();

        AssessmentReport report = engine.assess(record);
        SimulatedResult result = engine.simulate(report.currentState(), report.getRepairs());

        assertTrue(report.getVerdict().isReplacement());
        assertEquals(1, report.getRepairs().size());
        assertEquals(100, result.healthScore());
        assertEquals(HealthStatus.OPTIMAL, result.status());
    }

    @Test
    void reportListsVerdictIssuesAndRepairs() {
        InspectionRecord record = InspectionRecord.builder(UnitType.TANK_GAS)
                .withAge(4)
                .withPsi(88)
                .withClosedLoop(true)
                .build();

        String text = engine.assess(record).toString();

        assertTrue(text.contains("Verdict: REPAIR"));
        assertTrue(text.contains("Missing Expansion Tank"));
        assertTrue(text.contains("Pressure Regulator + Expansion Tank"));
        assertTrue(text.contains("TANK_GAS, 50 gal"));
        assertTrue(text.contains("- Expansion Tank Installation [OVERDUE] now"));
    }

    @Test
    void bundlesQuotesForReplacement() throws Exception {
        InspectionRecord record = InspectionRecord.builder(UnitType.TANK_ELECTRIC)
                .withAge(18)
                .withPsi(92)
                .build();
        AssessmentReport report = engine.assess(record);

        try (TieredQuoteBundler bundler = new TieredQuoteBundler()) {
            QuoteBatch batch = engine.withQuoteBundler(bundler)
                    .bundleQuotes(record, report.getIssues(), new PresetQuoteProvider());
            Map<QualityTier, TierResult> results = batch.await(Duration.ofSeconds(5));

            for (QualityTier tier : QualityTier.values()) {
                assertInstanceOf(TierResult.Priced.class, results.get(tier));
            }
            TierResult.Priced builder = (TierResult.Priced) results.get(QualityTier.BUILDER);
            // 1200 electric unit, 525 install, 350-550 regulator
            assertEquals(2075, builder.quote().total().low());
            assertEquals(2275, builder.quote().total().high());
        }
    }

    @Test
    void concurrentCallersShareOneBundler() throws Exception {
        InspectionRecord record = InspectionRecord.builder(UnitType.TANK_GAS).withAge(16).build();
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService callers = Executors.newFixedThreadPool(2);
        try {
            List<Future<QuoteBatch>> submitted = new ArrayList<>();
            for (int i = 0; i < 2; i++) {
                submitted.add(callers.submit(() -> {
                    go.await();
                    return engine.bundleQuotes(record, List.of(), new PresetQuoteProvider());
                }));
            }
            go.countDown();
            QuoteBatch first = submitted.get(0).get(5, TimeUnit.SECONDS);
            QuoteBatch second = submitted.get(1).get(5, TimeUnit.SECONDS);

            assertNotEquals(first.getGeneration(), second.getGeneration());
            QuoteBatch older = first.getGeneration() < second.getGeneration() ? first : second;
            QuoteBatch newer = older == first ? second : first;
            assertTrue(older.isCancelled());
            assertFalse(newer.isCancelled());
        } finally {
            callers.shutdownNow();
        }
    }

    @Test
    void closingEngineStopsItsOwnBundler() {
        InspectionRecord record = InspectionRecord.builder(UnitType.TANK_GAS).withAge(16).build();
        QuoteBatch batch = engine.bundleQuotes(record, List.of(), new PresetQuoteProvider());

        engine.close();

        assertTrue(batch.isCancelled());
        assertThrows(IllegalStateException.class,
                () -> engine.bundleQuotes(record, List.of(), new PresetQuoteProvider()));
    }

    @Test
    void closingEngineLeavesInjectedBundlerOpen() throws Exception {
        InspectionRecord record = InspectionRecord.builder(UnitType.TANK_GAS).withAge(16).build();

        try (TieredQuoteBundler bundler = new TieredQuoteBundler()) {
            HeaterRiskEngine shared = new HeaterRiskEngine().withQuoteBundler(bundler);
            shared.close();

            QuoteBatch batch = bundler.bundle(record, List.of(), new PresetQuoteProvider());
            Map<QualityTier, TierResult> results = batch.await(Duration.ofSeconds(5));
            assertInstanceOf(TierResult.Priced.class, results.get(QualityTier.STANDARD));
        }
    }
}
