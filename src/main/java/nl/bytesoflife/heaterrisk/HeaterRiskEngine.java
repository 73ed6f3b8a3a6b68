package nl.bytesoflife.heaterrisk;

import nl.bytesoflife.heaterrisk.issue.InfrastructureIssue;
import nl.bytesoflife.heaterrisk.issue.IssueDetector;
import nl.bytesoflife.heaterrisk.maintenance.MaintenancePlanner;
import nl.bytesoflife.heaterrisk.maintenance.MaintenanceSchedule;
import nl.bytesoflife.heaterrisk.metrics.DegradationMetrics;
import nl.bytesoflife.heaterrisk.metrics.MetricsEngine;
import nl.bytesoflife.heaterrisk.model.InspectionRecord;
import nl.bytesoflife.heaterrisk.quote.QuoteBatch;
import nl.bytesoflife.heaterrisk.quote.QuoteProvider;
import nl.bytesoflife.heaterrisk.quote.TieredQuoteBundler;
import nl.bytesoflife.heaterrisk.repair.RepairCatalog;
import nl.bytesoflife.heaterrisk.repair.RepairEligibilityEngine;
import nl.bytesoflife.heaterrisk.repair.RepairOption;
import nl.bytesoflife.heaterrisk.repair.RepairSimulator;
import nl.bytesoflife.heaterrisk.repair.SimulatedResult;
import nl.bytesoflife.heaterrisk.repair.SystemState;
import nl.bytesoflife.heaterrisk.verdict.Verdict;
import nl.bytesoflife.heaterrisk.verdict.VerdictEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Main entry point: turns one inspection into metrics, a verdict, infrastructure issues, the
 * repairs that may be offered and a maintenance schedule, and prices replacement tiers on request.
 *
 * <p>
 * Closing the engine shuts down the quote bundler it created itself. A bundler passed to
 * {@link #withQuoteBundler(TieredQuoteBundler)} stays open and belongs to the caller.
 *
 * <pre>
 * try (HeaterRiskEngine engine = new HeaterRiskEngine()) {
 *     AssessmentReport report = engine.assess(record);
 *     if (report.getVerdict().isReplacement()) {
 *         QuoteBatch batch = engine.bundleQuotes(record, report.getIssues(), provider);
 *     }
 * }
 * </pre>
 */
public class HeaterRiskEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HeaterRiskEngine.class);

    private final MetricsEngine metricsEngine = MetricsEngine.withDefaultCalculators();
    private final IssueDetector issueDetector = IssueDetector.withDefaultChecks();
    private final VerdictEngine verdictEngine = VerdictEngine.withDefaultRules(issueDetector);
    private final RepairSimulator simulator = new RepairSimulator();
    private final MaintenancePlanner maintenancePlanner = new MaintenancePlanner();
    private RepairEligibilityEngine eligibility = new RepairEligibilityEngine(RepairCatalog.builtin());
    private TieredQuoteBundler quoteBundler;
    private boolean ownsQuoteBundler;
    private boolean closed;

    public HeaterRiskEngine withCatalog(RepairCatalog catalog) {
        this.eligibility = new RepairEligibilityEngine(catalog);
        return this;
    }

    public synchronized HeaterRiskEngine withQuoteBundler(TieredQuoteBundler quoteBundler) {
        if (ownsQuoteBundler && this.quoteBundler != null) {
            this.quoteBundler.close();
        }
        this.quoteBundler = quoteBundler;
        this.ownsQuoteBundler = false;
        return this;
    }

    public DegradationMetrics computeMetrics(InspectionRecord record) {
        return metricsEngine.compute(record);
    }

    public List<InfrastructureIssue> detectIssues(InspectionRecord record, DegradationMetrics metrics) {
        return issueDetector.detect(record, metrics);
    }

    public Verdict computeVerdict(InspectionRecord record, DegradationMetrics metrics) {
        return verdictEngine.evaluate(record, metrics);
    }

    public List<RepairOption> eligibleRepairs(InspectionRecord record, DegradationMetrics metrics, Verdict verdict) {
        return eligibility.eligibleRepairs(record, metrics, verdict);
    }

    public MaintenanceSchedule maintenanceSchedule(InspectionRecord record, DegradationMetrics metrics,
                                                   Verdict verdict, List<InfrastructureIssue> issues) {
        return maintenancePlanner.schedule(record, metrics, verdict, issues);
    }

    public SimulatedResult simulate(SystemState current, List<RepairOption> selection) {
        return simulator.simulate(current, selection);
    }

    /**
     * Starts pricing every replacement tier. A previous batch from this engine is cancelled.
     */
    public QuoteBatch bundleQuotes(InspectionRecord record, List<InfrastructureIssue> issues, QuoteProvider provider) {
        return quoteBundler().bundle(record, issues, provider);
    }

    /**
     * Runs metrics, issue detection, the verdict, repair eligibility and maintenance planning in one pass.
     */
    public AssessmentReport assess(InspectionRecord record) {
        DegradationMetrics metrics = computeMetrics(record);
        List<InfrastructureIssue> issues = detectIssues(record, metrics);
        Verdict verdict = verdictEngine.evaluate(record, metrics, issues);
        List<RepairOption> repairs = eligibleRepairs(record, metrics, verdict);
        MaintenanceSchedule maintenance = maintenanceSchedule(record, metrics, verdict, issues);

        log.debug("Assessed {} aged {}: health {}, verdict {}, {} issues, {} repairs",
                record.getUnitType(), record.getCalendarAge(), metrics.healthScore(),
                verdict.action(), issues.size(), repairs.size());

        return new AssessmentReport(record, metrics, verdict, issues, repairs, maintenance);
    }

    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;
        if (ownsQuoteBundler && quoteBundler != null) {
            quoteBundler.close();
        }
    }

    private synchronized TieredQuoteBundler quoteBundler() {
        if (closed) {
            throw new IllegalStateException("Engine is closed");
        }
        if (quoteBundler == null) {
            quoteBundler = new TieredQuoteBundler();
            ownsQuoteBundler = true;
        }
        return quoteBundler;
    }
}
