package nl.bytesoflife.heaterrisk.verdict;

import nl.bytesoflife.heaterrisk.issue.InfrastructureIssue;
import nl.bytesoflife.heaterrisk.issue.IssueDetector;
import nl.bytesoflife.heaterrisk.metrics.DegradationMetrics;
import nl.bytesoflife.heaterrisk.model.InspectionRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks the verdict ladder in priority order; the first rule that applies decides.
 */
public class VerdictEngine {

    static final Verdict HEALTHY = Verdict.pass(Badge.OPTIMAL, "System Healthy",
            "No replacement triggers, violations or maintenance items found");

    private final List<VerdictRule> rules = new ArrayList<>();
    private final IssueDetector issueDetector;

    public VerdictEngine(IssueDetector issueDetector) {
        this.issueDetector = issueDetector;
    }

    public VerdictEngine addRule(VerdictRule rule) {
        rules.add(rule);
        return this;
    }

    public static VerdictEngine withDefaultRules(IssueDetector issueDetector) {
        return new VerdictEngine(issueDetector)
                .addRule(new ContainmentBreachRule())
                .addRule(new EndOfLifeRule())
                .addRule(new ImmediateHazardRule())
                .addRule(new ComponentFailureRule())
                .addRule(new CodeViolationRule())
                .addRule(new UpgradeRule())
                .addRule(new MaintenanceRule());
    }

    public Verdict evaluate(InspectionRecord record, DegradationMetrics metrics) {
        return evaluate(record, metrics, issueDetector.detect(record, metrics));
    }

    /**
     * Same as {@link #evaluate(InspectionRecord, DegradationMetrics)} with issues already detected.
     */
    public Verdict evaluate(InspectionRecord record, DegradationMetrics metrics, List<InfrastructureIssue> issues) {
        VerdictContext context = new VerdictContext(record, metrics, issues);
        for (VerdictRule rule : rules) {
            Verdict verdict = rule.evaluate(context);
            if (verdict != null) {
                return verdict;
            }
        }
        return HEALTHY;
    }
}
