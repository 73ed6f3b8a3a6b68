package nl.bytesoflife.heaterrisk.issue;

import nl.bytesoflife.heaterrisk.metrics.DegradationMetrics;
import nl.bytesoflife.heaterrisk.model.CostRange;
import nl.bytesoflife.heaterrisk.model.InspectionRecord;
import nl.bytesoflife.heaterrisk.model.QualityTier;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs every registered check and reports the issues in {@link IssueKind} order,
 * independent of registration order.
 */
public class IssueDetector {

    private final List<IssueCheck> checks = new ArrayList<>();

    public IssueDetector registerCheck(IssueCheck check) {
        checks.add(check);
        return this;
    }

    public static IssueDetector withDefaultChecks() {
        return new IssueDetector()
                .registerCheck(new ExpansionTankCheck())
                .registerCheck(new PressureRegulatorCheck())
                .registerCheck(new VentingCheck())
                .registerCheck(new DrainPanCheck())
                .registerCheck(new WaterTreatmentCheck())
                .registerCheck(new IsolationValveCheck());
    }

    public List<InfrastructureIssue> detect(InspectionRecord record, DegradationMetrics metrics) {
        List<InfrastructureIssue> issues = new ArrayList<>();
        for (IssueCheck check : checks) {
            issues.addAll(check.check(record, metrics));
        }
        issues.sort(Comparator.comparing(InfrastructureIssue::kind));
        return List.copyOf(issues);
    }

    /**
     * Issues bundled into a quote at the given tier.
     */
    public static List<InfrastructureIssue> forTier(List<InfrastructureIssue> issues, QualityTier tier) {
        return issues.stream()
                .filter(issue -> tier.includes(issue.minimumTier()))
                .toList();
    }

    public static CostRange totalCost(List<InfrastructureIssue> issues) {
        CostRange total = CostRange.ZERO;
        for (InfrastructureIssue issue : issues) {
            total = total.plus(issue.cost());
        }
        return total;
    }
}
