package nl.bytesoflife.heaterrisk.issue;

import nl.bytesoflife.heaterrisk.metrics.DegradationMetrics;
import nl.bytesoflife.heaterrisk.model.InspectionRecord;
import nl.bytesoflife.heaterrisk.model.UnitFamily;

import java.util.List;

/**
 * Without isolation valves a tankless unit cannot be descaled.
 */
public class IsolationValveCheck implements IssueCheck {

    @Override
    public List<InfrastructureIssue> check(InspectionRecord record, DegradationMetrics metrics) {
        if (record.getUnitFamily() == UnitFamily.TANKLESS && !record.hasIsolationValves()) {
            return List.of(new InfrastructureIssue(IssueKind.ISOLATION_VALVES,
                    "No service valves on the water connections"));
        }
        return List.of();
    }
}
