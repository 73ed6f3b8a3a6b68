package nl.bytesoflife.heaterrisk.verdict;

import nl.bytesoflife.heaterrisk.issue.InfrastructureIssue;
import nl.bytesoflife.heaterrisk.metrics.DegradationMetrics;
import nl.bytesoflife.heaterrisk.model.InspectionRecord;
import nl.bytesoflife.heaterrisk.model.UnitFamily;

import java.util.List;

/**
 * Everything a verdict rule may look at.
 */
public record VerdictContext(InspectionRecord record, DegradationMetrics metrics, List<InfrastructureIssue> issues) {

    public VerdictContext {
        issues = List.copyOf(issues);
    }

    public UnitFamily family() {
        return record.getUnitFamily();
    }

    public boolean hasStorageTank() {
        return record.getUnitType().hasStorageTank();
    }
}
