package nl.bytesoflife.heaterrisk.issue;

import nl.bytesoflife.heaterrisk.metrics.DegradationMetrics;
import nl.bytesoflife.heaterrisk.model.InspectionRecord;

import java.util.List;

public class DrainPanCheck implements IssueCheck {

    @Override
    public List<InfrastructureIssue> check(InspectionRecord record, DegradationMetrics metrics) {
        if (record.getUnitType().hasStorageTank()
                && record.getLocation().isAboveLivingSpace()
                && !record.hasDrainPan()) {
            return List.of(new InfrastructureIssue(IssueKind.DRAIN_PAN_REQUIRED,
                    "Tank installed over living space without a drain pan"));
        }
        return List.of();
    }
}
