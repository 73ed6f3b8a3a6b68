package nl.bytesoflife.heaterrisk.issue;

import nl.bytesoflife.heaterrisk.metrics.DegradationMetrics;
import nl.bytesoflife.heaterrisk.model.InspectionRecord;

import java.util.List;

public interface IssueCheck {

    List<InfrastructureIssue> check(InspectionRecord record, DegradationMetrics metrics);
}
