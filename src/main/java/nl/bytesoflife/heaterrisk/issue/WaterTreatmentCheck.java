package nl.bytesoflife.heaterrisk.issue;

import nl.bytesoflife.heaterrisk.metrics.DegradationMetrics;
import nl.bytesoflife.heaterrisk.model.InspectionRecord;

import java.util.List;
import java.util.Locale;

import static nl.bytesoflife.heaterrisk.metrics.RiskConstants.HARD_WATER_GPG;
import static nl.bytesoflife.heaterrisk.metrics.RiskConstants.SOFTENER_FAILURE_GPG;

/**
 * Hardness is measured at the heater, so with a softener in place a high reading means the
 * softener is not doing its job.
 */
public class WaterTreatmentCheck implements IssueCheck {

    @Override
    public List<InfrastructureIssue> check(InspectionRecord record, DegradationMetrics metrics) {
        double hardness = record.getHardnessGpg();
        if (hardness <= HARD_WATER_GPG) {
            return List.of();
        }
        String measured = String.format(Locale.US, "%.1f gpg", hardness);

        if (!record.hasSoftener()) {
            return List.of(new InfrastructureIssue(IssueKind.SOFTENER_NEW,
                    "Untreated hard water at " + measured));
        }
        if (hardness > SOFTENER_FAILURE_GPG) {
            return List.of(new InfrastructureIssue(IssueKind.SOFTENER_REPLACE,
                    "Softener present but water measures " + measured));
        }
        return List.of(new InfrastructureIssue(IssueKind.SOFTENER_SERVICE,
                "Softener letting " + measured + " through"));
    }
}
