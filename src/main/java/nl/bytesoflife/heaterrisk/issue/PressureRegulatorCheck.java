package nl.bytesoflife.heaterrisk.issue;

import nl.bytesoflife.heaterrisk.metrics.DegradationMetrics;
import nl.bytesoflife.heaterrisk.model.InspectionRecord;

import java.util.List;
import java.util.Locale;

import static nl.bytesoflife.heaterrisk.metrics.RiskConstants.PSI_REGULATOR_RECOMMENDED;
import static nl.bytesoflife.heaterrisk.metrics.RiskConstants.PSI_SAFE_LIMIT;

/**
 * Supply pressure bands. At most one issue per record: the bands do not overlap.
 */
public class PressureRegulatorCheck implements IssueCheck {

    static final double LONGEVITY_PSI = 60.0;

    @Override
    public List<InfrastructureIssue> check(InspectionRecord record, DegradationMetrics metrics) {
        double psi = record.getHousePsi();
        String measured = String.format(Locale.US, "%.0f PSI", psi);

        if (record.hasPrv()) {
            if (psi > PSI_SAFE_LIMIT) {
                return List.of(new InfrastructureIssue(IssueKind.PRV_FAILED,
                        "Regulator installed but house pressure is " + measured));
            }
            return List.of();
        }

        if (psi > PSI_SAFE_LIMIT) {
            return List.of(new InfrastructureIssue(IssueKind.PRV_REQUIRED,
                    measured + " exceeds the 80 PSI code limit"));
        }
        if (psi >= PSI_REGULATOR_RECOMMENDED) {
            return List.of(new InfrastructureIssue(IssueKind.PRV_RECOMMENDED,
                    measured + " is at the top of the safe range"));
        }
        if (psi >= LONGEVITY_PSI) {
            return List.of(new InfrastructureIssue(IssueKind.PRV_LONGEVITY,
                    measured + " is above the 60 PSI longevity target"));
        }
        return List.of();
    }
}
