package nl.bytesoflife.heaterrisk.issue;

import nl.bytesoflife.heaterrisk.metrics.DegradationMetrics;
import nl.bytesoflife.heaterrisk.model.InspectionRecord;
import nl.bytesoflife.heaterrisk.model.VentType;
import nl.bytesoflife.heaterrisk.model.VentingScenario;

import java.util.List;

/**
 * An atmospheric gas unit left alone on a chimney sized for a furnace cannot draft reliably.
 */
public class VentingCheck implements IssueCheck {

    @Override
    public List<InfrastructureIssue> check(InspectionRecord record, DegradationMetrics metrics) {
        if (record.isGasFired()
                && record.getVentType() == VentType.ATMOSPHERIC
                && record.getVentingScenario() == VentingScenario.ORPHANED_FLUE) {
            return List.of(new InfrastructureIssue(IssueKind.ORPHANED_FLUE,
                    "Atmospheric vent on an orphaned chimney flue"));
        }
        return List.of();
    }
}
