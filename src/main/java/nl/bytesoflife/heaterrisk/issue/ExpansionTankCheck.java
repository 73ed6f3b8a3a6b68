package nl.bytesoflife.heaterrisk.issue;

import nl.bytesoflife.heaterrisk.metrics.DegradationMetrics;
import nl.bytesoflife.heaterrisk.model.ExpansionTankStatus;
import nl.bytesoflife.heaterrisk.model.InspectionRecord;
import nl.bytesoflife.heaterrisk.model.UnitFamily;

import java.util.List;

/**
 * A closed system has nowhere for heated water to expand unless an expansion tank absorbs it.
 * Tankless units hold no stored volume and are skipped.
 */
public class ExpansionTankCheck implements IssueCheck {

    @Override
    public List<InfrastructureIssue> check(InspectionRecord record, DegradationMetrics metrics) {
        if (record.getUnitFamily() == UnitFamily.TANKLESS || !record.isClosedSystem()) {
            return List.of();
        }

        String loop = record.hasPrv() ? "pressure reducing valve" : "check valve";
        if (!record.hasExpansionTank()) {
            return List.of(new InfrastructureIssue(IssueKind.EXPANSION_TANK_REQUIRED,
                    "Closed system (" + loop + ") without an expansion tank"));
        }
        if (record.getExpansionTankStatus() == ExpansionTankStatus.WATERLOGGED) {
            return List.of(new InfrastructureIssue(IssueKind.EXPANSION_TANK_REPLACE,
                    "Expansion tank bladder is waterlogged"));
        }
        return List.of();
    }
}
