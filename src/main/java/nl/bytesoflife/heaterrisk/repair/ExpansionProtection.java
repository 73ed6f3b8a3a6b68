package nl.bytesoflife.heaterrisk.repair;

import nl.bytesoflife.heaterrisk.model.InspectionRecord;
import nl.bytesoflife.heaterrisk.model.UnitFamily;

import static nl.bytesoflife.heaterrisk.metrics.RiskConstants.PSI_SAFE_LIMIT;

/**
 * Whether the system can absorb thermal expansion once a regulator closes it.
 */
public enum ExpansionProtection {
    /** A working expansion tank is already installed. */
    PRESENT,
    /** No stored volume to expand, as on a tankless unit. */
    NOT_REQUIRED,
    /** A regulator must come with an expansion tank. */
    MISSING;

    /**
     * Pressure above the code limit with a tank in place suggests a failed bladder, so the tank
     * only counts as protection at or below the limit.
     */
    public static ExpansionProtection assess(InspectionRecord record) {
        if (record.getUnitFamily() == UnitFamily.TANKLESS) {
            return NOT_REQUIRED;
        }
        if (record.hasFunctionalExpansionTank() && record.getHousePsi() <= PSI_SAFE_LIMIT) {
            return PRESENT;
        }
        return MISSING;
    }
}
