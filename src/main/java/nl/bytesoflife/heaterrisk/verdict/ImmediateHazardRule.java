package nl.bytesoflife.heaterrisk.verdict;

import nl.bytesoflife.heaterrisk.model.InspectionRecord;
import nl.bytesoflife.heaterrisk.model.UnitFamily;
import nl.bytesoflife.heaterrisk.model.VentCondition;

import java.util.Locale;

import static nl.bytesoflife.heaterrisk.metrics.RiskConstants.PSI_EXPLOSION;

/**
 * Conditions that must be made safe on the spot: runaway supply pressure and a blocked
 * combustion vent.
 * <p>
 * Registered ahead of {@link CodeViolationRule}: supply pressure at or above 150 PSI is also a
 * missing-regulator violation, but it reports as {@link Action#URGENT} rather than a scheduled repair.
 */
public class ImmediateHazardRule implements VerdictRule {

    @Override
    public Verdict evaluate(VerdictContext context) {
        InspectionRecord record = context.record();

        if (record.getHousePsi() >= PSI_EXPLOSION) {
            return new Verdict(Action.URGENT, Badge.CRITICAL, true, "Dangerous Supply Pressure",
                    String.format(Locale.US, "%.0f PSI can rupture fittings and the tank; shut off and regulate now",
                            record.getHousePsi()));
        }

        if (context.family() == UnitFamily.TANKLESS && record.getTanklessVent() == VentCondition.BLOCKED) {
            return new Verdict(Action.URGENT, Badge.CRITICAL, true, "Vent Obstruction",
                    "Blocked exhaust vent is a carbon monoxide hazard; shut the unit down until cleared");
        }

        return null;
    }
}
