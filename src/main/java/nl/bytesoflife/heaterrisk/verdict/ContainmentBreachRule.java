package nl.bytesoflife.heaterrisk.verdict;

import nl.bytesoflife.heaterrisk.model.InspectionRecord;

public class ContainmentBreachRule implements VerdictRule {

    @Override
    public Verdict evaluate(VerdictContext context) {
        InspectionRecord record = context.record();
        if (!record.hasActiveLeak() && !record.hasVisibleRust()) {
            return null;
        }

        String title = context.hasStorageTank() ? "Containment Breach" : "Heat Exchanger Failure";
        String reason = record.hasActiveLeak()
                ? "Water is escaping the pressure boundary; the unit cannot be repaired"
                : "Visible corrosion on the pressure boundary means failure is imminent";
        return Verdict.replace(Badge.CRITICAL, true, title, reason);
    }
}
