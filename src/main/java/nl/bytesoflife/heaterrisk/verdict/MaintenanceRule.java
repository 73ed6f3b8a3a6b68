package nl.bytesoflife.heaterrisk.verdict;

import nl.bytesoflife.heaterrisk.metrics.DegradationMetrics;
import nl.bytesoflife.heaterrisk.metrics.DescaleStatus;
import nl.bytesoflife.heaterrisk.metrics.ServiceWindows;
import nl.bytesoflife.heaterrisk.model.InspectionRecord;

import java.util.Locale;

/**
 * Routine maintenance, or a deliberate hands-off verdict where maintenance would do harm.
 */
public class MaintenanceRule implements VerdictRule {

    @Override
    public Verdict evaluate(VerdictContext context) {
        return context.hasStorageTank() ? storageTank(context) : tankless(context);
    }

    private Verdict storageTank(VerdictContext context) {
        InspectionRecord record = context.record();
        DegradationMetrics metrics = context.metrics();

        if (ServiceWindows.isServiceableSediment(metrics.sedimentLbs())) {
            if (ServiceWindows.isFragile(record.getCalendarAge(), metrics.failProb())) {
                return Verdict.pass(Badge.MONITOR, "Maintenance Risk",
                        "Flushing a fragile tank can dislodge sediment that is sealing weak spots");
            }
            return new Verdict(Action.MAINTAIN, Badge.SERVICE, false, "Performance Flush",
                    String.format(Locale.US, "%.1f lbs of sediment is reducing efficiency", metrics.sedimentLbs()));
        }

        if (ServiceWindows.isAnodeRefreshWindow(metrics.shieldLife(), record.getCalendarAge())) {
            return new Verdict(Action.MAINTAIN, Badge.MONITOR, false, "Anode Refresh",
                    "Anode rod is nearly spent; replacing it now restores corrosion protection");
        }

        return null;
    }

    private Verdict tankless(VerdictContext context) {
        InspectionRecord record = context.record();
        DescaleStatus status = context.metrics().scale().descaleStatus();

        Verdict descale = switch (status) {
            case RUN_TO_FAILURE -> Verdict.pass(Badge.MONITOR, "Run to Failure",
                    "Hard-water scale has never been removed; descaling now would open pinholes");
            case CRITICAL -> new Verdict(Action.MAINTAIN, Badge.SERVICE, true, "Descale Overdue",
                    "Heavy scale is cutting flow and overheating the exchanger");
            case DUE -> new Verdict(Action.MAINTAIN, Badge.SERVICE, false, "Descale Due",
                    "Scale is building up on the heat exchanger");
            case OPTIMAL, LOCKOUT -> null;
        };
        if (descale != null) {
            return descale;
        }

        if (!record.hasIsolationValves() && record.getCalendarAge() > 1) {
            return new Verdict(Action.UPGRADE, Badge.SERVICE, false, "Isolation Valves Missing",
                    "Service valves are needed before the unit can be descaled");
        }
        return null;
    }
}
