package nl.bytesoflife.heaterrisk.verdict;

import nl.bytesoflife.heaterrisk.metrics.DegradationMetrics;
import nl.bytesoflife.heaterrisk.metrics.DescaleStatus;
import nl.bytesoflife.heaterrisk.metrics.RiskLevel;
import nl.bytesoflife.heaterrisk.metrics.StressModel;
import nl.bytesoflife.heaterrisk.model.InspectionRecord;

import java.util.Locale;

import static nl.bytesoflife.heaterrisk.metrics.RiskConstants.*;

/**
 * Replacement triggers that are not a visible breach: the unit is statistically or
 * economically past saving.
 */
public class EndOfLifeRule implements VerdictRule {

    static final int TANKLESS_MAX_ERROR_CODES = 10;
    static final double TANKLESS_MAX_AGE = 15.0;

    @Override
    public Verdict evaluate(VerdictContext context) {
        return context.hasStorageTank() ? storageTank(context) : tankless(context);
    }

    private Verdict storageTank(VerdictContext context) {
        InspectionRecord record = context.record();
        DegradationMetrics metrics = context.metrics();

        if (metrics.sedimentLbs() > SEDIMENT_LOCKOUT) {
            return Verdict.replace(Badge.REPLACE, false, "Sediment Lockout",
                    String.format(Locale.US, "%.1f lbs of sediment is past the point where flushing is safe",
                            metrics.sedimentLbs()));
        }

        if (record.getHousePsi() > PSI_VESSEL_FATIGUE && record.getCalendarAge() > VESSEL_FATIGUE_AGE) {
            return Verdict.replace(Badge.CRITICAL, true, "Vessel Fatigue",
                    String.format(Locale.US, "%.0f PSI on a %.0f-year-old tank has fatigued the steel",
                            record.getHousePsi(), record.getCalendarAge()));
        }

        if (metrics.failProb() > REPLACE_FAIL_PROB || metrics.bioAge() >= BIO_AGE_CEILING) {
            boolean urgent = metrics.failProb() >= URGENT_REPLACE_FAIL_PROB;
            return Verdict.replace(urgent ? Badge.CRITICAL : Badge.REPLACE, urgent, "End of Service Life",
                    String.format(Locale.US, "Biological age %.1f years with %.1f%% annual failure risk",
                            metrics.bioAge(), metrics.failProb()));
        }

        if (metrics.riskLevel().isAtLeast(RiskLevel.HIGH) && metrics.failProb() > LIABILITY_FAIL_PROB) {
            return Verdict.replace(Badge.REPLACE, false, "Liability Hazard",
                    String.format(Locale.US, "%.1f%% annual failure risk above finished living space",
                            metrics.failProb()));
        }

        return null;
    }

    private Verdict tankless(VerdictContext context) {
        InspectionRecord record = context.record();

        if (record.getErrorCodeCount() > TANKLESS_MAX_ERROR_CODES) {
            return Verdict.replace(Badge.CRITICAL, true, "Electronics Failure",
                    record.getErrorCodeCount() + " logged error codes point to a failing control board");
        }
        if (record.getCalendarAge() > TANKLESS_MAX_AGE) {
            return Verdict.replace(Badge.REPLACE, false, "End of Service Life",
                    String.format(Locale.US, "%.0f years is beyond the service life of a tankless unit",
                            record.getCalendarAge()));
        }
        // Gate probabilities (error codes, lockout) belong to their own triggers; only the aging curve counts here.
        DegradationMetrics metrics = context.metrics();
        double statistical = StressModel.weibullFailProb(metrics.bioAge());
        if (statistical > REPLACE_FAIL_PROB || metrics.bioAge() >= BIO_AGE_CEILING) {
            boolean urgent = metrics.failProb() >= URGENT_REPLACE_FAIL_PROB;
            return Verdict.replace(urgent ? Badge.CRITICAL : Badge.REPLACE, urgent, "End of Service Life",
                    String.format(Locale.US, "Biological age %.1f years with %.1f%% annual failure risk",
                            metrics.bioAge(), metrics.failProb()));
        }
        if (metrics.scale() != null && metrics.scale().descaleStatus() == DescaleStatus.LOCKOUT) {
            return Verdict.replace(Badge.REPLACE, false, "Scale Lockout",
                    "Heat exchanger scale is too heavy to descale safely");
        }
        return null;
    }
}
