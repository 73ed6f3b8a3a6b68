package nl.bytesoflife.heaterrisk.verdict;

import nl.bytesoflife.heaterrisk.model.FilterCondition;
import nl.bytesoflife.heaterrisk.model.InspectionRecord;

public class ComponentFailureRule implements VerdictRule {

    @Override
    public Verdict evaluate(VerdictContext context) {
        InspectionRecord record = context.record();

        switch (context.family()) {
            case HYBRID -> {
                if (record.getAirFilter() == FilterCondition.CLOGGED) {
                    return Verdict.repair(true, "Airflow Blocked",
                            "Clogged air filter is starving the heat pump and forcing backup elements on");
                }
                if (!record.isCondensateClear()) {
                    return Verdict.repair(true, "Condensate Blocked",
                            "Blocked condensate line risks water damage and a compressor lockout");
                }
            }
            case TANKLESS -> {
                if (record.getErrorCodeCount() > 0) {
                    return Verdict.repair(true, "Active Error Codes",
                            record.getErrorCodeCount() + " logged error code(s) need diagnosis");
                }
            }
            case TANK -> {
                // no serviceable components beyond the tank itself
            }
        }
        return null;
    }
}
