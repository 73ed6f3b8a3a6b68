package nl.bytesoflife.heaterrisk.verdict;

import nl.bytesoflife.heaterrisk.model.GasLineSize;
import nl.bytesoflife.heaterrisk.model.InspectionRecord;
import nl.bytesoflife.heaterrisk.model.RoomVolume;

import java.util.Locale;

import static nl.bytesoflife.heaterrisk.metrics.RiskConstants.ANODE_AGE_LIMIT;
import static nl.bytesoflife.heaterrisk.metrics.RiskConstants.PSI_SAFE_LIMIT;

/**
 * Installation improvements that are worth doing on a unit with years left in it.
 */
public class UpgradeRule implements VerdictRule {

    static final double PRESSURE_OPTIMIZATION_PSI = 65.0;
    static final int GAS_STARVATION_BTU = 150_000;

    @Override
    public Verdict evaluate(VerdictContext context) {
        InspectionRecord record = context.record();

        return switch (context.family()) {
            case TANK, HYBRID -> {
                double psi = record.getHousePsi();
                if (!record.hasPrv() && psi >= PRESSURE_OPTIMIZATION_PSI && psi <= PSI_SAFE_LIMIT
                        && record.getCalendarAge() < ANODE_AGE_LIMIT) {
                    yield new Verdict(Action.UPGRADE, Badge.SERVICE, false, "Pressure Optimization",
                            String.format(Locale.US, "%.0f PSI is legal but shortens tank life; a regulator pays back",
                                    psi));
                }
                if (record.getRoomVolume() == RoomVolume.CLOSET_SEALED && context.metrics().hybridEfficiency() != null) {
                    yield new Verdict(Action.UPGRADE, Badge.SERVICE, false, "Airflow Restricted",
                            "A sealed closet recirculates cold exhaust air; add louvers or ducting");
                }
                yield null;
            }
            case TANKLESS -> {
                Integer btu = record.getBtuRating();
                if (record.isGasFired() && btu != null && btu > GAS_STARVATION_BTU
                        && record.getGasLineSize() == GasLineSize.HALF_INCH) {
                    yield new Verdict(Action.UPGRADE, Badge.CRITICAL, true, "Gas Supply Undersized",
                            btu + " BTU burner on a 1/2\" gas line starves under full load");
                }
                yield null;
            }
        };
    }
}
