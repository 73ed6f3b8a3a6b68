package nl.bytesoflife.heaterrisk.metrics;

import nl.bytesoflife.heaterrisk.model.InspectionRecord;
import nl.bytesoflife.heaterrisk.model.UnitFamily;

/**
 * Heat pump water heaters share the storage tank physics and add an efficiency picture
 * for the refrigeration side.
 */
public class HybridMetricsCalculator implements MetricsCalculator {

    static final double EFFICIENCY_PENALTY_DIVISOR = 5.0;

    private final TankMetricsCalculator tankCalculator = new TankMetricsCalculator();

    @Override
    public DegradationMetrics calculate(InspectionRecord record) {
        DegradationMetrics base = tankCalculator.calculate(record);

        double efficiency = efficiency(record);
        int penalty = (int) Math.round((100.0 - efficiency) / EFFICIENCY_PENALTY_DIVISOR);
        int score = Math.max(0, base.healthScore() - penalty);

        return base.withHybridEfficiency(efficiency, score);
    }

    @Override
    public UnitFamily getSupportedFamily() {
        return UnitFamily.HYBRID;
    }

    /**
     * Percent of rated heat pump efficiency still available, 0-100.
     */
    static double efficiency(InspectionRecord record) {
        double efficiency = 100.0;

        efficiency -= switch (record.getAirFilter()) {
            case CLEAN -> 0;
            case DIRTY -> 15;
            case CLOGGED -> 40;
        };

        efficiency -= switch (record.getRoomVolume()) {
            case OPEN -> 0;
            case CLOSET_LOUVERED -> 10;
            case CLOSET_SEALED -> 30;
        };

        double compressor = Math.max(0, Math.min(100, record.getCompressorHealthPercent()));
        efficiency *= compressor / 100.0;

        if (!record.isCondensateClear()) {
            efficiency -= 5;
        }

        return Math.max(0, Math.min(100, Math.round(efficiency)));
    }
}
