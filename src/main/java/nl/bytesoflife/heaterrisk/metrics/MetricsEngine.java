package nl.bytesoflife.heaterrisk.metrics;

import nl.bytesoflife.heaterrisk.model.InspectionRecord;
import nl.bytesoflife.heaterrisk.model.UnitFamily;

import java.util.EnumMap;
import java.util.Map;

/**
 * Routes an inspection record to the calculator for its unit family.
 */
public class MetricsEngine {

    private final Map<UnitFamily, MetricsCalculator> calculators = new EnumMap<>(UnitFamily.class);

    public MetricsEngine registerCalculator(MetricsCalculator calculator) {
        calculators.put(calculator.getSupportedFamily(), calculator);
        return this;
    }

    /**
     * Engine with the tank, tankless and hybrid calculators registered.
     */
    public static MetricsEngine withDefaultCalculators() {
        return new MetricsEngine()
                .registerCalculator(new TankMetricsCalculator())
                .registerCalculator(new TanklessMetricsCalculator())
                .registerCalculator(new HybridMetricsCalculator());
    }

    public DegradationMetrics compute(InspectionRecord record) {
        MetricsCalculator calculator = calculators.get(record.getUnitFamily());
        if (calculator == null) {
            throw new IllegalStateException("No metrics calculator registered for " + record.getUnitFamily());
        }
        return calculator.calculate(record);
    }
}
