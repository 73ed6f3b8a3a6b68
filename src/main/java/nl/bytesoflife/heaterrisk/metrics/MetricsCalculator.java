package nl.bytesoflife.heaterrisk.metrics;

import nl.bytesoflife.heaterrisk.model.InspectionRecord;
import nl.bytesoflife.heaterrisk.model.UnitFamily;

public interface MetricsCalculator {

    DegradationMetrics calculate(InspectionRecord record);

    UnitFamily getSupportedFamily();
}
