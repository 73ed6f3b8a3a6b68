package nl.bytesoflife.heaterrisk.metrics;

/**
 * @param scaleBuildupScore  0-100 estimate of heat exchanger scale
 * @param flowDegradation    percent loss of rated flow
 * @param descaleStatus      maintenance band
 */
public record ScaleOutlook(double scaleBuildupScore, double flowDegradation, DescaleStatus descaleStatus) {
}
