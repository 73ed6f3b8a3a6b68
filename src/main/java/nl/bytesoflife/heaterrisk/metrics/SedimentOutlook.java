package nl.bytesoflife.heaterrisk.metrics;

/**
 * @param ratePerYear     pounds of sediment added per year at the current hardness
 * @param flushStatus     maintenance band the current load falls in
 * @param monthsToLockout months until the load passes the lockout limit, 0 once past it, null when not accumulating
 */
public record SedimentOutlook(double ratePerYear, FlushStatus flushStatus, Integer monthsToLockout) {
}
