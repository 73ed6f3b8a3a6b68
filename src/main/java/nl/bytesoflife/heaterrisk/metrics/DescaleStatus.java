package nl.bytesoflife.heaterrisk.metrics;

/**
 * Scale state of a tankless heat exchanger.
 * {@link #RUN_TO_FAILURE} marks a calcified exchanger that must not be descaled: the scale is
 * holding pinholes shut.
 */
public enum DescaleStatus {
    OPTIMAL,
    DUE,
    CRITICAL,
    LOCKOUT,
    RUN_TO_FAILURE;

    public boolean isServiceable() {
        return this == DUE || this == CRITICAL;
    }
}
