package nl.bytesoflife.heaterrisk.model;

/**
 * How the flue leaves the building. An orphaned flue is a shared chimney that lost its
 * furnace and is now oversized for the water heater alone.
 */
public enum VentingScenario {
    SHARED_FLUE,
    ORPHANED_FLUE,
    DIRECT_VENT
}
