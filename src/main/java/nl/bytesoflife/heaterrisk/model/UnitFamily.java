package nl.bytesoflife.heaterrisk.model;

/**
 * Broad appliance families. Each family has its own degradation physics and repair menu.
 */
public enum UnitFamily {
    TANK,
    TANKLESS,
    HYBRID
}
