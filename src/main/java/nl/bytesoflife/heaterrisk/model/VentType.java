package nl.bytesoflife.heaterrisk.model;

public enum VentType {
    ATMOSPHERIC,
    POWER_VENT,
    DIRECT_VENT
}
