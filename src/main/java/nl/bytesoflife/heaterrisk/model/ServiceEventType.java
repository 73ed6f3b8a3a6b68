package nl.bytesoflife.heaterrisk.model;

public enum ServiceEventType {
    FLUSH,
    ANODE_REPLACEMENT,
    DESCALE,
    INSPECTION,
    REPAIR,
    PRV_INSTALL,
    EXPANSION_TANK_INSTALL,
    FILTER_CLEAN,
    VALVE_INSTALL
}
