package nl.bytesoflife.heaterrisk.model;

public enum VentCondition {
    CLEAR,
    RESTRICTED,
    BLOCKED
}
