package nl.bytesoflife.heaterrisk.model;

public enum ExpansionTankStatus {
    FUNCTIONAL,
    WATERLOGGED
}
