package nl.bytesoflife.heaterrisk.model;

public enum ThermostatSetting {
    LOW,
    NORMAL,
    HOT
}
