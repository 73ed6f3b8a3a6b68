package nl.bytesoflife.heaterrisk.metrics;

public enum Stressor {
    NONE("Normal wear"),
    PRESSURE("High pressure"),
    THERMAL("Thermostat setting"),
    CIRCULATION("Continuous recirculation"),
    LOOP("Thermal expansion"),
    SEDIMENT("Sediment buildup");

    private final String label;

    Stressor(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
