package nl.bytesoflife.heaterrisk.metrics;

/**
 * Multiplicative stress factors, each at least 1.0.
 *
 * @param pressure    mechanical stress from supply pressure
 * @param thermal     stress from the thermostat setting
 * @param circulation stress from a recirculation pump running continuously
 * @param loop        thermal expansion penalty in a closed system without a working expansion tank
 * @param sediment    corrosion accelerator from sediment on the tank floor
 */
public record StressFactors(double pressure, double thermal, double circulation, double loop, double sediment) {

    public static final StressFactors NONE = new StressFactors(1.0, 1.0, 1.0, 1.0, 1.0);

    /**
     * Product of pressure, thermal, circulation and loop factors.
     */
    public double total() {
        return pressure * thermal * circulation * loop;
    }

    /**
     * Chemical stress on the steel: everything except the mechanical pressure factor.
     */
    public double corrosion() {
        return thermal * circulation * loop * sediment;
    }

    public Stressor primary() {
        Stressor primary = Stressor.NONE;
        double worst = 1.0;
        if (pressure > worst) { worst = pressure; primary = Stressor.PRESSURE; }
        if (loop > worst) { worst = loop; primary = Stressor.LOOP; }
        if (circulation > worst) { worst = circulation; primary = Stressor.CIRCULATION; }
        if (thermal > worst) { worst = thermal; primary = Stressor.THERMAL; }
        if (sediment > worst) { primary = Stressor.SEDIMENT; }
        return primary;
    }
}
