package nl.bytesoflife.heaterrisk.metrics;

/**
 * Tunable limits shared by the metrics, verdict and eligibility stages.
 */
public final class RiskConstants {

    // Pressure (buffer zone model)
    public static final double PSI_SAFE_LIMIT = 80.0;
    public static final double PSI_SCALAR = 20.0;
    public static final double PSI_VESSEL_FATIGUE = 100.0;
    public static final double PSI_EXPLOSION = 150.0;
    public static final double PSI_REGULATOR_RECOMMENDED = 70.0;
    public static final double PSI_REGULATOR_WORN = 75.0;

    // Thermal multipliers by thermostat tier
    public static final double THERMAL_LOW = 1.0;
    public static final double THERMAL_NORMAL = 1.1;
    public static final double THERMAL_HOT = 1.75;

    public static final double CIRCULATION_CONTINUOUS = 1.4;
    public static final double LOOP_PENALTY = 1.5;
    public static final double SEDIMENT_STRESS_PER_LB = 0.05;

    // Sediment accumulation, lbs per year per gpg
    public static final double SEDIMENT_COEF_GAS = 0.044;
    public static final double SEDIMENT_COEF_ELECTRIC = 0.08;
    public static final double SEDIMENT_COEF_HYBRID = 0.06;
    public static final double FLUSH_EFFICIENCY = 0.5;

    // Anode
    public static final double DEFAULT_ANODE_LIFE = 6.0;
    public static final double ANODE_DECAY_SOFTENER = 1.4;
    public static final double ANODE_DECAY_CIRCULATION = 0.5;

    // Biological age
    public static final double MAX_NAKED_STRESS = 12.0;
    public static final double PROTECTED_CORROSION_WEIGHT = 0.1;
    public static final double MAX_RAW_BIO_AGE = 50.0;
    public static final double BIO_AGE_CEILING = 20.0;

    // Failure probability
    public static final double WEIBULL_ETA = 13.0;
    public static final double WEIBULL_BETA = 3.2;
    public static final double MAX_STATISTICAL_FAIL_PROB = 85.0;
    public static final double BREACH_FAIL_PROB = 99.9;
    public static final double HEALTH_DECAY = 0.04;

    // Sediment bands, lbs
    public static final double SEDIMENT_ADVISORY = 2.0;
    public static final double SEDIMENT_SERVICEABLE = 5.0;
    public static final double SEDIMENT_CRITICAL = 10.0;
    public static final double SEDIMENT_LOCKOUT = 15.0;

    // Fragility and replacement thresholds
    public static final double FRAGILE_FAIL_PROB = 60.0;
    public static final double FRAGILE_AGE = 12.0;
    public static final double ANODE_AGE_LIMIT = 8.0;
    public static final double REPLACE_FAIL_PROB = 60.0;
    public static final double URGENT_REPLACE_FAIL_PROB = 75.0;
    public static final double LIABILITY_FAIL_PROB = 30.0;
    public static final double VESSEL_FATIGUE_AGE = 10.0;

    // Water treatment, gpg
    public static final double HARD_WATER_GPG = 10.0;
    public static final double SOFTENER_FAILURE_GPG = 15.0;

    private RiskConstants() {
    }
}
