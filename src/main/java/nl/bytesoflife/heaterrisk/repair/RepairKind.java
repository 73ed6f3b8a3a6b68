package nl.bytesoflife.heaterrisk.repair;

public enum RepairKind {
    REPLACE_TANK("replace_tank"),
    REPLACE_TANKLESS("replace_tankless"),
    REPLACE_HYBRID("replace_hybrid"),

    PRV("prv"),
    PRV_WITH_EXPANSION_TANK("prv_exp_package"),
    REPLACE_PRV("replace_prv"),
    REPLACE_PRV_WITH_EXPANSION_TANK("replace_prv_exp_package"),
    EXPANSION_TANK("exp_tank"),
    REPLACE_EXPANSION_TANK("replace_exp"),
    FLUSH("flush"),
    ANODE("anode"),

    ISOLATION_VALVES("isolation_valves"),
    DESCALE("descale"),
    INLET_FILTER("inlet_filter"),
    IGNITER_SERVICE("igniter_service"),
    FLOW_SENSOR("flow_sensor"),
    VENT_CLEANING("vent_cleaning"),
    RECIRCULATION_SERVICE("recirculation_service"),

    AIR_FILTER_SERVICE("air_filter_service"),
    CONDENSATE_CLEAR("condensate_clear"),
    COMPRESSOR_SERVICE("compressor_service"),
    REFRIGERANT_CHECK("refrigerant_check");

    private final String id;

    RepairKind(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public boolean isFullReplacement() {
        return this == REPLACE_TANK || this == REPLACE_TANKLESS || this == REPLACE_HYBRID;
    }

    /**
     * A regulator sold together with the expansion tank it requires.
     */
    public boolean isBundle() {
        return this == PRV_WITH_EXPANSION_TANK || this == REPLACE_PRV_WITH_EXPANSION_TANK;
    }

    boolean isRegulator() {
        return this == PRV || this == REPLACE_PRV || isBundle();
    }
}
