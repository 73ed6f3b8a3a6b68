package nl.bytesoflife.heaterrisk.maintenance;

import nl.bytesoflife.heaterrisk.model.ServiceEventType;

/**
 * Every task a schedule can contain, with the service event a technician logs once it is done.
 */
public enum TaskType {
    FLUSH("Tank Flush", ServiceEventType.FLUSH, false),
    ANODE("Anode Rod Inspection", ServiceEventType.ANODE_REPLACEMENT, false),
    DESCALE("Descale Heat Exchanger", ServiceEventType.DESCALE, false),
    INLET_FILTER("Clean Inlet Filter", ServiceEventType.FILTER_CLEAN, false),
    ISOLATION_VALVES("Install Isolation Valves", ServiceEventType.VALVE_INSTALL, false),
    AIR_FILTER("Clean Air Filter", ServiceEventType.FILTER_CLEAN, false),
    CONDENSATE("Clear Condensate Drain", ServiceEventType.REPAIR, false),
    REPLACEMENT_CONSULT("Unit Replacement Required", ServiceEventType.INSPECTION, false),

    EXPANSION_TANK_INSTALL("Expansion Tank Installation", ServiceEventType.EXPANSION_TANK_INSTALL, true),
    EXPANSION_TANK_REPLACE("Expansion Tank Replacement", ServiceEventType.EXPANSION_TANK_INSTALL, true),
    PRV_INSTALL("Pressure Regulator Installation", ServiceEventType.PRV_INSTALL, true),
    PRV_REPLACE("Pressure Regulator Replacement", ServiceEventType.PRV_INSTALL, true);

    private final String label;
    private final ServiceEventType completedBy;
    private final boolean infrastructure;

    TaskType(String label, ServiceEventType completedBy, boolean infrastructure) {
        this.label = label;
        this.completedBy = completedBy;
        this.infrastructure = infrastructure;
    }

    public String label() { return label; }
    public ServiceEventType completedBy() { return completedBy; }
    public boolean isInfrastructure() { return infrastructure; }
}
