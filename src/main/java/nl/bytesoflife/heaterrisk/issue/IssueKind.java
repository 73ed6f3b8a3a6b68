package nl.bytesoflife.heaterrisk.issue;

import nl.bytesoflife.heaterrisk.model.CostRange;

/**
 * Every infrastructure issue the detector knows. Declaration order is the reporting order.
 */
public enum IssueKind {
    EXPANSION_TANK_REQUIRED("exp_tank_required", IssueCategory.VIOLATION,
            "Missing Expansion Tank", "Install thermal expansion tank", CostRange.of(250, 400)),
    PRV_FAILED("prv_failed", IssueCategory.VIOLATION,
            "Failed Pressure Regulator", "Replace pressure reducing valve", CostRange.of(350, 550)),
    PRV_REQUIRED("prv_critical", IssueCategory.VIOLATION,
            "Pressure Above Code Limit", "Install pressure reducing valve", CostRange.of(350, 550)),
    ORPHANED_FLUE("orphaned_flue", IssueCategory.VIOLATION,
            "Orphaned Flue", "Reline chimney or convert to power vent", CostRange.of(1500, 2500)),
    DRAIN_PAN_REQUIRED("drain_pan_required", IssueCategory.VIOLATION,
            "Missing Drain Pan", "Install drain pan with drain line", CostRange.of(150, 300)),

    PRV_RECOMMENDED("prv_recommended", IssueCategory.INFRASTRUCTURE,
            "High Pressure", "Install pressure reducing valve", CostRange.of(350, 550)),
    SOFTENER_SERVICE("softener_service", IssueCategory.INFRASTRUCTURE,
            "Softener Underperforming", "Service water softener", CostRange.of(200, 350)),
    EXPANSION_TANK_REPLACE("exp_tank_replace", IssueCategory.INFRASTRUCTURE,
            "Waterlogged Expansion Tank", "Replace expansion tank", CostRange.of(250, 400)),
    ISOLATION_VALVES("isolation_valves", IssueCategory.INFRASTRUCTURE,
            "No Isolation Valves", "Install service isolation valves", CostRange.of(400, 650)),

    SOFTENER_REPLACE("softener_replace", IssueCategory.RECOMMENDATION,
            "Softener Failed", "Replace water softener", CostRange.of(2200, 3000)),
    PRV_LONGEVITY("prv_longevity", IssueCategory.RECOMMENDATION,
            "Elevated Pressure", "Install pressure reducing valve", CostRange.of(350, 550)),
    SOFTENER_NEW("softener_new", IssueCategory.RECOMMENDATION,
            "Hard Water", "Install water softener", CostRange.of(2400, 3200));

    private final String id;
    private final IssueCategory category;
    private final String friendlyName;
    private final String remediation;
    private final CostRange cost;

    IssueKind(String id, IssueCategory category, String friendlyName, String remediation, CostRange cost) {
        this.id = id;
        this.category = category;
        this.friendlyName = friendlyName;
        this.remediation = remediation;
        this.cost = cost;
    }

    public String id() { return id; }
    public IssueCategory category() { return category; }
    public String friendlyName() { return friendlyName; }
    public String remediation() { return remediation; }
    public CostRange cost() { return cost; }
}
