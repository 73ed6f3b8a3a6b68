package nl.bytesoflife.heaterrisk.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of one water-heating appliance as observed during an inspection.
 * <p>
 * Optional telemetry falls back to optimistic defaults (clean filters, healthy igniter,
 * clear vent, full compressor health) when the inspector did not capture it.
 *
 * <pre>
 * InspectionRecord record = InspectionRecord.builder(UnitType.TANK_GAS)
 *     .withAge(8)
 *     .withPsi(85)
 *     .withHardness(12)
 *     .withLocation(InstallLocation.ATTIC)
 *     .build();
 * </pre>
 */
public final class InspectionRecord {

    private final UnitType unitType;
    private final double calendarAge;
    private final double housePsi;
    private final int warrantyYears;
    private final double hardnessGpg;

    private final boolean softener;
    private final boolean circPump;
    private final boolean circPumpDemandControlled;
    private final boolean closedLoop;
    private final boolean expansionTank;
    private final ExpansionTankStatus expansionTankStatus;
    private final boolean prv;
    private final boolean isolationValves;

    private final InstallLocation location;
    private final boolean finishedArea;
    private final boolean visibleRust;
    private final boolean activeLeak;
    private final ThermostatSetting thermostat;
    private final int tankCapacityGallons;
    private final VentType ventType;
    private final VentingScenario ventingScenario;
    private final boolean drainPan;

    private final FilterCondition inletFilter;
    private final FlameRodCondition flameRod;
    private final VentCondition tanklessVent;
    private final double igniterHealthPercent;
    private final Double scaleBuildupScore;
    private final double flowDegradationPercent;
    private final int errorCodeCount;
    private final Integer btuRating;
    private final GasLineSize gasLineSize;

    private final FilterCondition airFilter;
    private final boolean condensateClear;
    private final double compressorHealthPercent;
    private final RoomVolume roomVolume;

    private final List<ServiceEvent> serviceHistory;
    private final LocalDate inspectionDate;

    private InspectionRecord(Builder b) {
        this.unitType = b.unitType;
        this.calendarAge = b.calendarAge;
        this.housePsi = b.housePsi;
        this.warrantyYears = b.warrantyYears;
        this.hardnessGpg = b.hardnessGpg;
        this.softener = b.softener;
        this.circPump = b.circPump;
        this.circPumpDemandControlled = b.circPumpDemandControlled;
        this.closedLoop = b.closedLoop;
        this.expansionTank = b.expansionTank;
        this.expansionTankStatus = b.expansionTankStatus;
        this.prv = b.prv;
        this.isolationValves = b.isolationValves;
        this.location = b.location;
        this.finishedArea = b.finishedArea;
        this.visibleRust = b.visibleRust;
        this.activeLeak = b.activeLeak;
        this.thermostat = b.thermostat;
        this.tankCapacityGallons = b.tankCapacityGallons;
        this.ventType = b.ventType;
        this.ventingScenario = b.ventingScenario;
        this.drainPan = b.drainPan;
        this.inletFilter = b.inletFilter;
        this.flameRod = b.flameRod;
        this.tanklessVent = b.tanklessVent;
        this.igniterHealthPercent = b.igniterHealthPercent;
        this.scaleBuildupScore = b.scaleBuildupScore;
        this.flowDegradationPercent = b.flowDegradationPercent;
        this.errorCodeCount = b.errorCodeCount;
        this.btuRating = b.btuRating;
        this.gasLineSize = b.gasLineSize;
        this.airFilter = b.airFilter;
        this.condensateClear = b.condensateClear;
        this.compressorHealthPercent = b.compressorHealthPercent;
        this.roomVolume = b.roomVolume;
        this.serviceHistory = List.copyOf(b.serviceHistory);
        this.inspectionDate = b.inspectionDate;
    }

    public static Builder builder(UnitType unitType) {
        return new Builder(unitType);
    }

    /**
     * Copy of this record with every field carried over, ready for adjustment.
     */
    public Builder toBuilder() {
        Builder b = new Builder(unitType);
        b.calendarAge = calendarAge;
        b.housePsi = housePsi;
        b.warrantyYears = warrantyYears;
        b.hardnessGpg = hardnessGpg;
        b.softener = softener;
        b.circPump = circPump;
        b.circPumpDemandControlled = circPumpDemandControlled;
        b.closedLoop = closedLoop;
        b.expansionTank = expansionTank;
        b.expansionTankStatus = expansionTankStatus;
        b.prv = prv;
        b.isolationValves = isolationValves;
        b.location = location;
        b.finishedArea = finishedArea;
        b.visibleRust = visibleRust;
        b.activeLeak = activeLeak;
        b.thermostat = thermostat;
        b.tankCapacityGallons = tankCapacityGallons;
        b.ventType = ventType;
        b.ventingScenario = ventingScenario;
        b.drainPan = drainPan;
        b.inletFilter = inletFilter;
        b.flameRod = flameRod;
        b.tanklessVent = tanklessVent;
        b.igniterHealthPercent = igniterHealthPercent;
        b.scaleBuildupScore = scaleBuildupScore;
        b.flowDegradationPercent = flowDegradationPercent;
        b.errorCodeCount = errorCodeCount;
        b.btuRating = btuRating;
        b.gasLineSize = gasLineSize;
        b.airFilter = airFilter;
        b.condensateClear = condensateClear;
        b.compressorHealthPercent = compressorHealthPercent;
        b.roomVolume = roomVolume;
        b.serviceHistory.addAll(serviceHistory);
        b.inspectionDate = inspectionDate;
        return b;
    }

    public InspectionRecord withWarrantyYears(int years) {
        return toBuilder().withWarranty(years).build();
    }

    public UnitType getUnitType() { return unitType; }
    public UnitFamily getUnitFamily() { return unitType.family(); }
    public boolean isGasFired() { return unitType.isGasFired(); }
    public double getCalendarAge() { return calendarAge; }
    public double getHousePsi() { return housePsi; }
    public int getWarrantyYears() { return warrantyYears; }
    public double getHardnessGpg() { return hardnessGpg; }

    public boolean hasSoftener() { return softener; }
    public boolean hasCircPump() { return circPump; }
    public boolean isCircPumpDemandControlled() { return circPumpDemandControlled; }
    public boolean isClosedLoop() { return closedLoop; }
    public boolean hasExpansionTank() { return expansionTank; }
    public ExpansionTankStatus getExpansionTankStatus() { return expansionTankStatus; }
    public boolean hasPrv() { return prv; }
    public boolean hasIsolationValves() { return isolationValves; }

    public InstallLocation getLocation() { return location; }
    public boolean isFinishedArea() { return finishedArea; }
    public boolean hasVisibleRust() { return visibleRust; }
    public boolean hasActiveLeak() { return activeLeak; }
    public ThermostatSetting getThermostat() { return thermostat; }
    public int getTankCapacityGallons() { return tankCapacityGallons; }
    public VentType getVentType() { return ventType; }
    public VentingScenario getVentingScenario() { return ventingScenario; }
    public boolean hasDrainPan() { return drainPan; }

    public FilterCondition getInletFilter() { return inletFilter; }
    public FlameRodCondition getFlameRod() { return flameRod; }
    public VentCondition getTanklessVent() { return tanklessVent; }
    public double getIgniterHealthPercent() { return igniterHealthPercent; }
    public Double getScaleBuildupScore() { return scaleBuildupScore; }
    public double getFlowDegradationPercent() { return flowDegradationPercent; }
    public int getErrorCodeCount() { return errorCodeCount; }
    public Integer getBtuRating() { return btuRating; }
    public GasLineSize getGasLineSize() { return gasLineSize; }

    public FilterCondition getAirFilter() { return airFilter; }
    public boolean isCondensateClear() { return condensateClear; }
    public double getCompressorHealthPercent() { return compressorHealthPercent; }
    public RoomVolume getRoomVolume() { return roomVolume; }

    public List<ServiceEvent> getServiceHistory() { return serviceHistory; }
    public LocalDate getInspectionDate() { return inspectionDate; }

    /**
     * A pressure-reducing valve closes the loop just like a check valve does.
     */
    public boolean isClosedSystem() {
        return closedLoop || prv;
    }

    public boolean hasFunctionalExpansionTank() {
        return expansionTank && expansionTankStatus == ExpansionTankStatus.FUNCTIONAL;
    }

    /**
     * A recirculation pump without a demand trigger keeps water moving around the clock.
     */
    public boolean hasContinuousCirculation() {
        return circPump && !circPumpDemandControlled;
    }

    public static final class Builder {

        private final UnitType unitType;
        private double calendarAge;
        private double housePsi = 60;
        private int warrantyYears = 6;
        private double hardnessGpg;

        private boolean softener;
        private boolean circPump;
        private boolean circPumpDemandControlled;
        private boolean closedLoop;
        private boolean expansionTank;
        private ExpansionTankStatus expansionTankStatus = ExpansionTankStatus.FUNCTIONAL;
        private boolean prv;
        private boolean isolationValves;

        private InstallLocation location = InstallLocation.GARAGE;
        private boolean finishedArea;
        private boolean visibleRust;
        private boolean activeLeak;
        private ThermostatSetting thermostat = ThermostatSetting.NORMAL;
        private int tankCapacityGallons = 50;
        private VentType ventType = VentType.ATMOSPHERIC;
        private VentingScenario ventingScenario = VentingScenario.SHARED_FLUE;
        private boolean drainPan = true;

        private FilterCondition inletFilter = FilterCondition.CLEAN;
        private FlameRodCondition flameRod = FlameRodCondition.GOOD;
        private VentCondition tanklessVent = VentCondition.CLEAR;
        private double igniterHealthPercent = 100;
        private Double scaleBuildupScore;
        private double flowDegradationPercent;
        private int errorCodeCount;
        private Integer btuRating;
        private GasLineSize gasLineSize = GasLineSize.THREE_QUARTER_INCH;

        private FilterCondition airFilter = FilterCondition.CLEAN;
        private boolean condensateClear = true;
        private double compressorHealthPercent = 100;
        private RoomVolume roomVolume = RoomVolume.OPEN;

        private final List<ServiceEvent> serviceHistory = new ArrayList<>();
        private LocalDate inspectionDate;

        private Builder(UnitType unitType) {
            this.unitType = Objects.requireNonNull(unitType, "unitType");
        }

        public Builder withAge(double years) { this.calendarAge = years; return this; }
        public Builder withPsi(double psi) { this.housePsi = psi; return this; }
        public Builder withWarranty(int years) { this.warrantyYears = years; return this; }
        public Builder withHardness(double gpg) { this.hardnessGpg = gpg; return this; }

        public Builder withSoftener(boolean present) { this.softener = present; return this; }
        public Builder withCircPump(boolean present) { this.circPump = present; return this; }
        public Builder withCircPumpDemandControl(boolean demandControlled) { this.circPumpDemandControlled = demandControlled; return this; }
        public Builder withClosedLoop(boolean closed) { this.closedLoop = closed; return this; }
        public Builder withExpansionTank(boolean present) { this.expansionTank = present; return this; }
        public Builder withPrv(boolean present) { this.prv = present; return this; }
        public Builder withIsolationValves(boolean present) { this.isolationValves = present; return this; }

        public Builder withExpansionTankStatus(ExpansionTankStatus status) {
            this.expansionTankStatus = Objects.requireNonNull(status, "expansionTankStatus");
            return this;
        }

        public Builder withLocation(InstallLocation location) {
            this.location = Objects.requireNonNull(location, "location");
            return this;
        }

        public Builder withFinishedArea(boolean finished) { this.finishedArea = finished; return this; }
        public Builder withVisibleRust(boolean rust) { this.visibleRust = rust; return this; }
        public Builder withActiveLeak(boolean leak) { this.activeLeak = leak; return this; }

        public Builder withThermostat(ThermostatSetting setting) {
            this.thermostat = Objects.requireNonNull(setting, "thermostat");
            return this;
        }

        public Builder withTankCapacity(int gallons) { this.tankCapacityGallons = gallons; return this; }

        public Builder withVentType(VentType ventType) {
            this.ventType = Objects.requireNonNull(ventType, "ventType");
            return this;
        }

        public Builder withVentingScenario(VentingScenario scenario) {
            this.ventingScenario = Objects.requireNonNull(scenario, "ventingScenario");
            return this;
        }

        public Builder withDrainPan(boolean present) { this.drainPan = present; return this; }

        public Builder withInletFilter(FilterCondition condition) {
            this.inletFilter = Objects.requireNonNull(condition, "inletFilter");
            return this;
        }

        public Builder withFlameRod(FlameRodCondition condition) {
            this.flameRod = Objects.requireNonNull(condition, "flameRod");
            return this;
        }

        public Builder withTanklessVent(VentCondition condition) {
            this.tanklessVent = Objects.requireNonNull(condition, "tanklessVent");
            return this;
        }

        public Builder withIgniterHealth(double percent) { this.igniterHealthPercent = percent; return this; }
        public Builder withScaleBuildup(Double score) { this.scaleBuildupScore = score; return this; }
        public Builder withFlowDegradation(double percent) { this.flowDegradationPercent = percent; return this; }
        public Builder withErrorCodes(int count) { this.errorCodeCount = count; return this; }
        public Builder withBtuRating(Integer btu) { this.btuRating = btu; return this; }

        public Builder withGasLine(GasLineSize size) {
            this.gasLineSize = Objects.requireNonNull(size, "gasLineSize");
            return this;
        }

        public Builder withAirFilter(FilterCondition condition) {
            this.airFilter = Objects.requireNonNull(condition, "airFilter");
            return this;
        }

        public Builder withCondensateClear(boolean clear) { this.condensateClear = clear; return this; }
        public Builder withCompressorHealth(double percent) { this.compressorHealthPercent = percent; return this; }

        public Builder withRoomVolume(RoomVolume volume) {
            this.roomVolume = Objects.requireNonNull(volume, "roomVolume");
            return this;
        }

        public Builder addServiceEvent(ServiceEvent event) {
            serviceHistory.add(Objects.requireNonNull(event, "event"));
            return this;
        }

        public Builder addServiceEvent(ServiceEventType type, LocalDate date) {
            return addServiceEvent(new ServiceEvent(type, date));
        }

        public Builder withInspectionDate(LocalDate date) { this.inspectionDate = date; return this; }

        public InspectionRecord build() {
            if (!serviceHistory.isEmpty() && inspectionDate == null) {
                throw new IllegalStateException("Inspection date must be set when service history is supplied");
            }
            return new InspectionRecord(this);
        }
    }

    @Override
    public String toString() {
        return "InspectionRecord{" + unitType
                + ", age=" + calendarAge
                + ", psi=" + housePsi
                + ", hardness=" + hardnessGpg
                + ", location=" + location
                + (activeLeak ? ", LEAK" : "")
                + (visibleRust ? ", RUST" : "")
                + ", events=" + serviceHistory.size()
                + "}";
    }
}
