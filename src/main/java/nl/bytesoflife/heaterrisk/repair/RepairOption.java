package nl.bytesoflife.heaterrisk.repair;

import nl.bytesoflife.heaterrisk.model.CostRange;
import nl.bytesoflife.heaterrisk.model.UnitFamily;

import java.util.Objects;
import java.util.Set;

/**
 * A repair that can be offered for a unit.
 *
 * @param kind        identity
 * @param name        display name
 * @param description what the contractor does
 * @param families    unit families the repair applies to
 * @param cost        installed cost
 * @param impact      nominal effect on the unit's health
 */
public record RepairOption(
        RepairKind kind,
        String name,
        String description,
        Set<UnitFamily> families,
        CostRange cost,
        RepairImpact impact
) {
    public RepairOption {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(cost, "cost");
        Objects.requireNonNull(impact, "impact");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Repair name must not be blank");
        }
        if (families == null || families.isEmpty()) {
            throw new IllegalArgumentException("Repair must apply to at least one unit family");
        }
        families = Set.copyOf(families);
    }

    public String id() {
        return kind.id();
    }

    public boolean isFullReplacement() {
        return kind.isFullReplacement();
    }

    public boolean isBundle() {
        return kind.isBundle();
    }

    public boolean appliesTo(UnitFamily family) {
        return families.contains(family);
    }

    @Override
    public String toString() {
        return name + " (" + cost + ")";
    }
}
