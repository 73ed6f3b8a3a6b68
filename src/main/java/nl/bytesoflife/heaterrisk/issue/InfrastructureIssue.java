package nl.bytesoflife.heaterrisk.issue;

import nl.bytesoflife.heaterrisk.model.CostRange;
import nl.bytesoflife.heaterrisk.model.QualityTier;

import java.util.Objects;

/**
 * A detected problem with the equipment around the water heater.
 *
 * @param kind    which issue
 * @param finding what was observed, with the measured values
 */
public record InfrastructureIssue(IssueKind kind, String finding) {

    public InfrastructureIssue {
        Objects.requireNonNull(kind, "kind");
    }

    public String id() { return kind.id(); }
    public IssueCategory category() { return kind.category(); }
    public String friendlyName() { return kind.friendlyName(); }
    public String remediation() { return kind.remediation(); }
    public CostRange cost() { return kind.cost(); }

    public QualityTier minimumTier() {
        return kind.category().minimumTier();
    }

    public boolean isViolation() {
        return kind.category() == IssueCategory.VIOLATION;
    }

    @Override
    public String toString() {
        return "[" + category() + "] " + friendlyName() + ": " + finding + " (" + cost() + ")";
    }
}
