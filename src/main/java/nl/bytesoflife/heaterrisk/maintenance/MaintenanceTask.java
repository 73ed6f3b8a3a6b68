package nl.bytesoflife.heaterrisk.maintenance;

import java.util.Objects;

/**
 * One scheduled piece of work.
 *
 * @param type            what to do
 * @param description     one-line instruction for the technician
 * @param monthsUntilDue  0 when due now, capped at three years
 * @param urgency         how pressing it is
 * @param benefit         what the homeowner gets out of it
 * @param agingMultiplier for infrastructure fixes, the aging factor the fix removes; null otherwise
 */
public record MaintenanceTask(
        TaskType type,
        String description,
        int monthsUntilDue,
        TaskUrgency urgency,
        String benefit,
        Double agingMultiplier
) {

    public MaintenanceTask {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(urgency, "urgency");
        if (monthsUntilDue < 0) {
            throw new IllegalArgumentException("monthsUntilDue must not be negative: " + monthsUntilDue);
        }
    }

    MaintenanceTask(TaskType type, String description, int monthsUntilDue, TaskUrgency urgency, String benefit) {
        this(type, description, monthsUntilDue, urgency, benefit, null);
    }

    public String label() {
        return type.label();
    }

    public boolean isInfrastructure() {
        return type.isInfrastructure();
    }
}
