package nl.bytesoflife.heaterrisk;

import nl.bytesoflife.heaterrisk.issue.InfrastructureIssue;
import nl.bytesoflife.heaterrisk.issue.IssueDetector;
import nl.bytesoflife.heaterrisk.maintenance.MaintenanceSchedule;
import nl.bytesoflife.heaterrisk.maintenance.MaintenanceTask;
import nl.bytesoflife.heaterrisk.metrics.DegradationMetrics;
import nl.bytesoflife.heaterrisk.model.InspectionRecord;
import nl.bytesoflife.heaterrisk.repair.RepairOption;
import nl.bytesoflife.heaterrisk.repair.SystemState;
import nl.bytesoflife.heaterrisk.verdict.Verdict;

import java.util.List;

/**
 * Result of assessing one unit: its metrics, the verdict, infrastructure issues, the repairs
 * that may be offered and the maintenance schedule.
 */
public class AssessmentReport {

    private final InspectionRecord record;
    private final DegradationMetrics metrics;
    private final Verdict verdict;
    private final List<InfrastructureIssue> issues;
    private final List<RepairOption> repairs;
    private final MaintenanceSchedule maintenance;

    public AssessmentReport(InspectionRecord record,
                            DegradationMetrics metrics,
                            Verdict verdict,
                            List<InfrastructureIssue> issues,
                            List<RepairOption> repairs,
                            MaintenanceSchedule maintenance) {
        this.record = record;
        this.metrics = metrics;
        this.verdict = verdict;
        this.issues = List.copyOf(issues);
        this.repairs = List.copyOf(repairs);
        this.maintenance = maintenance;
    }

    public InspectionRecord getRecord() {
        return record;
    }

    public DegradationMetrics getMetrics() {
        return metrics;
    }

    public Verdict getVerdict() {
        return verdict;
    }

    public List<InfrastructureIssue> getIssues() {
        return issues;
    }

    public List<RepairOption> getRepairs() {
        return repairs;
    }

    public MaintenanceSchedule getMaintenance() {
        return maintenance;
    }

    public boolean hasViolations() {
        return issues.stream().anyMatch(InfrastructureIssue::isViolation);
    }

    /**
     * Starting point for simulating the offered repairs.
     */
    public SystemState currentState() {
        return SystemState.from(metrics);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Water Heater Assessment:\n");
        sb.append("  Unit: ").append(record.getUnitType());
        if (record.getUnitType().hasStorageTank()) {
            sb.append(", ").append(record.getTankCapacityGallons()).append(" gal");
        }
        sb.append(String.format(" (%.1f years, %.0f psi)%n", record.getCalendarAge(), record.getHousePsi()));
        sb.append("  Health: ").append(metrics.healthScore())
          .append(String.format(" (biological age %.1f, failure probability %.1f%%)",
                  metrics.bioAge(), metrics.failProb()))
          .append("\n");
        sb.append("  Verdict: ").append(verdict.action()).append(" [").append(verdict.badge()).append("] ")
          .append(verdict.title()).append("\n");
        sb.append("    ").append(verdict.reason()).append("\n");

        if (!issues.isEmpty()) {
            sb.append("\n  Infrastructure issues (").append(IssueDetector.totalCost(issues)).append("):\n");
            for (InfrastructureIssue issue : issues) {
                sb.append("  - ").append(issue.friendlyName())
                  .append(" [").append(issue.category()).append("] ")
                  .append(issue.cost()).append("\n");
                sb.append("    ").append(issue.finding()).append("\n");
            }
        }

        if (!repairs.isEmpty()) {
            sb.append("\n  Repair options:\n");
            for (RepairOption repair : repairs) {
                sb.append("  - ").append(repair.name()).append(": ").append(repair.cost()).append("\n");
            }
        } else {
            sb.append("\n  No repairs to offer.\n");
        }

        if (maintenance.isMonitorOnly()) {
            sb.append("\n  Maintenance: monitor only.\n");
        } else if (!maintenance.isEmpty()) {
            sb.append("\n  Maintenance:\n");
            for (MaintenanceTask task : maintenance.allTasks()) {
                sb.append("  - ").append(task.label()).append(" [").append(task.urgency()).append("] ")
                  .append(task.monthsUntilDue() == 0 ? "now" : "in " + task.monthsUntilDue() + " months")
                  .append("\n");
            }
        }

        return sb.toString();
    }
}
