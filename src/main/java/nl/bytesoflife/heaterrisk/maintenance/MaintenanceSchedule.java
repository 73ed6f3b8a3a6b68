package nl.bytesoflife.heaterrisk.maintenance;

import nl.bytesoflife.heaterrisk.model.UnitFamily;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Upcoming maintenance for one unit. Tasks due close together are bundled into a single visit;
 * infrastructure fixes always come before routine work.
 */
public class MaintenanceSchedule {

    private final UnitFamily family;
    private final List<MaintenanceTask> infrastructureTasks;
    private final MaintenanceTask primaryTask;
    private final MaintenanceTask secondaryTask;
    private final List<MaintenanceTask> additionalTasks;
    private final List<MaintenanceTask> bundledTasks;
    private final String bundleReason;
    private final boolean monitorOnly;

    MaintenanceSchedule(UnitFamily family, List<MaintenanceTask> infrastructureTasks,
                        MaintenanceTask primaryTask, MaintenanceTask secondaryTask,
                        List<MaintenanceTask> additionalTasks, List<MaintenanceTask> bundledTasks,
                        String bundleReason, boolean monitorOnly) {
        this.family = Objects.requireNonNull(family, "family");
        this.infrastructureTasks = List.copyOf(infrastructureTasks);
        this.primaryTask = primaryTask;
        this.secondaryTask = secondaryTask;
        this.additionalTasks = List.copyOf(additionalTasks);
        this.bundledTasks = List.copyOf(bundledTasks);
        this.bundleReason = bundleReason;
        this.monitorOnly = monitorOnly;
    }

    static MaintenanceSchedule monitorOnly(UnitFamily family) {
        return new MaintenanceSchedule(family, List.of(), null, null, List.of(), List.of(), null, true);
    }

    static MaintenanceSchedule empty(UnitFamily family) {
        return new MaintenanceSchedule(family, List.of(), null, null, List.of(), List.of(), null, false);
    }

    static MaintenanceSchedule sequential(UnitFamily family, MaintenanceTask primary, MaintenanceTask secondary,
                                          List<MaintenanceTask> additional) {
        return new MaintenanceSchedule(family, List.of(), primary, secondary, additional, List.of(), null, false);
    }

    static MaintenanceSchedule bundled(UnitFamily family, MaintenanceTask primary, List<MaintenanceTask> bundle,
                                       List<MaintenanceTask> additional, String reason) {
        return new MaintenanceSchedule(family, List.of(), primary, null, additional, bundle, reason, false);
    }

    MaintenanceSchedule withInfrastructureTasks(List<MaintenanceTask> tasks) {
        return new MaintenanceSchedule(family, tasks, primaryTask, secondaryTask, additionalTasks,
                bundledTasks, bundleReason, monitorOnly);
    }

    public UnitFamily getFamily() { return family; }
    public List<MaintenanceTask> getInfrastructureTasks() { return infrastructureTasks; }
    public MaintenanceTask getPrimaryTask() { return primaryTask; }
    public MaintenanceTask getSecondaryTask() { return secondaryTask; }
    public List<MaintenanceTask> getAdditionalTasks() { return additionalTasks; }
    public List<MaintenanceTask> getBundledTasks() { return bundledTasks; }
    public String getBundleReason() { return bundleReason; }

    /**
     * True when the unit is healthy enough that no service should be recommended.
     */
    public boolean isMonitorOnly() { return monitorOnly; }

    public boolean isBundled() {
        return !bundledTasks.isEmpty();
    }

    public boolean isEmpty() {
        return infrastructureTasks.isEmpty() && primaryTask == null;
    }

    /**
     * Every distinct task in visit order: infrastructure first, then the primary task and the
     * rest of the bundle, then the secondary and additional tasks.
     */
    public List<MaintenanceTask> allTasks() {
        List<MaintenanceTask> tasks = new ArrayList<>(infrastructureTasks);
        addIfAbsent(tasks, primaryTask);
        bundledTasks.forEach(task -> addIfAbsent(tasks, task));
        addIfAbsent(tasks, secondaryTask);
        additionalTasks.forEach(task -> addIfAbsent(tasks, task));
        return tasks;
    }

    private static void addIfAbsent(List<MaintenanceTask> tasks, MaintenanceTask task) {
        if (task != null && !tasks.contains(task)) {
            tasks.add(task);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Maintenance Schedule (").append(family).append("):\n");
        if (monitorOnly) {
            sb.append("  Monitor only, no service recommended\n");
            return sb.toString();
        }
        if (isEmpty()) {
            sb.append("  No maintenance scheduled\n");
            return sb.toString();
        }
        for (MaintenanceTask task : allTasks()) {
            sb.append(String.format("  %-32s %-10s in %2d months%n",
                    task.label(), task.urgency(), task.monthsUntilDue()));
        }
        if (isBundled()) {
            sb.append("  Bundled: ").append(bundleReason).append("\n");
        }
        return sb.toString();
    }
}
