package io.gradeflow.core.grading;

import java.util.List;

/// Terminal state of every task of one fan-out.
///
/// @param tasks tasks in plan order, not null
/// @param cancelled whether submission stopped early because the run was cancelled
public record DispatchResult(List<GradingTask> tasks, boolean cancelled) {

    public DispatchResult {
        tasks = tasks != null ? List.copyOf(tasks) : List.of();
    }

    public List<GradingTask> failedTasks() {
        return tasks.stream().filter(t -> t.status() == TaskStatus.FAILED).toList();
    }

    public boolean allTerminal() {
        return tasks.stream().allMatch(t -> t.status().isTerminal());
    }
}
