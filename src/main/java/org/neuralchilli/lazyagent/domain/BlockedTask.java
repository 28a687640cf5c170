package org.neuralchilli.lazyagent.domain;

import java.util.List;

/**
 * An incomplete task paired with the dependency ids it is still waiting on.
 */
public record BlockedTask(
        Task task,
        List<String> unsatisfied
) {
    public BlockedTask {
        if (task == null) {
            throw new IllegalArgumentException("Task cannot be null");
        }
        if (unsatisfied == null || unsatisfied.isEmpty()) {
            throw new IllegalArgumentException("A blocked task must have at least one unsatisfied dependency");
        }
        unsatisfied = List.copyOf(unsatisfied);
    }

    public String taskId() {
        return task.id();
    }
}
