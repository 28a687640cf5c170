package org.neuralchilli.lazyagent.domain;

/**
 * Thrown when a task depends on an id that no task in the graph carries.
 */
public class DanglingDependencyException extends ValidationException {

    private final String taskId;
    private final String dependencyId;

    public DanglingDependencyException(String taskId, String dependencyId) {
        super("Task '" + taskId + "' depends on non-existent task '" + dependencyId + "'");
        this.taskId = taskId;
        this.dependencyId = dependencyId;
    }

    public String taskId() {
        return taskId;
    }

    public String dependencyId() {
        return dependencyId;
    }
}
