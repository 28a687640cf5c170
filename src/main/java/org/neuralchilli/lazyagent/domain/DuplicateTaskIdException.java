package org.neuralchilli.lazyagent.domain;

/**
 * Thrown when two or more tasks in a graph share an id.
 */
public class DuplicateTaskIdException extends ValidationException {

    private final String taskId;

    public DuplicateTaskIdException(String taskId) {
        super("Duplicate task id: '" + taskId + "'");
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }
}
