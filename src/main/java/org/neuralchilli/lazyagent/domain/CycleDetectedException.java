package org.neuralchilli.lazyagent.domain;

import java.util.List;

/**
 * Thrown when the dependency relation of a task graph contains a cycle.
 * Extends ValidationException as this is a structural error that should
 * be caught while loading a tasks file, not while scheduling.
 */
public class CycleDetectedException extends ValidationException {

    private final List<String> cycleTasks;

    public CycleDetectedException(List<String> cycleTasks) {
        super("Circular dependency detected among tasks: " + cycleTasks);
        this.cycleTasks = List.copyOf(cycleTasks);
    }

    public CycleDetectedException(String message) {
        super(message);
        this.cycleTasks = List.of();
    }

    /**
     * Ids of the tasks that lie on a cycle, in graph order
     */
    public List<String> cycleTasks() {
        return cycleTasks;
    }
}
