package org.neuralchilli.lazyagent.service;

import java.nio.file.Path;

/**
 * Thrown when a tasks file cannot be turned into a validated task graph.
 * The message says which stage failed (read, parse or validation) and names the file.
 */
public class TasksFileException extends RuntimeException {

    private final Path path;

    public TasksFileException(String message, Path path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
