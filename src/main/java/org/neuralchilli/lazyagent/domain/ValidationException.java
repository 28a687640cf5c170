package org.neuralchilli.lazyagent.domain;

/**
 * Base type for structural failures of a task list or its configuration.
 * Unchecked: a graph that fails validation is rejected as a whole at load time.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
