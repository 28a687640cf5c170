package org.neuralchilli.lazyagent.service;

import java.util.Optional;

/**
 * Result of loading one project's tasks file.
 */
public sealed interface LoadResult {

    boolean isSuccess();

    /**
     * Project name the load was for
     */
    String name();

    Optional<String> error();

    record Success(String name, int totalTasks) implements LoadResult {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<String> error() {
            return Optional.empty();
        }
    }

    record Failure(String name, String errorMessage) implements LoadResult {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<String> error() {
            return Optional.of(errorMessage);
        }
    }

    static LoadResult success(String name, int totalTasks) {
        return new Success(name, totalTasks);
    }

    static LoadResult failure(String name, String error) {
        return new Failure(name, error);
    }

    static LoadResult failure(String name, Exception e) {
        return new Failure(name, e.getMessage());
    }
}
