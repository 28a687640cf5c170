package org.neuralchilli.lazyagent.domain;

import javax.annotation.Nonnull;

/**
 * Snapshot of a validated task graph: how far the work has progressed, how the
 * remaining tasks split into ready and blocked, and the shape of the dependency waves.
 */
public record TaskGraphStatistics(
        int totalTasks,
        int completedTasks,
        int readyTasks,
        int blockedTasks,
        int executionLevels,
        int maxParallelism
) {
    public TaskGraphStatistics {
        requireNonNegative("totalTasks", totalTasks);
        requireNonNegative("completedTasks", completedTasks);
        requireNonNegative("readyTasks", readyTasks);
        requireNonNegative("blockedTasks", blockedTasks);
        requireNonNegative("executionLevels", executionLevels);
        requireNonNegative("maxParallelism", maxParallelism);

        if (completedTasks > totalTasks) {
            throw new IllegalArgumentException(
                    "Completed tasks (" + completedTasks + ") exceed total tasks (" + totalTasks + ")");
        }
        // Every incomplete task is either ready or blocked, never both
        if (readyTasks + blockedTasks != totalTasks - completedTasks) {
            throw new IllegalArgumentException(
                    "Ready (" + readyTasks + ") and blocked (" + blockedTasks
                            + ") tasks must add up to the " + (totalTasks - completedTasks) + " remaining tasks");
        }
    }

    public int remainingTasks() {
        return totalTasks - completedTasks;
    }

    public boolean isFinished() {
        return completedTasks == totalTasks;
    }

    /**
     * Work is left but nothing can start. A validated graph never reaches this state.
     */
    public boolean isStalled() {
        return remainingTasks() > 0 && readyTasks == 0;
    }

    /**
     * Number of tasks a scheduler could start now with the given concurrency limit
     */
    public int dispatchable(int maxParallel) {
        if (maxParallel < 1) {
            throw new IllegalArgumentException("maxParallel must be at least 1, got: " + maxParallel);
        }
        return Math.min(readyTasks, maxParallel);
    }

    public boolean hasParallelism() {
        return maxParallelism > 1;
    }

    private static void requireNonNegative(String name, int value) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " cannot be negative: " + value);
        }
    }

    @Nonnull
    @Override
    public String toString() {
        return String.format(
                "TaskGraphStatistics[done=%d/%d, ready=%d, blocked=%d, levels=%d, width=%d]",
                completedTasks, totalTasks, readyTasks, blockedTasks, executionLevels, maxParallelism
        );
    }
}
