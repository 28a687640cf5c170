package org.neuralchilli.lazyagent.domain;

import java.util.List;
import java.util.Objects;

/**
 * A single unit of work in a tasks file.
 * Identity and dependency edges are fixed at construction; only the completion flag
 * changes, and only through the collaborator that owns the graph.
 */
public final class Task {

    private final String id;
    private final String title;
    private final List<String> depends;
    private final Integer parallelGroup;
    private boolean completed;

    public Task(String id, String title, boolean completed, List<String> depends, Integer parallelGroup) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Task id cannot be null or empty");
        }

        this.id = id;
        this.title = title != null ? title : "";
        this.completed = completed;
        this.depends = depends != null ? List.copyOf(depends) : List.of();
        this.parallelGroup = parallelGroup;
    }

    public Task(String id, String title, boolean completed, List<String> depends) {
        this(id, title, completed, depends, null);
    }

    // Getters
    public String id() {
        return id;
    }

    public String title() {
        return title;
    }

    public boolean completed() {
        return completed;
    }

    public List<String> depends() {
        return depends;
    }

    public Integer parallelGroup() {
        return parallelGroup;
    }

    public boolean hasParallelGroup() {
        return parallelGroup != null;
    }

    /**
     * Flip the completion flag once the task has finished successfully
     */
    public void markCompleted() {
        this.completed = true;
    }

    /**
     * Copy of this task with a different dependency list
     */
    public Task withDepends(List<String> depends) {
        return new Task(id, title, completed, depends, parallelGroup);
    }

    /**
     * Tasks are identified by id alone, so a task keeps its place in sets and map keys
     * when its completion flag flips.
     */
    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        Task that = (Task) obj;
        return Objects.equals(this.id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task[" +
                "id=" + id + ", " +
                "title=" + title + ", " +
                "completed=" + completed + ", " +
                "depends=" + depends + ", " +
                "parallelGroup=" + parallelGroup + ']';
    }

    /**
     * Builder for creating tasks fluently
     */
    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static class Builder {
        private final String id;
        private String title = "";
        private boolean completed = false;
        private List<String> depends = List.of();
        private Integer parallelGroup;

        public Builder(String id) {
            this.id = id;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder completed(boolean completed) {
            this.completed = completed;
            return this;
        }

        public Builder depends(List<String> depends) {
            this.depends = depends;
            return this;
        }

        public Builder depends(String... depends) {
            this.depends = List.of(depends);
            return this;
        }

        public Builder parallelGroup(Integer parallelGroup) {
            this.parallelGroup = parallelGroup;
            return this;
        }

        public Task build() {
            return new Task(id, title, completed, depends, parallelGroup);
        }
    }
}
