package org.neuralchilli.lazyagent.domain;

import java.util.*;

/**
 * Compiles parallel group tags into explicit dependency edges.
 *
 * <p>Tasks tagged with group {@code g} may run together once every task of the
 * next lower group present in the list has completed. Compilation expresses that
 * as dependencies: each tagged task gains a dependency on every task of the
 * greatest group strictly below its own. Untagged tasks are returned unchanged.
 */
public final class ParallelGroups {

    private ParallelGroups() {
    }

    public static boolean hasGroups(List<Task> tasks) {
        return tasks.stream().anyMatch(Task::hasParallelGroup);
    }

    /**
     * @return a new task list in the same order, with generated dependencies
     *         appended after each task's declared ones
     */
    public static List<Task> compile(List<Task> tasks) {
        NavigableMap<Integer, List<String>> idsByGroup = new TreeMap<>();
        for (Task task : tasks) {
            if (task.hasParallelGroup()) {
                idsByGroup.computeIfAbsent(task.parallelGroup(), k -> new ArrayList<>()).add(task.id());
            }
        }

        List<Task> compiled = new ArrayList<>(tasks.size());
        for (Task task : tasks) {
            if (!task.hasParallelGroup()) {
                compiled.add(task);
                continue;
            }

            Map.Entry<Integer, List<String>> previous = idsByGroup.lowerEntry(task.parallelGroup());
            if (previous == null) {
                compiled.add(task);
                continue;
            }

            Set<String> depends = new LinkedHashSet<>(task.depends());
            depends.addAll(previous.getValue());
            compiled.add(task.withDepends(new ArrayList<>(depends)));
        }

        return compiled;
    }
}
