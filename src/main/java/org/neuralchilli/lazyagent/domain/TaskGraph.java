package org.neuralchilli.lazyagent.domain;

import org.jgrapht.Graph;
import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;

import java.util.*;

/**
 * Ordered collection of tasks loaded from one tasks file, plus the structural
 * checks and derived views a scheduler needs.
 *
 * <p>The task list and its dependency edges are fixed at construction. The only
 * mutation after {@link #validate()} is the completion flag of individual tasks,
 * so a validated graph stays structurally valid. Adding or removing tasks means
 * building a new graph and validating it again.
 *
 * <p>Not thread-safe. Callers that flip completion flags from several threads must
 * serialize those updates and the queries that follow them.
 */
public final class TaskGraph {

    private final List<Task> tasks;
    private boolean validated;

    public TaskGraph(List<Task> tasks) {
        this.tasks = tasks != null ? List.copyOf(tasks) : List.of();
    }

    public static TaskGraph of(Task... tasks) {
        return new TaskGraph(List.of(tasks));
    }

    public List<Task> tasks() {
        return tasks;
    }

    public boolean isValidated() {
        return validated;
    }

    // Validation

    /**
     * Check uniqueness, referential integrity and acyclicity, in that order.
     * Stops at the first failure.
     *
     * @throws DuplicateTaskIdException    if two tasks share an id
     * @throws DanglingDependencyException if a task depends on an unknown id
     * @throws CycleDetectedException      if the dependency relation has a cycle
     */
    public void validate() {
        Set<String> ids = checkUniqueIds();
        checkReferences(ids);
        checkNoCycles();
        validated = true;
    }

    private Set<String> checkUniqueIds() {
        Set<String> ids = new HashSet<>();
        for (Task task : tasks) {
            if (!ids.add(task.id())) {
                throw new DuplicateTaskIdException(task.id());
            }
        }
        return ids;
    }

    private void checkReferences(Set<String> ids) {
        for (Task task : tasks) {
            for (String dependency : task.depends()) {
                if (!ids.contains(dependency)) {
                    throw new DanglingDependencyException(task.id(), dependency);
                }
            }
        }
    }

    private void checkNoCycles() {
        List<Task> removed = eliminate();
        if (removed.size() < tasks.size()) {
            throw new CycleDetectedException(findCycleMembers(removed));
        }
    }

    /**
     * Kahn elimination. Edges run from each dependency to its dependents.
     * Zero in-degree tasks are processed first-in first-out, seeded in graph
     * order, so the result is stable for a given task list.
     *
     * @return tasks in removal order; shorter than the task list when a cycle exists
     */
    private List<Task> eliminate() {
        Map<String, Task> byId = new HashMap<>();
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();

        for (Task task : tasks) {
            byId.put(task.id(), task);
            Set<String> distinct = new LinkedHashSet<>(task.depends());
            inDegree.put(task.id(), distinct.size());
            for (String dependency : distinct) {
                dependents.computeIfAbsent(dependency, k -> new ArrayList<>()).add(task.id());
            }
        }

        Deque<String> queue = new ArrayDeque<>();
        for (Task task : tasks) {
            if (inDegree.get(task.id()) == 0) {
                queue.add(task.id());
            }
        }

        List<Task> order = new ArrayList<>(tasks.size());
        while (!queue.isEmpty()) {
            String id = queue.poll();
            order.add(byId.get(id));

            for (String dependent : dependents.getOrDefault(id, List.of())) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    queue.add(dependent);
                }
            }
        }

        return order;
    }

    /**
     * Narrow the tasks Kahn elimination left behind down to the ones on a cycle.
     * Tasks that merely depend on a cycle are left out.
     */
    private List<String> findCycleMembers(List<Task> removed) {
        Set<String> removedIds = new HashSet<>();
        for (Task task : removed) {
            removedIds.add(task.id());
        }

        Graph<String, DefaultEdge> remaining = new DefaultDirectedGraph<>(DefaultEdge.class);
        Set<String> onCycle = new HashSet<>();
        for (Task task : tasks) {
            if (!removedIds.contains(task.id())) {
                remaining.addVertex(task.id());
            }
        }
        for (Task task : tasks) {
            if (removedIds.contains(task.id())) {
                continue;
            }
            for (String dependency : task.depends()) {
                if (dependency.equals(task.id())) {
                    onCycle.add(task.id());
                } else if (remaining.containsVertex(dependency)) {
                    remaining.addEdge(dependency, task.id());
                }
            }
        }
        onCycle.addAll(new CycleDetector<>(remaining).findCycles());

        return tasks.stream()
                .map(Task::id)
                .filter(onCycle::contains)
                .toList();
    }

    // Queries

    /**
     * Find a task by exact id match
     */
    public Optional<Task> getTaskById(String id) {
        return tasks.stream()
                .filter(task -> task.id().equals(id))
                .findFirst();
    }

    /**
     * Incomplete tasks whose dependencies are all completed, in graph order.
     *
     * @throws IllegalStateException if the graph has not been validated
     */
    public List<Task> getReadyTasks() {
        requireValidated();
        Map<String, Task> byId = index();

        List<Task> ready = new ArrayList<>();
        for (Task task : tasks) {
            if (!task.completed() && unsatisfiedDependencies(task, byId).isEmpty()) {
                ready.add(task);
            }
        }
        return ready;
    }

    /**
     * Incomplete tasks with at least one dependency that is missing or not yet
     * completed, each paired with those dependency ids.
     *
     * @throws IllegalStateException if the graph has not been validated
     */
    public List<BlockedTask> getBlockedTasks() {
        requireValidated();
        Map<String, Task> byId = index();

        List<BlockedTask> blocked = new ArrayList<>();
        for (Task task : tasks) {
            if (task.completed()) {
                continue;
            }
            List<String> unsatisfied = unsatisfiedDependencies(task, byId);
            if (!unsatisfied.isEmpty()) {
                blocked.add(new BlockedTask(task, unsatisfied));
            }
        }
        return blocked;
    }

    /**
     * All tasks ordered so that every dependency precedes its dependents.
     * Validates the graph first if that has not happened yet.
     *
     * @throws ValidationException if the graph is malformed, including a
     *                             {@link CycleDetectedException} for cycles
     */
    public List<Task> topologicalOrder() {
        if (!validated) {
            validate();
        }
        List<Task> order = eliminate();
        if (order.size() < tasks.size()) {
            throw new CycleDetectedException(findCycleMembers(order));
        }
        return order;
    }

    private List<String> unsatisfiedDependencies(Task task, Map<String, Task> byId) {
        Set<String> unsatisfied = new LinkedHashSet<>();
        for (String dependency : task.depends()) {
            Task upstream = byId.get(dependency);
            // Missing counts as unsatisfied
            if (upstream == null || !upstream.completed()) {
                unsatisfied.add(dependency);
            }
        }
        return List.copyOf(unsatisfied);
    }

    private Map<String, Task> index() {
        Map<String, Task> byId = new HashMap<>();
        for (Task task : tasks) {
            byId.putIfAbsent(task.id(), task);
        }
        return byId;
    }

    private void requireValidated() {
        if (!validated) {
            throw new IllegalStateException("Task graph has not been validated");
        }
    }

    // Progress views

    public int totalTasks() {
        return tasks.size();
    }

    public int completedTasks() {
        return (int) tasks.stream().filter(Task::completed).count();
    }

    public int remainingTasks() {
        return (int) tasks.stream().filter(task -> !task.completed()).count();
    }

    public List<Task> incompleteTasks() {
        return tasks.stream().filter(task -> !task.completed()).toList();
    }

    public List<Task> completedTaskList() {
        return tasks.stream().filter(Task::completed).toList();
    }

    // Parallel group views

    public List<Task> tasksByGroup(int group) {
        return tasks.stream()
                .filter(task -> task.hasParallelGroup() && task.parallelGroup() == group)
                .toList();
    }

    public List<Task> incompleteTasksByGroup(int group) {
        return tasks.stream()
                .filter(task -> !task.completed())
                .filter(task -> task.hasParallelGroup() && task.parallelGroup() == group)
                .toList();
    }

    /**
     * Lowest parallel group that still has incomplete tasks
     */
    public Optional<Integer> nextParallelGroup() {
        return tasks.stream()
                .filter(task -> !task.completed() && task.hasParallelGroup())
                .map(Task::parallelGroup)
                .min(Integer::compare);
    }

    @Override
    public String toString() {
        return "TaskGraph[tasks=" + tasks.size() +
                ", completed=" + completedTasks() +
                ", validated=" + validated + ']';
    }
}
