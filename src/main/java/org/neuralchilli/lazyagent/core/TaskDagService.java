package org.neuralchilli.lazyagent.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.neuralchilli.lazyagent.domain.Task;
import org.neuralchilli.lazyagent.domain.TaskGraph;
import org.neuralchilli.lazyagent.domain.TaskGraphStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Structural analysis of a validated task graph using JGraphT.
 * Vertices are task ids; each edge runs from a dependency to its dependent.
 */
@ApplicationScoped
public class TaskDagService {

    private static final Logger log = LoggerFactory.getLogger(TaskDagService.class);

    /**
     * Build a DAG from a validated task graph.
     *
     * @throws IllegalStateException if the graph has not been validated
     */
    public DirectedAcyclicGraph<String, DefaultEdge> buildDAG(TaskGraph graph) {
        if (!graph.isValidated()) {
            throw new IllegalStateException("Task graph has not been validated");
        }

        DirectedAcyclicGraph<String, DefaultEdge> dag = new DirectedAcyclicGraph<>(DefaultEdge.class);

        for (Task task : graph.tasks()) {
            dag.addVertex(task.id());
        }

        for (Task task : graph.tasks()) {
            for (String dependency : task.depends()) {
                // Edge direction: from dependency to dependent
                dag.addEdge(dependency, task.id());
                log.trace("Added edge: {} -> {}", dependency, task.id());
            }
        }

        log.debug("DAG built: {} vertices, {} edges", dag.vertexSet().size(), dag.edgeSet().size());
        return dag;
    }

    /**
     * Tasks that list the given task as a direct dependency, in graph order
     */
    public List<Task> getDependents(TaskGraph graph, String taskId) {
        DirectedAcyclicGraph<String, DefaultEdge> dag = buildDAG(graph);
        if (!dag.containsVertex(taskId)) {
            throw new IllegalArgumentException("Unknown task: " + taskId);
        }

        Set<String> dependents = new HashSet<>();
        for (DefaultEdge edge : dag.outgoingEdgesOf(taskId)) {
            dependents.add(dag.getEdgeTarget(edge));
        }
        return inGraphOrder(graph, dependents);
    }

    /**
     * Tasks with no dependencies
     */
    public List<Task> getRootTasks(TaskGraph graph) {
        DirectedAcyclicGraph<String, DefaultEdge> dag = buildDAG(graph);
        return graph.tasks().stream()
                .filter(task -> dag.inDegreeOf(task.id()) == 0)
                .toList();
    }

    /**
     * Tasks nothing else depends on
     */
    public List<Task> getLeafTasks(TaskGraph graph) {
        DirectedAcyclicGraph<String, DefaultEdge> dag = buildDAG(graph);
        return graph.tasks().stream()
                .filter(task -> dag.outDegreeOf(task.id()) == 0)
                .toList();
    }

    /**
     * Group tasks into waves. Every dependency of a task sits in an earlier wave,
     * so the tasks of one wave could run side by side. Completion state is ignored.
     */
    public List<List<Task>> getExecutionLevels(TaskGraph graph) {
        DirectedAcyclicGraph<String, DefaultEdge> dag = buildDAG(graph);

        Map<String, Integer> levelOf = new HashMap<>();
        int maxLevel = -1;
        // Iteration order of DirectedAcyclicGraph is topological
        for (String id : dag) {
            int level = 0;
            for (DefaultEdge edge : dag.incomingEdgesOf(id)) {
                level = Math.max(level, levelOf.get(dag.getEdgeSource(edge)) + 1);
            }
            levelOf.put(id, level);
            maxLevel = Math.max(maxLevel, level);
        }

        List<List<Task>> levels = new ArrayList<>();
        for (int i = 0; i <= maxLevel; i++) {
            levels.add(new ArrayList<>());
        }
        for (Task task : graph.tasks()) {
            levels.get(levelOf.get(task.id())).add(task);
        }

        log.debug("Task graph has {} execution levels", levels.size());
        return levels.stream().map(List::copyOf).toList();
    }

    /**
     * Progress and shape of a validated graph, using the completion flags as they are now
     */
    public TaskGraphStatistics getStatistics(TaskGraph graph) {
        List<List<Task>> levels = getExecutionLevels(graph);
        int maxParallelism = levels.stream()
                .mapToInt(List::size)
                .max()
                .orElse(0);

        return new TaskGraphStatistics(
                graph.totalTasks(),
                graph.completedTasks(),
                graph.getReadyTasks().size(),
                graph.getBlockedTasks().size(),
                levels.size(),
                maxParallelism
        );
    }

    private List<Task> inGraphOrder(TaskGraph graph, Set<String> ids) {
        return graph.tasks().stream()
                .filter(task -> ids.contains(task.id()))
                .toList();
    }
}
