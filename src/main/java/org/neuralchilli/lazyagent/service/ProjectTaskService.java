package org.neuralchilli.lazyagent.service;

import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.neuralchilli.lazyagent.config.ConfigValidator;
import org.neuralchilli.lazyagent.config.LazyAgentConfig;
import org.neuralchilli.lazyagent.config.ProjectSettings;
import org.neuralchilli.lazyagent.domain.BlockedTask;
import org.neuralchilli.lazyagent.domain.Task;
import org.neuralchilli.lazyagent.domain.TaskGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the in-memory task graph of every configured project.
 * Loads each project's tasks file on startup and is the single writer of
 * completion flags; flag updates and readiness queries share one lock.
 */
@ApplicationScoped
public class ProjectTaskService {

    private static final Logger log = LoggerFactory.getLogger(ProjectTaskService.class);

    @Inject
    LazyAgentConfig config;

    @Inject
    ConfigValidator configValidator;

    @Inject
    TasksFileLoader loader;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ProjectSettings> settings = new LinkedHashMap<>();
    private final Map<String, TaskGraph> graphs = new HashMap<>();

    /**
     * Validate configuration and load all projects on startup
     */
    void onStart(@Observes StartupEvent event) {
        log.info("Initializing project tasks");

        configValidator.validate(config);

        List<LoadResult> results = loadAll();
        logResults(results);

        log.info("Project tasks initialization complete");
    }

    /**
     * Load the tasks file of every configured project
     */
    public List<LoadResult> loadAll() {
        lock.lock();
        try {
            settings.clear();
            for (LazyAgentConfig.ProjectConfig project : config.projects()) {
                settings.put(project.name(), ProjectSettings.resolve(project, config.agent()));
            }
        } finally {
            lock.unlock();
        }

        List<LoadResult> results = new ArrayList<>();
        for (String project : projectNames()) {
            results.add(reload(project));
        }
        return results;
    }

    /**
     * Re-read one project's tasks file, replacing its graph only if the new one is valid
     */
    public LoadResult reload(String project) {
        ProjectSettings projectSettings = settings(project);
        try {
            TaskGraph graph = loader.load(projectSettings.tasksYaml());

            lock.lock();
            try {
                graphs.put(project, graph);
            } finally {
                lock.unlock();
            }

            log.info("✓ Loaded tasks for project: {} ({} tasks, {} remaining)",
                    project, graph.totalTasks(), graph.remainingTasks());
            return LoadResult.success(project, graph.totalTasks());

        } catch (TasksFileException e) {
            log.error("✗ Failed to load tasks for project: {}", project, e);
            return LoadResult.failure(project, e);
        }
    }

    public List<String> projectNames() {
        lock.lock();
        try {
            return List.copyOf(settings.keySet());
        } finally {
            lock.unlock();
        }
    }

    /**
     * @throws IllegalArgumentException if the project is not configured
     */
    public ProjectSettings settings(String project) {
        lock.lock();
        try {
            ProjectSettings projectSettings = settings.get(project);
            if (projectSettings == null) {
                throw new IllegalArgumentException("Unknown project: " + project);
            }
            return projectSettings;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Loaded graph of a project, empty if its tasks file failed to load.
     * Completion flags must be changed through {@link #markCompleted}, not on the returned graph.
     */
    public Optional<TaskGraph> graph(String project) {
        settings(project);
        lock.lock();
        try {
            return Optional.ofNullable(graphs.get(project));
        } finally {
            lock.unlock();
        }
    }

    public List<Task> readyTasks(String project) {
        lock.lock();
        try {
            return requireGraph(project).getReadyTasks();
        } finally {
            lock.unlock();
        }
    }

    public List<BlockedTask> blockedTasks(String project) {
        lock.lock();
        try {
            return requireGraph(project).getBlockedTasks();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Record that a task finished successfully. The next readiness query sees the change.
     *
     * @throws IllegalArgumentException if the project or task is unknown
     */
    public void markCompleted(String project, String taskId) {
        lock.lock();
        try {
            TaskGraph graph = requireGraph(project);
            Task task = graph.getTaskById(taskId)
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Unknown task '" + taskId + "' in project '" + project + "'"));

            task.markCompleted();
            log.info("Task completed: {}/{} ({}/{} done)",
                    project, taskId, graph.completedTasks(), graph.totalTasks());
        } finally {
            lock.unlock();
        }
    }

    private TaskGraph requireGraph(String project) {
        settings(project);
        TaskGraph graph = graphs.get(project);
        if (graph == null) {
            throw new IllegalStateException("No valid tasks loaded for project: " + project);
        }
        return graph;
    }

    private void logResults(List<LoadResult> results) {
        long successful = results.stream().filter(LoadResult::isSuccess).count();
        long failed = results.size() - successful;

        if (failed > 0) {
            log.warn("Loaded {} projects: {} successful, {} failed",
                    results.size(), successful, failed);

            results.stream()
                    .filter(r -> !r.isSuccess())
                    .forEach(r -> log.error("  ✗ {}: {}", r.name(), r.error().orElse("unknown error")));
        } else {
            log.info("Loaded {} projects: all successful", results.size());
        }
    }
}
