package org.neuralchilli.lazyagent.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.lazyagent.config.TasksYamlParser;
import org.neuralchilli.lazyagent.domain.TaskGraph;
import org.neuralchilli.lazyagent.domain.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a tasks YAML file and hands back a validated task graph.
 * A file that fails any stage is rejected as a whole.
 */
@ApplicationScoped
public class TasksFileLoader {

    private static final Logger log = LoggerFactory.getLogger(TasksFileLoader.class);

    @Inject
    TasksYamlParser parser;

    public TasksFileLoader() {
    }

    TasksFileLoader(TasksYamlParser parser) {
        this.parser = parser;
    }

    /**
     * @throws TasksFileException if the file cannot be read, parsed or validated
     */
    public TaskGraph load(Path path) {
        log.debug("Loading tasks from: {}", path);

        String yaml;
        try {
            yaml = Files.readString(path);
        } catch (IOException e) {
            throw new TasksFileException("Failed to read tasks YAML file: " + path, path, e);
        }

        TaskGraph graph;
        try {
            graph = parser.parse(yaml);
        } catch (YAMLException | IllegalArgumentException e) {
            throw new TasksFileException(
                    "Failed to parse tasks YAML file: " + path + ": " + e.getMessage(), path, e);
        }

        try {
            graph.validate();
        } catch (ValidationException e) {
            throw new TasksFileException(
                    "Tasks validation failed for " + path + ": " + e.getMessage(), path, e);
        }

        log.debug("Loaded {} tasks from {} ({} completed)",
                graph.totalTasks(), path, graph.completedTasks());
        return graph;
    }
}
