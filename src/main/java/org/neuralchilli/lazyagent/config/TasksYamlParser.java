package org.neuralchilli.lazyagent.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.lazyagent.domain.ParallelGroups;
import org.neuralchilli.lazyagent.domain.Task;
import org.neuralchilli.lazyagent.domain.TaskGraph;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Parses a tasks YAML document into a candidate (not yet validated) TaskGraph.
 *
 * <pre>
 * tasks:
 *   - id: setup
 *     title: "Initialize project"
 *     completed: true
 *   - id: config
 *     title: "Setup config"
 *     depends: [setup]
 * </pre>
 */
@ApplicationScoped
public class TasksYamlParser {

    private final Yaml yaml = new Yaml();

    /**
     * Parse a tasks document from YAML string
     */
    public TaskGraph parse(String yamlContent) {
        return parseFromDocument(yaml.load(yamlContent));
    }

    /**
     * Parse a tasks document from InputStream
     */
    public TaskGraph parse(InputStream inputStream) {
        return parseFromDocument(yaml.load(inputStream));
    }

    private TaskGraph parseFromDocument(Object document) {
        if (document == null) {
            throw new IllegalArgumentException("Tasks document is empty");
        }
        if (!(document instanceof Map)) {
            throw new IllegalArgumentException("Tasks document must be a mapping with a 'tasks' list");
        }

        Map<?, ?> data = (Map<?, ?>) document;
        Object tasksValue = data.get("tasks");
        if (tasksValue == null) {
            throw new IllegalArgumentException("Missing required field: tasks");
        }
        if (!(tasksValue instanceof List)) {
            throw new IllegalArgumentException("Field 'tasks' must be a list");
        }

        List<?> tasksList = (List<?>) tasksValue;

        List<Task> tasks = new ArrayList<>();
        for (int i = 0; i < tasksList.size(); i++) {
            Object entry = tasksList.get(i);
            if (!(entry instanceof Map)) {
                throw new IllegalArgumentException("Task entry " + i + " must be a mapping");
            }
            tasks.add(parseTaskFromMap((Map<?, ?>) entry));
        }

        if (ParallelGroups.hasGroups(tasks)) {
            tasks = ParallelGroups.compile(tasks);
        }

        return new TaskGraph(tasks);
    }

    private Task parseTaskFromMap(Map<?, ?> data) {
        String id = getString(data, "id", true);
        String title = getString(data, "title", false);
        boolean completed = getBoolean(data, "completed", false);
        List<String> depends = getStringList(data, "depends", List.of());
        Integer parallelGroup = getNonNegativeInteger(data, "parallel_group");

        return new Task(id, title, completed, depends, parallelGroup);
    }

    // Helper methods for type-safe extraction

    private String getString(Map<?, ?> map, String key, boolean required) {
        Object value = map.get(key);
        if (value == null) {
            if (required) {
                throw new IllegalArgumentException("Missing required field: " + key);
            }
            return null;
        }
        return value.toString();
    }

    private boolean getBoolean(Map<?, ?> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        throw new IllegalArgumentException("Field '" + key + "' must be a boolean, got: " + value);
    }

    private Integer getNonNegativeInteger(Map<?, ?> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }

        long number;
        if (value instanceof Integer || value instanceof Long) {
            number = ((Number) value).longValue();
        } else if (value instanceof BigInteger) {
            throw outOfRange(key, value);
        } else if (value instanceof String) {
            try {
                number = Long.parseLong((String) value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Field '" + key + "' must be an integer, got: " + value, e);
            }
        } else {
            // Floats land here: 1.9 is not a group number
            throw new IllegalArgumentException("Field '" + key + "' must be an integer, got: " + value);
        }

        if (number < 0 || number > Integer.MAX_VALUE) {
            throw outOfRange(key, value);
        }
        return (int) number;
    }

    private IllegalArgumentException outOfRange(String key, Object value) {
        return new IllegalArgumentException(
                "Field '" + key + "' must be between 0 and " + Integer.MAX_VALUE + ", got: " + value);
    }

    private List<String> getStringList(Map<?, ?> map, String key, List<String> defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof List) {
            List<?> entries = (List<?>) value;
            if (entries.contains(null)) {
                throw new IllegalArgumentException("Field '" + key + "' must not contain null entries");
            }
            return entries.stream()
                    .map(Object::toString)
                    .collect(Collectors.toList());
        }
        throw new IllegalArgumentException("Field '" + key + "' must be a list");
    }
}
