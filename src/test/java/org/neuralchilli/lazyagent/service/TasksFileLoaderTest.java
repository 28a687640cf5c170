package org.neuralchilli.lazyagent.service;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.lazyagent.domain.CycleDetectedException;
import org.neuralchilli.lazyagent.domain.DanglingDependencyException;
import org.neuralchilli.lazyagent.domain.DuplicateTaskIdException;
import org.neuralchilli.lazyagent.domain.Task;
import org.neuralchilli.lazyagent.domain.TaskGraph;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@QuarkusTest
class TasksFileLoaderTest {

    @Inject
    TasksFileLoader loader;

    private Path tempDir;

    @BeforeEach
    void setup() throws IOException {
        tempDir = Files.createTempDirectory("lazyagent-test-");
    }

    @AfterEach
    void cleanup() throws IOException {
        try (Stream<Path> paths = Files.walk(tempDir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> path.toFile().delete());
        }
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Test
    void shouldLoadValidatedGraph() throws IOException {
        // Given: A valid tasks file
        Path file = write("tasks.yaml", """
                tasks:
                  - id: setup
                    title: "Initialize project"
                    completed: true
                  - id: config
                    title: "Setup config"
                    depends: [setup]
                """);

        // When: Loading
        TaskGraph graph = loader.load(file);

        // Then: Graph is validated and queryable
        assertThat(graph.isValidated()).isTrue();
        assertThat(graph.totalTasks()).isEqualTo(2);
        assertThat(graph.getReadyTasks()).extracting(Task::id).containsExactly("config");
    }

    @Test
    void shouldLoadFixtureFromTestResources() {
        TaskGraph graph = loader.load(Path.of("src/test/resources/tasks/grouped-tasks.yaml"));

        assertThat(graph.getReadyTasks()).extracting(Task::id).containsExactly("api", "ui", "notes");
        assertThat(graph.getBlockedTasks()).singleElement()
                .satisfies(blocked -> assertThat(blocked.unsatisfied()).containsExactly("api", "ui"));
    }

    @Test
    void shouldFailOnMissingFile() {
        Path missing = tempDir.resolve("nonexistent.yaml");

        assertThatThrownBy(() -> loader.load(missing))
                .isInstanceOf(TasksFileException.class)
                .hasMessageContaining("Failed to read tasks YAML file")
                .hasCauseInstanceOf(NoSuchFileException.class)
                .satisfies(e -> assertThat(((TasksFileException) e).path()).isEqualTo(missing));
    }

    @Test
    void shouldFailOnInvalidYaml() throws IOException {
        Path file = write("invalid.yaml", "invalid: yaml: content: [[[");

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(TasksFileException.class)
                .hasMessageContaining("Failed to parse tasks YAML file");
    }

    @Test
    void shouldFailOnMalformedTaskEntry() throws IOException {
        Path file = write("no-id.yaml", """
                tasks:
                  - title: "No id"
                """);

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(TasksFileException.class)
                .hasMessageContaining("Failed to parse tasks YAML file")
                .hasMessageContaining("Missing required field: id");
    }

    @Test
    void shouldFailOnNullDependencyEntry() throws IOException {
        Path file = write("null-dep.yaml", """
                tasks:
                  - id: a
                  - id: b
                    depends: [a, ~]
                """);

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(TasksFileException.class)
                .hasMessageContaining("Failed to parse tasks YAML file: " + file)
                .hasMessageContaining("must not contain null entries")
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldFailOnNonBooleanCompletion() throws IOException {
        Path file = write("maybe.yaml", """
                tasks:
                  - id: a
                    completed: maybe
                """);

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(TasksFileException.class)
                .hasMessageContaining("Failed to parse tasks YAML file")
                .hasMessageContaining("'completed' must be a boolean");
    }

    @Test
    void shouldFailOnDuplicateIds() throws IOException {
        Path file = write("dupes.yaml", """
                tasks:
                  - id: a
                  - id: a
                """);

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(TasksFileException.class)
                .hasMessageContaining("Tasks validation failed")
                .hasCauseInstanceOf(DuplicateTaskIdException.class);
    }

    @Test
    void shouldFailOnDanglingDependency() throws IOException {
        Path file = write("dangling.yaml", """
                tasks:
                  - id: a
                    depends: [ghost]
                """);

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(TasksFileException.class)
                .hasMessageContaining("Task 'a' depends on non-existent task 'ghost'")
                .hasCauseInstanceOf(DanglingDependencyException.class);
    }

    @Test
    void shouldFailOnCycle() throws IOException {
        Path file = write("cycle.yaml", """
                tasks:
                  - id: a
                    depends: [b]
                  - id: b
                    depends: [a]
                  - id: c
                """);

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(TasksFileException.class)
                .hasMessageContaining("Circular dependency detected")
                .hasCauseInstanceOf(CycleDetectedException.class);
    }
}
