package org.neuralchilli.lazyagent.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.neuralchilli.lazyagent.config.TestConfigs.*;

class ProjectSettingsTest {

    @Test
    void shouldInheritAgentSettingsWithoutOverrides() {
        ProjectSettings settings = ProjectSettings.resolve(project("test-1"), defaultAgent());

        assertThat(settings.name()).isEqualTo("test-1");
        assertThat(settings.repoPath()).isEqualTo(Path.of("/absolute/path/to/repo"));
        assertThat(settings.tasksYaml()).isEqualTo(Path.of("/absolute/path/to/tasks.yaml"));
        assertThat(settings.baseBranch()).isEqualTo("main");
        assertThat(settings.maxParallel()).isEqualTo(3);
        assertThat(settings.maxIterations()).isEqualTo(3);
        assertThat(settings.autoPr()).isTrue();
        assertThat(settings.draftPr()).isFalse();
    }

    @Test
    void shouldPreferProjectOverrides() {
        Project project = new Project("test-2", "/repo", "/tasks.yaml", "develop", 2,
                Optional.of(new Overrides(Optional.of(5), Optional.of(false), Optional.empty())));

        ProjectSettings settings = ProjectSettings.resolve(project, defaultAgent());

        assertThat(settings.maxIterations()).isEqualTo(5);
        assertThat(settings.autoPr()).isFalse();
        assertThat(settings.draftPr()).isFalse();
    }
}
