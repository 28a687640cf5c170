package org.neuralchilli.lazyagent.config;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@QuarkusTest
class LazyAgentConfigTest {

    @Inject
    LazyAgentConfig config;

    @Test
    void shouldMapUiAndAgentSettings() {
        assertThat(config.ui().refreshMs()).isEqualTo(300);
        assertThat(config.agent().engine()).isEqualTo("claude");
        assertThat(config.agent().maxIterations()).isEqualTo(3);
        assertThat(config.agent().autoPr()).isTrue();
        assertThat(config.agent().draftPr()).isFalse();
    }

    @Test
    void shouldMapProjectWithOverrides() {
        assertThat(config.projects()).hasSize(1);

        LazyAgentConfig.ProjectConfig project = config.projects().get(0);
        assertThat(project.name()).isEqualTo("demo");
        assertThat(project.repoPath()).isEqualTo("/tmp/demo-repo");
        assertThat(project.baseBranch()).isEqualTo("develop");
        assertThat(project.maxParallel()).isEqualTo(2);
        assertThat(project.overrides()).isPresent();

        ProjectSettings settings = ProjectSettings.resolve(project, config.agent());
        assertThat(settings.maxIterations()).isEqualTo(5);
        assertThat(settings.autoPr()).isTrue();
        assertThat(settings.draftPr()).isTrue();
    }
}
