package org.neuralchilli.lazyagent.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.List;
import java.util.Optional;

/**
 * Application settings: dashboard refresh, agent defaults and the projects
 * whose tasks files are loaded.
 */
@ConfigMapping(prefix = "lazyagent")
public interface LazyAgentConfig {

    UiConfig ui();

    AgentConfig agent();

    List<ProjectConfig> projects();

    interface UiConfig {

        @WithName("refresh-ms")
        @WithDefault("200")
        long refreshMs();
    }

    interface AgentConfig {

        @WithDefault("claude")
        String engine();

        @WithName("max-iterations")
        @WithDefault("3")
        int maxIterations();

        @WithName("auto-pr")
        @WithDefault("true")
        boolean autoPr();

        @WithName("draft-pr")
        @WithDefault("false")
        boolean draftPr();
    }

    interface ProjectConfig {

        String name();

        @WithName("repo-path")
        String repoPath();

        @WithName("tasks-yaml")
        String tasksYaml();

        @WithName("base-branch")
        String baseBranch();

        @WithName("max-parallel")
        int maxParallel();

        Optional<ProjectOverrides> overrides();
    }

    /**
     * Per-project values that win over the global agent settings
     */
    interface ProjectOverrides {

        @WithName("max-iterations")
        Optional<Integer> maxIterations();

        @WithName("auto-pr")
        Optional<Boolean> autoPr();

        @WithName("draft-pr")
        Optional<Boolean> draftPr();
    }
}
