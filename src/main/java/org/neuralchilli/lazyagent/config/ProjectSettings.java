package org.neuralchilli.lazyagent.config;

import org.neuralchilli.lazyagent.config.LazyAgentConfig.AgentConfig;
import org.neuralchilli.lazyagent.config.LazyAgentConfig.ProjectConfig;
import org.neuralchilli.lazyagent.config.LazyAgentConfig.ProjectOverrides;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Effective settings of one project, with overrides already applied.
 */
public record ProjectSettings(
        String name,
        Path repoPath,
        Path tasksYaml,
        String baseBranch,
        int maxParallel,
        int maxIterations,
        boolean autoPr,
        boolean draftPr
) {
    public ProjectSettings {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Project name cannot be null or empty");
        }
        if (tasksYaml == null) {
            throw new IllegalArgumentException("Tasks file cannot be null");
        }
    }

    public static ProjectSettings resolve(ProjectConfig project, AgentConfig agent) {
        Optional<ProjectOverrides> overrides = project.overrides();

        int maxIterations = overrides.flatMap(ProjectOverrides::maxIterations)
                .orElse(agent.maxIterations());
        boolean autoPr = overrides.flatMap(ProjectOverrides::autoPr)
                .orElse(agent.autoPr());
        boolean draftPr = overrides.flatMap(ProjectOverrides::draftPr)
                .orElse(agent.draftPr());

        return new ProjectSettings(
                project.name(),
                Path.of(project.repoPath()),
                Path.of(project.tasksYaml()),
                project.baseBranch(),
                project.maxParallel(),
                maxIterations,
                autoPr,
                draftPr
        );
    }
}
