package org.neuralchilli.lazyagent.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.lazyagent.config.LazyAgentConfig.ProjectConfig;
import org.neuralchilli.lazyagent.domain.ValidationException;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Validates application settings beyond what the config mapping enforces.
 * Reports the first rule that fails.
 */
@ApplicationScoped
public class ConfigValidator {

    static final String SUPPORTED_ENGINE = "claude";

    /**
     * @throws ValidationException if validation fails
     */
    public void validate(LazyAgentConfig config) {
        String error = firstError(config);
        if (error != null) {
            throw new ValidationException("Config validation failed: " + error);
        }
    }

    private String firstError(LazyAgentConfig config) {
        List<ProjectConfig> projects = config.projects();
        if (projects == null || projects.isEmpty()) {
            return "At least one project must be configured";
        }

        Set<String> names = new HashSet<>();
        for (int idx = 0; idx < projects.size(); idx++) {
            ProjectConfig project = projects.get(idx);

            if (project.name() == null || project.name().isBlank()) {
                return "Project " + idx + " has empty name";
            }
            if (!names.add(project.name())) {
                return "Project '" + project.name() + "' is configured more than once";
            }
            if (project.repoPath() == null || !Path.of(project.repoPath()).isAbsolute()) {
                return "Project '" + project.name() + "' repo_path must be absolute: " + project.repoPath();
            }
            if (project.baseBranch() == null || project.baseBranch().isBlank()) {
                return "Project '" + project.name() + "' has empty base_branch";
            }
            if (project.maxParallel() <= 0) {
                return "Project '" + project.name() + "' max_parallel must be greater than 0";
            }

            boolean badOverride = project.overrides()
                    .flatMap(LazyAgentConfig.ProjectOverrides::maxIterations)
                    .map(maxIterations -> maxIterations <= 0)
                    .orElse(false);
            if (badOverride) {
                return "Project '" + project.name() + "' override max_iterations must be greater than 0";
            }
        }

        String engine = config.agent().engine();
        if (!SUPPORTED_ENGINE.equals(engine)) {
            return "Unsupported engine '" + engine + "', only '" + SUPPORTED_ENGINE + "' is supported";
        }

        if (config.agent().maxIterations() <= 0) {
            return "agent.max_iterations must be greater than 0";
        }

        return null;
    }
}
