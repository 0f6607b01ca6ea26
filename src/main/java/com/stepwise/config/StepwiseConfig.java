package com.stepwise.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stepwise.core.graph.DependencyResolver;
import com.stepwise.core.parser.DomainClassifier;
import com.stepwise.core.parser.KeywordDomainClassifier;
import com.stepwise.core.parser.TaskParser;
import com.stepwise.core.rollback.FailureLedger;
import com.stepwise.core.tdd.CommandTestRunner;
import com.stepwise.core.tdd.TestRunner;
import com.stepwise.core.tracker.FileStatusTracker;
import com.stepwise.core.tracker.StatusTracker;
import com.stepwise.worker.CommandWorkerDispatcher;
import com.stepwise.worker.ShellCommandRunner;
import com.stepwise.worker.WorkerDispatcher;
import com.stepwise.workspace.GitWorkspaceManager;
import com.stepwise.workspace.WorkspaceManager;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Wires the external collaborators. Everything resolves paths against
 * {@code stepwise.workspace.project-dir}.
 */
@Configuration
public class StepwiseConfig {

    @Bean
    public DomainClassifier domainClassifier(StepwiseProperties properties) {
        return new KeywordDomainClassifier(properties.getDomainKeywords());
    }

    @Bean
    public TaskParser taskParser(DomainClassifier domainClassifier) {
        return new TaskParser(domainClassifier);
    }

    @Bean
    public DependencyResolver dependencyResolver() {
        return new DependencyResolver();
    }

    @Bean
    public StatusTracker statusTracker(StepwiseProperties properties, ObjectMapper objectMapper) {
        String notes = properties.getNotesFile();
        Path notesFile = notes == null || notes.isBlank() ? null : projectDir(properties).resolve(notes);
        return new FileStatusTracker(stateDir(properties), notesFile, objectMapper);
    }

    @Bean
    public FailureLedger failureLedger(StepwiseProperties properties, ObjectMapper objectMapper) {
        return new FailureLedger(stateDir(properties), objectMapper);
    }

    @Bean
    public WorkspaceManager workspaceManager(StepwiseProperties properties) {
        String configured = properties.getWorktreeDir();
        Path worktreeRoot = configured == null || configured.isBlank()
                ? stateDir(properties).resolve("worktrees")
                : projectDir(properties).resolve(configured);
        return new GitWorkspaceManager(projectDir(properties), worktreeRoot, properties.getBaseBranch());
    }

    @Bean
    public ShellCommandRunner shellCommandRunner() {
        return new ShellCommandRunner();
    }

    @Bean
    public WorkerDispatcher workerDispatcher(StepwiseProperties properties, ShellCommandRunner shellCommandRunner) {
        return new CommandWorkerDispatcher(properties.getWorkerCommand(),
                Duration.ofSeconds(properties.getTaskTimeoutSeconds()), shellCommandRunner);
    }

    /**
     * Only present when a test command is configured; without it Cleanup tasks cannot
     * verify a green suite and are blocked.
     */
    @Bean
    @ConditionalOnProperty(name = "stepwise.tdd.test-command")
    public TestRunner testRunner(StepwiseProperties properties, ShellCommandRunner shellCommandRunner) {
        return new CommandTestRunner(properties.getTestCommand(),
                Duration.ofSeconds(properties.getTestTimeoutSeconds()), shellCommandRunner);
    }

    static Path projectDir(StepwiseProperties properties) {
        return Path.of(properties.getProjectDir()).toAbsolutePath().normalize();
    }

    public static Path stateDir(StepwiseProperties properties) {
        return projectDir(properties).resolve(properties.getStateDir());
    }
}
