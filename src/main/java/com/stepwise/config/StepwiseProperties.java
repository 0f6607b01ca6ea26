package com.stepwise.config;

import com.stepwise.core.model.DomainTag;
import com.stepwise.core.parser.KeywordDomainClassifier;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "stepwise")
public class StepwiseProperties {

    private Scheduler scheduler = new Scheduler();
    private Worker worker = new Worker();
    private Tdd tdd = new Tdd();
    private Tracker tracker = new Tracker();
    private Workspace workspace = new Workspace();
    private Classifier classifier = new Classifier();

    // -- Scheduler accessors (delegate to nested) --
    public int getMaxBatchSize() { return scheduler.maxBatchSize; }
    public int getMaxGroupSize() { return scheduler.maxGroupSize; }
    public int getTaskTimeoutSeconds() { return scheduler.taskTimeoutSeconds; }

    // -- Worker / TDD accessors --
    public String getWorkerCommand() { return worker.command; }
    public String getTestCommand() { return tdd.testCommand; }
    public int getTestTimeoutSeconds() { return tdd.testTimeoutSeconds; }
    public boolean isVerifyWithTestRunner() { return tdd.verifyWithTestRunner; }

    // -- Tracker / workspace accessors --
    public String getStateDir() { return tracker.stateDir; }
    public String getNotesFile() { return tracker.notesFile; }
    public String getProjectDir() { return workspace.projectDir; }
    public String getBaseBranch() { return workspace.baseBranch; }
    public String getWorktreeDir() { return workspace.worktreeDir; }

    /**
     * Keyword sets per domain; domains absent from configuration keep their defaults.
     */
    public Map<DomainTag, List<String>> getDomainKeywords() {
        var merged = new EnumMap<DomainTag, List<String>>(DomainTag.class);
        merged.putAll(KeywordDomainClassifier.DEFAULT_KEYWORDS);
        classifier.keywords.forEach((domain, words) -> merged.put(domain, words));
        return merged;
    }

    public Scheduler getScheduler() { return scheduler; }
    public void setScheduler(Scheduler scheduler) { this.scheduler = scheduler; }
    public Worker getWorker() { return worker; }
    public void setWorker(Worker worker) { this.worker = worker; }
    public Tdd getTdd() { return tdd; }
    public void setTdd(Tdd tdd) { this.tdd = tdd; }
    public Tracker getTracker() { return tracker; }
    public void setTracker(Tracker tracker) { this.tracker = tracker; }
    public Workspace getWorkspace() { return workspace; }
    public void setWorkspace(Workspace workspace) { this.workspace = workspace; }
    public Classifier getClassifier() { return classifier; }
    public void setClassifier(Classifier classifier) { this.classifier = classifier; }

    public static class Scheduler {
        private int maxBatchSize = 4;
        private int maxGroupSize = 3;
        private int taskTimeoutSeconds = 600;

        public int getMaxBatchSize() { return maxBatchSize; }
        public void setMaxBatchSize(int maxBatchSize) { this.maxBatchSize = maxBatchSize; }
        public int getMaxGroupSize() { return maxGroupSize; }
        public void setMaxGroupSize(int maxGroupSize) { this.maxGroupSize = maxGroupSize; }
        public int getTaskTimeoutSeconds() { return taskTimeoutSeconds; }
        public void setTaskTimeoutSeconds(int taskTimeoutSeconds) { this.taskTimeoutSeconds = taskTimeoutSeconds; }
    }

    public static class Worker {
        private String command = "";

        public String getCommand() { return command; }
        public void setCommand(String command) { this.command = command; }
    }

    public static class Tdd {
        private String testCommand = "";
        private int testTimeoutSeconds = 300;
        private boolean verifyWithTestRunner = false;

        public String getTestCommand() { return testCommand; }
        public void setTestCommand(String testCommand) { this.testCommand = testCommand; }
        public int getTestTimeoutSeconds() { return testTimeoutSeconds; }
        public void setTestTimeoutSeconds(int testTimeoutSeconds) { this.testTimeoutSeconds = testTimeoutSeconds; }
        public boolean isVerifyWithTestRunner() { return verifyWithTestRunner; }
        public void setVerifyWithTestRunner(boolean verifyWithTestRunner) { this.verifyWithTestRunner = verifyWithTestRunner; }
    }

    public static class Tracker {
        private String stateDir = ".stepwise";
        private String notesFile = "";

        public String getStateDir() { return stateDir; }
        public void setStateDir(String stateDir) { this.stateDir = stateDir; }
        public String getNotesFile() { return notesFile; }
        public void setNotesFile(String notesFile) { this.notesFile = notesFile; }
    }

    public static class Workspace {
        private String projectDir = ".";
        private String baseBranch = "HEAD";
        private String worktreeDir = "";

        public String getProjectDir() { return projectDir; }
        public void setProjectDir(String projectDir) { this.projectDir = projectDir; }
        public String getBaseBranch() { return baseBranch; }
        public void setBaseBranch(String baseBranch) { this.baseBranch = baseBranch; }
        public String getWorktreeDir() { return worktreeDir; }
        public void setWorktreeDir(String worktreeDir) { this.worktreeDir = worktreeDir; }
    }

    public static class Classifier {
        private Map<DomainTag, List<String>> keywords = new EnumMap<>(DomainTag.class);

        public Map<DomainTag, List<String>> getKeywords() { return keywords; }
        public void setKeywords(Map<DomainTag, List<String>> keywords) { this.keywords = keywords; }
    }
}
