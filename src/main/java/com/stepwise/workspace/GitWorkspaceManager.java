package com.stepwise.workspace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * {@link WorkspaceManager} backed by git worktrees.
 *
 * <p>Each task works in its own worktree on branch {@code stepwise/<taskId>}. Discarding
 * a task removes its worktree and branch, leaving every other task untouched. A
 * checkpoint merges the completed task branches into the shared tree in plan order
 * and squashes the result into a single commit.
 *
 * <p>Operations that touch repository-wide state (refs, worktree list, the shared
 * tree) are serialized on one lock, which is also the commit lock for checkpoints.
 *
 * <p>This class shells out to the {@code git} CLI via {@link ProcessBuilder}
 * rather than depending on JGit.
 */
public class GitWorkspaceManager implements WorkspaceManager {

    private static final Logger log = LoggerFactory.getLogger(GitWorkspaceManager.class);

    private static final String BRANCH_PREFIX = "stepwise/";
    private static final String DEFAULT_USER_NAME = "Stepwise";
    private static final String DEFAULT_USER_EMAIL = "stepwise@localhost";

    private final Path projectRoot;
    private final Path worktreeRoot;
    private final String baseBranch;
    private final ReentrantLock repositoryLock = new ReentrantLock();

    /**
     * @param projectRoot  the shared tree (main checkout of the repository)
     * @param worktreeRoot directory under which task worktrees are created
     * @param baseBranch   revision fresh workspaces start from, typically {@code HEAD}
     */
    public GitWorkspaceManager(Path projectRoot, Path worktreeRoot, String baseBranch) {
        this.projectRoot = projectRoot;
        this.worktreeRoot = worktreeRoot;
        this.baseBranch = baseBranch;
    }

    @Override
    public Path acquire(String taskId, String baseTaskId) {
        String branchName = getBranchName(taskId);
        Path worktreePath = getWorktreePath(taskId);

        repositoryLock.lock();
        try {
            // Leftovers from an interrupted attempt are never reused
            removeWorktree(worktreePath);
            if (branchExists(branchName)) {
                runGit(projectRoot, "branch", "-D", branchName);
            }

            String base = baseBranch;
            if (baseTaskId != null && branchExists(getBranchName(baseTaskId))) {
                base = getBranchName(baseTaskId);
            }

            Files.createDirectories(worktreeRoot);
            log.info("Adding worktree for {} at {} (branch: {}, base: {})", taskId, worktreePath, branchName, base);
            int exitCode = runGit(projectRoot, "worktree", "add", "-b", branchName, worktreePath.toString(), base);
            if (exitCode != 0) {
                throw new WorkspaceException("Failed to create worktree for " + taskId + " (exit code " + exitCode + ")");
            }
            return worktreePath;
        } catch (IOException e) {
            throw new WorkspaceException("Failed to create worktree directory " + worktreeRoot, e);
        } finally {
            repositoryLock.unlock();
        }
    }

    @Override
    public String commitTask(String taskId, String message) {
        Path worktreePath = getWorktreePath(taskId);
        if (!Files.isDirectory(worktreePath)) {
            throw new WorkspaceException("Cannot commit: worktree does not exist at " + worktreePath);
        }

        repositoryLock.lock();
        try {
            runGit(worktreePath, "add", "-A");

            // exit 0 means nothing staged; the worker may have committed on its own
            int diffExit = runGit(worktreePath, "diff", "--cached", "--quiet");
            if (diffExit != 0) {
                int commitExit = runGit(worktreePath, withIdentity("commit", "-m", message));
                if (commitExit != 0) {
                    throw new WorkspaceException("Commit failed in worktree " + taskId + " (exit code " + commitExit + ")");
                }
            } else {
                log.info("No uncommitted changes in worktree {}", taskId);
            }
            return runGitOutput(worktreePath, "rev-parse", "HEAD").trim();
        } finally {
            repositoryLock.unlock();
        }
    }

    @Override
    public void release(String taskId) {
        repositoryLock.lock();
        try {
            removeWorktree(getWorktreePath(taskId));
        } finally {
            repositoryLock.unlock();
        }
    }

    @Override
    public void discard(String taskId) {
        String branchName = getBranchName(taskId);
        repositoryLock.lock();
        try {
            removeWorktree(getWorktreePath(taskId));
            if (branchExists(branchName)) {
                int exitCode = runGit(projectRoot, "branch", "-D", branchName);
                if (exitCode != 0) {
                    throw new WorkspaceException("Failed to delete branch " + branchName + " (exit code " + exitCode + ")");
                }
            }
            log.info("Discarded workspace of {}", taskId);
        } finally {
            repositoryLock.unlock();
        }
    }

    @Override
    public boolean hasTaskChange(String taskId) {
        return branchExists(getBranchName(taskId));
    }

    @Override
    public Optional<String> checkpoint(String message, List<String> taskIds) {
        repositoryLock.lock();
        try {
            String preHead = runGitOutput(projectRoot, "rev-parse", "HEAD").trim();

            String dirty = runGitOutput(projectRoot, "status", "--porcelain", "--untracked-files=no");
            if (!dirty.isBlank()) {
                throw new CommitException("Shared tree has uncommitted changes made outside the scheduler:\n" + dirty);
            }

            for (String taskId : taskIds) {
                String branchName = getBranchName(taskId);
                if (!branchExists(branchName)) {
                    throw new CommitException("No change recorded for " + taskId + " (branch " + branchName + " missing)");
                }
                int mergeExit = runGit(projectRoot, withIdentity("merge", "--no-ff", "--no-edit", branchName));
                if (mergeExit != 0) {
                    runGit(projectRoot, "merge", "--abort");
                    runGit(projectRoot, "reset", "--hard", preHead);
                    throw new CommitException("Change of " + taskId + " conflicts with the shared tree; reset to " + preHead);
                }
            }

            if (runGit(projectRoot, "diff", "--quiet", preHead, "HEAD") == 0) {
                runGit(projectRoot, "reset", "--hard", preHead);
                deleteBranches(taskIds);
                log.info("Checkpoint skipped: no net changes from {}", String.join(", ", taskIds));
                return Optional.empty();
            }

            runGit(projectRoot, "reset", "--soft", preHead);
            int commitExit = runGit(projectRoot, withIdentity("commit", "-m", message));
            if (commitExit != 0) {
                runGit(projectRoot, "reset", "--hard", preHead);
                throw new CommitException("Checkpoint commit failed (exit code " + commitExit + "); reset to " + preHead);
            }

            String commitRef = runGitOutput(projectRoot, "rev-parse", "HEAD").trim();
            deleteBranches(taskIds);
            log.info("Checkpoint {} created for {}", commitRef, String.join(", ", taskIds));
            return Optional.of(commitRef);
        } finally {
            repositoryLock.unlock();
        }
    }

    /**
     * Returns the branch name for a given task ID.
     *
     * @return branch name in format {@code stepwise/{taskId}}
     */
    public String getBranchName(String taskId) {
        return BRANCH_PREFIX + taskId;
    }

    public Path getWorktreePath(String taskId) {
        return worktreeRoot.resolve(taskId);
    }

    private boolean branchExists(String branchName) {
        return runGit(projectRoot, "rev-parse", "--verify", "--quiet", "refs/heads/" + branchName) == 0;
    }

    private void removeWorktree(Path worktreePath) {
        if (!Files.exists(worktreePath)) {
            return;
        }
        // --force in case the worker left uncommitted changes
        int exitCode = runGit(projectRoot, "worktree", "remove", "--force", worktreePath.toString());
        if (exitCode != 0) {
            log.warn("git worktree remove failed for {}, pruning worktree references", worktreePath);
            runGit(projectRoot, "worktree", "prune");
            if (Files.exists(worktreePath)) {
                throw new WorkspaceException("Failed to remove worktree " + worktreePath);
            }
        }
    }

    private void deleteBranches(List<String> taskIds) {
        for (String taskId : taskIds) {
            String branchName = getBranchName(taskId);
            if (runGit(projectRoot, "branch", "-D", branchName) != 0) {
                log.warn("Could not delete merged branch {}", branchName);
            }
        }
    }

    /**
     * Prefixes a commit-creating command with a fallback identity when the repository has none.
     */
    private String[] withIdentity(String... args) {
        var command = new ArrayList<String>();
        if (runGitOutput(projectRoot, "config", "user.email").isBlank()) {
            command.addAll(List.of("-c", "user.name=" + DEFAULT_USER_NAME, "-c", "user.email=" + DEFAULT_USER_EMAIL));
        }
        command.addAll(List.of(args));
        return command.toArray(String[]::new);
    }

    /**
     * Runs a git command and returns the exit code.
     *
     * @param workDir working directory for the git command
     * @param args    git arguments (e.g. "worktree", "add", "path")
     * @return process exit code
     */
    int runGit(Path workDir, String... args) {
        var command = buildCommand(args);
        log.debug("Running: {}", String.join(" ", command));

        try {
            var process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectErrorStream(true)
                    .start();

            // Consume output to prevent blocking
            try (var reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    log.debug("git: {}", line);
                }
            }

            return process.waitFor();
        } catch (IOException e) {
            throw new WorkspaceException("Git command failed: " + String.join(" ", command), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkspaceException("Interrupted while running: " + String.join(" ", command), e);
        }
    }

    /**
     * Runs a git command and captures stdout.
     *
     * @param workDir working directory for the git command
     * @param args    git arguments
     * @return captured stdout as a single string
     */
    String runGitOutput(Path workDir, String... args) {
        var command = buildCommand(args);
        log.debug("Running (capture): {}", String.join(" ", command));

        try {
            var process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectErrorStream(false)
                    .start();

            String output;
            try (var reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                output = reader.lines().collect(Collectors.joining("\n"));
            }

            int exitCode = process.waitFor();
            if (exitCode != 0) {
                log.debug("Git command exited with code {}: {}", exitCode, String.join(" ", command));
            }

            return output;
        } catch (IOException e) {
            throw new WorkspaceException("Git command failed: " + String.join(" ", command), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkspaceException("Interrupted while running: " + String.join(" ", command), e);
        }
    }

    private List<String> buildCommand(String... args) {
        var command = new ArrayList<String>();
        command.add("git");
        command.addAll(List.of(args));
        return command;
    }
}
