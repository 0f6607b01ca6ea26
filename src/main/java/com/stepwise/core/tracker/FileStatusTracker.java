package com.stepwise.core.tracker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stepwise.core.StepwiseException;
import com.stepwise.core.model.Checkpoint;
import com.stepwise.core.model.ExecutionRecord;
import com.stepwise.core.model.ExecutionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link StatusTracker} persisted as a JSON document.
 * <p>
 * Every write replaces the state file atomically and is read back; a read-back that
 * does not match the intended record raises {@link TrackerInconsistencyException}.
 * <p>
 * When a notes file is configured, {@code ✅ T001} lines in it count as tasks completed
 * and integrated by earlier tooling, and every task folded into a checkpoint is
 * appended to it in the same form.
 */
public class FileStatusTracker implements StatusTracker {

    private static final Logger log = LoggerFactory.getLogger(FileStatusTracker.class);

    public static final String STATE_FILE = "status.json";

    static final Pattern NOTES_COMPLETED = Pattern.compile("✅\\s*(T\\d+)\\b");

    private final Path stateFile;
    private final Path notesFile;
    private final ObjectMapper objectMapper;

    private final Map<String, ExecutionRecord> records = new LinkedHashMap<>();
    private final List<Checkpoint> checkpoints = new ArrayList<>();
    private final Set<String> notedTasks = new LinkedHashSet<>();

    /**
     * @param stateDir     directory holding {@value #STATE_FILE}; created on first write
     * @param notesFile    optional NOTES.md-style completion log, may be null
     * @param objectMapper mapper with Java time support
     */
    public FileStatusTracker(Path stateDir, Path notesFile, ObjectMapper objectMapper) {
        this.stateFile = stateDir.resolve(STATE_FILE);
        this.notesFile = notesFile;
        this.objectMapper = objectMapper;
        load();
    }

    @Override
    public synchronized ExecutionRecord queryStatus(String taskId) {
        ExecutionRecord record = records.get(taskId);
        return record != null ? record : ExecutionRecord.pending(taskId);
    }

    @Override
    public synchronized void markPending(String taskId) {
        ExecutionRecord current = queryStatus(taskId);
        if (current.status() == ExecutionStatus.COMPLETED) {
            throw new TrackerInconsistencyException(taskId, "cannot reset a COMPLETED task to PENDING");
        }
        write(records.containsKey(taskId)
                ? new ExecutionRecord(taskId, ExecutionStatus.PENDING, null, null, null, false, Instant.now())
                : current);
    }

    @Override
    public synchronized void markInProgress(String taskId) {
        ExecutionRecord current = expect(taskId, EnumSet.of(ExecutionStatus.PENDING), ExecutionStatus.IN_PROGRESS);
        write(current.transition(ExecutionStatus.IN_PROGRESS));
    }

    @Override
    public synchronized void markCompleted(String taskId, String commitRef, String evidence) {
        ExecutionRecord current = expect(taskId, EnumSet.of(ExecutionStatus.IN_PROGRESS), ExecutionStatus.COMPLETED);
        write(current.asCompleted(commitRef, evidence));
    }

    @Override
    public synchronized void markFailed(String taskId, String reason) {
        ExecutionRecord current = expect(taskId,
                EnumSet.of(ExecutionStatus.PENDING, ExecutionStatus.IN_PROGRESS), ExecutionStatus.FAILED);
        write(current.asFailed(reason));
    }

    @Override
    public synchronized void markBlocked(String taskId, String reason) {
        ExecutionRecord current = expect(taskId, EnumSet.of(ExecutionStatus.PENDING), ExecutionStatus.BLOCKED);
        write(current.asBlocked(reason));
    }

    @Override
    public synchronized void markCheckpointed(Collection<String> taskIds) {
        for (String taskId : taskIds) {
            ExecutionRecord current = expect(taskId, EnumSet.of(ExecutionStatus.COMPLETED), ExecutionStatus.COMPLETED);
            records.put(taskId, current.asCheckpointed());
        }
        persist();
        for (String taskId : taskIds) {
            verify(records.get(taskId));
        }
        appendNotes(taskIds);
    }

    @Override
    public synchronized void recordCheckpoint(Checkpoint checkpoint) {
        checkpoints.add(checkpoint);
        markCheckpointed(checkpoint.taskIds());
        log.info("Recorded checkpoint {} for group {} ({})",
                checkpoint.commitRef(), checkpoint.groupIndex(), String.join(", ", checkpoint.taskIds()));
    }

    @Override
    public synchronized List<Checkpoint> checkpoints() {
        return List.copyOf(checkpoints);
    }

    @Override
    public synchronized Map<String, ExecutionRecord> snapshot() {
        return new LinkedHashMap<>(records);
    }

    public Path getStateFile() {
        return stateFile;
    }

    private ExecutionRecord expect(String taskId, Set<ExecutionStatus> allowed, ExecutionStatus target) {
        ExecutionRecord current = queryStatus(taskId);
        if (!allowed.contains(current.status())) {
            throw new TrackerInconsistencyException(taskId,
                    "cannot move from " + current.status() + " to " + target);
        }
        return current;
    }

    private void write(ExecutionRecord record) {
        records.put(record.taskId(), record);
        persist();
        verify(record);
        log.debug("Task {} is now {}", record.taskId(), record.status());
    }

    private void verify(ExecutionRecord expected) {
        TrackerState onDisk = read();
        ExecutionRecord actual = onDisk.records().get(expected.taskId());
        if (actual == null || actual.status() != expected.status()
                || actual.checkpointed() != expected.checkpointed()) {
            throw new TrackerInconsistencyException(expected.taskId(),
                    "status write did not read back (expected " + expected.status()
                            + ", found " + (actual == null ? "nothing" : actual.status()) + ")");
        }
    }

    private void persist() {
        try {
            Files.createDirectories(stateFile.getParent());
            Path tmp = stateFile.resolveSibling(STATE_FILE + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValue(tmp.toFile(), new TrackerState(records, checkpoints));
            Files.move(tmp, stateFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StepwiseException("Failed to write status file " + stateFile, e);
        }
    }

    private TrackerState read() {
        try {
            return objectMapper.readValue(stateFile.toFile(), TrackerState.class);
        } catch (IOException e) {
            throw new StepwiseException("Failed to read status file " + stateFile, e);
        }
    }

    private void load() {
        if (Files.exists(stateFile)) {
            TrackerState state = read();
            if (state.records() != null) {
                records.putAll(state.records());
            }
            if (state.checkpoints() != null) {
                checkpoints.addAll(state.checkpoints());
            }
            log.info("Loaded {} task records and {} checkpoints from {}",
                    records.size(), checkpoints.size(), stateFile);
        }
        importNotes();
    }

    private void importNotes() {
        if (notesFile == null || !Files.exists(notesFile)) {
            return;
        }
        try {
            for (String line : Files.readAllLines(notesFile, StandardCharsets.UTF_8)) {
                Matcher m = NOTES_COMPLETED.matcher(line);
                while (m.find()) {
                    notedTasks.add(m.group(1));
                }
            }
        } catch (IOException e) {
            throw new StepwiseException("Failed to read notes file " + notesFile, e);
        }
        int imported = 0;
        for (String taskId : notedTasks) {
            if (!records.containsKey(taskId)) {
                records.put(taskId, new ExecutionRecord(taskId, ExecutionStatus.COMPLETED, null,
                        "recorded in " + notesFile.getFileName(), null, true, Instant.now()));
                imported++;
            }
        }
        if (imported > 0) {
            log.info("Imported {} completed tasks from {}", imported, notesFile);
        }
    }

    private void appendNotes(Collection<String> taskIds) {
        if (notesFile == null) {
            return;
        }
        var lines = new StringBuilder();
        for (String taskId : taskIds) {
            if (notedTasks.add(taskId)) {
                lines.append("✅ ").append(taskId).append(System.lineSeparator());
            }
        }
        if (lines.length() == 0) {
            return;
        }
        try {
            Files.writeString(notesFile, lines, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new StepwiseException("Failed to append to notes file " + notesFile, e);
        }
    }

    /**
     * On-disk layout of the state file.
     */
    public record TrackerState(Map<String, ExecutionRecord> records, List<Checkpoint> checkpoints) {}
}
