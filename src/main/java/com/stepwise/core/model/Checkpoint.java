package com.stepwise.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * A commit capturing the combined change of every task completed in one group.
 *
 * @param groupIndex group the checkpoint closes; 0 for a recovery checkpoint on resume
 * @param commitRef  the commit created
 * @param taskIds    tasks whose changes the commit contains
 * @param timestamp  when the commit was made
 */
public record Checkpoint(
    int groupIndex,
    String commitRef,
    List<String> taskIds,
    Instant timestamp
) implements Serializable {

    public Checkpoint {
        taskIds = taskIds == null ? List.of() : List.copyOf(taskIds);
    }
}
