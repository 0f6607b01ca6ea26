package com.stepwise.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * One line of the append-only failure ledger.
 */
public record FailureEntry(
    String taskId,
    String reason,
    Instant timestamp
) implements Serializable {}
