package com.stepwise.core.model;

import java.io.Serializable;
import java.math.BigInteger;
import java.util.List;

/**
 * A single declarative work item from the task list. Immutable once parsed.
 *
 * @param id             unique identifier (e.g., "T001"), strictly increasing within the list
 * @param description    free-text description handed to the worker
 * @param phase          TDD phase, {@link TddPhase#NONE} for ordinary work
 * @param domain         domain classification used for batching
 * @param predecessorRef ID of the task this one depends on; null when none
 * @param labels         remaining bracket tags from the source line (e.g., "P", "US1")
 * @param lineNumber     1-based line in the source list, for error reporting
 */
public record Task(
    String id,
    String description,
    TddPhase phase,
    DomainTag domain,
    String predecessorRef,
    List<String> labels,
    int lineNumber
) implements Serializable {

    public Task {
        labels = labels == null ? List.of() : List.copyOf(labels);
        phase = phase == null ? TddPhase.NONE : phase;
        domain = domain == null ? DomainTag.GENERAL : domain;
    }

    public boolean isPhaseBound() {
        return phase.isPhaseBound();
    }

    public boolean hasPredecessor() {
        return predecessorRef != null;
    }

    /**
     * Numeric part of the ID, used for ordering checks.
     */
    public BigInteger sequence() {
        return new BigInteger(id.substring(1));
    }

    public Task withPredecessor(String ref) {
        return new Task(id, description, phase, domain, ref, labels, lineNumber);
    }
}
