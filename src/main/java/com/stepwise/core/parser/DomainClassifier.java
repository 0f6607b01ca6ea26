package com.stepwise.core.parser;

import com.stepwise.core.model.DomainTag;

/**
 * Assigns a {@link DomainTag} to a task description.
 * <p>
 * Classification is heuristic and will be wrong sometimes, so it is kept behind
 * this interface and can be replaced without touching scheduling.
 */
@FunctionalInterface
public interface DomainClassifier {

    DomainTag classify(String description);
}
