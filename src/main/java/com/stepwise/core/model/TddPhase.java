package com.stepwise.core.model;

/**
 * TDD phase a task may declare. A chain runs FAILING_TEST, MAKE_PASS, CLEANUP.
 */
public enum TddPhase {
    NONE,
    FAILING_TEST,
    MAKE_PASS,
    CLEANUP;

    public boolean isPhaseBound() {
        return this != NONE;
    }
}
