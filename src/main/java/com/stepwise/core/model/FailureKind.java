package com.stepwise.core.model;

/**
 * Why a test run did not pass.
 */
public enum FailureKind {
    NONE,
    ASSERTION,
    MISSING_SYMBOL,
    SETUP_ERROR,
    UNKNOWN
}
