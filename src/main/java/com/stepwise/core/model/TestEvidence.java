package com.stepwise.core.model;

import java.io.Serializable;

/**
 * Structured reading of a free-form test-run summary.
 *
 * @param recognized  whether any known test-runner output was found
 * @param passed      true when the run was recognized and nothing failed
 * @param totalTests  number of tests reported, 0 if unknown
 * @param failedTests number of failing tests reported
 * @param failureKind classification of the failure; {@link FailureKind#NONE} on a pass
 * @param output      the raw summary
 */
public record TestEvidence(
    boolean recognized,
    boolean passed,
    int totalTests,
    int failedTests,
    FailureKind failureKind,
    String output
) implements Serializable {

    public String summary() {
        if (!recognized) {
            return "no recognizable test output";
        }
        if (passed) {
            return totalTests > 0 ? totalTests + " tests passed" : "test run passed";
        }
        return failedTests + " of " + totalTests + " failed (" + failureKind + ")";
    }
}
