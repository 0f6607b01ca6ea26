package com.stepwise.core;

/**
 * Base type for the scheduler's domain errors.
 */
public class StepwiseException extends RuntimeException {

    public StepwiseException(String message) {
        super(message);
    }

    public StepwiseException(String message, Throwable cause) {
        super(message, cause);
    }
}
