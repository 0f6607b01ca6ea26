package com.stepwise.core.model;

import java.io.Serializable;

/**
 * Verdict of a TDD precondition or postcondition check.
 */
public record GuardDecision(boolean allowed, String reason) implements Serializable {

    public static GuardDecision allow(String reason) {
        return new GuardDecision(true, reason);
    }

    public static GuardDecision reject(String reason) {
        return new GuardDecision(false, reason);
    }
}
