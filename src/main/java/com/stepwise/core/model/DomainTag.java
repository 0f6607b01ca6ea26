package com.stepwise.core.model;

/**
 * Coarse area of the codebase a task touches. Used to keep concurrently running
 * tasks away from each other's files.
 */
public enum DomainTag {
    BACKEND,
    FRONTEND,
    DATABASE,
    TEST,
    GENERAL
}
