package com.stepwise.core.model;

public enum BatchMode {
    SEQUENTIAL,
    PARALLEL
}
