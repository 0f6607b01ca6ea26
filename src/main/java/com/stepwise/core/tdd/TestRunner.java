package com.stepwise.core.tdd;

import java.nio.file.Path;

/**
 * Runs the project's test suite in a workspace and returns its raw output.
 */
@FunctionalInterface
public interface TestRunner {

    String run(Path workspace);
}
