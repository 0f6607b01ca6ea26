package com.stepwise.core.tdd;

import com.stepwise.core.model.FailureKind;
import com.stepwise.core.model.TestEvidence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads free-form test-runner output into {@link TestEvidence}.
 * <p>
 * Recognizes Maven/Surefire, Jest and pytest summaries plus build-failure markers.
 * Output with none of these is reported as unrecognized, which phase checks treat as
 * a rejection rather than a pass.
 */
@Service
public class TestEvidenceParser {

    private static final Logger log = LoggerFactory.getLogger(TestEvidenceParser.class);

    /** Maven/Surefire: "Tests run: 10, Failures: 2, Errors: 1". */
    private static final Pattern MAVEN_PATTERN =
            Pattern.compile("Tests run:\\s*(\\d+),\\s*Failures:\\s*(\\d+)(?:,\\s*Errors:\\s*(\\d+))?");

    /** Jest: "Tests:       1 failed, 1 skipped, 4 passed, 6 total". */
    private static final Pattern JEST_PATTERN =
            Pattern.compile("Tests:\\s+(?:(\\d+) failed,\\s*)?(?:\\d+ skipped,\\s*)?(?:\\d+ todo,\\s*)?(?:(\\d+) passed,\\s*)?(\\d+) total");

    /** pytest: "8 passed, 2 failed". */
    private static final Pattern PYTEST_PASSED_PATTERN = Pattern.compile("(\\d+)\\s+passed");
    private static final Pattern PYTEST_FAILED_PATTERN = Pattern.compile("(\\d+)\\s+failed");
    private static final Pattern PYTEST_ERROR_PATTERN = Pattern.compile("(\\d+)\\s+errors?\\b");

    private static final Pattern BUILD_FAILURE_PATTERN =
            Pattern.compile("(?i)(BUILD FAILURE|BUILD FAILED|COMPILATION ERROR|npm ERR!|Could not resolve dependencies|command not found)");

    private static final Pattern MISSING_SYMBOL_PATTERN =
            Pattern.compile("(cannot find symbol|NameError|ImportError|ModuleNotFoundError|is not defined"
                    + "|has no attribute|Cannot find module|is not a function|undefined method"
                    + "|Unresolved reference|NoSuchMethodError|NoClassDefFoundError|package \\S+ does not exist)");

    private static final Pattern ASSERTION_PATTERN =
            Pattern.compile("(AssertionError|AssertionFailedError|ComparisonFailure|assert\\s|expected:\\s*<"
                    + "|Expected:|expected .+ but was|toEqual|toBe\\()");

    public TestEvidence parse(String output) {
        if (output == null || output.isBlank()) {
            return new TestEvidence(false, false, 0, 0, FailureKind.UNKNOWN, output == null ? "" : output);
        }

        boolean buildFailure = BUILD_FAILURE_PATTERN.matcher(output).find();

        // Surefire prints one line per class and a final total; the last one is the summary
        Matcher maven = MAVEN_PATTERN.matcher(output);
        String[] lastMaven = null;
        while (maven.find()) {
            lastMaven = new String[]{maven.group(1), maven.group(2), maven.group(3)};
        }
        if (lastMaven != null) {
            int total = Integer.parseInt(lastMaven[0]);
            int failures = Integer.parseInt(lastMaven[1]);
            int errors = lastMaven[2] != null ? Integer.parseInt(lastMaven[2]) : 0;
            log.debug("Parsed Maven-style output: {} run, {} failures, {} errors", total, failures, errors);
            return fromCounts(output, total, failures, errors, buildFailure);
        }

        Matcher jest = JEST_PATTERN.matcher(output);
        if (jest.find()) {
            int failed = jest.group(1) != null ? Integer.parseInt(jest.group(1)) : 0;
            int total = Integer.parseInt(jest.group(3));
            log.debug("Parsed Jest-style output: {} total, {} failed", total, failed);
            return fromCounts(output, total, failed, 0, buildFailure);
        }

        Matcher passedMatcher = PYTEST_PASSED_PATTERN.matcher(output);
        Matcher failedMatcher = PYTEST_FAILED_PATTERN.matcher(output);
        Matcher errorMatcher = PYTEST_ERROR_PATTERN.matcher(output);
        boolean foundPassed = passedMatcher.find();
        boolean foundFailed = failedMatcher.find();
        boolean foundErrors = errorMatcher.find();
        if (foundPassed || foundFailed || foundErrors) {
            int passed = foundPassed ? Integer.parseInt(passedMatcher.group(1)) : 0;
            int failed = foundFailed ? Integer.parseInt(failedMatcher.group(1)) : 0;
            int errors = foundErrors ? Integer.parseInt(errorMatcher.group(1)) : 0;
            log.debug("Parsed pytest-style output: {} passed, {} failed, {} errors", passed, failed, errors);
            return fromCounts(output, passed + failed + errors, failed, errors, buildFailure);
        }

        if (buildFailure) {
            FailureKind kind = classify(output, FailureKind.SETUP_ERROR);
            log.debug("Build failure without test summary, classified as {}", kind);
            return new TestEvidence(true, false, 0, 0, kind, output);
        }

        if (MISSING_SYMBOL_PATTERN.matcher(output).find()) {
            return new TestEvidence(true, false, 0, 0, FailureKind.MISSING_SYMBOL, output);
        }

        log.debug("No test framework output found");
        return new TestEvidence(false, false, 0, 0, FailureKind.UNKNOWN, output);
    }

    /**
     * Failures count as assertions unless the text says otherwise; errors alone
     * (exceptions outside assertions) stay unclassified.
     */
    private TestEvidence fromCounts(String output, int total, int failures, int errors, boolean buildFailure) {
        int failed = failures + errors;
        if (failed > 0) {
            FailureKind fallback = failures > 0 ? FailureKind.ASSERTION : FailureKind.UNKNOWN;
            return new TestEvidence(true, false, total, failed, classify(output, fallback), output);
        }
        if (buildFailure) {
            return new TestEvidence(true, false, total, 0, classify(output, FailureKind.SETUP_ERROR), output);
        }
        if (total == 0) {
            return new TestEvidence(true, false, 0, 0, FailureKind.UNKNOWN, output);
        }
        return new TestEvidence(true, true, total, 0, FailureKind.NONE, output);
    }

    private FailureKind classify(String output, FailureKind fallback) {
        if (MISSING_SYMBOL_PATTERN.matcher(output).find()) {
            return FailureKind.MISSING_SYMBOL;
        }
        if (ASSERTION_PATTERN.matcher(output).find()) {
            return FailureKind.ASSERTION;
        }
        return fallback;
    }
}
