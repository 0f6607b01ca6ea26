package com.stepwise.core.tdd;

import com.stepwise.core.model.FailureKind;
import com.stepwise.core.model.TestEvidence;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TestEvidenceParserTest {

    private final TestEvidenceParser parser = new TestEvidenceParser();

    @Nested
    @DisplayName("Maven / Surefire")
    class Maven {

        @Test
        @DisplayName("all green run passes")
        void passing() {
            TestEvidence evidence = parser.parse("""
                    [INFO] Tests run: 5, Failures: 0, Errors: 0, Skipped: 0
                    [INFO] BUILD SUCCESS
                    """);
            assertTrue(evidence.recognized());
            assertTrue(evidence.passed());
            assertEquals(5, evidence.totalTests());
            assertEquals(FailureKind.NONE, evidence.failureKind());
        }

        @Test
        @DisplayName("the last summary line wins over per-class lines")
        void lastSummaryWins() {
            TestEvidence evidence = parser.parse("""
                    Tests run: 2, Failures: 0, Errors: 0, Skipped: 0 - in com.acme.ATest
                    Tests run: 3, Failures: 1, Errors: 0, Skipped: 0 - in com.acme.BTest
                    org.opentest4j.AssertionFailedError: expected: <2> but was: <1>
                    Tests run: 5, Failures: 1, Errors: 0, Skipped: 0
                    """);
            assertFalse(evidence.passed());
            assertEquals(5, evidence.totalTests());
            assertEquals(1, evidence.failedTests());
            assertEquals(FailureKind.ASSERTION, evidence.failureKind());
        }

        @Test
        @DisplayName("errors without assertion text stay unclassified")
        void errorsOnly() {
            TestEvidence evidence = parser.parse("""
                    java.lang.NullPointerException
                    Tests run: 2, Failures: 0, Errors: 2, Skipped: 0
                    """);
            assertFalse(evidence.passed());
            assertEquals(2, evidence.failedTests());
            assertEquals(FailureKind.UNKNOWN, evidence.failureKind());
        }

        @Test
        @DisplayName("compilation error on a missing class is a missing symbol")
        void compilationMissingSymbol() {
            TestEvidence evidence = parser.parse("""
                    [ERROR] COMPILATION ERROR :
                    [ERROR] /src/test/java/OrderServiceTest.java:[12,9] cannot find symbol
                    [INFO] BUILD FAILURE
                    """);
            assertTrue(evidence.recognized());
            assertFalse(evidence.passed());
            assertEquals(FailureKind.MISSING_SYMBOL, evidence.failureKind());
        }

        @Test
        @DisplayName("dependency resolution failure is a setup error")
        void setupError() {
            TestEvidence evidence = parser.parse("""
                    [ERROR] Failed to execute goal on project app: Could not resolve dependencies for project
                    [INFO] BUILD FAILURE
                    """);
            assertFalse(evidence.passed());
            assertEquals(FailureKind.SETUP_ERROR, evidence.failureKind());
        }
    }

    @Nested
    @DisplayName("Other runners")
    class OtherRunners {

        @Test
        @DisplayName("Jest summary")
        void jest() {
            TestEvidence evidence = parser.parse("""
                    expect(received).toEqual(expected)
                    Tests:       1 failed, 3 passed, 4 total
                    """);
            assertFalse(evidence.passed());
            assertEquals(4, evidence.totalTests());
            assertEquals(1, evidence.failedTests());
            assertEquals(FailureKind.ASSERTION, evidence.failureKind());
        }

        @Test
        @DisplayName("Jest all passing")
        void jestPassing() {
            TestEvidence evidence = parser.parse("Tests:       4 passed, 4 total");
            assertTrue(evidence.passed());
        }

        @Test
        @DisplayName("pytest failure caused by a NameError is a missing symbol")
        void pytestNameError() {
            TestEvidence evidence = parser.parse("""
                    E   NameError: name 'apply_discount' is not defined
                    ========= 1 failed, 2 passed in 0.12s =========
                    """);
            assertFalse(evidence.passed());
            assertEquals(3, evidence.totalTests());
            assertEquals(FailureKind.MISSING_SYMBOL, evidence.failureKind());
        }

        @Test
        @DisplayName("pytest passing")
        void pytestPassing() {
            TestEvidence evidence = parser.parse("========= 8 passed in 0.40s =========");
            assertTrue(evidence.passed());
            assertEquals(8, evidence.totalTests());
        }
    }

    @Nested
    @DisplayName("Unrecognized output")
    class Unrecognized {

        @Test
        @DisplayName("blank or null output is not a pass")
        void blank() {
            assertFalse(parser.parse(null).recognized());
            assertFalse(parser.parse("  ").passed());
        }

        @Test
        @DisplayName("free text without a summary is not a pass")
        void freeText() {
            TestEvidence evidence = parser.parse("All good, I implemented the feature.");
            assertFalse(evidence.recognized());
            assertFalse(evidence.passed());
            assertEquals("no recognizable test output", evidence.summary());
        }

        @Test
        @DisplayName("zero tests run is not a pass")
        void zeroTests() {
            TestEvidence evidence = parser.parse("Tests run: 0, Failures: 0, Errors: 0, Skipped: 0");
            assertTrue(evidence.recognized());
            assertFalse(evidence.passed());
        }
    }
}
