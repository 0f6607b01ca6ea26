package com.stepwise.core.parser;

import com.stepwise.core.model.DomainTag;
import com.stepwise.core.model.Task;
import com.stepwise.core.model.TddPhase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskParserTest {

    private TaskParser parser;

    @BeforeEach
    void setUp() {
        parser = new TaskParser(new KeywordDomainClassifier());
    }

    private Task single(String line) {
        List<Task> tasks = parser.parse(List.of(line));
        assertEquals(1, tasks.size());
        return tasks.get(0);
    }

    @Nested
    @DisplayName("Line format")
    class LineFormat {

        @Test
        @DisplayName("strips checkbox prefix and keeps description")
        void stripsCheckboxPrefix() {
            Task task = single("- [ ] T001 Add index on orders.created_at column");
            assertEquals("T001", task.id());
            assertEquals("Add index on orders.created_at column", task.description());
            assertEquals(TddPhase.NONE, task.phase());
            assertEquals(1, task.lineNumber());
        }

        @Test
        @DisplayName("checked checkbox and bare lines are both accepted")
        void checkedAndBareLines() {
            var tasks = parser.parse(List.of("- [x] T001 First thing", "T002 Second thing", "* T003 Third thing"));
            assertEquals(List.of("T001", "T002", "T003"), tasks.stream().map(Task::id).toList());
        }

        @Test
        @DisplayName("skips blank lines and headings, keeps source line numbers")
        void skipsBlankAndHeadings() {
            var tasks = parser.parse(List.of("# Phase 1", "", "T001 Build the page layout", "   ", "## Next", "T002 Add api endpoint"));
            assertEquals(2, tasks.size());
            assertEquals(3, tasks.get(0).lineNumber());
            assertEquals(6, tasks.get(1).lineNumber());
        }

        @Test
        @DisplayName("reads a task file from disk")
        void readsFile(@TempDir Path dir) throws Exception {
            Path file = dir.resolve("tasks.md");
            Files.writeString(file, "# Tasks\n- [ ] T001 [RED] Write failing test for totals\n- [ ] T002 [GREEN->T001] Implement totals\n");
            var tasks = parser.parse(file);
            assertEquals(2, tasks.size());
            assertEquals("T001", tasks.get(1).predecessorRef());
        }

        @Test
        @DisplayName("missing file is reported as unreadable")
        void missingFile(@TempDir Path dir) {
            assertThrows(UncheckedIOException.class, () -> parser.parse(dir.resolve("nope.md")));
        }
    }

    @Nested
    @DisplayName("Tags")
    class Tags {

        @Test
        @DisplayName("phase aliases map to phases")
        void phaseAliases() {
            var tasks = parser.parse(List.of(
                    "T001 [RED] a", "T002 [green] b", "T003 [REFACTOR] c",
                    "T004 [FAILING-TEST] d", "T005 [MAKE-PASS] e", "T006 [CLEANUP] f",
                    "T007 [TEST] g", "T008 [IMPL] h"));
            assertEquals(List.of(TddPhase.FAILING_TEST, TddPhase.MAKE_PASS, TddPhase.CLEANUP,
                            TddPhase.FAILING_TEST, TddPhase.MAKE_PASS, TddPhase.CLEANUP,
                            TddPhase.FAILING_TEST, TddPhase.MAKE_PASS),
                    tasks.stream().map(Task::phase).toList());
        }

        @Test
        @DisplayName("predecessor suffixes: ->, → and :")
        void predecessorSuffixes() {
            var tasks = parser.parse(List.of(
                    "T001 [RED] a", "T002 [GREEN->T001] b", "T003 [REFACTOR→T002] c", "T004 [GREEN:T001] d"));
            assertNull(tasks.get(0).predecessorRef());
            assertEquals("T001", tasks.get(1).predecessorRef());
            assertEquals("T002", tasks.get(2).predecessorRef());
            assertEquals("T001", tasks.get(3).predecessorRef());
        }

        @Test
        @DisplayName("[after:Tnnn] declares a plain dependency")
        void afterTag() {
            var task = parser.parse(List.of("T001 Create table", "T002 [after:T001] Seed table")).get(1);
            assertEquals(TddPhase.NONE, task.phase());
            assertEquals("T001", task.predecessorRef());
        }

        @Test
        @DisplayName("explicit domain overrides the classifier")
        void explicitDomain() {
            Task task = single("T001 [domain:frontend] Add api endpoint");
            assertEquals(DomainTag.FRONTEND, task.domain());
        }

        @Test
        @DisplayName("other tags are kept as labels")
        void labels() {
            Task task = single("T001 [P] [US1] [RED] Write failing test");
            assertEquals(List.of("P", "US1"), task.labels());
            assertEquals(TddPhase.FAILING_TEST, task.phase());
        }

        @Test
        @DisplayName("uses the injected classifier for the domain")
        void injectedClassifier() {
            var custom = new TaskParser(description -> DomainTag.DATABASE);
            assertEquals(DomainTag.DATABASE, custom.parse(List.of("T001 anything")).get(0).domain());
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("line without task ID names the line")
        void missingId() {
            var e = assertThrows(ParseException.class,
                    () -> parser.parse(List.of("T001 ok", "Do something without an id")));
            assertEquals(2, e.getLineNumber());
            assertEquals("Do something without an id", e.getLine());
        }

        @Test
        @DisplayName("duplicate IDs are rejected")
        void duplicateId() {
            var e = assertThrows(ParseException.class, () -> parser.parse(List.of("T001 a", "T001 b")));
            assertTrue(e.getMessage().contains("duplicate"));
        }

        @Test
        @DisplayName("IDs must increase")
        void decreasingId() {
            var e = assertThrows(ParseException.class, () -> parser.parse(List.of("T002 a", "T001 b")));
            assertEquals(2, e.getLineNumber());
        }

        @Test
        @DisplayName("IDs longer than a long are still ordered")
        void overlongIds() {
            var tasks = parser.parse(List.of("T99999999999999999999 do thing", "T100000000000000000000 next thing"));
            assertEquals(2, tasks.size());

            var e = assertThrows(ParseException.class,
                    () -> parser.parse(List.of("T100000000000000000000 a", "T99999999999999999999 b")));
            assertEquals(2, e.getLineNumber());
        }

        @Test
        @DisplayName("description is required")
        void missingDescription() {
            assertThrows(ParseException.class, () -> parser.parse(List.of("T001 [RED]")));
        }

        @Test
        @DisplayName("two phase tags are rejected")
        void twoPhases() {
            assertThrows(ParseException.class, () -> parser.parse(List.of("T001 [RED] [GREEN] a")));
        }

        @Test
        @DisplayName("two predecessor references are rejected")
        void twoReferences() {
            assertThrows(ParseException.class,
                    () -> parser.parse(List.of("T001 a", "T002 b", "T003 [GREEN->T001] [after:T002] c")));
        }

        @Test
        @DisplayName("unknown tag with a reference is rejected")
        void unknownReferenceTag() {
            assertThrows(ParseException.class, () -> parser.parse(List.of("T001 a", "T002 [BLUE->T001] b")));
        }

        @Test
        @DisplayName("unknown domain is rejected")
        void unknownDomain() {
            assertThrows(ParseException.class, () -> parser.parse(List.of("T001 [domain:mobile] a")));
        }
    }
}
