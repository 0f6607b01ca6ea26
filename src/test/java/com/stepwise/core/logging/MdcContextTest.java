package com.stepwise.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setRun puts runId in MDC")
    void setRun() {
        MdcContext.setRun("run-1a2b3c4d");
        assertEquals("run-1a2b3c4d", MDC.get("runId"));
    }

    @Test
    @DisplayName("setTask puts runId, groupIndex, taskId and phase in MDC")
    void setTask() {
        MdcContext.setTask("run-1a2b3c4d", 2, "T004", "MAKE_PASS");
        assertEquals("run-1a2b3c4d", MDC.get("runId"));
        assertEquals("2", MDC.get("groupIndex"));
        assertEquals("T004", MDC.get("taskId"));
        assertEquals("MAKE_PASS", MDC.get("phase"));
    }

    @Test
    @DisplayName("clear removes all Stepwise keys")
    void clear() {
        MdcContext.setTask("run-1a2b3c4d", 1, "T001", "FAILING_TEST");
        MdcContext.clear();
        assertNull(MDC.get("runId"));
        assertNull(MDC.get("groupIndex"));
        assertNull(MDC.get("taskId"));
        assertNull(MDC.get("phase"));
    }
}
