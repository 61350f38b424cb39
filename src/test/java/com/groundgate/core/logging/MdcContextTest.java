package com.groundgate.core.logging;

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
    @DisplayName("setRun puts rootTaskId in MDC")
    void setRun() {
        MdcContext.setRun("root-1");
        assertEquals("root-1", MDC.get("rootTaskId"));
    }

    @Test
    @DisplayName("setTask resets the attempt counter")
    void setTask() {
        MdcContext.setTask("root-1", "t-1");
        MdcContext.setAttempt(2);
        MdcContext.setTask("root-1", "t-2");

        assertEquals("root-1", MDC.get("rootTaskId"));
        assertEquals("t-2", MDC.get("taskId"));
        assertNull(MDC.get("attempt"));
    }

    @Test
    @DisplayName("clearTask keeps the run key")
    void clearTask() {
        MdcContext.setTask("root-1", "t-1");
        MdcContext.setAttempt(1);
        MdcContext.clearTask();

        assertEquals("root-1", MDC.get("rootTaskId"));
        assertNull(MDC.get("taskId"));
        assertNull(MDC.get("attempt"));
    }

    @Test
    @DisplayName("clear removes all groundgate MDC keys")
    void clear() {
        MdcContext.setTask("root-1", "t-1");
        MdcContext.setAttempt(3);
        MdcContext.clear();

        assertNull(MDC.get("rootTaskId"));
        assertNull(MDC.get("taskId"));
        assertNull(MDC.get("attempt"));
    }
}
