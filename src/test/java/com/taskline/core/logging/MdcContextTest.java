package com.taskline.core.logging;

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
    @DisplayName("setUser puts userId in MDC")
    void setUser() {
        MdcContext.setUser("alice");
        assertEquals("alice", MDC.get("userId"));
    }

    @Test
    @DisplayName("setOperation puts userId, taskId and operation in MDC")
    void setOperation() {
        MdcContext.setOperation("alice", "t-1", "retry");
        assertEquals("alice", MDC.get("userId"));
        assertEquals("t-1", MDC.get("taskId"));
        assertEquals("retry", MDC.get("operation"));
    }

    @Test
    @DisplayName("clearOperation keeps the user")
    void clearOperation() {
        MdcContext.setOperation("alice", "t-1", "update");
        MdcContext.clearOperation();
        assertEquals("alice", MDC.get("userId"));
        assertNull(MDC.get("taskId"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("clear removes all taskline MDC keys")
    void clear() {
        MdcContext.setOperation("alice", "t-1", "update");
        MdcContext.clear();
        assertNull(MDC.get("userId"));
        assertNull(MDC.get("taskId"));
        assertNull(MDC.get("operation"));
    }
}
