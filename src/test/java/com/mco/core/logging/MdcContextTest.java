package com.mco.core.logging;

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
    @DisplayName("setOrchestration puts orchestrationId in MDC")
    void setOrchestration() {
        MdcContext.setOrchestration("o-123");
        assertEquals("o-123", MDC.get("orchestrationId"));
    }

    @Test
    @DisplayName("setAdapter puts orchestrationId, stepId, and adapter in MDC")
    void setAdapter() {
        MdcContext.setAdapter("o-123", "plan", "echo");
        assertEquals("o-123", MDC.get("orchestrationId"));
        assertEquals("plan", MDC.get("stepId"));
        assertEquals("echo", MDC.get("adapter"));
    }

    @Test
    @DisplayName("clear removes all orchestration MDC keys")
    void clear() {
        MdcContext.setAdapter("o-123", "plan", "echo");
        MdcContext.clear();
        assertNull(MDC.get("orchestrationId"));
        assertNull(MDC.get("stepId"));
        assertNull(MDC.get("adapter"));
    }
}
