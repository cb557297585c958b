package com.planwatch.core.logging;

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
    @DisplayName("setSession with state puts both keys in MDC")
    void setSessionWithState() {
        MdcContext.setSession("wf-1", "listen");
        assertEquals("wf-1", MDC.get("correlationId"));
        assertEquals("listen", MDC.get("monitorState"));
    }

    @Test
    @DisplayName("clear removes all planwatch MDC keys")
    void clear() {
        MdcContext.setSession("wf-1", "dispatch");
        MdcContext.clear();
        assertNull(MDC.get("correlationId"));
        assertNull(MDC.get("monitorState"));
    }
}
