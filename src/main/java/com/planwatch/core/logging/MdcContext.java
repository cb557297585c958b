package com.planwatch.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Planwatch-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSession(String correlationId, String monitorState) {
        MDC.put("correlationId", correlationId);
        MDC.put("monitorState", monitorState);
    }

    public static void clear() {
        MDC.remove("correlationId");
        MDC.remove("monitorState");
    }
}
