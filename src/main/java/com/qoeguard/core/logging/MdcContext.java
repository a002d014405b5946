package com.qoeguard.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing qoe-guard MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setComparison(String comparison) {
        MDC.put("comparison", comparison);
    }

    public static void setComparison(String runId, String comparison) {
        MDC.put("runId", runId);
        MDC.put("comparison", comparison);
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("comparison");
    }
}
