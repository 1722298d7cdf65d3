package com.cloudcost.awspricing.api;

import org.slf4j.MDC;

/**
 * Per-request trace id holder.
 *
 * The id lives in the SLF4J MDC under {@code trace_id} so every log line
 * written while handling the request carries it.
 *
 * USAGE:
 * - Set by TraceContextFilter at the start of each request
 * - Read by exceptions to populate error details
 * - Cleared after request completion
 */
public final class TraceContext {

    public static final String MDC_KEY = "trace_id";
    public static final String HEADER = "X-Trace-Id";

    private TraceContext() {
        // Utility class
    }

    public static void setTraceId(String traceId) {
        MDC.put(MDC_KEY, traceId);
    }

    public static String getTraceIdOrNull() {
        return MDC.get(MDC_KEY);
    }

    public static void clear() {
        MDC.remove(MDC_KEY);
    }
}
