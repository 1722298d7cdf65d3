package com.cloudcost.awspricing.exception;

import com.cloudcost.awspricing.api.TraceContext;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base for every error the engine propagates to its caller.
 *
 * Carries the error kind, the trace id of the request that raised it, and
 * a structured details map.
 */
public class CostEngineException extends RuntimeException {

    private final ErrorCode errorCode;
    private final String traceId;
    private final Map<String, String> details;

    public CostEngineException(ErrorCode errorCode, String message) {
        this(errorCode, message, Map.of(), null);
    }

    public CostEngineException(ErrorCode errorCode, String message, Map<String, String> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.traceId = TraceContext.getTraceIdOrNull();
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getTraceId() {
        return traceId;
    }

    public Map<String, String> getDetails() {
        return details;
    }
}
