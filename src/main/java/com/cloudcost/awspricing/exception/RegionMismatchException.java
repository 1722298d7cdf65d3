package com.cloudcost.awspricing.exception;

import com.cloudcost.awspricing.api.TraceContext;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown when a resource belongs to a region other than the one this
 * engine instance serves. The caller is expected to route the request to
 * the instance for {@code required_region}.
 */
public class RegionMismatchException extends CostEngineException {

    private final String engineRegion;
    private final String resourceRegion;

    public RegionMismatchException(String engineRegion, String resourceRegion) {
        super(ErrorCode.UNSUPPORTED_REGION, "region mismatch", details(engineRegion, resourceRegion), null);
        this.engineRegion = engineRegion;
        this.resourceRegion = resourceRegion;
    }

    public String getEngineRegion() {
        return engineRegion;
    }

    public String getResourceRegion() {
        return resourceRegion;
    }

    private static Map<String, String> details(String engineRegion, String resourceRegion) {
        Map<String, String> details = new LinkedHashMap<>();
        String traceId = TraceContext.getTraceIdOrNull();
        details.put("trace_id", traceId == null ? "" : traceId);
        details.put("plugin_region", engineRegion);
        details.put("resource_region", resourceRegion);
        details.put("required_region", resourceRegion);
        return details;
    }
}
