package com.cloudcost.awspricing.exception;

import java.util.Map;

/**
 * Thrown when a request or one of its explicitly supplied values is malformed.
 */
public class InvalidResourceException extends CostEngineException {

    public InvalidResourceException(String message) {
        super(ErrorCode.INVALID_RESOURCE, message);
    }

    public InvalidResourceException(String message, Throwable cause) {
        super(ErrorCode.INVALID_RESOURCE, message, Map.of(), cause);
    }
}
