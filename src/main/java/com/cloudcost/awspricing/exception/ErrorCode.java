package com.cloudcost.awspricing.exception;

import org.springframework.http.HttpStatus;

/**
 * Error kinds surfaced to callers.
 *
 * Pricing misses are not errors and have no code here.
 */
public enum ErrorCode {
    INVALID_RESOURCE(HttpStatus.BAD_REQUEST),
    UNSUPPORTED_REGION(HttpStatus.PRECONDITION_FAILED),
    UNSPECIFIED(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus httpStatus;

    ErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
