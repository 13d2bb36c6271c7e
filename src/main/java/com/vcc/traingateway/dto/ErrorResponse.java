package com.vcc.traingateway.dto;

import java.util.UUID;

/**
 * Error body in the upstream API's shape, so SDK clients parse gateway errors the same way.
 */
public record ErrorResponse(
        String type,
        ErrorDetail error,
        String traceId
) {
    public record ErrorDetail(String type, String message) {}

    public static ErrorResponse of(String errorType, String message) {
        return new ErrorResponse("error", new ErrorDetail(errorType, message), UUID.randomUUID().toString());
    }
}
