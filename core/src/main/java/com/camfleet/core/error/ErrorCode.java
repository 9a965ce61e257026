package com.camfleet.core.error;

import lombok.Getter;

/**
 * Stable machine-readable error codes and the HTTP status each one maps to.
 */
@Getter
public enum ErrorCode {
    INVALID_REQUEST(400, ErrorCategory.VALIDATION),
    MISSING_BODY(400, ErrorCategory.VALIDATION),
    INVALID_ALIAS(400, ErrorCategory.VALIDATION),
    UNAUTHORIZED(401, ErrorCategory.AUTH),
    NOT_FOUND(404, ErrorCategory.NOT_FOUND),
    METHOD_NOT_ALLOWED(404, ErrorCategory.NOT_FOUND),
    REQUEST_TIMEOUT(408, ErrorCategory.TIMEOUT),
    RATE_LIMITED(429, ErrorCategory.RATE_LIMIT),
    STREAM_START_FAILED(500, ErrorCategory.UPSTREAM),
    STREAM_STOP_FAILED(500, ErrorCategory.UPSTREAM),
    CAMERA_UPDATE_FAILED(500, ErrorCategory.UPSTREAM),
    VIDEO_SETTINGS_UPDATE_FAILED(500, ErrorCategory.UPSTREAM),
    KEYFRAME_FAILED(500, ErrorCategory.UPSTREAM),
    MEASURE_FAILED(500, ErrorCategory.UPSTREAM),
    ALIAS_UPDATE_FAILED(500, ErrorCategory.UPSTREAM),
    HANDLER_FAILED(500, ErrorCategory.UPSTREAM),
    ENCODING_FAILED(500, ErrorCategory.ENCODING),
    INTERNAL_ERROR(500, ErrorCategory.INTERNAL),
    NOT_IMPLEMENTED(501, ErrorCategory.NOT_IMPLEMENTED);

    private final int httpStatus;
    private final ErrorCategory category;

    ErrorCode(int httpStatus, ErrorCategory category) {
        this.httpStatus = httpStatus;
        this.category = category;
    }

    /**
     * Wire representation, identical to the constant name.
     */
    public String code() {
        return name();
    }
}
