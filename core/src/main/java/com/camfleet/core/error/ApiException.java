package com.camfleet.core.error;

import com.camfleet.core.msg.ErrorResponse;
import lombok.Getter;

/**
 * Error raised inside a request pipeline and converted to a {@code {code, message}} body at the
 * server boundary. The message is what the caller sees; causes are only logged.
 */
@Getter
public class ApiException extends RuntimeException {

    private final ErrorCode errorCode;

    public ApiException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ApiException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public int getHttpStatus() {
        return errorCode.getHttpStatus();
    }

    public ErrorResponse toErrorResponse() {
        return new ErrorResponse(errorCode.code(), getMessage());
    }

    public static ApiException unauthorized() {
        return new ApiException(ErrorCode.UNAUTHORIZED, "Invalid or missing bearer token");
    }

    public static ApiException missingBody() {
        return new ApiException(ErrorCode.MISSING_BODY, "Request body is missing");
    }

    public static ApiException invalidRequest(String details) {
        return new ApiException(ErrorCode.INVALID_REQUEST, "Invalid request: " + details);
    }

    public static ApiException invalidAlias(String details) {
        return new ApiException(ErrorCode.INVALID_ALIAS, details);
    }

    public static ApiException notFound(String resource) {
        return new ApiException(ErrorCode.NOT_FOUND, "Resource not found: " + resource);
    }

    public static ApiException methodNotAllowed(String method) {
        return new ApiException(ErrorCode.METHOD_NOT_ALLOWED, "HTTP method not allowed: " + method);
    }

    public static ApiException rateLimited(long waitMs) {
        return new ApiException(ErrorCode.RATE_LIMITED, "Too many requests, wait " + waitMs + "ms");
    }

    public static ApiException timeout(String operation, long timeoutMs) {
        return new ApiException(ErrorCode.REQUEST_TIMEOUT,
                operation + " did not complete within " + timeoutMs + "ms");
    }

    public static ApiException notImplemented(String feature) {
        return new ApiException(ErrorCode.NOT_IMPLEMENTED, "Not implemented: " + feature);
    }

    public static ApiException encodingFailed(Throwable cause) {
        return new ApiException(ErrorCode.ENCODING_FAILED, "Failed to encode response: " + summarize(cause), cause);
    }

    public static ApiException internal(Throwable cause) {
        return new ApiException(ErrorCode.INTERNAL_ERROR, "Internal error: " + summarize(cause), cause);
    }

    /**
     * Wraps a collaborator failure under the given upstream code.
     *
     * @param code   one of the {@link ErrorCategory#UPSTREAM} codes
     * @param prefix human prefix such as "Stream start failed"
     */
    public static ApiException upstream(ErrorCode code, String prefix, Throwable cause) {
        return new ApiException(code, prefix + ": " + summarize(cause), cause);
    }

    /**
     * One-line description of a throwable, never a stack trace.
     */
    public static String summarize(Throwable t) {
        if (t == null) {
            return "unknown error";
        }
        String message = t.getMessage();
        return message == null || message.isBlank() ? t.getClass().getSimpleName() : message;
    }
}
