package com.camfleet.console.client;

import lombok.Getter;

/**
 * Failure of one call from the console to one device.
 * <p>
 * The {@link FailureKind} tells timeouts, connection problems and non-success HTTP answers
 * apart; the message is what ends up in a group result entry.
 * </p>
 */
@Getter
public class DeviceCallException extends RuntimeException {

    public enum FailureKind {
        TIMEOUT,
        CONNECTION,
        HTTP_STATUS,
        DECODE,
        NOT_FOUND
    }

    private final FailureKind kind;
    private final String deviceId;
    /**
     * Device error code for {@link FailureKind#HTTP_STATUS}, e.g. {@code RATE_LIMITED}.
     */
    private final String errorCode;
    private final int httpStatus;

    private DeviceCallException(FailureKind kind, String deviceId, String message, String errorCode,
                                int httpStatus, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.deviceId = deviceId;
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
    }

    public static DeviceCallException timeout(String deviceId, long timeoutMs) {
        return new DeviceCallException(FailureKind.TIMEOUT, deviceId,
                "Request timed out after " + timeoutMs + "ms", null, 0, null);
    }

    public static DeviceCallException connection(String deviceId, Throwable cause) {
        String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new DeviceCallException(FailureKind.CONNECTION, deviceId, "Connection failed: " + detail,
                null, 0, cause);
    }

    public static DeviceCallException httpStatus(String deviceId, int status, String errorCode, String message) {
        String text = errorCode != null ? errorCode + ": " + message : "HTTP " + status + ": " + message;
        return new DeviceCallException(FailureKind.HTTP_STATUS, deviceId, text, errorCode, status, null);
    }

    public static DeviceCallException decode(String deviceId, Throwable cause) {
        return new DeviceCallException(FailureKind.DECODE, deviceId,
                "Unreadable response: " + cause.getMessage(), null, 0, cause);
    }

    public static DeviceCallException notFound(String deviceId) {
        return new DeviceCallException(FailureKind.NOT_FOUND, deviceId, "Device not found: " + deviceId,
                null, 0, null);
    }
}
