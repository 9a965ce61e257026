package com.camfleet.device.config;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Configuration for a device control server, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class DeviceConfig {

    String deviceId;
    String alias;
    int httpPort;
    String bearerToken;
    boolean authEnabled;
    /**
     * Minimum spacing between two accepted camera mutations.
     */
    long rateLimitIntervalMs;
    long telemetryIntervalMs;
    long handlerTimeoutMs;
    int wsClientBuffer;
    int pingInterval;
    int idleTimeout;

    public static DeviceConfig fromEnv() {
        return DeviceConfig.builder()
                .deviceId(getEnv("DEVICE_ID", "camera-1"))
                .alias(getEnv("DEVICE_ALIAS", "AvoCam"))
                .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8888")))
                .bearerToken(getEnv("BEARER_TOKEN", UUID.randomUUID().toString()))
                .authEnabled(Boolean.parseBoolean(getEnv("AUTH_ENABLED", "false")))
                .rateLimitIntervalMs(Long.parseLong(getEnv("RATE_LIMIT_INTERVAL_MS", "50")))
                .telemetryIntervalMs(Long.parseLong(getEnv("TELEMETRY_INTERVAL_MS", "1000")))
                .handlerTimeoutMs(Long.parseLong(getEnv("HANDLER_TIMEOUT_MS", "10000")))
                .wsClientBuffer(Integer.parseInt(getEnv("WS_CLIENT_BUFFER", "32")))
                .pingInterval(Integer.parseInt(getEnv("PING_INTERVAL_SEC", "10")))
                .idleTimeout(Integer.parseInt(getEnv("IDLE_TIMEOUT_SEC", "30")))
                .build();
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
