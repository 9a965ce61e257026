package com.camfleet.console.config;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration for the fleet console, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class ConsoleConfig {

    String consoleId;
    int httpPort;
    Path dataDir;

    // Device calls
    Duration requestTimeout;
    int maxConcurrentOperations;

    // Periodic work
    Duration refreshInterval;
    Duration discoveryInterval;
    int offlineAfterFailures;   // consecutive failed refreshes before a device is offline

    Duration debounceWindow;

    /**
     * Comma-separated {@code alias@host:port} entries served by the static discovery browser.
     */
    String discoveryStatic;
    boolean telemetryFeedEnabled;

    public static ConsoleConfig fromEnv() {
        return ConsoleConfig.builder()
                .consoleId(getEnv("CONSOLE_ID", "console-1"))
                .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8090")))
                .dataDir(Path.of(getEnv("DATA_DIR", "./data")))
                .requestTimeout(Duration.ofMillis(Long.parseLong(getEnv("REQUEST_TIMEOUT_MS", "5000"))))
                .maxConcurrentOperations(Integer.parseInt(getEnv("MAX_CONCURRENT_OPERATIONS", "64")))
                .refreshInterval(Duration.ofMillis(Long.parseLong(getEnv("REFRESH_INTERVAL_MS", "2000"))))
                .discoveryInterval(Duration.ofMillis(Long.parseLong(getEnv("DISCOVERY_INTERVAL_MS", "10000"))))
                .offlineAfterFailures(Integer.parseInt(getEnv("OFFLINE_AFTER_FAILURES", "3")))
                .debounceWindow(Duration.ofMillis(Long.parseLong(getEnv("DEBOUNCE_WINDOW_MS", "300"))))
                .discoveryStatic(getEnv("DISCOVERY_STATIC", ""))
                .telemetryFeedEnabled(Boolean.parseBoolean(getEnv("TELEMETRY_FEED_ENABLED", "true")))
                .build();
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
