package com.camfleet.core.metrics;

/**
 * Micrometer metric names used across the fleet.
 * <p>
 * <b>Naming convention:</b> {@code camfleet.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: HTTP requests answered by the device control server.
     * <p>
     * Tags: device_id, status
     * </p>
     */
    public static final String DEVICE_HTTP_REQUESTS_TOTAL = "camfleet.device.http.requests.total";

    /**
     * Counter: requests rejected by the rate limiter (REST and WebSocket).
     * <p>
     * Tags: device_id, source (rest/ws)
     * </p>
     */
    public static final String DEVICE_RATE_LIMITED_TOTAL = "camfleet.device.rate.limited.total";

    /**
     * Gauge: connected WebSocket clients.
     */
    public static final String DEVICE_WS_CLIENTS = "camfleet.device.ws.clients";

    /**
     * Counter: telemetry frames handed to the hub for broadcast.
     */
    public static final String DEVICE_TELEMETRY_FRAMES_TOTAL = "camfleet.device.telemetry.frames.total";

    /**
     * Counter: outbound WebSocket frames dropped.
     * <p>
     * Tags: device_id, reason (buffer_full/closed)
     * </p>
     */
    public static final String DEVICE_WS_DROPS_TOTAL = "camfleet.device.ws.drops.total";

    /**
     * Timer: device call latency as seen by the console.
     * <p>
     * Tags: op, outcome (success/timeout/connection/http_status/decode)
     * </p>
     */
    public static final String CONSOLE_DEVICE_CALL_LATENCY = "camfleet.console.device.call.latency";

    /**
     * Counter: per-device outcomes of group commands.
     * <p>
     * Tags: op, outcome (success/failure)
     * </p>
     */
    public static final String CONSOLE_GROUP_RESULTS_TOTAL = "camfleet.console.group.results.total";

    /**
     * Gauge: claimed devices by liveness.
     * <p>
     * Tags: liveness (online/stale/offline)
     * </p>
     */
    public static final String CONSOLE_DEVICES = "camfleet.console.devices";

    /**
     * Counter: debounced settings edits collapsed into a later send.
     */
    public static final String CONSOLE_DEBOUNCE_COALESCED_TOTAL = "camfleet.console.debounce.coalesced.total";
}
