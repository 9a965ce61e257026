package com.camfleet.device.metrics;

import com.camfleet.core.metrics.MetricsNames;
import com.camfleet.core.metrics.MetricsTags;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;

import java.util.function.Supplier;

/**
 * Centralized metrics service for the device control server.
 */
public class MetricsService {
    public static final String SOURCE_REST = "rest";
    public static final String SOURCE_WS = "ws";

    private final MeterRegistry registry;
    private final String deviceId;

    private final Counter rateLimitedRest;
    private final Counter rateLimitedWs;
    private final Counter telemetryFrames;
    private final Counter dropsBufferFull;
    private final Counter dropsClosed;

    public MetricsService(MeterRegistry registry, String deviceId) {
        this.registry = registry;
        this.deviceId = deviceId;

        new ProcessorMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);

        rateLimitedRest = Counter.builder(MetricsNames.DEVICE_RATE_LIMITED_TOTAL)
                .tag(MetricsTags.DEVICE_ID, deviceId)
                .tag(MetricsTags.SOURCE, SOURCE_REST)
                .description("REST mutations rejected by the rate limiter")
                .register(registry);

        rateLimitedWs = Counter.builder(MetricsNames.DEVICE_RATE_LIMITED_TOTAL)
                .tag(MetricsTags.DEVICE_ID, deviceId)
                .tag(MetricsTags.SOURCE, SOURCE_WS)
                .description("WebSocket set commands rejected by the rate limiter")
                .register(registry);

        telemetryFrames = Counter.builder(MetricsNames.DEVICE_TELEMETRY_FRAMES_TOTAL)
                .tag(MetricsTags.DEVICE_ID, deviceId)
                .register(registry);

        dropsBufferFull = Counter.builder(MetricsNames.DEVICE_WS_DROPS_TOTAL)
                .tag(MetricsTags.DEVICE_ID, deviceId)
                .tag(MetricsTags.REASON, "buffer_full")
                .description("Frames dropped because a client's outbound buffer was full")
                .register(registry);

        dropsClosed = Counter.builder(MetricsNames.DEVICE_WS_DROPS_TOTAL)
                .tag(MetricsTags.DEVICE_ID, deviceId)
                .tag(MetricsTags.REASON, "closed")
                .description("Frames dropped because the client was already closed")
                .register(registry);
    }

    /**
     * Registers the connected-clients gauge.
     *
     * @param clientCount supplier read on every scrape
     */
    public void registerClientGauge(Supplier<Number> clientCount) {
        Gauge.builder(MetricsNames.DEVICE_WS_CLIENTS, clientCount)
                .tag(MetricsTags.DEVICE_ID, deviceId)
                .description("Connected WebSocket clients")
                .register(registry);
    }

    public void recordHttpRequest(int status) {
        registry.counter(MetricsNames.DEVICE_HTTP_REQUESTS_TOTAL,
                MetricsTags.DEVICE_ID, deviceId,
                MetricsTags.STATUS, Integer.toString(status)).increment();
    }

    public void recordRateLimited(String source) {
        if (SOURCE_WS.equals(source)) {
            rateLimitedWs.increment();
        } else {
            rateLimitedRest.increment();
        }
    }

    public void recordTelemetryFrame() {
        telemetryFrames.increment();
    }

    public void recordDropBufferFull() {
        dropsBufferFull.increment();
    }

    public void recordDropClosed() {
        dropsClosed.increment();
    }

    public double rateLimitedCount() {
        return rateLimitedRest.count() + rateLimitedWs.count();
    }
}
