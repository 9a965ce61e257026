package com.camfleet.device;

import com.camfleet.core.discovery.ServiceRecord;
import com.camfleet.core.metrics.MetricsTags;
import com.camfleet.core.metrics.PrometheusMetricsExporter;
import com.camfleet.device.camera.SimulatedCamera;
import com.camfleet.device.camera.SimulatedTransmitter;
import com.camfleet.device.config.DeviceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Main entry point for a device control server.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Serve the control REST API under /api/v1 and WebSockets at /ws</li>
 *   <li>Authenticate and rate-limit mutations</li>
 *   <li>Broadcast telemetry to connected clients</li>
 *   <li>Expose /metrics</li>
 * </ul>
 * </p>
 */
public class DeviceApp {
    private static final Logger log = LoggerFactory.getLogger(DeviceApp.class);

    public static void main(String[] args) {
        DeviceConfig config = DeviceConfig.fromEnv();
        MDC.put("deviceId", config.getDeviceId());

        log.info("Starting device control server: {}", config.getDeviceId());
        log.info("  Alias: {}", config.getAlias());
        log.info("  HTTP port: {}", config.getHttpPort());
        log.info("  Auth: {}", config.isAuthEnabled() ? "bearer token" : "disabled");
        log.info("  Rate limit: {}ms between camera mutations", config.getRateLimitIntervalMs());

        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(MetricsTags.DEVICE_ID,
                config.getDeviceId());
        SimulatedCamera camera = new SimulatedCamera(config.getAlias(), new SimulatedTransmitter());
        DeviceServer server = new DeviceServer(config, camera, metricsExporter);

        int port = server.start();
        ServiceRecord record = ServiceRecord.advertise(config.getAlias(), "0.0.0.0", port);
        log.info("Advertising {} as {} on port {} ({})", ServiceRecord.SERVICE_TYPE, record.getAlias(),
                record.getPort(), record.getTxt());

        handleShutdown(config, server);

        // Keep the application running until shutdown signal
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    private static void handleShutdown(DeviceConfig config, DeviceServer server) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            MDC.put("deviceId", config.getDeviceId());
            log.info("Shutdown signal received, initiating graceful shutdown...");
            server.stop();
            log.info("Shutdown complete");
        }));
    }
}
