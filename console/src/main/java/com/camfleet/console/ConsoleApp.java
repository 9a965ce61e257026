package com.camfleet.console;

import com.camfleet.console.client.DeviceClient;
import com.camfleet.console.config.ConsoleConfig;
import com.camfleet.console.discovery.StaticDiscoveryBrowser;
import com.camfleet.console.metrics.MetricsService;
import com.camfleet.core.metrics.MetricsTags;
import com.camfleet.core.metrics.PrometheusMetricsExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Main entry point for the fleet console.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Keep the claimed-device registry fresh</li>
 *   <li>Surface discovered, unclaimed devices</li>
 *   <li>Fan commands and profiles out to many devices</li>
 *   <li>Serve the operator API under /api/v1 and /metrics</li>
 * </ul>
 * </p>
 */
public class ConsoleApp {
    private static final Logger log = LoggerFactory.getLogger(ConsoleApp.class);

    public static void main(String[] args) {
        ConsoleConfig config = ConsoleConfig.fromEnv();
        MDC.put("consoleId", config.getConsoleId());

        log.info("Starting fleet console: {}", config.getConsoleId());
        log.info("  HTTP port: {}", config.getHttpPort());
        log.info("  Data dir: {}", config.getDataDir().toAbsolutePath());
        log.info("  Request timeout: {}ms", config.getRequestTimeout().toMillis());
        log.info("  Refresh every {}ms, offline after {} failures", config.getRefreshInterval().toMillis(),
                config.getOfflineAfterFailures());
        log.info("  Debounce window: {}ms", config.getDebounceWindow().toMillis());

        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(MetricsTags.CONSOLE_ID,
                config.getConsoleId());
        MetricsService metricsService = new MetricsService(metricsExporter.getRegistry());
        DeviceClient deviceClient = new DeviceClient(config.getRequestTimeout(), metricsService);

        ConsoleServer server = new ConsoleServer(config, deviceClient,
                new StaticDiscoveryBrowser(config.getDiscoveryStatic()), metricsService, metricsExporter);
        server.start();

        handleShutdown(config, server);

        // Keep the application running until shutdown signal
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    private static void handleShutdown(ConsoleConfig config, ConsoleServer server) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            MDC.put("consoleId", config.getConsoleId());
            log.info("Shutdown signal received, initiating graceful shutdown...");
            server.stop();
            log.info("Shutdown complete");
        }));
    }
}
