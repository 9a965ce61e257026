package com.camfleet.console;

import com.camfleet.console.client.IDeviceClient;
import com.camfleet.console.command.CommandOrchestrator;
import com.camfleet.console.command.SettingsDebouncer;
import com.camfleet.console.config.ConsoleConfig;
import com.camfleet.console.discovery.DiscoveryBrowser;
import com.camfleet.console.discovery.DiscoveryService;
import com.camfleet.console.http.ConsoleHttpServer;
import com.camfleet.console.metrics.MetricsService;
import com.camfleet.console.profile.ProfileService;
import com.camfleet.console.registry.DeviceRegistry;
import com.camfleet.console.store.DevicesDocument;
import com.camfleet.console.store.JsonFileStore;
import com.camfleet.console.store.ProfilesDocument;
import com.camfleet.console.telemetry.TelemetryFeed;
import com.camfleet.core.metrics.PrometheusMetricsExporter;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;

import java.util.ArrayList;
import java.util.List;

/**
 * Wires the console: registry, discovery, orchestrator, profiles, telemetry feed and operator API
 * around an {@link IDeviceClient}.
 */
public class ConsoleServer {
    private static final Logger log = LoggerFactory.getLogger(ConsoleServer.class);

    private final ConsoleConfig config;
    @Getter
    private final DeviceRegistry registry;
    @Getter
    private final DiscoveryService discovery;
    @Getter
    private final ProfileService profiles;
    private final SettingsDebouncer debouncer;
    private final TelemetryFeed telemetryFeed;
    private final ConsoleHttpServer httpServer;

    private final List<Disposable> timers = new ArrayList<>();

    public ConsoleServer(ConsoleConfig config,
                         IDeviceClient deviceClient,
                         DiscoveryBrowser browser,
                         MetricsService metricsService,
                         PrometheusMetricsExporter metricsExporter) {
        this.config = config;

        this.registry = new DeviceRegistry(deviceClient,
                new JsonFileStore<>(config.getDataDir().resolve("devices.json"), DevicesDocument.class,
                        DevicesDocument::new),
                config.getOfflineAfterFailures(), metricsService);
        CommandOrchestrator orchestrator = new CommandOrchestrator(registry, deviceClient, metricsService,
                config.getRequestTimeout(), config.getMaxConcurrentOperations());
        this.debouncer = new SettingsDebouncer(orchestrator, metricsService, config.getDebounceWindow());
        this.profiles = new ProfileService(
                new JsonFileStore<>(config.getDataDir().resolve("profiles.json"), ProfilesDocument.class,
                        ProfilesDocument::new),
                orchestrator);
        this.discovery = new DiscoveryService(browser, registry);
        this.telemetryFeed = new TelemetryFeed(deviceClient, registry);
        this.httpServer = new ConsoleHttpServer(config, registry, deviceClient, orchestrator, debouncer,
                discovery, profiles, metricsExporter);
    }

    /**
     * Loads persisted state, starts the periodic work and binds the operator API.
     *
     * @return bound port
     */
    public int start() {
        registry.load();
        profiles.load();

        timers.add(registry.startRefreshing(config.getRefreshInterval()));
        timers.add(discovery.start(config.getDiscoveryInterval()));
        if (config.isTelemetryFeedEnabled()) {
            timers.add(telemetryFeed.start(config.getRefreshInterval()));
        }

        httpServer.start();
        log.info("Console {} ready with {} claimed devices", config.getConsoleId(), registry.size());
        return httpServer.port();
    }

    /**
     * Stops timers and pending debounced edits, then disposes the server.
     */
    public void stop() {
        timers.forEach(Disposable::dispose);
        timers.clear();
        debouncer.cancelAll();
        httpServer.stop();
    }
}
