package com.camfleet.device;

import com.camfleet.core.metrics.PrometheusMetricsExporter;
import com.camfleet.device.camera.CameraControl;
import com.camfleet.device.config.DeviceConfig;
import com.camfleet.device.controller.CameraController;
import com.camfleet.device.controller.StatusController;
import com.camfleet.device.controller.StreamController;
import com.camfleet.device.http.AuthMiddleware;
import com.camfleet.device.http.ControlPage;
import com.camfleet.device.http.CorsMiddleware;
import com.camfleet.device.http.DeviceHttpServer;
import com.camfleet.device.http.HttpResult;
import com.camfleet.device.http.RateLimitMiddleware;
import com.camfleet.device.http.RateLimiter;
import com.camfleet.device.http.Router;
import com.camfleet.device.metrics.MetricsService;
import com.camfleet.device.telemetry.TelemetryBroadcaster;
import com.camfleet.device.ws.WebSocketHandler;
import com.camfleet.device.ws.WebSocketHub;
import com.camfleet.device.ws.WebSocketUpgradeHandler;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Wires one device control server: middleware pipeline, controllers, WebSocket hub and
 * telemetry timer around a {@link CameraControl}.
 */
public class DeviceServer {
    private static final Logger log = LoggerFactory.getLogger(DeviceServer.class);

    private final DeviceConfig config;
    @Getter
    private final WebSocketHub hub;
    @Getter
    private final MetricsService metricsService;
    private final TelemetryBroadcaster telemetryBroadcaster;
    private final DeviceHttpServer httpServer;
    private Disposable telemetryTimer;

    public DeviceServer(DeviceConfig config, CameraControl camera, PrometheusMetricsExporter metricsExporter) {
        this.config = config;
        this.metricsService = new MetricsService(metricsExporter.getRegistry(), config.getDeviceId());
        this.hub = new WebSocketHub(metricsService);

        Duration handlerTimeout = Duration.ofMillis(config.getHandlerTimeoutMs());
        RateLimiter rateLimiter = new RateLimiter(Duration.ofMillis(config.getRateLimitIntervalMs()));
        AuthMiddleware auth = new AuthMiddleware(config.isAuthEnabled(), config.getBearerToken());

        Router router = new Router(List.of(
                new CorsMiddleware(),
                auth,
                new RateLimitMiddleware(RateLimitMiddleware.CAMERA_PATHS, rateLimiter, metricsService)
        ));
        CameraController cameraController = new CameraController(camera, handlerTimeout);
        new StatusController(camera, handlerTimeout).registerRoutes(router);
        new StreamController(camera, handlerTimeout).registerRoutes(router);
        cameraController.registerRoutes(router);
        router.get("/", req -> Mono.fromCallable(() ->
                HttpResult.text(200, "text/html; charset=utf-8", ControlPage.load(config.getAlias()))));
        router.get("/metrics", req -> Mono.fromCallable(() ->
                HttpResult.text(200, "text/plain; version=0.0.4; charset=utf-8", metricsExporter.scrape())));

        WebSocketHandler wsHandler = new WebSocketHandler(config, hub, cameraController, rateLimiter, metricsService);
        this.httpServer = new DeviceHttpServer(config, router, new WebSocketUpgradeHandler(auth, wsHandler),
                metricsService);
        this.telemetryBroadcaster = new TelemetryBroadcaster(camera, hub, metricsService,
                Duration.ofMillis(config.getTelemetryIntervalMs()));
    }

    /**
     * Binds the HTTP server and starts the telemetry timer.
     *
     * @return bound port
     */
    public int start() {
        httpServer.start();
        telemetryTimer = telemetryBroadcaster.start();
        log.info("Device {} ({}) ready, auth {}", config.getDeviceId(), config.getAlias(),
                config.isAuthEnabled() ? "enabled" : "disabled");
        return httpServer.port();
    }

    /**
     * Stops the telemetry timer, closes every WebSocket client, then disposes the server.
     */
    public void stop() {
        if (telemetryTimer != null) {
            telemetryTimer.dispose();
        }
        hub.closeAll();
        httpServer.stop();
    }
}
