package com.camfleet.device.telemetry;

import com.camfleet.core.util.JsonUtils;
import com.camfleet.device.camera.CameraControl;
import com.camfleet.device.metrics.MetricsService;
import com.camfleet.device.ws.WebSocketHub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;

/**
 * Pushes a telemetry frame to every connected WebSocket client at a fixed period.
 * <p>
 * Runs on its own timer, independent of request handling. A tick with no clients skips the
 * collaborator call. A failing collaborator, or one that does not answer within one period,
 * costs one frame and the timer keeps going.
 * </p>
 */
public class TelemetryBroadcaster {
    private static final Logger log = LoggerFactory.getLogger(TelemetryBroadcaster.class);

    private final CameraControl camera;
    private final WebSocketHub hub;
    private final MetricsService metricsService;
    private final Duration period;
    private final Scheduler scheduler;

    public TelemetryBroadcaster(CameraControl camera, WebSocketHub hub, MetricsService metricsService,
                                Duration period) {
        this(camera, hub, metricsService, period, Schedulers.parallel());
    }

    public TelemetryBroadcaster(CameraControl camera, WebSocketHub hub, MetricsService metricsService,
                                Duration period, Scheduler scheduler) {
        this.camera = camera;
        this.hub = hub;
        this.metricsService = metricsService;
        this.period = period;
        this.scheduler = scheduler;
    }

    /**
     * Starts the timer.
     *
     * @return handle that stops it when disposed
     */
    public Disposable start() {
        log.info("Broadcasting telemetry every {}ms", period.toMillis());
        return Flux.interval(period, scheduler)
                .onBackpressureDrop()
                .concatMap(tick -> broadcastOnce()
                        .onErrorResume(err -> {
                            log.warn("Telemetry tick failed: {}", err.toString());
                            return Mono.empty();
                        }))
                .subscribe();
    }

    /**
     * Reads one telemetry snapshot and broadcasts it.
     *
     * @return number of clients the frame was queued for
     */
    public Mono<Integer> broadcastOnce() {
        if (hub.clientCount() == 0) {
            return Mono.just(0);
        }
        return camera.currentTelemetry()
                // an unanswered read would otherwise hold every later tick behind it
                .timeout(period, scheduler)
                .map(JsonUtils::writeValueAsString)
                .map(frame -> {
                    metricsService.recordTelemetryFrame();
                    return hub.broadcast(frame);
                });
    }
}
