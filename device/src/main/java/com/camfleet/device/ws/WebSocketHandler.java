package com.camfleet.device.ws;

import com.camfleet.core.error.ApiException;
import com.camfleet.core.msg.CommandMessage;
import com.camfleet.core.util.JsonUtils;
import com.camfleet.device.config.DeviceConfig;
import com.camfleet.device.controller.CameraController;
import com.camfleet.device.http.RateLimiter;
import com.camfleet.device.metrics.MetricsService;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.channel.AbortedException;
import reactor.netty.http.websocket.WebsocketInbound;
import reactor.netty.http.websocket.WebsocketOutbound;

import java.io.UncheckedIOException;
import java.util.OptionalLong;
import java.util.UUID;

/**
 * Lifecycle of one device WebSocket connection.
 * <p>
 * Protocol (server → client):
 * <ul>
 *   <li>telemetry: {@code {fps, bitrate, queue_ms, battery, temp_c, wifi_rssi, ndi_state, ...}}</li>
 *   <li>error: {@code {code, message}}, only to the client whose command failed</li>
 * </ul>
 * </p>
 * <p>
 * Protocol (client → server):
 * <ul>
 *   <li>set: {@code {"op":"set","camera":{...}}}</li>
 * </ul>
 * Anything else is logged and dropped; the connection stays open.
 * </p>
 */
public class WebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(WebSocketHandler.class);

    private final DeviceConfig config;
    private final WebSocketHub hub;
    private final CameraController cameraController;
    private final RateLimiter rateLimiter;
    private final MetricsService metricsService;

    public WebSocketHandler(DeviceConfig config,
                            WebSocketHub hub,
                            CameraController cameraController,
                            RateLimiter rateLimiter,
                            MetricsService metricsService) {
        this.config = config;
        this.hub = hub;
        this.cameraController = cameraController;
        this.rateLimiter = rateLimiter;
        this.metricsService = metricsService;
    }

    public Publisher<Void> handle(WebsocketInbound inbound, WebsocketOutbound outbound) {
        WebSocketClient client = new WebSocketClient(UUID.randomUUID().toString(), config.getWsClientBuffer());
        hub.add(client);

        inbound.withConnection(connection -> {
            long idleTimeoutInMillis = config.getIdleTimeout() * 1000L;
            long pingIntervalInMillis = config.getPingInterval() * 1000L;

            connection.onWriteIdle(pingIntervalInMillis, () -> connection.outbound()
                            .sendObject(Mono.just(new PingWebSocketFrame()))
                            .then()
                            .subscribe(null, err -> log.debug("Ping to {} failed: {}", client.getId(), err.toString())))
                    .onReadIdle(idleTimeoutInMillis, () -> {
                        log.info("Closing idle WebSocket client {}", client.getId());
                        connection.dispose();
                    })
                    .onDispose(() -> disconnect(client));
        });

        return Mono.when(
                        outbound.sendString(client.frames()),
                        handleInboundMessages(inbound, client)
                )
                .onErrorResume(err -> {
                    if (!(err instanceof AbortedException)) {
                        log.error("WebSocket error for client {}", client.getId(), err);
                    }
                    return Mono.empty();
                })
                .doFinally(signal -> disconnect(client));
    }

    private void disconnect(WebSocketClient client) {
        hub.remove(client);
        client.close();
    }

    private Mono<Void> handleInboundMessages(WebsocketInbound inbound, WebSocketClient client) {
        return inbound.aggregateFrames()
                .receive()
                .asString()
                .concatMap(msg -> handleInboundMessage(client, msg)
                        .onErrorResume(err -> {
                            log.warn("Error processing message from {}: {}", client.getId(), err.getMessage());
                            return Mono.empty();
                        }))
                .then(Mono.fromRunnable(() -> disconnect(client)));
    }

    Mono<Void> handleInboundMessage(WebSocketClient client, String messageJson) {
        CommandMessage command;
        try {
            command = JsonUtils.readValue(messageJson, CommandMessage.class);
        } catch (UncheckedIOException e) {
            log.warn("Dropping malformed WebSocket payload from {}: {}", client.getId(), e.getCause().getMessage());
            return Mono.empty();
        }

        if (!CommandMessage.OP_SET.equals(command.getOp())) {
            log.warn("Unknown op '{}' from {}", command.getOp(), client.getId());
            return Mono.empty();
        }
        if (command.getCamera() == null) {
            log.warn("'set' without camera settings from {}", client.getId());
            return Mono.empty();
        }

        OptionalLong waitMs = rateLimiter.tryAcquire();
        if (waitMs.isPresent()) {
            metricsService.recordRateLimited(MetricsService.SOURCE_WS);
            replyError(client, ApiException.rateLimited(waitMs.getAsLong()));
            return Mono.empty();
        }

        return cameraController.applyCameraSettings(command.getCamera())
                .doOnSuccess(v -> log.debug("Applied camera settings from WebSocket client {}", client.getId()))
                .onErrorResume(ApiException.class, e -> {
                    replyError(client, e);
                    return Mono.empty();
                });
    }

    private void replyError(WebSocketClient client, ApiException error) {
        log.warn("WebSocket command from {} rejected: {} {}", client.getId(),
                error.getErrorCode().code(), error.getMessage());
        client.send(JsonUtils.writeValueAsString(error.toErrorResponse()));
    }
}
