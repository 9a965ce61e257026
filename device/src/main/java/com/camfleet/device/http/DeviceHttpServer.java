package com.camfleet.device.http;

import com.camfleet.core.error.ApiException;
import com.camfleet.device.config.DeviceConfig;
import com.camfleet.device.metrics.MetricsService;
import com.camfleet.device.ws.WebSocketUpgradeHandler;
import io.netty.channel.ChannelOption;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.QueryStringDecoder;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Reactor Netty front end of the device control server.
 * <p>
 * {@code GET /ws} with an upgrade header goes to the WebSocket upgrade handler; every other
 * request is aggregated, converted to an {@link HttpRequest} and passed to the {@link Router}.
 * </p>
 */
@RequiredArgsConstructor
public class DeviceHttpServer {
    private static final Logger log = LoggerFactory.getLogger(DeviceHttpServer.class);

    public static final String WS_PATH = "/ws";
    static final String HEALTH_PATH = "/healthz";

    private final DeviceConfig config;
    private final Router router;
    private final WebSocketUpgradeHandler upgradeHandler;
    private final MetricsService metricsService;
    private DisposableServer server;

    /**
     * Binds the server and blocks until it is listening.
     *
     * @return the bound server; {@code port()} is the real port when configured with 0
     */
    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
                .port(config.getHttpPort())
                .option(ChannelOption.SO_REUSEADDR, true)
                .handle(this::handle)
                .bind()
                .doOnNext(s -> log.info("HTTP server started on port {}", s.port()))
                .doOnError(err -> log.error("Failed to start HTTP server", err))
                .block(Duration.ofSeconds(45));
        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(10));
            log.info("HTTP server stopped");
        }
    }

    public int port() {
        return server.port();
    }

    private Mono<Void> handle(HttpServerRequest req, HttpServerResponse res) {
        String path = new QueryStringDecoder(req.uri()).path();

        if (WS_PATH.equals(path) && req.requestHeaders().containsValue(HttpHeaderNames.UPGRADE, "websocket", true)) {
            return upgradeHandler.handle(req, res);
        }
        // probes stay outside the middleware chain
        if (HEALTH_PATH.equals(path)) {
            return write(res, HttpResult.text(200, "text/plain; charset=utf-8", "OK"));
        }

        return req.receive()
                .aggregate()
                .asByteArray()
                .defaultIfEmpty(new byte[0])
                .flatMap(body -> HttpMethod.parse(req.method().name())
                        .map(method -> router.route(HttpRequest.of(method, path, headersOf(req), body)))
                        .orElseGet(() -> Mono.just(HttpResult.error(ApiException.methodNotAllowed(req.method().name())))))
                .flatMap(result -> write(res, result));
    }

    private Mono<Void> write(HttpServerResponse res, HttpResult result) {
        metricsService.recordHttpRequest(result.getStatus());
        res.status(result.getStatus());
        result.getHeaders().forEach(res::header);
        if (result.getBody().length == 0) {
            return res.send().then();
        }
        return res.sendByteArray(Mono.just(result.getBody())).then();
    }

    private static Map<String, String> headersOf(HttpServerRequest req) {
        Map<String, String> headers = new HashMap<>();
        req.requestHeaders().forEach(e -> headers.putIfAbsent(e.getKey(), e.getValue()));
        return headers;
    }
}
