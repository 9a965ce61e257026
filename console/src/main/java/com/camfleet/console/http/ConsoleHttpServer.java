package com.camfleet.console.http;

import com.camfleet.console.client.DeviceCallException;
import com.camfleet.console.client.IDeviceClient;
import com.camfleet.console.command.Command;
import com.camfleet.console.command.CommandOrchestrator;
import com.camfleet.console.command.CommandType;
import com.camfleet.console.command.SettingsDebouncer;
import com.camfleet.console.config.ConsoleConfig;
import com.camfleet.console.discovery.DiscoveryService;
import com.camfleet.console.profile.ProfileService;
import com.camfleet.console.profile.ProfileSettings;
import com.camfleet.console.registry.DeviceRegistry;
import com.camfleet.core.error.ApiException;
import com.camfleet.core.error.ErrorCode;
import com.camfleet.core.metrics.PrometheusMetricsExporter;
import com.camfleet.core.model.AliasUpdateRequest;
import com.camfleet.core.model.CameraSettingsRequest;
import com.camfleet.core.msg.ErrorResponse;
import com.camfleet.core.msg.SuccessResponse;
import com.camfleet.core.util.JsonUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;
import reactor.netty.http.server.HttpServerRoutes;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

/**
 * Operator REST API of the console.
 * <p>
 * JSON bodies use snake_case; every error is a {@code {code, message}} body. Group routes always
 * answer 200 with one result per requested device, whatever the individual outcomes.
 * </p>
 */
public class ConsoleHttpServer {
    private static final Logger log = LoggerFactory.getLogger(ConsoleHttpServer.class);

    private static final String API = "/api/v1";
    private static final String APPLICATION_JSON = "application/json";

    private final ConsoleConfig config;
    private final DeviceRegistry registry;
    private final IDeviceClient deviceClient;
    private final CommandOrchestrator orchestrator;
    private final SettingsDebouncer debouncer;
    private final DiscoveryService discovery;
    private final ProfileService profiles;
    private final PrometheusMetricsExporter metricsExporter;

    private DisposableServer server;

    public ConsoleHttpServer(ConsoleConfig config,
                             DeviceRegistry registry,
                             IDeviceClient deviceClient,
                             CommandOrchestrator orchestrator,
                             SettingsDebouncer debouncer,
                             DiscoveryService discovery,
                             ProfileService profiles,
                             PrometheusMetricsExporter metricsExporter) {
        this.config = config;
        this.registry = registry;
        this.deviceClient = deviceClient;
        this.orchestrator = orchestrator;
        this.debouncer = debouncer;
        this.discovery = discovery;
        this.profiles = profiles;
        this.metricsExporter = metricsExporter;
    }

    /**
     * Starts the HTTP server.
     *
     * @return the bound server
     */
    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
                .port(config.getHttpPort())
                .route(this::configureRoutes)
                .bind()
                .doOnNext(bound -> log.info("Console API started on port {}", bound.port()))
                .doOnError(err -> log.error("Failed to start console API", err))
                .block(Duration.ofSeconds(45));

        return server;
    }

    public int port() {
        return server.port();
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(20));
        }
    }

    private void configureRoutes(HttpServerRoutes routes) {
        routes
                .get("/healthz", (req, res) ->
                        res.status(200).sendString(Mono.just("OK"))
                )
                .get("/metrics", (req, res) ->
                        res.addHeader("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                                .sendString(Mono.just(metricsExporter.scrape()))
                                .then()
                )
                // Registry
                .get(API + "/devices", (req, res) ->
                        respond(res, HttpResponseStatus.OK, () -> Mono.just(registry.list()))
                )
                .post(API + "/devices", (req, res) ->
                        respond(res, HttpResponseStatus.CREATED, () -> body(req, ClaimRequest.class)
                                .flatMap(claim -> {
                                    if (claim.getHost() == null || claim.getHost().isBlank() || claim.getPort() == null) {
                                        return Mono.error(ApiException.invalidRequest("host and port are required"));
                                    }
                                    return registry.claim(claim.getHost().trim(), claim.getPort(), claim.getToken());
                                }))
                )
                .delete(API + "/devices", (req, res) ->
                        respond(res, HttpResponseStatus.OK, () -> {
                            registry.deleteAll();
                            return Mono.just(SuccessResponse.of("All cameras removed"));
                        })
                )
                .delete(API + "/devices/{id}", (req, res) ->
                        respond(res, HttpResponseStatus.OK, () -> {
                            registry.unclaim(req.param("id"));
                            return Mono.just(SuccessResponse.of("Camera removed"));
                        })
                )
                .put(API + "/devices/{id}/alias", (req, res) ->
                        respond(res, HttpResponseStatus.OK, () -> body(req, AliasUpdateRequest.class)
                                .map(update -> registry.rename(req.param("id"), update.getAlias())))
                )
                .get(API + "/devices/{id}/status", (req, res) ->
                        respond(res, HttpResponseStatus.OK, () ->
                                deviceClient.getStatus(registry.require(req.param("id")).address()))
                )
                .get(API + "/devices/{id}/capabilities", (req, res) ->
                        respond(res, HttpResponseStatus.OK, () ->
                                deviceClient.getCapabilities(registry.require(req.param("id")).address()))
                )
                .get(API + "/devices/{id}/video/settings", (req, res) ->
                        respond(res, HttpResponseStatus.OK, () ->
                                deviceClient.getVideoSettings(registry.require(req.param("id")).address()))
                )
                .post(API + "/devices/{id}/camera/wb/measure", (req, res) ->
                        respond(res, HttpResponseStatus.OK, () ->
                                deviceClient.measureWhiteBalance(registry.require(req.param("id")).address()))
                )
                // Commands
                .post(API + "/devices/{id}/commands", (req, res) ->
                        respond(res, HttpResponseStatus.OK, () -> body(req, CommandRequest.class)
                                .flatMap(request -> {
                                    String id = req.param("id");
                                    CommandType type = commandType(request.getOp());
                                    Command command = Command.single(type, id, payload(type, request.getPayload()));
                                    return orchestrator.execute(id, command)
                                            .thenReturn(SuccessResponse.of(request.getOp() + " sent to " + id));
                                }))
                )
                .post(API + "/devices/{id}/camera/debounced", (req, res) ->
                        respond(res, HttpResponseStatus.ACCEPTED, () -> body(req, CameraSettingsRequest.class)
                                .map(camera -> {
                                    String id = registry.require(req.param("id")).getId();
                                    debouncer.submit(id, CommandType.UPDATE_CAMERA_SETTINGS, camera);
                                    return SuccessResponse.of("Camera settings queued");
                                }))
                )
                .post(API + "/groups/commands", (req, res) ->
                        respond(res, HttpResponseStatus.OK, () -> body(req, CommandRequest.class)
                                .flatMap(request -> {
                                    CommandType type = commandType(request.getOp());
                                    return orchestrator.executeGroup(Command.of(type,
                                            requireIds(request.getDeviceIds()), payload(type, request.getPayload())));
                                }))
                )
                .post(API + "/fleet/start", (req, res) ->
                        respond(res, HttpResponseStatus.OK, orchestrator::startAll)
                )
                .post(API + "/fleet/stop", (req, res) ->
                        respond(res, HttpResponseStatus.OK, orchestrator::stopAll)
                )
                // Discovery
                .get(API + "/discovery/candidates", (req, res) ->
                        respond(res, HttpResponseStatus.OK, () -> Mono.just(
                                "true".equals(queryParam(req, "all")) ? discovery.candidates() : discovery.newCandidates()))
                )
                // Profiles
                .get(API + "/profiles", (req, res) ->
                        respond(res, HttpResponseStatus.OK, () -> Mono.just(profiles.list()))
                )
                .put(API + "/profiles/{name}", (req, res) ->
                        respond(res, HttpResponseStatus.OK, () -> body(req, ProfileSettings.class)
                                .map(settings -> profiles.save(req.param("name"), settings)))
                )
                .delete(API + "/profiles/{name}", (req, res) ->
                        respond(res, HttpResponseStatus.OK, () -> {
                            profiles.delete(req.param("name"));
                            return Mono.just(SuccessResponse.of("Profile deleted"));
                        })
                )
                .post(API + "/profiles/{name}/apply", (req, res) ->
                        respond(res, HttpResponseStatus.OK, () -> body(req, ApplyProfileRequest.class)
                                .flatMap(apply -> profiles.apply(req.param("name"), requireIds(apply.getDeviceIds()))))
                );
    }

    /**
     * Runs a handler and writes its value as JSON, or its failure as {@code {code, message}}.
     * The handler is invoked lazily so synchronous throws are reported the same way.
     */
    private Mono<Void> respond(HttpServerResponse res, HttpResponseStatus status, Supplier<Mono<?>> handler) {
        return Mono.defer(handler)
                .map(JsonUtils::writeValueAsString)
                .flatMap(json -> res.status(status)
                        .header("Content-Type", APPLICATION_JSON)
                        .sendString(Mono.just(json))
                        .then())
                .onErrorResume(err -> sendError(res, err));
    }

    private Mono<Void> sendError(HttpServerResponse res, Throwable err) {
        int status;
        ErrorResponse body;
        if (err instanceof ApiException api) {
            status = api.getHttpStatus();
            body = api.toErrorResponse();
            log.warn("Request failed with {}: {}", body.getCode(), body.getMessage());
        } else if (err instanceof DeviceCallException call) {
            ApiException mapped = fromDeviceCall(call);
            status = call.getKind() == DeviceCallException.FailureKind.HTTP_STATUS
                    ? call.getHttpStatus() : mapped.getHttpStatus();
            body = mapped.toErrorResponse();
            log.warn("Device call to {} failed with {}: {}", call.getDeviceId(), call.getKind(), call.getMessage());
        } else {
            ApiException internal = ApiException.internal(err);
            status = internal.getHttpStatus();
            body = internal.toErrorResponse();
            log.error("Unhandled error in console API", err);
        }
        return res.status(status)
                .header("Content-Type", APPLICATION_JSON)
                .sendString(Mono.just(JsonUtils.writeValueAsString(body)))
                .then();
    }

    static ApiException fromDeviceCall(DeviceCallException call) {
        return switch (call.getKind()) {
            case TIMEOUT -> new ApiException(ErrorCode.REQUEST_TIMEOUT, call.getMessage(), call);
            case NOT_FOUND -> new ApiException(ErrorCode.NOT_FOUND, call.getMessage(), call);
            case HTTP_STATUS -> new ApiException(knownCode(call.getErrorCode()), call.getMessage(), call);
            case CONNECTION, DECODE -> new ApiException(ErrorCode.HANDLER_FAILED, call.getMessage(), call);
        };
    }

    private static ErrorCode knownCode(String code) {
        if (code == null) {
            return ErrorCode.HANDLER_FAILED;
        }
        try {
            return ErrorCode.valueOf(code);
        } catch (IllegalArgumentException e) {
            return ErrorCode.HANDLER_FAILED;
        }
    }

    private static <T> Mono<T> body(HttpServerRequest req, Class<T> type) {
        return req.receive()
                .aggregate()
                .asString()
                .defaultIfEmpty("")
                .map(text -> {
                    if (text.isBlank()) {
                        throw ApiException.missingBody();
                    }
                    try {
                        return JsonUtils.readValue(text, type);
                    } catch (UncheckedIOException e) {
                        Throwable cause = e.getCause();
                        String detail = cause instanceof JsonProcessingException jpe
                                ? jpe.getOriginalMessage() : ApiException.summarize(e);
                        throw ApiException.invalidRequest(detail);
                    }
                });
    }

    private static CommandType commandType(String op) {
        if (op == null) {
            throw ApiException.invalidRequest("op is required");
        }
        return CommandType.fromWire(op)
                .orElseThrow(() -> ApiException.invalidRequest("unknown op " + op));
    }

    private static Object payload(CommandType type, JsonNode node) {
        if (type.payloadType() == null || node == null || node.isNull()) {
            return null;
        }
        try {
            return JsonUtils.mapper().treeToValue(node, type.payloadType());
        } catch (JsonProcessingException e) {
            throw ApiException.invalidRequest(e.getOriginalMessage());
        }
    }

    private static List<String> requireIds(List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            throw ApiException.invalidRequest("device_ids must not be empty");
        }
        return ids;
    }

    private static String queryParam(HttpServerRequest req, String name) {
        List<String> values = new QueryStringDecoder(req.uri()).parameters().get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
