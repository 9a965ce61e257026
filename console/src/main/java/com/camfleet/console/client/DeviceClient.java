package com.camfleet.console.client;

import com.camfleet.console.metrics.MetricsService;
import com.camfleet.core.model.AliasUpdateRequest;
import com.camfleet.core.model.AliasUpdateResponse;
import com.camfleet.core.model.CameraSettingsRequest;
import com.camfleet.core.model.Capability;
import com.camfleet.core.model.StatusResponse;
import com.camfleet.core.model.StreamStartRequest;
import com.camfleet.core.model.VideoSettingsResponse;
import com.camfleet.core.model.VideoSettingsUpdateRequest;
import com.camfleet.core.model.WhiteBalanceMeasureResponse;
import com.camfleet.core.msg.ErrorResponse;
import com.camfleet.core.msg.TelemetryMessage;
import com.camfleet.core.util.JsonUtils;
import com.fasterxml.jackson.core.type.TypeReference;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.timeout.ReadTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.ByteBufFlux;
import reactor.netty.http.client.HttpClient;
import reactor.netty.http.client.HttpClientResponse;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Device API client over reactor-netty {@link HttpClient}.
 * <p>
 * One shared connection pool serves every device; host, port and token come from the
 * {@link DeviceAddress} of each call. Each call is bounded by the request timeout on its own,
 * so a slow device never holds up calls to other devices.
 * </p>
 */
public class DeviceClient implements IDeviceClient {
    private static final Logger log = LoggerFactory.getLogger(DeviceClient.class);

    private static final String API = "/api/v1";

    private final HttpClient httpClient;
    private final HttpClient wsClient;
    private final Duration requestTimeout;
    private final MetricsService metricsService;

    public DeviceClient(Duration requestTimeout, MetricsService metricsService) {
        this.requestTimeout = requestTimeout;
        this.metricsService = metricsService;
        this.httpClient = HttpClient.create()
                .headers(h -> h.set(HttpHeaderNames.ACCEPT, HttpHeaderValues.APPLICATION_JSON))
                // socket-level backstop; the per-call timeout in call() fires first
                .responseTimeout(requestTimeout.plusSeconds(1));
        // Telemetry streams stay open; no response timeout on the upgrade client
        this.wsClient = HttpClient.create();

        log.info("DeviceClient initialized with request timeout {}ms", requestTimeout.toMillis());
    }

    @Override
    public Mono<StatusResponse> getStatus(DeviceAddress device) {
        return call(device, "status", HttpMethod.GET, API + "/status", null)
                .map(body -> decode(device, body, StatusResponse.class));
    }

    @Override
    public Mono<List<Capability>> getCapabilities(DeviceAddress device) {
        return call(device, "capabilities", HttpMethod.GET, API + "/capabilities", null)
                .map(body -> decode(device, body, new TypeReference<List<Capability>>() {
                }));
    }

    @Override
    public Mono<Void> startStream(DeviceAddress device, StreamStartRequest request) {
        return call(device, "stream_start", HttpMethod.POST, API + "/stream/start", request).then();
    }

    @Override
    public Mono<Void> stopStream(DeviceAddress device) {
        return call(device, "stream_stop", HttpMethod.POST, API + "/stream/stop", null).then();
    }

    @Override
    public Mono<Void> updateCameraSettings(DeviceAddress device, CameraSettingsRequest request) {
        return call(device, "camera", HttpMethod.POST, API + "/camera", request).then();
    }

    @Override
    public Mono<VideoSettingsResponse> getVideoSettings(DeviceAddress device) {
        return call(device, "video_settings_get", HttpMethod.GET, API + "/video/settings", null)
                .map(body -> decode(device, body, VideoSettingsResponse.class));
    }

    @Override
    public Mono<Void> updateVideoSettings(DeviceAddress device, VideoSettingsUpdateRequest request) {
        return call(device, "video_settings_put", HttpMethod.PUT, API + "/video/settings", request).then();
    }

    @Override
    public Mono<Void> forceKeyframe(DeviceAddress device) {
        return call(device, "force_keyframe", HttpMethod.POST, API + "/encoder/force_keyframe", null).then();
    }

    @Override
    public Mono<WhiteBalanceMeasureResponse> measureWhiteBalance(DeviceAddress device) {
        return call(device, "wb_measure", HttpMethod.POST, API + "/camera/wb/measure", null)
                .map(body -> decode(device, body, WhiteBalanceMeasureResponse.class));
    }

    @Override
    public Mono<AliasUpdateResponse> updateAlias(DeviceAddress device, String alias) {
        return call(device, "alias", HttpMethod.PUT, API + "/settings/alias", new AliasUpdateRequest(alias))
                .map(body -> decode(device, body, AliasUpdateResponse.class));
    }

    @Override
    public Flux<TelemetryMessage> telemetry(DeviceAddress device) {
        return withAuth(wsClient, device)
                .websocket()
                .uri("ws://" + device.getHost() + ":" + device.getPort() + "/ws")
                .handle((inbound, outbound) -> inbound.receive().asString())
                .flatMap(json -> {
                    try {
                        return Mono.just(JsonUtils.readValue(json, TelemetryMessage.class));
                    } catch (RuntimeException e) {
                        log.warn("Dropping unreadable telemetry frame from {}: {}", device.id(), e.getMessage());
                        return Mono.empty();
                    }
                });
    }

    /**
     * Issues one request and resolves to the response body of a 2xx answer.
     */
    private Mono<String> call(DeviceAddress device, String op, HttpMethod method, String path, Object body) {
        long startedAt = System.nanoTime();

        HttpClient.RequestSender sender = withAuth(httpClient, device)
                .headers(h -> {
                    if (body != null) {
                        h.set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON);
                    }
                })
                .request(method)
                .uri(device.baseUrl() + path);

        HttpClient.ResponseReceiver<?> receiver = body != null
                ? sender.send(ByteBufFlux.fromString(Mono.just(JsonUtils.writeValueAsString(body))))
                : sender;

        return receiver
                .responseSingle((response, content) -> content.asString(StandardCharsets.UTF_8)
                        .defaultIfEmpty("")
                        .flatMap(text -> checkStatus(device, response, text)))
                .timeout(requestTimeout)
                .onErrorMap(err -> !(err instanceof DeviceCallException), err -> toCallException(device, err))
                .doOnSuccess(ignored -> metricsService.recordDeviceCall(op, MetricsService.OUTCOME_SUCCESS,
                        Duration.ofNanos(System.nanoTime() - startedAt)))
                .doOnError(err -> {
                    metricsService.recordDeviceCall(op, MetricsService.OUTCOME_FAILURE,
                            Duration.ofNanos(System.nanoTime() - startedAt));
                    log.warn("Device call {} to {} failed: {}", op, device.id(), err.getMessage());
                });
    }

    private static HttpClient withAuth(HttpClient client, DeviceAddress device) {
        if (!device.hasToken()) {
            return client;
        }
        return client.headers(h -> h.set(HttpHeaderNames.AUTHORIZATION, "Bearer " + device.getToken()));
    }

    private Mono<String> checkStatus(DeviceAddress device, HttpClientResponse response, String text) {
        int status = response.status().code();
        if (status >= 200 && status < 300) {
            return Mono.just(text);
        }
        String code = null;
        String message = response.status().reasonPhrase();
        try {
            ErrorResponse error = JsonUtils.readValue(text, ErrorResponse.class);
            if (error.getCode() != null) {
                code = error.getCode();
                message = error.getMessage();
            }
        } catch (RuntimeException e) {
            log.debug("Non-JSON error body from {}: {}", device.id(), text);
        }
        return Mono.error(DeviceCallException.httpStatus(device.id(), status, code, message));
    }

    private DeviceCallException toCallException(DeviceAddress device, Throwable err) {
        if (err instanceof TimeoutException || err instanceof ReadTimeoutException) {
            return DeviceCallException.timeout(device.id(), requestTimeout.toMillis());
        }
        // refused, reset, unresolved host and friends
        return DeviceCallException.connection(device.id(), err);
    }

    private static <T> T decode(DeviceAddress device, String body, Class<T> type) {
        try {
            return JsonUtils.readValue(body, type);
        } catch (RuntimeException e) {
            throw DeviceCallException.decode(device.id(), e);
        }
    }

    private static <T> T decode(DeviceAddress device, String body, TypeReference<T> type) {
        try {
            return JsonUtils.readValue(body, type);
        } catch (RuntimeException e) {
            throw DeviceCallException.decode(device.id(), e);
        }
    }
}
