package com.camfleet.console.client;

import com.camfleet.console.metrics.MetricsService;
import com.camfleet.core.model.CameraSettingsRequest;
import com.camfleet.core.model.NdiState;
import com.camfleet.core.model.StatusResponse;
import com.camfleet.core.model.WhiteBalanceMeasureResponse;
import com.camfleet.core.model.WhiteBalanceMode;
import com.camfleet.core.msg.TelemetryMessage;
import com.camfleet.core.util.JsonUtils;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Runs the client against a scripted device server on an ephemeral port.
 */
class DeviceClientTest {
    private static final String TOKEN = "secret";

    private DisposableServer device;
    private SimpleMeterRegistry meterRegistry;
    private DeviceClient client;

    private final AtomicReference<String> lastAuthorization = new AtomicReference<>();
    private final AtomicReference<String> lastBody = new AtomicReference<>();

    @BeforeEach
    void setUp() {
        device = HttpServer.create()
                .port(0)
                .route(routes -> routes
                        .get("/api/v1/status", (req, res) -> {
                            String auth = req.requestHeaders().get("Authorization");
                            lastAuthorization.set(auth);
                            if (!("Bearer " + TOKEN).equals(auth)) {
                                return res.status(401).header("Content-Type", "application/json")
                                        .sendString(Mono.just("{\"code\":\"UNAUTHORIZED\","
                                                + "\"message\":\"Invalid or missing bearer token\"}"));
                            }
                            return res.header("Content-Type", "application/json")
                                    .sendString(Mono.just(JsonUtils.writeValueAsString(StatusResponse.builder()
                                            .alias("Stage Left").ndiState(NdiState.STREAMING).build())));
                        })
                        .post("/api/v1/stream/start", (req, res) ->
                                res.status(429).header("Content-Type", "application/json")
                                        .sendString(Mono.just("{\"code\":\"RATE_LIMITED\","
                                                + "\"message\":\"Too many requests, wait 40ms\"}")))
                        .post("/api/v1/stream/stop", (req, res) ->
                                Mono.delay(Duration.ofSeconds(2)).then(res.sendString(Mono.just("{}")).then()))
                        .post("/api/v1/camera", (req, res) ->
                                req.receive().aggregate().asString()
                                        .doOnNext(lastBody::set)
                                        .then(res.sendString(Mono.just("{\"success\":true,\"message\":\"ok\"}")).then()))
                        .post("/api/v1/encoder/force_keyframe", (req, res) ->
                                res.status(502).sendString(Mono.just("bad gateway")))
                        .get("/api/v1/capabilities", (req, res) ->
                                res.sendString(Mono.just("not json")))
                        .get("/api/v1/video/settings", (req, res) ->
                                res.sendString(Mono.just("{\"selected_preset_id\":\"720p30\"}")))
                        .post("/api/v1/camera/wb/measure", (req, res) ->
                                res.sendString(Mono.just("{\"scene_cct_k\":5600,\"tint\":-1.5}")))
                        .put("/api/v1/settings/alias", (req, res) ->
                                req.receive().aggregate().asString()
                                        .doOnNext(lastBody::set)
                                        .then(res.sendString(Mono.just("{\"alias\":\"Booth\"}")).then()))
                        .ws("/ws", (in, out) -> out.sendString(Flux.just(
                                JsonUtils.writeValueAsString(TelemetryMessage.builder().fps(30.0).build()),
                                "garbage",
                                JsonUtils.writeValueAsString(TelemetryMessage.builder().fps(29.0).build())))))
                .bindNow();
        meterRegistry = new SimpleMeterRegistry();
        client = new DeviceClient(Duration.ofMillis(300), new MetricsService(meterRegistry));
    }

    @AfterEach
    void tearDown() {
        device.disposeNow();
    }

    private DeviceAddress address(String token) {
        return new DeviceAddress("localhost", device.port(), token);
    }

    private static boolean failedWith(Throwable err, DeviceCallException.FailureKind kind) {
        return err instanceof DeviceCallException && ((DeviceCallException) err).getKind() == kind;
    }

    @Test
    void testGetStatus_SendsBearerToken() {
        StatusResponse status = client.getStatus(address(TOKEN)).block();

        assertEquals("Stage Left", status.getAlias());
        assertEquals(NdiState.STREAMING, status.getNdiState());
        assertEquals("Bearer secret", lastAuthorization.get());
        assertEquals(1, meterRegistry.get("camfleet.console.device.call.latency")
                .tag("op", "status").tag("outcome", "success").timer().count());
    }

    @Test
    void testGetStatus_EmptyTokenSendsNoHeader() {
        StepVerifier.create(client.getStatus(address("")))
                .expectErrorSatisfies(err -> {
                    assertTrue(failedWith(err, DeviceCallException.FailureKind.HTTP_STATUS));
                    DeviceCallException call = (DeviceCallException) err;
                    assertEquals(401, call.getHttpStatus());
                    assertEquals("UNAUTHORIZED", call.getErrorCode());
                })
                .verify(Duration.ofSeconds(5));
        assertNull(lastAuthorization.get());
    }

    @Test
    void testErrorBody_ParsedIntoMessage() {
        StepVerifier.create(client.startStream(address(TOKEN), null))
                .expectErrorMessage("RATE_LIMITED: Too many requests, wait 40ms")
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void testNonJsonErrorBody_FallsBackToStatusLine() {
        StepVerifier.create(client.forceKeyframe(address(TOKEN)))
                .expectErrorMessage("HTTP 502: Bad Gateway")
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void testSlowDevice_TimesOut() {
        StepVerifier.create(client.stopStream(address(TOKEN)))
                .expectErrorMatches(err -> failedWith(err, DeviceCallException.FailureKind.TIMEOUT)
                        && err.getMessage().equals("Request timed out after 300ms"))
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void testClosedPort_ConnectionFailure() {
        DisposableServer gone = HttpServer.create().port(0).bindNow();
        int port = gone.port();
        gone.disposeNow();

        StepVerifier.create(client.getStatus(new DeviceAddress("localhost", port, "")))
                .expectErrorMatches(err -> failedWith(err, DeviceCallException.FailureKind.CONNECTION))
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void testUnreadableBody_DecodeFailure() {
        StepVerifier.create(client.getCapabilities(address(TOKEN)))
                .expectErrorMatches(err -> failedWith(err, DeviceCallException.FailureKind.DECODE))
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void testCameraSettings_SentAsSnakeCase() {
        client.updateCameraSettings(address(TOKEN),
                CameraSettingsRequest.builder().wbMode(WhiteBalanceMode.MANUAL).wbKelvin(5000).build()).block();

        assertEquals("{\"wb_mode\":\"manual\",\"wb_kelvin\":5000}", lastBody.get());
    }

    @Test
    void testTelemetry_SkipsUnreadableFrames() {
        StepVerifier.create(client.telemetry(address(TOKEN)))
                .expectNextMatches(frame -> frame.getFps() == 30.0)
                .expectNextMatches(frame -> frame.getFps() == 29.0)
                .verifyComplete();
    }

    @Test
    void testReadOnlyQueries_Decoded() {
        assertEquals("720p30", client.getVideoSettings(address(TOKEN)).block().getSelectedPresetId());

        WhiteBalanceMeasureResponse wb = client.measureWhiteBalance(address(TOKEN)).block();
        assertEquals(5600, wb.getSceneCctK());
        assertEquals(-1.5, wb.getTint());
    }

    @Test
    void testUpdateAlias_SendsAliasBody() {
        assertEquals("Booth", client.updateAlias(address(TOKEN), "Booth").block().getAlias());
        assertEquals("{\"alias\":\"Booth\"}", lastBody.get());
    }
}
