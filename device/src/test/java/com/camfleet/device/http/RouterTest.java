package com.camfleet.device.http;

import com.camfleet.core.msg.ErrorResponse;
import com.camfleet.core.util.JsonUtils;
import com.camfleet.device.camera.StubCameraControl;
import com.camfleet.device.controller.CameraController;
import com.camfleet.device.controller.StatusController;
import com.camfleet.device.controller.StreamController;
import com.camfleet.device.metrics.MetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Pipeline tests: CORS → auth → rate limit → exact-match dispatch → handler.
 */
class RouterTest {
    private static final String TOKEN = "secret-token";

    private final AtomicLong clock = new AtomicLong(TimeUnit.SECONDS.toNanos(1));
    private StubCameraControl camera;
    private MetricsService metricsService;

    @BeforeEach
    void setUp() {
        camera = new StubCameraControl();
        metricsService = new MetricsService(new SimpleMeterRegistry(), "camera-test");
    }

    private Router router(boolean authEnabled) {
        RateLimiter limiter = new RateLimiter(Duration.ofMillis(50), clock::get);
        Router router = new Router(List.of(
                new CorsMiddleware(),
                new AuthMiddleware(authEnabled, TOKEN),
                new RateLimitMiddleware(RateLimitMiddleware.CAMERA_PATHS, limiter, metricsService)
        ));
        Duration timeout = Duration.ofMillis(200);
        new StatusController(camera, timeout).registerRoutes(router);
        new StreamController(camera, timeout).registerRoutes(router);
        new CameraController(camera, timeout).registerRoutes(router);
        return router;
    }

    private static HttpRequest post(String path, String json, Map<String, String> headers) {
        byte[] body = json == null ? null : json.getBytes(StandardCharsets.UTF_8);
        return HttpRequest.of(HttpMethod.POST, path, headers, body);
    }

    private static ErrorResponse error(HttpResult result) {
        return JsonUtils.readValue(result.getBody(), ErrorResponse.class);
    }

    @Test
    void testUnknownPath_NotFound() {
        HttpResult result = router(false).route(HttpRequest.of(HttpMethod.GET, "/api/v1/nope")).block();

        assertEquals(404, result.getStatus());
        assertEquals("NOT_FOUND", error(result).getCode());
        assertEquals("Resource not found: Endpoint not found: GET /api/v1/nope", error(result).getMessage());
    }

    @Test
    void testWrongMethodOnKnownPath_NotFound() {
        HttpResult result = router(false).route(HttpRequest.of(HttpMethod.DELETE, "/api/v1/status")).block();

        assertEquals(404, result.getStatus());
        assertTrue(camera.calls.isEmpty());
    }

    @Test
    void testPathWithTrailingSlash_NotMatched() {
        HttpResult result = router(false).route(HttpRequest.of(HttpMethod.GET, "/api/v1/status/")).block();

        assertEquals(404, result.getStatus());
    }

    @Test
    void testPreflight_ShortCircuitsWithCorsHeaders() {
        HttpResult result = router(true).route(HttpRequest.of(HttpMethod.OPTIONS, "/api/v1/camera")).block();

        assertEquals(200, result.getStatus());
        assertEquals("*", result.getHeaders().get("Access-Control-Allow-Origin"));
        assertEquals("GET, POST, PUT, DELETE, OPTIONS", result.getHeaders().get("Access-Control-Allow-Methods"));
        assertEquals("86400", result.getHeaders().get("Access-Control-Max-Age"));
        assertTrue(camera.calls.isEmpty());
    }

    @Test
    void testAuthEnabled_MissingHeader_Unauthorized() {
        HttpResult result = router(true).route(HttpRequest.of(HttpMethod.GET, "/api/v1/status")).block();

        assertEquals(401, result.getStatus());
        assertEquals("UNAUTHORIZED", error(result).getCode());
        assertEquals("Invalid or missing bearer token", error(result).getMessage());
        assertEquals("*", result.getHeaders().get("Access-Control-Allow-Origin"));
        assertTrue(camera.calls.isEmpty());
    }

    @Test
    void testAuthEnabled_WrongToken_Unauthorized() {
        HttpRequest request = HttpRequest.of(HttpMethod.GET, "/api/v1/status",
                Map.of("Authorization", "Bearer secret-tokem"), null);

        assertEquals(401, router(true).route(request).block().getStatus());
    }

    @Test
    void testAuthEnabled_CorrectToken_ReachesHandler() {
        HttpRequest request = HttpRequest.of(HttpMethod.GET, "/api/v1/status",
                Map.of("authorization", "Bearer " + TOKEN), null);

        HttpResult result = router(true).route(request).block();

        assertEquals(200, result.getStatus());
        assertEquals(List.of("getStatus"), camera.calls);
        assertTrue(result.bodyAsString().contains("\"alias\":\"stub\""));
    }

    @Test
    void testCameraPostTooSoon_RateLimitedWithWait() {
        Router router = router(false);
        String body = "{\"wb_mode\":\"manual\",\"wb_kelvin\":5000}";

        HttpResult first = router.route(post("/api/v1/camera", body, Map.of())).block();
        clock.addAndGet(TimeUnit.MILLISECONDS.toNanos(10));
        HttpResult second = router.route(post("/api/v1/camera", body, Map.of())).block();

        assertEquals(200, first.getStatus());
        assertEquals(429, second.getStatus());
        assertEquals("RATE_LIMITED", error(second).getCode());
        assertEquals("Too many requests, wait 40ms", error(second).getMessage());
        assertEquals(1, camera.cameraUpdates.size());
        assertEquals(1.0, metricsService.rateLimitedCount());
    }

    @Test
    void testCameraPostsSpacedOut_BothSucceed() {
        Router router = router(false);
        String body = "{\"iso\":400}";

        HttpResult first = router.route(post("/api/v1/camera", body, Map.of())).block();
        clock.addAndGet(TimeUnit.MILLISECONDS.toNanos(60));
        HttpResult second = router.route(post("/api/v1/camera", body, Map.of())).block();

        assertEquals(200, first.getStatus());
        assertEquals(200, second.getStatus());
        assertEquals(400, camera.cameraUpdates.get(1).getIso());
    }

    @Test
    void testNonCameraPathsAreNotRateLimited() {
        Router router = router(false);

        for (int i = 0; i < 3; i++) {
            assertEquals(200, router.route(HttpRequest.of(HttpMethod.GET, "/api/v1/status")).block().getStatus());
        }
    }

    @Test
    void testMissingBody_MissingBody() {
        HttpResult result = router(false).route(post("/api/v1/stream/start", null, Map.of())).block();

        assertEquals(400, result.getStatus());
        assertEquals("MISSING_BODY", error(result).getCode());
    }

    @Test
    void testMalformedJson_InvalidRequest() {
        HttpResult result = router(false).route(post("/api/v1/stream/start", "{not json", Map.of())).block();

        assertEquals(400, result.getStatus());
        assertEquals("INVALID_REQUEST", error(result).getCode());
        assertTrue(camera.calls.isEmpty());
    }

    @Test
    void testStreamStartMissingField_InvalidRequest() {
        HttpResult result = router(false).route(post("/api/v1/stream/start",
                "{\"resolution\":\"1920x1080\",\"framerate\":30,\"codec\":\"h264\"}", Map.of())).block();

        assertEquals(400, result.getStatus());
        assertTrue(error(result).getMessage().contains("bitrate"));
        assertTrue(camera.calls.isEmpty());
    }

    @Test
    void testStreamStart_CallsCollaboratorOnce() {
        HttpResult result = router(false).route(post("/api/v1/stream/start",
                "{\"resolution\":\"1920x1080\",\"framerate\":30,\"bitrate\":10000000,\"codec\":\"h264\"}",
                Map.of())).block();

        assertEquals(200, result.getStatus());
        assertTrue(result.bodyAsString().contains("\"success\":true"));
        assertTrue(result.bodyAsString().contains("\"message\":\"Stream started\""));
        assertEquals(List.of("startStream"), camera.calls);
    }

    @Test
    void testCollaboratorFailure_MappedToTypedCode() {
        camera.failWith = new IllegalStateException("encoder busy");

        HttpResult result = router(false).route(post("/api/v1/stream/stop", null, Map.of())).block();

        assertEquals(500, result.getStatus());
        assertEquals("STREAM_STOP_FAILED", error(result).getCode());
        assertEquals("Stream stop failed: encoder busy", error(result).getMessage());
    }

    @Test
    void testCollaboratorTimeout_RequestTimeout() {
        camera.hang = true;

        HttpResult result = router(false).route(HttpRequest.of(HttpMethod.GET, "/api/v1/status")).block();

        assertEquals(408, result.getStatus());
        assertEquals("REQUEST_TIMEOUT", error(result).getCode());
    }

    @Test
    void testInvalidAlias_Rejected() {
        HttpRequest request = HttpRequest.of(HttpMethod.PUT, "/api/v1/settings/alias", Map.of(),
                "{\"alias\":\"   \"}".getBytes(StandardCharsets.UTF_8));

        HttpResult result = router(false).route(request).block();

        assertEquals(400, result.getStatus());
        assertEquals("INVALID_ALIAS", error(result).getCode());
        assertEquals("Alias must be 1-64 characters", error(result).getMessage());
    }

    @Test
    void testLogsDownload_NotImplemented() {
        HttpResult result = router(false).route(HttpRequest.of(HttpMethod.GET, "/api/v1/logs.zip")).block();

        assertEquals(501, result.getStatus());
        assertEquals("NOT_IMPLEMENTED", error(result).getCode());
    }

    @Test
    void testUnexpectedHandlerException_InternalError() {
        Router router = router(false);
        router.get("/boom", req -> {
            throw new IllegalStateException("kaput");
        });

        HttpResult result = router.route(HttpRequest.of(HttpMethod.GET, "/boom")).block();

        assertEquals(500, result.getStatus());
        assertEquals("INTERNAL_ERROR", error(result).getCode());
        assertEquals("Internal error: kaput", error(result).getMessage());
        assertTrue(result.getHeaders().get("Content-Type").startsWith("application/json"));
    }

    @Test
    void testDuplicateRoute_Rejected() {
        Router router = router(false);
        assertThrows(IllegalStateException.class,
                () -> router.get("/api/v1/status", req -> Mono.empty()));
    }
}
