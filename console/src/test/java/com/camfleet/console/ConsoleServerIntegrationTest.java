package com.camfleet.console;

import com.camfleet.console.client.StubDeviceClient;
import com.camfleet.console.config.ConsoleConfig;
import com.camfleet.console.discovery.StaticDiscoveryBrowser;
import com.camfleet.console.metrics.MetricsService;
import com.camfleet.core.metrics.MetricsTags;
import com.camfleet.core.metrics.PrometheusMetricsExporter;
import com.camfleet.core.msg.ErrorResponse;
import com.camfleet.core.msg.GroupOperationResult;
import com.camfleet.core.util.JsonUtils;
import com.fasterxml.jackson.core.type.TypeReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.publisher.Mono;
import reactor.netty.ByteBufFlux;
import reactor.netty.http.client.HttpClient;
import reactor.util.function.Tuple2;
import reactor.util.function.Tuples;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Binds the operator API on an ephemeral port over stubbed devices.
 */
class ConsoleServerIntegrationTest {
    private static final String A = "10.0.0.1:8888";
    private static final String B = "10.0.0.2:8888";

    @TempDir
    Path dataDir;

    private StubDeviceClient devices;
    private ConsoleServer server;
    private HttpClient http;

    @BeforeEach
    void setUp() {
        devices = new StubDeviceClient().alias(A, "cam-a").alias(B, "cam-b");
        ConsoleConfig config = ConsoleConfig.builder()
                .consoleId("console-it")
                .httpPort(0)
                .dataDir(dataDir)
                .requestTimeout(Duration.ofMillis(500))
                .maxConcurrentOperations(8)
                .refreshInterval(Duration.ofHours(1))
                .discoveryInterval(Duration.ofHours(1))
                .offlineAfterFailures(3)
                .debounceWindow(Duration.ofMillis(300))
                .discoveryStatic("cam-a@10.0.0.1:8888,cam-z@10.0.0.9:8888")
                .telemetryFeedEnabled(false)
                .build();
        PrometheusMetricsExporter exporter = new PrometheusMetricsExporter(MetricsTags.CONSOLE_ID, "console-it");
        server = new ConsoleServer(config, devices, new StaticDiscoveryBrowser(config.getDiscoveryStatic()),
                new MetricsService(exporter.getRegistry()), exporter);
        int port = server.start();
        http = HttpClient.create().baseUrl("http://localhost:" + port);
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private static Tuple2<Integer, String> exchange(HttpClient.ResponseReceiver<?> receiver) {
        return receiver.responseSingle((res, body) -> body.asString()
                        .defaultIfEmpty("")
                        .map(s -> Tuples.of(res.status().code(), s)))
                .block(Duration.ofSeconds(5));
    }

    private Tuple2<Integer, String> send(String method, String path, String json) {
        HttpClient client = http.headers(h -> h.set("Content-Type", "application/json"));
        HttpClient.RequestSender sender = switch (method) {
            case "PUT" -> client.put();
            case "DELETE" -> client.delete();
            default -> client.post();
        };
        return exchange(sender.uri(path).send(ByteBufFlux.fromString(Mono.just(json))));
    }

    private void claim(String host) {
        Tuple2<Integer, String> response = send("POST", "/api/v1/devices", "{\"host\":\"" + host + "\",\"port\":8888}");
        assertEquals(201, response.getT1(), response.getT2());
    }

    private static String errorCode(Tuple2<Integer, String> response) {
        return JsonUtils.readValue(response.getT2(), ErrorResponse.class).getCode();
    }

    @Test
    void testClaimAndList() {
        claim("10.0.0.1");

        Tuple2<Integer, String> list = exchange(http.get().uri("/api/v1/devices"));

        assertEquals(200, list.getT1());
        assertTrue(list.getT2().contains("\"id\":\"" + A + "\""));
        assertTrue(list.getT2().contains("\"liveness\":\"online\""));
        assertFalse(list.getT2().contains("\"token\""));
    }

    @Test
    void testDeviceQueries_ProxiedToDevice() {
        claim("10.0.0.1");

        Tuple2<Integer, String> video = exchange(http.get().uri("/api/v1/devices/" + A + "/video/settings"));
        Tuple2<Integer, String> wb = send("POST", "/api/v1/devices/" + A + "/camera/wb/measure", "");

        assertEquals(200, video.getT1());
        assertTrue(video.getT2().contains("\"selected_preset_id\":\"1080p30\""));
        assertEquals(200, wb.getT1());
        assertTrue(wb.getT2().contains("\"scene_cct_k\":5200"));
        assertEquals(1, devices.count(A, "wb_measure"));
    }

    @Test
    void testClaim_UnreachableDeviceRejected() {
        devices.unreachable(B);

        Tuple2<Integer, String> response = send("POST", "/api/v1/devices", "{\"host\":\"10.0.0.2\",\"port\":8888}");

        assertEquals(500, response.getT1());
        assertEquals("HANDLER_FAILED", errorCode(response));
    }

    @Test
    void testClaim_MissingBody() {
        Tuple2<Integer, String> response = exchange(http.post().uri("/api/v1/devices"));

        assertEquals(400, response.getT1());
        assertEquals("MISSING_BODY", errorCode(response));
    }

    @Test
    void testGroupCommand_OneEntryPerRequestedDevice() {
        claim("10.0.0.1");
        claim("10.0.0.2");
        devices.unreachable(B);

        Tuple2<Integer, String> response = send("POST", "/api/v1/groups/commands",
                "{\"op\":\"stop-stream\",\"device_ids\":[\"" + A + "\",\"" + B + "\",\"10.0.0.7:8888\"]}");

        assertEquals(200, response.getT1());
        List<GroupOperationResult> results = JsonUtils.readValue(response.getT2(),
                new TypeReference<List<GroupOperationResult>>() {
                });
        assertEquals(3, results.size());
        assertTrue(results.get(0).isSuccess());
        assertFalse(results.get(1).isSuccess());
        assertEquals("Device not found: 10.0.0.7:8888", results.get(2).getError());
    }

    @Test
    void testGroupCommand_UnknownOpRejected() {
        Tuple2<Integer, String> response = send("POST", "/api/v1/groups/commands",
                "{\"op\":\"self-destruct\",\"device_ids\":[\"" + A + "\"]}");

        assertEquals(400, response.getT1());
        assertEquals("INVALID_REQUEST", errorCode(response));
    }

    @Test
    void testDeviceCommand_UnreachableDeviceSurfacesError() {
        claim("10.0.0.1");
        devices.unreachable(A);

        Tuple2<Integer, String> response = send("POST", "/api/v1/devices/" + A + "/commands",
                "{\"op\":\"force-keyframe\"}");

        assertEquals(500, response.getT1());
        assertEquals("HANDLER_FAILED", errorCode(response));
    }

    @Test
    void testDebouncedCamera_AcceptedThenSentOnce() throws InterruptedException {
        claim("10.0.0.1");

        for (int k = 5000; k < 5300; k += 100) {
            Tuple2<Integer, String> response = send("POST", "/api/v1/devices/" + A + "/camera/debounced",
                    "{\"wb_kelvin\":" + k + "}");
            assertEquals(202, response.getT1());
        }
        Thread.sleep(800);

        assertEquals(1, devices.cameraUpdates.get(A).size());
        assertEquals(5200, devices.cameraUpdates.get(A).get(0).getWbKelvin());
    }

    @Test
    void testUnclaim_UnknownDevice() {
        Tuple2<Integer, String> response = exchange(http.delete().uri("/api/v1/devices/10.0.0.9:1"));

        assertEquals(404, response.getT1());
        assertEquals("NOT_FOUND", errorCode(response));
    }

    @Test
    void testCandidates_ClaimedAliasExcluded() {
        claim("10.0.0.1");
        server.getDiscovery().browseOnce().block();

        Tuple2<Integer, String> fresh = exchange(http.get().uri("/api/v1/discovery/candidates"));
        Tuple2<Integer, String> all = exchange(http.get().uri("/api/v1/discovery/candidates?all=true"));

        assertFalse(fresh.getT2().contains("cam-a"));
        assertTrue(fresh.getT2().contains("cam-z"));
        assertTrue(all.getT2().contains("cam-a"));
    }

    @Test
    void testProfiles_SaveApplyDelete() {
        claim("10.0.0.1");

        Tuple2<Integer, String> saved = send("PUT", "/api/v1/profiles/warm",
                "{\"camera\":{\"wb_mode\":\"manual\",\"wb_kelvin\":3200}}");
        Tuple2<Integer, String> applied = send("POST", "/api/v1/profiles/warm/apply",
                "{\"device_ids\":[\"" + A + "\"]}");
        Tuple2<Integer, String> missing = send("POST", "/api/v1/profiles/nope/apply",
                "{\"device_ids\":[\"" + A + "\"]}");
        Tuple2<Integer, String> deleted = send("DELETE", "/api/v1/profiles/warm", "");

        assertEquals(200, saved.getT1());
        assertTrue(applied.getT2().contains("\"success\":true"), applied.getT2());
        assertEquals(3200, devices.cameraUpdates.get(A).get(0).getWbKelvin());
        assertEquals(404, missing.getT1());
        assertEquals(200, deleted.getT1());
        assertEquals("[]", exchange(http.get().uri("/api/v1/profiles")).getT2());
    }

    @Test
    void testHealthAndMetrics() {
        claim("10.0.0.1");

        assertEquals("OK", exchange(http.get().uri("/healthz")).getT2());
        String metrics = exchange(http.get().uri("/metrics")).getT2();
        assertTrue(metrics.contains("camfleet_console_devices"), metrics);
    }
}
