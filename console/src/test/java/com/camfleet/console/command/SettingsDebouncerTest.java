package com.camfleet.console.command;

import com.camfleet.console.client.StubDeviceClient;
import com.camfleet.console.metrics.MetricsService;
import com.camfleet.console.registry.DeviceRegistry;
import com.camfleet.console.store.DevicesDocument;
import com.camfleet.console.store.JsonFileStore;
import com.camfleet.core.error.ApiException;
import com.camfleet.core.model.CameraSettingsRequest;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SettingsDebouncerTest {
    private static final String A = "10.0.0.1:8888";
    private static final String B = "10.0.0.2:8888";

    @TempDir
    Path dataDir;

    private StubDeviceClient client;
    private MetricsService metrics;
    private VirtualTimeScheduler scheduler;
    private SettingsDebouncer debouncer;

    @BeforeEach
    void setUp() {
        client = new StubDeviceClient();
        metrics = new MetricsService(new SimpleMeterRegistry());
        DeviceRegistry registry = new DeviceRegistry(client,
                new JsonFileStore<>(dataDir.resolve("devices.json"), DevicesDocument.class, DevicesDocument::new),
                3, metrics);
        registry.claim("10.0.0.1", 8888, "").block();
        registry.claim("10.0.0.2", 8888, "").block();
        CommandOrchestrator orchestrator = new CommandOrchestrator(registry, client, metrics, Duration.ofSeconds(1), 8);
        scheduler = VirtualTimeScheduler.create();
        debouncer = new SettingsDebouncer(orchestrator, metrics, Duration.ofMillis(300), scheduler);
    }

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    private static CameraSettingsRequest kelvin(int value) {
        return CameraSettingsRequest.builder().wbKelvin(value).build();
    }

    @Test
    void testRapidEdits_CollapseIntoOneCallWithLastValue() {
        for (int k = 5000; k <= 5400; k += 100) {
            debouncer.submit(A, CommandType.UPDATE_CAMERA_SETTINGS, kelvin(k));
            scheduler.advanceTimeBy(Duration.ofMillis(50));
        }
        assertNull(client.cameraUpdates.get(A));

        scheduler.advanceTimeBy(Duration.ofMillis(300));

        List<CameraSettingsRequest> sent = client.cameraUpdates.get(A);
        assertEquals(1, sent.size());
        assertEquals(5400, sent.get(0).getWbKelvin());
        assertEquals(4.0, metrics.coalescedCount());
        assertEquals(0, debouncer.pendingCount());
    }

    @Test
    void testEditsSpacedBeyondWindow_EachSent() {
        debouncer.submit(A, CommandType.UPDATE_CAMERA_SETTINGS, kelvin(5000));
        scheduler.advanceTimeBy(Duration.ofMillis(400));
        debouncer.submit(A, CommandType.UPDATE_CAMERA_SETTINGS, kelvin(5600));
        scheduler.advanceTimeBy(Duration.ofMillis(400));

        assertEquals(2, client.cameraUpdates.get(A).size());
        assertEquals(0.0, metrics.coalescedCount());
    }

    @Test
    void testDevicesAreDebouncedIndependently() {
        debouncer.submit(A, CommandType.UPDATE_CAMERA_SETTINGS, kelvin(5000));
        debouncer.submit(B, CommandType.UPDATE_CAMERA_SETTINGS, kelvin(3200));
        assertEquals(2, debouncer.pendingCount());

        scheduler.advanceTimeBy(Duration.ofMillis(300));

        assertEquals(5000, client.cameraUpdates.get(A).get(0).getWbKelvin());
        assertEquals(3200, client.cameraUpdates.get(B).get(0).getWbKelvin());
    }

    @Test
    void testWindowRestartsOnEveryEdit() {
        debouncer.submit(A, CommandType.UPDATE_CAMERA_SETTINGS, kelvin(5000));
        scheduler.advanceTimeBy(Duration.ofMillis(250));
        debouncer.submit(A, CommandType.UPDATE_CAMERA_SETTINGS, kelvin(5100));
        scheduler.advanceTimeBy(Duration.ofMillis(250));

        assertNull(client.cameraUpdates.get(A));

        scheduler.advanceTimeBy(Duration.ofMillis(50));
        assertEquals(5100, client.cameraUpdates.get(A).get(0).getWbKelvin());
    }

    @Test
    void testCancelAll_DropsPendingEdits() {
        debouncer.submit(A, CommandType.UPDATE_CAMERA_SETTINGS, kelvin(5000));

        debouncer.cancelAll();
        scheduler.advanceTimeBy(Duration.ofSeconds(1));

        assertNull(client.cameraUpdates.get(A));
    }

    @Test
    void testSubmit_MissingPayloadRejected() {
        assertThrows(ApiException.class, () -> debouncer.submit(A, CommandType.UPDATE_CAMERA_SETTINGS, null));
    }
}
