package com.camfleet.console.profile;

import com.camfleet.console.client.StubDeviceClient;
import com.camfleet.console.command.CommandOrchestrator;
import com.camfleet.console.metrics.MetricsService;
import com.camfleet.console.registry.DeviceRegistry;
import com.camfleet.console.store.DevicesDocument;
import com.camfleet.console.store.JsonFileStore;
import com.camfleet.console.store.ProfilesDocument;
import com.camfleet.core.error.ApiException;
import com.camfleet.core.error.ErrorCode;
import com.camfleet.core.model.CameraSettingsRequest;
import com.camfleet.core.model.VideoSettingsUpdateRequest;
import com.camfleet.core.model.WhiteBalanceMode;
import com.camfleet.core.msg.GroupOperationResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProfileServiceTest {
    private static final String A = "10.0.0.1:8888";
    private static final String B = "10.0.0.2:8888";
    private static final String C = "10.0.0.3:8888";

    @TempDir
    Path dataDir;

    private StubDeviceClient client;
    private CommandOrchestrator orchestrator;
    private ProfileService profiles;

    private final ProfileSettings warm = ProfileSettings.builder()
            .camera(CameraSettingsRequest.builder().wbMode(WhiteBalanceMode.MANUAL).wbKelvin(3200).build())
            .video(VideoSettingsUpdateRequest.builder().selectedPresetId("1080p30").build())
            .build();

    @BeforeEach
    void setUp() {
        client = new StubDeviceClient();
        MetricsService metrics = new MetricsService(new SimpleMeterRegistry());
        DeviceRegistry registry = new DeviceRegistry(client,
                new JsonFileStore<>(dataDir.resolve("devices.json"), DevicesDocument.class, DevicesDocument::new),
                3, metrics);
        registry.claim("10.0.0.1", 8888, "").block();
        registry.claim("10.0.0.2", 8888, "").block();
        registry.claim("10.0.0.3", 8888, "").block();
        orchestrator = new CommandOrchestrator(registry, client, metrics, Duration.ofMillis(500), 8);
        profiles = newProfiles();
    }

    private ProfileService newProfiles() {
        return new ProfileService(
                new JsonFileStore<>(dataDir.resolve("profiles.json"), ProfilesDocument.class, ProfilesDocument::new),
                orchestrator);
    }

    @Test
    void testApply_OneUnreachableOfThree() {
        profiles.save("warm", warm);
        client.unreachable(C);

        List<GroupOperationResult> results = profiles.apply("warm", List.of(A, B, C)).block();

        assertEquals(3, results.size());
        assertEquals(2, results.stream().filter(GroupOperationResult::isSuccess).count());
        GroupOperationResult failed = results.get(2);
        assertEquals(C, failed.getDeviceId());
        assertFalse(failed.isSuccess());
        assertTrue(failed.getError().startsWith("Connection failed"));
    }

    @Test
    void testApply_CameraBeforeVideoOnEachDevice() {
        profiles.save("warm", warm);

        profiles.apply("warm", List.of(A)).block();

        int camera = client.calls.indexOf(A + " camera");
        int video = client.calls.indexOf(A + " video_settings_put");
        assertTrue(camera >= 0 && video > camera, client.calls.toString());
    }

    @Test
    void testApply_UnknownProfileIsRequestLevelNotFound() {
        StepVerifier.create(profiles.apply("missing", List.of(A)))
                .expectErrorMatches(err -> err instanceof ApiException
                        && ((ApiException) err).getErrorCode() == ErrorCode.NOT_FOUND)
                .verify();
    }

    @Test
    void testSave_UpsertsByName() {
        profiles.save("warm", warm);
        ProfileSettings cooler = warm.toBuilder()
                .camera(CameraSettingsRequest.builder().wbKelvin(5600).build())
                .build();

        profiles.save("warm", cooler);

        assertEquals(1, profiles.list().size());
        assertEquals(5600, profiles.list().get(0).getSettings().getCamera().getWbKelvin());
    }

    @Test
    void testDelete_MissingIsNoOp() {
        profiles.save("warm", warm);

        profiles.delete("nope");
        profiles.delete("warm");
        profiles.delete("warm");

        assertTrue(profiles.list().isEmpty());
    }

    @Test
    void testSave_EmptyBundleRejected() {
        ApiException ex = assertThrows(ApiException.class, () -> profiles.save("empty", new ProfileSettings()));

        assertEquals(ErrorCode.INVALID_REQUEST, ex.getErrorCode());
    }

    @Test
    void testLoad_ProfilesSurviveRestart() {
        profiles.save("warm", warm);
        profiles.save("cool", ProfileSettings.builder()
                .camera(CameraSettingsRequest.builder().wbKelvin(5600).build()).build());

        ProfileService reloaded = newProfiles();
        reloaded.load();

        assertEquals(List.of("cool", "warm"), reloaded.list().stream().map(Profile::getName).toList());
        assertEquals(3200, reloaded.list().get(1).getSettings().getCamera().getWbKelvin());
    }
}
