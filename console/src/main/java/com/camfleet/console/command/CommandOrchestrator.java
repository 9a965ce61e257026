package com.camfleet.console.command;

import com.camfleet.console.client.DeviceAddress;
import com.camfleet.console.client.DeviceCallException;
import com.camfleet.console.client.IDeviceClient;
import com.camfleet.console.metrics.MetricsService;
import com.camfleet.console.profile.ProfileSettings;
import com.camfleet.console.registry.Device;
import com.camfleet.console.registry.DeviceRegistry;
import com.camfleet.core.error.ApiException;
import com.camfleet.core.model.CameraSettingsRequest;
import com.camfleet.core.model.StreamStartRequest;
import com.camfleet.core.model.VideoSettingsUpdateRequest;
import com.camfleet.core.msg.GroupOperationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs commands against one or many claimed devices.
 * <p>
 * Group execution fans out to the targets with at most {@code maxConcurrency} device calls in
 * flight ({@code MAX_CONCURRENT_OPERATIONS}, 64 by default); further targets wait for a free slot.
 * It waits for every call to settle and reports one {@link GroupOperationResult} per distinct
 * target, in request order. A failure on one device is captured in that device's entry and never fails
 * the group. Each device call has its own deadline.
 * </p>
 */
public class CommandOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(CommandOrchestrator.class);

    private final DeviceRegistry registry;
    private final IDeviceClient deviceClient;
    private final MetricsService metricsService;
    private final Duration callTimeout;
    private final int maxConcurrency;

    public CommandOrchestrator(DeviceRegistry registry,
                               IDeviceClient deviceClient,
                               MetricsService metricsService,
                               Duration callTimeout,
                               int maxConcurrency) {
        this.registry = registry;
        this.deviceClient = deviceClient;
        this.metricsService = metricsService;
        this.callTimeout = callTimeout;
        this.maxConcurrency = Math.max(1, maxConcurrency);
    }

    /**
     * Runs the command against a single device.
     *
     * @return completes on success; errors with a {@link DeviceCallException} whose kind tells
     * timeouts, connection failures, non-success answers and unknown devices apart
     */
    public Mono<Void> execute(String deviceId, Command command) {
        return Mono.defer(() -> {
            Device device = registry.get(deviceId).orElse(null);
            if (device == null) {
                return Mono.error(DeviceCallException.notFound(deviceId));
            }
            return dispatch(device, command);
        });
    }

    /**
     * Runs the command against every target. The returned list always has one entry per distinct
     * target id; this Mono itself never errors.
     */
    public Mono<List<GroupOperationResult>> executeGroup(Command command) {
        return Flux.fromIterable(command.getTargets())
                .flatMapSequential(id -> executeCaptured(id, command), maxConcurrency)
                .collectList()
                .doOnNext(results -> log.info("{} on {} devices: {} succeeded",
                        command.getType().wireName(), results.size(),
                        results.stream().filter(GroupOperationResult::isSuccess).count()));
    }

    /**
     * Starts streaming on every claimed device with its last used stream settings, or the defaults.
     */
    public Mono<List<GroupOperationResult>> startAll() {
        return executeGroup(Command.of(CommandType.START_STREAM, claimedIds(), null));
    }

    public Mono<List<GroupOperationResult>> stopAll() {
        return executeGroup(Command.of(CommandType.STOP_STREAM, claimedIds(), null));
    }

    private List<String> claimedIds() {
        return registry.list().stream().map(Device::getId).collect(Collectors.toList());
    }

    private Mono<GroupOperationResult> executeCaptured(String deviceId, Command command) {
        return execute(deviceId, command)
                .then(Mono.fromCallable(() -> GroupOperationResult.ok(deviceId)))
                .onErrorResume(err -> Mono.just(GroupOperationResult.failed(deviceId, ApiException.summarize(err))))
                .doOnNext(result -> metricsService.recordGroupResult(result.isSuccess()));
    }

    private Mono<Void> dispatch(Device device, Command command) {
        DeviceAddress address = device.address();
        String id = device.getId();
        return switch (command.getType()) {
            case START_STREAM -> {
                StreamStartRequest stream = streamSettingsFor(device, command);
                yield bounded(id, deviceClient.startStream(address, stream))
                        .then(Mono.fromRunnable(() -> registry.rememberStream(id, stream)));
            }
            case STOP_STREAM -> bounded(id, deviceClient.stopStream(address));
            case UPDATE_CAMERA_SETTINGS -> {
                CameraSettingsRequest camera = command.payloadAs(CameraSettingsRequest.class);
                yield bounded(id, deviceClient.updateCameraSettings(address, camera))
                        .then(Mono.fromRunnable(() -> registry.rememberCamera(id, camera)));
            }
            case UPDATE_VIDEO_SETTINGS -> bounded(id,
                    deviceClient.updateVideoSettings(address, command.payloadAs(VideoSettingsUpdateRequest.class)));
            case FORCE_KEYFRAME -> bounded(id, deviceClient.forceKeyframe(address));
            case APPLY_PROFILE -> applySettings(device, command.payloadAs(ProfileSettings.class));
        };
    }

    /**
     * Camera settings first, then video settings. Stops at the first failure.
     */
    private Mono<Void> applySettings(Device device, ProfileSettings settings) {
        DeviceAddress address = device.address();
        String id = device.getId();
        Mono<Void> camera = settings.getCamera() == null
                ? Mono.empty()
                : bounded(id, deviceClient.updateCameraSettings(address, settings.getCamera()))
                .then(Mono.fromRunnable(() -> registry.rememberCamera(id, settings.getCamera())));
        Mono<Void> video = settings.getVideo() == null
                ? Mono.empty()
                : bounded(id, deviceClient.updateVideoSettings(address, settings.getVideo()));
        return camera.then(video);
    }

    private StreamStartRequest streamSettingsFor(Device device, Command command) {
        if (command.getPayload() != null) {
            return command.payloadAs(StreamStartRequest.class);
        }
        return device.getLastStream() != null ? device.getLastStream() : StreamStartRequest.defaults();
    }

    private Mono<Void> bounded(String deviceId, Mono<Void> call) {
        return call.timeout(callTimeout, Mono.error(DeviceCallException.timeout(deviceId, callTimeout.toMillis())));
    }
}
