package com.camfleet.device.camera;

import com.camfleet.core.model.AliasUpdateResponse;
import com.camfleet.core.model.CameraSettingsRequest;
import com.camfleet.core.model.Capability;
import com.camfleet.core.model.NdiState;
import com.camfleet.core.model.StatusResponse;
import com.camfleet.core.model.StreamStartRequest;
import com.camfleet.core.model.VideoSettingsResponse;
import com.camfleet.core.model.VideoSettingsUpdateRequest;
import com.camfleet.core.model.WhiteBalanceMeasureResponse;
import com.camfleet.core.msg.TelemetryMessage;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test stub: records calls and answers with canned values, or with {@link #failWith} /
 * {@link #hang} when set.
 */
public class StubCameraControl implements CameraControl {
    public final List<String> calls = new CopyOnWriteArrayList<>();
    public final List<CameraSettingsRequest> cameraUpdates = new CopyOnWriteArrayList<>();
    public final AtomicInteger telemetryReads = new AtomicInteger();

    public volatile RuntimeException failWith;
    public volatile boolean hang;

    private <T> Mono<T> answer(String op, Mono<T> value) {
        calls.add(op);
        if (hang) {
            return Mono.never();
        }
        if (failWith != null) {
            return Mono.error(failWith);
        }
        return value;
    }

    @Override
    public Mono<StatusResponse> getStatus() {
        return answer("getStatus", Mono.just(StatusResponse.builder().alias("stub").ndiState(NdiState.IDLE).build()));
    }

    @Override
    public Mono<List<Capability>> getCapabilities() {
        return answer("getCapabilities", Mono.just(List.of(
                new Capability("1920x1080", List.of(30), List.of("h264"), null, null))));
    }

    @Override
    public Mono<VideoSettingsResponse> getVideoSettings() {
        return answer("getVideoSettings", Mono.just(VideoSettingsResponse.builder().selectedPresetId("1080p30").build()));
    }

    @Override
    public Mono<Void> updateVideoSettings(VideoSettingsUpdateRequest request) {
        return answer("updateVideoSettings", Mono.empty());
    }

    @Override
    public Mono<Void> startStream(StreamStartRequest request) {
        return answer("startStream", Mono.empty());
    }

    @Override
    public Mono<Void> stopStream() {
        return answer("stopStream", Mono.empty());
    }

    @Override
    public Mono<Void> updateCameraSettings(CameraSettingsRequest request) {
        return answer("updateCameraSettings", Mono.<Void>empty().doOnSubscribe(s -> cameraUpdates.add(request)));
    }

    @Override
    public Mono<Void> forceKeyframe() {
        return answer("forceKeyframe", Mono.empty());
    }

    @Override
    public Mono<Void> updateScreenBrightness(boolean dimmed) {
        return answer("updateScreenBrightness", Mono.empty());
    }

    @Override
    public Mono<WhiteBalanceMeasureResponse> measureWhiteBalance() {
        return answer("measureWhiteBalance", Mono.just(new WhiteBalanceMeasureResponse(5600, 1.5)));
    }

    @Override
    public Mono<AliasUpdateResponse> updateAlias(String alias) {
        return answer("updateAlias", Mono.just(new AliasUpdateResponse(alias)));
    }

    @Override
    public Mono<TelemetryMessage> currentTelemetry() {
        telemetryReads.incrementAndGet();
        return answer("currentTelemetry", Mono.just(TelemetryMessage.builder()
                .fps(30).bitrate(10_000_000).battery(0.8).tempC(35.5).wifiRssi(-50)
                .ndiState(NdiState.STREAMING).build()));
    }
}
