package com.camfleet.device.camera;

import com.camfleet.core.model.AliasUpdateResponse;
import com.camfleet.core.model.CameraSettingsRequest;
import com.camfleet.core.model.Capability;
import com.camfleet.core.model.StatusResponse;
import com.camfleet.core.model.StreamStartRequest;
import com.camfleet.core.model.VideoSettingsResponse;
import com.camfleet.core.model.VideoSettingsUpdateRequest;
import com.camfleet.core.model.WhiteBalanceMeasureResponse;
import com.camfleet.core.msg.TelemetryMessage;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Operations the control server may invoke on the capture/encode side of a device.
 * <p>
 * Every HTTP handler calls exactly one of these. Failures are signalled as error signals on the
 * returned {@link Mono}; the handler maps them to a typed error code.
 * </p>
 */
public interface CameraControl {

    Mono<StatusResponse> getStatus();

    Mono<List<Capability>> getCapabilities();

    Mono<VideoSettingsResponse> getVideoSettings();

    Mono<Void> updateVideoSettings(VideoSettingsUpdateRequest request);

    Mono<Void> startStream(StreamStartRequest request);

    Mono<Void> stopStream();

    /**
     * Applies the non-null fields of the request; null fields keep their current value.
     */
    Mono<Void> updateCameraSettings(CameraSettingsRequest request);

    Mono<Void> forceKeyframe();

    Mono<Void> updateScreenBrightness(boolean dimmed);

    Mono<WhiteBalanceMeasureResponse> measureWhiteBalance();

    Mono<AliasUpdateResponse> updateAlias(String alias);

    /**
     * Telemetry frame for the periodic WebSocket broadcast.
     */
    Mono<TelemetryMessage> currentTelemetry();
}
