package com.camfleet.console.client;

import com.camfleet.core.model.AliasUpdateResponse;
import com.camfleet.core.model.CameraSettingsRequest;
import com.camfleet.core.model.Capability;
import com.camfleet.core.model.StatusResponse;
import com.camfleet.core.model.StreamStartRequest;
import com.camfleet.core.model.VideoSettingsResponse;
import com.camfleet.core.model.VideoSettingsUpdateRequest;
import com.camfleet.core.model.WhiteBalanceMeasureResponse;
import com.camfleet.core.msg.TelemetryMessage;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Typed access to one device control server.
 * <p>
 * Every call is bounded by the console request timeout and fails with a
 * {@link DeviceCallException}.
 * </p>
 */
public interface IDeviceClient {

    Mono<StatusResponse> getStatus(DeviceAddress device);

    Mono<List<Capability>> getCapabilities(DeviceAddress device);

    Mono<Void> startStream(DeviceAddress device, StreamStartRequest request);

    Mono<Void> stopStream(DeviceAddress device);

    Mono<Void> updateCameraSettings(DeviceAddress device, CameraSettingsRequest request);

    Mono<VideoSettingsResponse> getVideoSettings(DeviceAddress device);

    Mono<Void> updateVideoSettings(DeviceAddress device, VideoSettingsUpdateRequest request);

    Mono<Void> forceKeyframe(DeviceAddress device);

    Mono<WhiteBalanceMeasureResponse> measureWhiteBalance(DeviceAddress device);

    Mono<AliasUpdateResponse> updateAlias(DeviceAddress device, String alias);

    /**
     * Telemetry frames from the device WebSocket. Completes or errors when the connection ends;
     * reconnecting is up to the caller.
     */
    Flux<TelemetryMessage> telemetry(DeviceAddress device);
}
