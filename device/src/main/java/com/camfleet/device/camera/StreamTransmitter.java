package com.camfleet.device.camera;

import com.camfleet.core.model.Telemetry;
import reactor.core.publisher.Mono;

/**
 * Narrow view of the encode/transmission layer that turns captured frames into a named network
 * video source. Implementations own all codec and pixel work.
 */
public interface StreamTransmitter {

    Mono<Void> start(TransmitterConfig config);

    /**
     * Stops the current stream. Stopping an idle transmitter completes normally.
     */
    Mono<Void> stop();

    Mono<Void> forceKeyframe();

    /**
     * Snapshot of the transmitter's health. Must be cheap; it is read once per telemetry tick.
     */
    Telemetry currentTelemetry();

    /**
     * Applies new encode settings to a running stream.
     */
    Mono<Void> updateSettings(TransmitterConfig settings);

    boolean isActive();
}
