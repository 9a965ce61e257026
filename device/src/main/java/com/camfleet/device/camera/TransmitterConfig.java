package com.camfleet.device.camera;

import lombok.Builder;
import lombok.Value;

/**
 * Parameters handed to the {@link StreamTransmitter} when a stream starts or is reconfigured.
 */
@Value
@Builder(toBuilder = true)
public class TransmitterConfig {
    /**
     * Name of the published network video source.
     */
    String sourceName;
    String resolution;
    int fps;
    int bitrate;
    String codec;
}
