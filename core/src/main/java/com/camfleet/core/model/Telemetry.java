package com.camfleet.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Device health snapshot produced by the capture/transmission layer.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Telemetry {
    double fps;
    /**
     * Bits per second actually sent.
     */
    int bitrate;
    /**
     * Battery level, 0.0 to 1.0.
     */
    double battery;
    double tempC;
    int wifiRssi;
    Double cpuUsage;
    Integer queueMs;
    Integer droppedFrames;
    ChargingState chargingState;
}
