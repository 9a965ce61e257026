package com.camfleet.core.msg;

import com.camfleet.core.model.ChargingState;
import com.camfleet.core.model.NdiState;
import com.camfleet.core.model.Telemetry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Telemetry frame pushed from a device to every connected WebSocket client at a fixed cadence.
 * <p>
 * Delivery is best-effort: a client that is disconnected or too slow simply misses frames.
 * </p>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class TelemetryMessage {
    double fps;
    int bitrate;
    int queueMs;
    double battery;
    double tempC;
    int wifiRssi;
    NdiState ndiState;
    int droppedFrames;
    ChargingState chargingState;

    /**
     * Flattens a collaborator telemetry snapshot into a wire frame, filling absent
     * optional values with zero / unplugged.
     */
    public static TelemetryMessage from(Telemetry telemetry, NdiState ndiState) {
        return TelemetryMessage.builder()
                .fps(telemetry.getFps())
                .bitrate(telemetry.getBitrate())
                .queueMs(telemetry.getQueueMs() != null ? telemetry.getQueueMs() : 0)
                .battery(telemetry.getBattery())
                .tempC(telemetry.getTempC())
                .wifiRssi(telemetry.getWifiRssi())
                .ndiState(ndiState)
                .droppedFrames(telemetry.getDroppedFrames() != null ? telemetry.getDroppedFrames() : 0)
                .chargingState(telemetry.getChargingState() != null
                        ? telemetry.getChargingState() : ChargingState.UNPLUGGED)
                .build();
    }
}
