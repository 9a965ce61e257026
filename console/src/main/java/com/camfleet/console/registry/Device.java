package com.camfleet.console.registry;

import com.camfleet.console.client.DeviceAddress;
import com.camfleet.core.model.CameraSettingsRequest;
import com.camfleet.core.model.StatusResponse;
import com.camfleet.core.model.StreamStartRequest;
import com.camfleet.core.msg.TelemetryMessage;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * Immutable snapshot of one claimed device. The registry replaces the snapshot on every change.
 */
@Value
@Builder(toBuilder = true)
@With
public class Device {
    String id;
    String alias;
    String host;
    int port;
    @JsonIgnore
    String token;

    Liveness liveness;
    int consecutiveFailures;
    Instant lastSeen;
    StatusResponse status;
    TelemetryMessage telemetry;

    StreamStartRequest lastStream;
    CameraSettingsRequest lastCamera;

    public DeviceAddress address() {
        return new DeviceAddress(host, port, token);
    }

    DeviceRecord toRecord() {
        return DeviceRecord.builder()
                .id(id)
                .alias(alias)
                .host(host)
                .port(port)
                .token(token)
                .lastStream(lastStream)
                .lastCamera(lastCamera)
                .build();
    }

    /**
     * A device read back from disk. It stays offline until the first refresh answers.
     */
    static Device fromRecord(DeviceRecord record) {
        return Device.builder()
                .id(record.getId())
                .alias(record.getAlias())
                .host(record.getHost())
                .port(record.getPort())
                .token(record.getToken() != null ? record.getToken() : "")
                .liveness(Liveness.OFFLINE)
                .lastStream(record.getLastStream())
                .lastCamera(record.getLastCamera())
                .build();
    }
}
