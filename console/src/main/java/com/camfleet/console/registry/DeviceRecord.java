package com.camfleet.console.registry;

import com.camfleet.core.model.CameraSettingsRequest;
import com.camfleet.core.model.StreamStartRequest;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Persisted part of a claimed device.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class DeviceRecord {
    String id;
    String alias;
    String host;
    int port;
    String token;
    StreamStartRequest lastStream;
    CameraSettingsRequest lastCamera;
}
