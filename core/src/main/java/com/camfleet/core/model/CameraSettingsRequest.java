package com.camfleet.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /api/v1/camera} and the {@code camera} member of a WebSocket
 * {@code set} command. Every field is optional; absent fields are left unchanged.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class CameraSettingsRequest {
    WhiteBalanceMode wbMode;
    Integer wbKelvin;
    Double wbTint;
    ExposureMode isoMode;
    Integer iso;
    ExposureMode shutterMode;
    Double shutterS;
    FocusMode focusMode;
    Double zoomFactor;
    String lens;
    String cameraPosition;
    String orientationLock;
}
