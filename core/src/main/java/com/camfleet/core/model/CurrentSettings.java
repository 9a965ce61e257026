package com.camfleet.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Effective stream and camera settings of a device, as reported in {@code GET /api/v1/status}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class CurrentSettings {
    String resolution;
    int fps;
    int bitrate;
    String codec;

    WhiteBalanceMode wbMode;
    /**
     * Only meaningful when {@link #wbMode} is manual.
     */
    Integer wbKelvin;
    Double wbTint;

    ExposureMode isoMode;
    int iso;
    ExposureMode shutterMode;
    double shutterS;

    FocusMode focusMode;
    double zoomFactor;
    String lens;
    String cameraPosition;
}
