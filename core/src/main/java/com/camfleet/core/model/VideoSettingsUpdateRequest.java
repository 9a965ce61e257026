package com.camfleet.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code PUT /api/v1/video/settings}. Either a preset id or a full set of custom values.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class VideoSettingsUpdateRequest {
    String selectedPresetId;
    String customResolution;
    Integer customFps;
    String customCodec;
    Integer customBitrate;

    public boolean hasCustomValues() {
        return customResolution != null && customFps != null && customCodec != null && customBitrate != null;
    }
}
