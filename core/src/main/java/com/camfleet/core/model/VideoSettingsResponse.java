package com.camfleet.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of {@code GET /api/v1/video/settings}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class VideoSettingsResponse {
    String selectedPresetId;
    String customResolution;
    Integer customFps;
    String customCodec;
    Integer customBitrate;
    List<VideoPreset> availablePresets;
}
