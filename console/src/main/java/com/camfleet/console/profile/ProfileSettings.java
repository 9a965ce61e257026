package com.camfleet.console.profile;

import com.camfleet.core.model.CameraSettingsRequest;
import com.camfleet.core.model.VideoSettingsUpdateRequest;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Settings bundle of a profile. Either part may be absent.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ProfileSettings {
    CameraSettingsRequest camera;
    VideoSettingsUpdateRequest video;

    public boolean isEmpty() {
        return camera == null && video == null;
    }
}
