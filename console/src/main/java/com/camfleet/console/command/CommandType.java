package com.camfleet.console.command;

import com.camfleet.console.profile.ProfileSettings;
import com.camfleet.core.model.CameraSettingsRequest;
import com.camfleet.core.model.StreamStartRequest;
import com.camfleet.core.model.VideoSettingsUpdateRequest;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Operations the console can issue to devices, with the payload each one carries.
 */
public enum CommandType {
    START_STREAM("start-stream", StreamStartRequest.class, false),
    STOP_STREAM("stop-stream", null, false),
    UPDATE_CAMERA_SETTINGS("update-camera-settings", CameraSettingsRequest.class, true),
    UPDATE_VIDEO_SETTINGS("update-video-settings", VideoSettingsUpdateRequest.class, true),
    FORCE_KEYFRAME("force-keyframe", null, false),
    APPLY_PROFILE("apply-profile", ProfileSettings.class, true);

    private final String wireName;
    private final Class<?> payloadType;
    private final boolean payloadRequired;

    CommandType(String wireName, Class<?> payloadType, boolean payloadRequired) {
        this.wireName = wireName;
        this.payloadType = payloadType;
        this.payloadRequired = payloadRequired;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Payload class, or {@code null} when the command takes none.
     */
    public Class<?> payloadType() {
        return payloadType;
    }

    public boolean payloadRequired() {
        return payloadRequired;
    }

    public static Optional<CommandType> fromWire(String name) {
        return Arrays.stream(values()).filter(t -> t.wireName.equals(name)).findFirst();
    }
}
