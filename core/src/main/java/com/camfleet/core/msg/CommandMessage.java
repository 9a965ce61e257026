package com.camfleet.core.msg;

import com.camfleet.core.model.CameraSettingsRequest;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Command envelope sent from a client to a device over the WebSocket.
 * <p>
 * Only {@value #OP_SET} is defined: it carries camera settings with the same fields as
 * {@code POST /api/v1/camera}.
 * </p>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class CommandMessage {
    public static final String OP_SET = "set";

    String op;
    CameraSettingsRequest camera;

    public static CommandMessage set(CameraSettingsRequest camera) {
        return new CommandMessage(OP_SET, camera);
    }
}
