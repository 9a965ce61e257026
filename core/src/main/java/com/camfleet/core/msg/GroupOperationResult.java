package com.camfleet.core.msg;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a command for one target device.
 * <p>
 * A group command returns exactly one of these per requested device id, in request order.
 * </p>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class GroupOperationResult {
    String deviceId;
    boolean success;
    String error;

    public static GroupOperationResult ok(String deviceId) {
        return new GroupOperationResult(deviceId, true, null);
    }

    public static GroupOperationResult failed(String deviceId, String error) {
        return new GroupOperationResult(deviceId, false, error);
    }
}
