package com.camfleet.core.msg;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SuccessResponse {
    boolean success;
    String message;

    public static SuccessResponse of(String message) {
        return new SuccessResponse(true, message);
    }
}
