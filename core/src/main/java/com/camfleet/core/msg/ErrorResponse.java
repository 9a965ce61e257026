package com.camfleet.core.msg;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Structured error body: a stable machine-readable code plus a human summary.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {
    String code;
    String message;
}
