package com.camfleet.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a one-shot white balance measurement.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class WhiteBalanceMeasureResponse {
    /**
     * Measured scene color temperature in Kelvin.
     */
    int sceneCctK;
    double tint;
}
