package com.camfleet.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Battery charging state reported in telemetry.
 */
public enum ChargingState {
    @JsonProperty("charging")
    CHARGING,
    @JsonProperty("full")
    FULL,
    @JsonProperty("unplugged")
    UNPLUGGED
}
