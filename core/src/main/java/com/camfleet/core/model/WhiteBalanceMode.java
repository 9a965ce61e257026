package com.camfleet.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * White balance control mode.
 */
public enum WhiteBalanceMode {
    @JsonProperty("auto")
    AUTO,
    @JsonProperty("manual")
    MANUAL
}
