package com.camfleet.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * ISO / shutter control mode.
 */
public enum ExposureMode {
    @JsonProperty("auto")
    AUTO,
    @JsonProperty("manual")
    MANUAL
}
