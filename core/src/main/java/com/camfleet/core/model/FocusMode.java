package com.camfleet.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Focus control mode.
 */
public enum FocusMode {
    @JsonProperty("auto")
    AUTO,
    @JsonProperty("manual")
    MANUAL
}
