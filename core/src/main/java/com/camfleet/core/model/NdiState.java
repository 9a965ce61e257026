package com.camfleet.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Whether the device is currently publishing its network video source.
 */
public enum NdiState {
    @JsonProperty("streaming")
    STREAMING,
    @JsonProperty("idle")
    IDLE
}
