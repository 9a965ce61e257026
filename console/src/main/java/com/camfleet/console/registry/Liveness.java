package com.camfleet.console.registry;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

public enum Liveness {
    @JsonProperty("online")
    ONLINE,
    @JsonProperty("stale")
    STALE,
    @JsonProperty("offline")
    OFFLINE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
