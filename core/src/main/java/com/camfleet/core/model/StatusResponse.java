package com.camfleet.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of {@code GET /api/v1/status}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class StatusResponse {
    String alias;
    NdiState ndiState;
    CurrentSettings current;
    Telemetry telemetry;
    List<Capability> capabilities;
}
