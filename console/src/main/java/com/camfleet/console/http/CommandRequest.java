package com.camfleet.console.http;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of the single-device and group command routes. {@code device_ids} is only read by the
 * group route.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CommandRequest {
    String op;
    List<String> deviceIds;
    JsonNode payload;
}
