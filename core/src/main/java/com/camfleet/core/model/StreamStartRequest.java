package com.camfleet.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /api/v1/stream/start}. All four fields are required.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class StreamStartRequest {
    String resolution;
    Integer framerate;
    Integer bitrate;
    String codec;

    /**
     * Stream settings used when a device has never been started from this console.
     */
    public static StreamStartRequest defaults() {
        return new StreamStartRequest("1920x1080", 30, 10_000_000, "h264");
    }
}
