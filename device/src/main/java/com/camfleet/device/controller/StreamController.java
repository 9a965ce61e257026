package com.camfleet.device.controller;

import com.camfleet.core.error.ApiException;
import com.camfleet.core.error.ErrorCode;
import com.camfleet.core.model.StreamStartRequest;
import com.camfleet.device.camera.CameraControl;
import com.camfleet.device.http.HttpRequest;
import com.camfleet.device.http.HttpResult;
import com.camfleet.device.http.Router;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Stream start/stop and keyframe endpoints.
 */
public class StreamController {
    private static final Logger log = LoggerFactory.getLogger(StreamController.class);

    private final CameraControl camera;
    private final Duration timeout;

    public StreamController(CameraControl camera, Duration timeout) {
        this.camera = camera;
        this.timeout = timeout;
    }

    public void registerRoutes(Router router) {
        router.post("/api/v1/stream/start", this::startStream)
                .post("/api/v1/stream/stop", this::stopStream)
                .post("/api/v1/encoder/force_keyframe", this::forceKeyframe);
    }

    public Mono<HttpResult> startStream(HttpRequest request) {
        StreamStartRequest start = request.decodeBody(StreamStartRequest.class);
        validate(start);
        return HandlerCalls.bounded(camera.startStream(start), timeout, ErrorCode.STREAM_START_FAILED, "Stream start")
                .doOnSuccess(v -> log.info("Stream started: {}@{}fps", start.getResolution(), start.getFramerate()))
                .thenReturn(HttpResult.success("Stream started"));
    }

    public Mono<HttpResult> stopStream(HttpRequest request) {
        return HandlerCalls.bounded(camera.stopStream(), timeout, ErrorCode.STREAM_STOP_FAILED, "Stream stop")
                .thenReturn(HttpResult.success("Stream stopped"));
    }

    public Mono<HttpResult> forceKeyframe(HttpRequest request) {
        return HandlerCalls.bounded(camera.forceKeyframe(), timeout, ErrorCode.KEYFRAME_FAILED, "Keyframe request")
                .thenReturn(HttpResult.success("Keyframe requested"));
    }

    private static void validate(StreamStartRequest start) {
        if (start.getResolution() == null || start.getResolution().isBlank()) {
            throw ApiException.invalidRequest("missing field 'resolution'");
        }
        if (start.getFramerate() == null || start.getFramerate() <= 0) {
            throw ApiException.invalidRequest("'framerate' must be a positive integer");
        }
        if (start.getBitrate() == null || start.getBitrate() <= 0) {
            throw ApiException.invalidRequest("'bitrate' must be a positive integer");
        }
        if (start.getCodec() == null || start.getCodec().isBlank()) {
            throw ApiException.invalidRequest("missing field 'codec'");
        }
    }
}
