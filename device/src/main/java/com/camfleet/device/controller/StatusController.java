package com.camfleet.device.controller;

import com.camfleet.core.error.ApiException;
import com.camfleet.core.error.ErrorCode;
import com.camfleet.core.model.VideoSettingsUpdateRequest;
import com.camfleet.device.camera.CameraControl;
import com.camfleet.device.http.HttpRequest;
import com.camfleet.device.http.HttpResult;
import com.camfleet.device.http.Router;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Status, capabilities, video settings and log download endpoints.
 */
public class StatusController {
    private final CameraControl camera;
    private final Duration timeout;

    public StatusController(CameraControl camera, Duration timeout) {
        this.camera = camera;
        this.timeout = timeout;
    }

    public void registerRoutes(Router router) {
        router.get("/api/v1/status", this::getStatus)
                .get("/api/v1/capabilities", this::getCapabilities)
                .get("/api/v1/video/settings", this::getVideoSettings)
                .put("/api/v1/video/settings", this::updateVideoSettings)
                .get("/api/v1/logs.zip", this::downloadLogs);
    }

    public Mono<HttpResult> getStatus(HttpRequest request) {
        return HandlerCalls.bounded(camera.getStatus(), timeout, ErrorCode.HANDLER_FAILED, "Status query")
                .map(HttpResult::ok);
    }

    public Mono<HttpResult> getCapabilities(HttpRequest request) {
        return HandlerCalls.bounded(camera.getCapabilities(), timeout, ErrorCode.HANDLER_FAILED,
                        "Capabilities query")
                .map(HttpResult::ok);
    }

    public Mono<HttpResult> getVideoSettings(HttpRequest request) {
        return HandlerCalls.bounded(camera.getVideoSettings(), timeout, ErrorCode.HANDLER_FAILED,
                        "Video settings query")
                .map(HttpResult::ok);
    }

    public Mono<HttpResult> updateVideoSettings(HttpRequest request) {
        VideoSettingsUpdateRequest update = request.decodeBody(VideoSettingsUpdateRequest.class);
        if (update.getSelectedPresetId() == null && !update.hasCustomValues()) {
            throw ApiException.invalidRequest(
                    "either selected_preset_id or custom_resolution, custom_fps, custom_codec and custom_bitrate");
        }
        return HandlerCalls.bounded(camera.updateVideoSettings(update), timeout,
                        ErrorCode.VIDEO_SETTINGS_UPDATE_FAILED, "Video settings update")
                .thenReturn(HttpResult.success("Video settings updated"));
    }

    public Mono<HttpResult> downloadLogs(HttpRequest request) {
        // TODO: serve the rolling logback files once a file appender is configured
        return Mono.error(ApiException.notImplemented("Logs download not yet implemented"));
    }
}
