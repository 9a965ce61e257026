package com.camfleet.device.controller;

import com.camfleet.core.error.ApiException;
import com.camfleet.core.error.ErrorCode;
import com.camfleet.core.model.AliasUpdateRequest;
import com.camfleet.core.model.CameraSettingsRequest;
import com.camfleet.core.model.ScreenBrightnessRequest;
import com.camfleet.device.camera.CameraControl;
import com.camfleet.device.http.HttpRequest;
import com.camfleet.device.http.HttpResult;
import com.camfleet.device.http.Router;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Camera settings, white balance, alias and screen brightness endpoints.
 * <p>
 * {@link #applyCameraSettings} is also the target of WebSocket {@code set} commands, so REST and
 * WebSocket mutate camera state through one path.
 * </p>
 */
public class CameraController {
    static final int MAX_ALIAS_LENGTH = 64;

    private final CameraControl camera;
    private final Duration timeout;

    public CameraController(CameraControl camera, Duration timeout) {
        this.camera = camera;
        this.timeout = timeout;
    }

    public void registerRoutes(Router router) {
        router.post("/api/v1/camera", this::updateCameraSettings)
                .post("/api/v1/camera/wb/measure", this::measureWhiteBalance)
                .put("/api/v1/settings/alias", this::updateAlias)
                .post("/api/v1/screen/brightness", this::updateScreenBrightness);
    }

    public Mono<HttpResult> updateCameraSettings(HttpRequest request) {
        CameraSettingsRequest settings = request.decodeBody(CameraSettingsRequest.class);
        return applyCameraSettings(settings).thenReturn(HttpResult.success("Camera settings updated"));
    }

    public Mono<Void> applyCameraSettings(CameraSettingsRequest settings) {
        return HandlerCalls.bounded(camera.updateCameraSettings(settings), timeout,
                ErrorCode.CAMERA_UPDATE_FAILED, "Camera update");
    }

    public Mono<HttpResult> measureWhiteBalance(HttpRequest request) {
        return HandlerCalls.bounded(camera.measureWhiteBalance(), timeout, ErrorCode.MEASURE_FAILED, "Measurement")
                .map(HttpResult::ok);
    }

    public Mono<HttpResult> updateAlias(HttpRequest request) {
        AliasUpdateRequest update = request.decodeBody(AliasUpdateRequest.class);
        String trimmed = update.getAlias() == null ? "" : update.getAlias().trim();
        if (trimmed.isEmpty() || trimmed.length() > MAX_ALIAS_LENGTH) {
            throw ApiException.invalidAlias("Alias must be 1-" + MAX_ALIAS_LENGTH + " characters");
        }
        return HandlerCalls.bounded(camera.updateAlias(trimmed), timeout, ErrorCode.ALIAS_UPDATE_FAILED, "Alias update")
                .map(HttpResult::ok);
    }

    public Mono<HttpResult> updateScreenBrightness(HttpRequest request) {
        ScreenBrightnessRequest brightness = request.decodeBody(ScreenBrightnessRequest.class);
        if (brightness.getDimmed() == null) {
            throw ApiException.invalidRequest("missing field 'dimmed'");
        }
        return HandlerCalls.bounded(camera.updateScreenBrightness(brightness.getDimmed()), timeout,
                        ErrorCode.HANDLER_FAILED, "Screen brightness update")
                .thenReturn(HttpResult.success("Screen brightness updated"));
    }
}
