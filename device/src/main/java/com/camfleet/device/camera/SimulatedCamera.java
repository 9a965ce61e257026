package com.camfleet.device.camera;

import com.camfleet.core.model.AliasUpdateResponse;
import com.camfleet.core.model.CameraSettingsRequest;
import com.camfleet.core.model.Capability;
import com.camfleet.core.model.CurrentSettings;
import com.camfleet.core.model.ExposureMode;
import com.camfleet.core.model.FocusMode;
import com.camfleet.core.model.NdiState;
import com.camfleet.core.model.StatusResponse;
import com.camfleet.core.model.StreamStartRequest;
import com.camfleet.core.model.VideoPreset;
import com.camfleet.core.model.VideoSettingsResponse;
import com.camfleet.core.model.VideoSettingsUpdateRequest;
import com.camfleet.core.model.WhiteBalanceMeasureResponse;
import com.camfleet.core.model.WhiteBalanceMode;
import com.camfleet.core.msg.TelemetryMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory camera that validates and records settings and drives a {@link StreamTransmitter}.
 * <p>
 * Format limits mirror a typical phone sensor: 720p and 1080p up to 60 fps, 2160p up to 30 fps,
 * H.264 and HEVC.
 * </p>
 */
public class SimulatedCamera implements CameraControl {
    private static final Logger log = LoggerFactory.getLogger(SimulatedCamera.class);

    static final String CUSTOM_PRESET_ID = "custom";
    static final double MAX_ZOOM = 10.0;

    private static final List<Capability> CAPABILITIES = List.of(
            new Capability("1280x720", List.of(24, 25, 30, 60), List.of("h264", "hevc"), "wide", MAX_ZOOM),
            new Capability("1920x1080", List.of(24, 25, 30, 60), List.of("h264", "hevc"), "wide", MAX_ZOOM),
            new Capability("3840x2160", List.of(24, 25, 30), List.of("h264", "hevc"), "wide", MAX_ZOOM)
    );

    private static final List<VideoPreset> PRESETS = List.of(
            new VideoPreset("720p30", "720p 30fps", "1280x720", 30, "h264", 4_000_000),
            new VideoPreset("1080p30", "1080p 30fps", "1920x1080", 30, "h264", 10_000_000),
            new VideoPreset("1080p60", "1080p 60fps", "1920x1080", 60, "h264", 16_000_000),
            new VideoPreset("2160p30", "4K 30fps", "3840x2160", 30, "hevc", 30_000_000)
    );

    private final StreamTransmitter transmitter;
    private final AtomicReference<String> alias;
    private final AtomicReference<CurrentSettings> current;
    private final AtomicReference<VideoPreset> selectedVideo;
    private volatile boolean screenDimmed;

    public SimulatedCamera(String alias, StreamTransmitter transmitter) {
        this.transmitter = transmitter;
        this.alias = new AtomicReference<>(alias);
        VideoPreset initial = PRESETS.get(1);
        this.selectedVideo = new AtomicReference<>(initial);
        this.current = new AtomicReference<>(CurrentSettings.builder()
                .resolution(initial.getResolution())
                .fps(initial.getFps())
                .bitrate(initial.getBitrate())
                .codec(initial.getCodec())
                .wbMode(WhiteBalanceMode.AUTO)
                .isoMode(ExposureMode.AUTO)
                .iso(100)
                .shutterMode(ExposureMode.AUTO)
                .shutterS(1.0 / 60)
                .focusMode(FocusMode.AUTO)
                .zoomFactor(1.0)
                .lens("wide")
                .cameraPosition("back")
                .build());
    }

    @Override
    public Mono<StatusResponse> getStatus() {
        return Mono.fromCallable(() -> StatusResponse.builder()
                .alias(alias.get())
                .ndiState(ndiState())
                .current(current.get())
                .telemetry(transmitter.currentTelemetry())
                .capabilities(CAPABILITIES)
                .build());
    }

    @Override
    public Mono<List<Capability>> getCapabilities() {
        return Mono.just(CAPABILITIES);
    }

    @Override
    public Mono<VideoSettingsResponse> getVideoSettings() {
        return Mono.fromCallable(() -> {
            VideoPreset selected = selectedVideo.get();
            VideoSettingsResponse.VideoSettingsResponseBuilder builder = VideoSettingsResponse.builder()
                    .selectedPresetId(selected.getId())
                    .availablePresets(PRESETS);
            if (CUSTOM_PRESET_ID.equals(selected.getId())) {
                builder.customResolution(selected.getResolution())
                        .customFps(selected.getFps())
                        .customCodec(selected.getCodec())
                        .customBitrate(selected.getBitrate());
            }
            return builder.build();
        });
    }

    @Override
    public Mono<Void> updateVideoSettings(VideoSettingsUpdateRequest request) {
        return Mono.fromCallable(() -> resolveVideo(request))
                .flatMap(video -> {
                    selectedVideo.set(video);
                    current.updateAndGet(c -> c.toBuilder()
                            .resolution(video.getResolution())
                            .fps(video.getFps())
                            .bitrate(video.getBitrate())
                            .codec(video.getCodec())
                            .build());
                    log.info("Video settings set to {}", video.getId());
                    if (!transmitter.isActive()) {
                        return Mono.empty();
                    }
                    return transmitter.updateSettings(toTransmitterConfig(video.getResolution(), video.getFps(),
                            video.getBitrate(), video.getCodec()));
                });
    }

    @Override
    public Mono<Void> startStream(StreamStartRequest request) {
        return Mono.fromCallable(() -> {
                    checkFormat(request.getResolution(), request.getFramerate(), request.getCodec());
                    return toTransmitterConfig(request.getResolution(), request.getFramerate(),
                            request.getBitrate(), request.getCodec());
                })
                .flatMap(config -> transmitter.start(config)
                        .then(Mono.fromRunnable(() -> current.updateAndGet(c -> c.toBuilder()
                                .resolution(config.getResolution())
                                .fps(config.getFps())
                                .bitrate(config.getBitrate())
                                .codec(config.getCodec())
                                .build()))));
    }

    @Override
    public Mono<Void> stopStream() {
        return transmitter.stop();
    }

    @Override
    public Mono<Void> updateCameraSettings(CameraSettingsRequest request) {
        return Mono.fromRunnable(() -> {
            validate(request);
            CurrentSettings updated = current.updateAndGet(c -> merge(c, request));
            log.debug("Camera settings now wb={} iso={} shutter={} zoom={}", updated.getWbMode(),
                    updated.getIso(), updated.getShutterS(), updated.getZoomFactor());
        });
    }

    @Override
    public Mono<Void> forceKeyframe() {
        return transmitter.forceKeyframe();
    }

    @Override
    public Mono<Void> updateScreenBrightness(boolean dimmed) {
        return Mono.fromRunnable(() -> {
            screenDimmed = dimmed;
            log.info("Screen {}", dimmed ? "dimmed" : "restored");
        });
    }

    @Override
    public Mono<WhiteBalanceMeasureResponse> measureWhiteBalance() {
        return Mono.fromCallable(() -> {
            ThreadLocalRandom random = ThreadLocalRandom.current();
            CurrentSettings settings = current.get();
            int cct = settings.getWbMode() == WhiteBalanceMode.MANUAL && settings.getWbKelvin() != null
                    ? settings.getWbKelvin()
                    : 5200 + random.nextInt(800);
            double tint = Math.round(random.nextDouble(-5, 5) * 10) / 10.0;
            return new WhiteBalanceMeasureResponse(cct, tint);
        });
    }

    @Override
    public Mono<AliasUpdateResponse> updateAlias(String newAlias) {
        return Mono.fromCallable(() -> {
            String trimmed = newAlias.trim();
            String previous = alias.getAndSet(trimmed);
            log.info("Alias changed from '{}' to '{}'", previous, trimmed);
            return new AliasUpdateResponse(trimmed);
        });
    }

    @Override
    public Mono<TelemetryMessage> currentTelemetry() {
        return Mono.fromCallable(() -> TelemetryMessage.from(transmitter.currentTelemetry(), ndiState()));
    }

    public String getAlias() {
        return alias.get();
    }

    public boolean isScreenDimmed() {
        return screenDimmed;
    }

    private NdiState ndiState() {
        return transmitter.isActive() ? NdiState.STREAMING : NdiState.IDLE;
    }

    private TransmitterConfig toTransmitterConfig(String resolution, int fps, int bitrate, String codec) {
        return TransmitterConfig.builder()
                .sourceName(alias.get())
                .resolution(resolution)
                .fps(fps)
                .bitrate(bitrate)
                .codec(codec)
                .build();
    }

    private static VideoPreset resolveVideo(VideoSettingsUpdateRequest request) {
        String presetId = request.getSelectedPresetId();
        if (presetId != null && !CUSTOM_PRESET_ID.equals(presetId)) {
            return findPreset(presetId)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown preset: " + presetId));
        }
        if (!request.hasCustomValues()) {
            throw new IllegalArgumentException("Custom settings require resolution, fps, codec and bitrate");
        }
        checkFormat(request.getCustomResolution(), request.getCustomFps(), request.getCustomCodec());
        return new VideoPreset(CUSTOM_PRESET_ID, "Custom", request.getCustomResolution(),
                request.getCustomFps(), request.getCustomCodec(), request.getCustomBitrate());
    }

    private static Optional<VideoPreset> findPreset(String id) {
        return PRESETS.stream().filter(p -> p.getId().equals(id)).findFirst();
    }

    private static void checkFormat(String resolution, int fps, String codec) {
        Capability capability = CAPABILITIES.stream()
                .filter(c -> c.getResolution().equals(resolution))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported resolution " + resolution));
        if (!capability.getFps().contains(fps)) {
            throw new IllegalArgumentException(fps + " fps is not supported at " + resolution);
        }
        if (!capability.getCodec().contains(codec)) {
            throw new IllegalArgumentException("Unsupported codec " + codec);
        }
    }

    private static void validate(CameraSettingsRequest r) {
        if (r.getWbKelvin() != null && (r.getWbKelvin() < 2000 || r.getWbKelvin() > 10000)) {
            throw new IllegalArgumentException("wb_kelvin must be between 2000 and 10000");
        }
        if (r.getWbTint() != null && Math.abs(r.getWbTint()) > 150) {
            throw new IllegalArgumentException("wb_tint must be between -150 and 150");
        }
        if (r.getIso() != null && (r.getIso() < 25 || r.getIso() > 6400)) {
            throw new IllegalArgumentException("iso must be between 25 and 6400");
        }
        if (r.getShutterS() != null && (r.getShutterS() <= 0 || r.getShutterS() > 1)) {
            throw new IllegalArgumentException("shutter_s must be in (0, 1]");
        }
        if (r.getZoomFactor() != null && (r.getZoomFactor() < 1.0 || r.getZoomFactor() > MAX_ZOOM)) {
            throw new IllegalArgumentException("zoom_factor must be between 1 and " + MAX_ZOOM);
        }
    }

    private static CurrentSettings merge(CurrentSettings c, CameraSettingsRequest r) {
        CurrentSettings.CurrentSettingsBuilder b = c.toBuilder();
        if (r.getWbMode() != null) {
            b.wbMode(r.getWbMode());
        }
        if (r.getWbKelvin() != null) {
            b.wbKelvin(r.getWbKelvin());
        }
        if (r.getWbTint() != null) {
            b.wbTint(r.getWbTint());
        }
        if (r.getIsoMode() != null) {
            b.isoMode(r.getIsoMode());
        }
        if (r.getIso() != null) {
            b.iso(r.getIso());
        }
        if (r.getShutterMode() != null) {
            b.shutterMode(r.getShutterMode());
        }
        if (r.getShutterS() != null) {
            b.shutterS(r.getShutterS());
        }
        if (r.getFocusMode() != null) {
            b.focusMode(r.getFocusMode());
        }
        if (r.getZoomFactor() != null) {
            b.zoomFactor(r.getZoomFactor());
        }
        if (r.getLens() != null) {
            b.lens(r.getLens());
        }
        if (r.getCameraPosition() != null) {
            b.cameraPosition(r.getCameraPosition());
        }
        return b.build();
    }
}
