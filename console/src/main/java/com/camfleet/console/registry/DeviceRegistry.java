package com.camfleet.console.registry;

import com.camfleet.console.client.DeviceAddress;
import com.camfleet.console.client.IDeviceClient;
import com.camfleet.console.metrics.MetricsService;
import com.camfleet.console.store.DevicesDocument;
import com.camfleet.console.store.JsonFileStore;
import com.camfleet.core.error.ApiException;
import com.camfleet.core.error.ErrorCode;
import com.camfleet.core.model.CameraSettingsRequest;
import com.camfleet.core.model.StatusResponse;
import com.camfleet.core.model.StreamStartRequest;
import com.camfleet.core.msg.TelemetryMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Claimed devices, keyed by {@code host:port}.
 * <p>
 * The registry is the only owner of {@link Device} snapshots. Claiming needs a live status answer;
 * the periodic refresh always asks the device again and never serves a cached status. Failed
 * refreshes degrade liveness ({@code online → stale → offline}) but never remove a device; only
 * {@link #unclaim(String)} does.
 * </p>
 * <p>
 * Every mutation of persisted fields (alias, token, last stream and camera settings) rewrites
 * {@code devices.json}.
 * </p>
 */
public class DeviceRegistry {
    private static final Logger log = LoggerFactory.getLogger(DeviceRegistry.class);

    private final IDeviceClient deviceClient;
    private final JsonFileStore<DevicesDocument> store;
    private final int offlineAfterFailures;
    private final Clock clock;

    private final Map<String, Device> devices = new ConcurrentHashMap<>();

    public DeviceRegistry(IDeviceClient deviceClient,
                          JsonFileStore<DevicesDocument> store,
                          int offlineAfterFailures,
                          MetricsService metricsService) {
        this(deviceClient, store, offlineAfterFailures, metricsService, Clock.systemUTC());
    }

    public DeviceRegistry(IDeviceClient deviceClient,
                          JsonFileStore<DevicesDocument> store,
                          int offlineAfterFailures,
                          MetricsService metricsService,
                          Clock clock) {
        this.deviceClient = deviceClient;
        this.store = store;
        this.offlineAfterFailures = Math.max(1, offlineAfterFailures);
        this.clock = clock;

        for (Liveness liveness : Liveness.values()) {
            metricsService.registerDeviceGauge(liveness.wireName(), () -> count(liveness));
        }
    }

    /**
     * Loads previously claimed devices from disk. Every loaded device starts offline.
     */
    public void load() {
        DevicesDocument document = store.load();
        if (document.getDevices() == null) {
            return;
        }
        for (DeviceRecord record : document.getDevices()) {
            if (record.getId() == null || record.getHost() == null) {
                log.warn("Skipping malformed device record {}", record);
                continue;
            }
            devices.put(record.getId(), Device.fromRecord(record));
        }
        log.info("Loaded {} claimed devices", devices.size());
    }

    /**
     * Claims the device at the given address after a live status query succeeds.
     * The alias is taken from the device. Claiming an already claimed address updates its token.
     */
    public Mono<Device> claim(String host, int port, String token) {
        DeviceAddress address = new DeviceAddress(host, port, token != null ? token : "");
        return deviceClient.getStatus(address)
                .onErrorMap(err -> !(err instanceof ApiException),
                        err -> ApiException.upstream(ErrorCode.HANDLER_FAILED, "Failed to connect to camera", err))
                .map(status -> {
                    Device claimed = devices.compute(address.id(), (id, existing) -> {
                        Device base = existing != null
                                ? existing
                                : Device.builder().id(id).host(host).port(port).build();
                        return onlineWith(base.withToken(address.getToken()), status);
                    });
                    log.info("Claimed device {} ({})", claimed.getId(), claimed.getAlias());
                    persist();
                    return claimed;
                });
    }

    /**
     * Removes a claimed device.
     *
     * @throws ApiException NOT_FOUND when the id is not claimed
     */
    public Device unclaim(String id) {
        Device removed = devices.remove(id);
        if (removed == null) {
            throw new ApiException(ErrorCode.NOT_FOUND, "Camera not found: " + id);
        }
        log.info("Unclaimed device {}", id);
        persist();
        return removed;
    }

    /**
     * Renames a device locally. The device itself keeps its advertised alias.
     */
    public Device rename(String id, String alias) {
        if (alias == null || alias.isBlank() || alias.trim().length() > 64) {
            throw ApiException.invalidAlias("Alias must be 1-64 characters");
        }
        Device renamed = update(id, device -> device.withAlias(alias.trim()));
        persist();
        return renamed;
    }

    public Optional<Device> get(String id) {
        return Optional.ofNullable(devices.get(id));
    }

    /**
     * @throws ApiException NOT_FOUND when the id is not claimed
     */
    public Device require(String id) {
        return get(id).orElseThrow(() -> new ApiException(ErrorCode.NOT_FOUND, "Camera not found: " + id));
    }

    public List<Device> list() {
        List<Device> snapshot = new ArrayList<>(devices.values());
        snapshot.sort(Comparator.comparing(Device::getId));
        return snapshot;
    }

    public Set<String> claimedAliases() {
        return devices.values().stream()
                .map(Device::getAlias)
                .filter(alias -> alias != null)
                .collect(Collectors.toSet());
    }

    /**
     * Queries the device for live status and updates its liveness. Never fails: a failed query
     * is folded into the liveness state and the previous status is kept.
     */
    public Mono<Device> refresh(String id) {
        Device device = devices.get(id);
        if (device == null) {
            return Mono.empty();
        }
        return deviceClient.getStatus(device.address())
                .map(status -> update(id, current -> onlineWith(current, status)))
                .onErrorResume(err -> {
                    Device failed = update(id, this::withFailure);
                    log.warn("Refresh of {} failed ({} in a row, now {}): {}",
                            id, failed.getConsecutiveFailures(), failed.getLiveness().wireName(),
                            ApiException.summarize(err));
                    return Mono.just(failed);
                })
                // unclaimed while the query was in flight
                .onErrorResume(ApiException.class, err -> Mono.empty());
    }

    public Mono<List<Device>> refreshAll() {
        return Flux.fromIterable(new ArrayList<>(devices.keySet()))
                .flatMap(this::refresh)
                .collectList();
    }

    /**
     * Starts the periodic refresh of every claimed device.
     */
    public Disposable startRefreshing(Duration interval) {
        return startRefreshing(interval, Schedulers.parallel());
    }

    public Disposable startRefreshing(Duration interval, Scheduler scheduler) {
        log.info("Refreshing claimed devices every {}ms", interval.toMillis());
        return Flux.interval(Duration.ZERO, interval, scheduler)
                .onBackpressureDrop()
                .concatMap(tick -> refreshAll()
                        .onErrorResume(err -> {
                            log.error("Refresh cycle failed", err);
                            return Mono.empty();
                        }))
                .subscribe();
    }

    public void rememberStream(String id, StreamStartRequest stream) {
        update(id, device -> device.withLastStream(stream));
        persist();
    }

    /**
     * Merges the given camera settings into the last-used ones; fields left null keep their value.
     */
    public void rememberCamera(String id, CameraSettingsRequest camera) {
        update(id, device -> device.withLastCamera(merge(device.getLastCamera(), camera)));
        persist();
    }

    /**
     * Attaches the latest telemetry frame. Liveness is not touched.
     */
    public void attachTelemetry(String id, TelemetryMessage telemetry) {
        devices.computeIfPresent(id, (key, device) -> device.withTelemetry(telemetry));
    }

    /**
     * Forgets every claimed device and resets {@code devices.json}.
     */
    public void deleteAll() {
        devices.clear();
        persist();
        log.info("Deleted all claimed devices");
    }

    public int size() {
        return devices.size();
    }

    private Device update(String id, UnaryOperator<Device> change) {
        Device updated = devices.computeIfPresent(id, (key, device) -> change.apply(device));
        if (updated == null) {
            throw new ApiException(ErrorCode.NOT_FOUND, "Camera not found: " + id);
        }
        return updated;
    }

    private Device onlineWith(Device device, StatusResponse status) {
        return device.toBuilder()
                .alias(device.getAlias() != null ? device.getAlias() : status.getAlias())
                .status(status)
                .liveness(Liveness.ONLINE)
                .consecutiveFailures(0)
                .lastSeen(clock.instant())
                .build();
    }

    private Device withFailure(Device device) {
        int failures = device.getConsecutiveFailures() + 1;
        Liveness liveness = failures >= offlineAfterFailures ? Liveness.OFFLINE : Liveness.STALE;
        return device.toBuilder()
                .consecutiveFailures(failures)
                .liveness(liveness)
                .build();
    }

    private long count(Liveness liveness) {
        return devices.values().stream().filter(d -> d.getLiveness() == liveness).count();
    }

    private void persist() {
        List<DeviceRecord> records = list().stream().map(Device::toRecord).collect(Collectors.toList());
        try {
            store.save(new DevicesDocument(records));
        } catch (UncheckedIOException e) {
            log.error("Failed to persist claimed devices to {}", store.getFile(), e);
        }
    }

    static CameraSettingsRequest merge(CameraSettingsRequest previous, CameraSettingsRequest next) {
        if (previous == null) {
            return next;
        }
        if (next == null) {
            return previous;
        }
        return previous.toBuilder()
                .wbMode(next.getWbMode() != null ? next.getWbMode() : previous.getWbMode())
                .wbKelvin(next.getWbKelvin() != null ? next.getWbKelvin() : previous.getWbKelvin())
                .wbTint(next.getWbTint() != null ? next.getWbTint() : previous.getWbTint())
                .isoMode(next.getIsoMode() != null ? next.getIsoMode() : previous.getIsoMode())
                .iso(next.getIso() != null ? next.getIso() : previous.getIso())
                .shutterMode(next.getShutterMode() != null ? next.getShutterMode() : previous.getShutterMode())
                .shutterS(next.getShutterS() != null ? next.getShutterS() : previous.getShutterS())
                .focusMode(next.getFocusMode() != null ? next.getFocusMode() : previous.getFocusMode())
                .zoomFactor(next.getZoomFactor() != null ? next.getZoomFactor() : previous.getZoomFactor())
                .lens(next.getLens() != null ? next.getLens() : previous.getLens())
                .cameraPosition(next.getCameraPosition() != null
                        ? next.getCameraPosition() : previous.getCameraPosition())
                .orientationLock(next.getOrientationLock() != null
                        ? next.getOrientationLock() : previous.getOrientationLock())
                .build();
    }
}
