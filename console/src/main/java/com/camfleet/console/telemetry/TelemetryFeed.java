package com.camfleet.console.telemetry;

import com.camfleet.console.client.DeviceAddress;
import com.camfleet.console.client.IDeviceClient;
import com.camfleet.console.registry.Device;
import com.camfleet.console.registry.DeviceRegistry;
import com.camfleet.core.util.JitterBackoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps one telemetry WebSocket subscription per claimed device and attaches the latest frame to
 * the registry entry.
 * <p>
 * A lost subscription is re-established with {@link JitterBackoff}, always against the device's
 * current address and token. A re-claim that changes either restarts the subscription on the next
 * sync. Telemetry never changes a device's liveness; only the status refresh does.
 * </p>
 */
public class TelemetryFeed {
    private static final Logger log = LoggerFactory.getLogger(TelemetryFeed.class);

    private final IDeviceClient deviceClient;
    private final DeviceRegistry registry;
    private final JitterBackoff backoff;

    private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();

    public TelemetryFeed(IDeviceClient deviceClient, DeviceRegistry registry) {
        this(deviceClient, registry, JitterBackoff.TELEMETRY);
    }

    public TelemetryFeed(IDeviceClient deviceClient, DeviceRegistry registry, JitterBackoff backoff) {
        this.deviceClient = deviceClient;
        this.registry = registry;
        this.backoff = backoff;
    }

    /**
     * Periodically lines subscriptions up with the claimed set: new devices get one, unclaimed
     * devices lose theirs.
     */
    public Disposable start(Duration syncInterval) {
        return start(syncInterval, Schedulers.parallel());
    }

    public Disposable start(Duration syncInterval, Scheduler scheduler) {
        Disposable sync = Flux.interval(Duration.ZERO, syncInterval, scheduler)
                .subscribe(tick -> sync());
        return () -> {
            sync.dispose();
            stopAll();
        };
    }

    public void sync() {
        Set<String> claimed = new HashSet<>();
        for (Device device : registry.list()) {
            claimed.add(device.getId());
            DeviceAddress address = device.address();
            subscriptions.compute(device.getId(), (id, current) -> {
                if (current != null && current.address().equals(address)) {
                    return current;
                }
                if (current != null) {
                    current.handle().dispose();
                    log.info("Telemetry feed for {} restarting with new credentials", id);
                }
                return new Subscription(address, subscribe(id));
            });
        }
        subscriptions.keySet().removeIf(id -> {
            if (claimed.contains(id)) {
                return false;
            }
            subscriptions.get(id).handle().dispose();
            log.info("Telemetry feed for {} stopped", id);
            return true;
        });
    }

    public int activeCount() {
        return subscriptions.size();
    }

    public void stopAll() {
        subscriptions.values().forEach(sub -> sub.handle().dispose());
        subscriptions.clear();
    }

    private Disposable subscribe(String id) {
        AtomicLong attempts = new AtomicLong();
        log.info("Telemetry feed for {} starting", id);
        return Flux.defer(() -> registry.get(id)
                        .map(device -> deviceClient.telemetry(device.address()))
                        .orElseGet(Flux::empty))
                .doOnNext(frame -> attempts.set(0))
                // a clean close is treated like a failure so the loop reconnects
                .concatWith(Mono.error(() -> new IllegalStateException("telemetry stream closed")))
                .retryWhen(Retry.from(signals -> signals.concatMap(signal -> {
                    Duration delay = backoff.next(attempts.getAndIncrement());
                    log.debug("Telemetry feed for {} lost ({}), reconnecting in {}ms",
                            id, signal.failure().getMessage(), delay.toMillis());
                    return Mono.delay(delay);
                })))
                .subscribe(
                        frame -> registry.attachTelemetry(id, frame),
                        err -> log.error("Telemetry feed for {} terminated", id, err));
    }

    private record Subscription(DeviceAddress address, Disposable handle) {
    }
}
