package com.camfleet.console.discovery;

import com.camfleet.console.registry.DeviceRegistry;
import com.camfleet.core.discovery.ServiceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Periodic discovery of devices that are not claimed yet.
 * <p>
 * Each successful browse cycle replaces the candidate snapshot. A failed cycle is logged and the
 * previous snapshot stays until the next cycle succeeds.
 * </p>
 */
public class DiscoveryService {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryService.class);

    private final DiscoveryBrowser browser;
    private final DeviceRegistry registry;

    private final AtomicReference<List<DiscoveredCandidate>> snapshot = new AtomicReference<>(List.of());

    public DiscoveryService(DiscoveryBrowser browser, DeviceRegistry registry) {
        this.browser = browser;
        this.registry = registry;
    }

    /**
     * Runs one browse cycle and publishes its result.
     */
    public Mono<List<DiscoveredCandidate>> browseOnce() {
        return browser.browse()
                .map(records -> records.stream()
                        .filter(ServiceRecord::speaksProtocol)
                        .map(DiscoveredCandidate::from)
                        .collect(Collectors.toList()))
                .doOnNext(candidates -> {
                    snapshot.set(List.copyOf(candidates));
                    log.debug("Discovery cycle found {} devices", candidates.size());
                });
    }

    public Disposable start(Duration interval) {
        return start(interval, Schedulers.parallel());
    }

    public Disposable start(Duration interval, Scheduler scheduler) {
        log.info("Browsing for {} every {}ms", ServiceRecord.SERVICE_TYPE, interval.toMillis());
        return Flux.interval(Duration.ZERO, interval, scheduler)
                .onBackpressureDrop()
                .concatMap(tick -> browseOnce()
                        .onErrorResume(err -> {
                            log.warn("Discovery cycle failed, retrying next cycle: {}", err.toString());
                            return Mono.empty();
                        }))
                .subscribe();
    }

    /**
     * Every device of the latest cycle, claimed or not.
     */
    public List<DiscoveredCandidate> candidates() {
        return snapshot.get();
    }

    /**
     * Devices of the latest cycle whose alias does not match a claimed device.
     */
    public List<DiscoveredCandidate> newCandidates() {
        Set<String> claimed = registry.claimedAliases();
        return snapshot.get().stream()
                .filter(candidate -> !claimed.contains(candidate.getAlias()))
                .collect(Collectors.toList());
    }
}
