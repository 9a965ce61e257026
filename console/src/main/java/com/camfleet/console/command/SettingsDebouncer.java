package com.camfleet.console.command;

import com.camfleet.console.metrics.MetricsService;
import com.camfleet.core.error.ApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Coalesces rapid settings edits per (device, command type).
 * <p>
 * Every edit restarts the window of its key and replaces the pending value. When a window elapses
 * without a newer edit, the last value is sent once. A send that has started is never cancelled;
 * a newer edit only supersedes values that have not been sent yet.
 * </p>
 */
public class SettingsDebouncer {
    private static final Logger log = LoggerFactory.getLogger(SettingsDebouncer.class);

    private final CommandOrchestrator orchestrator;
    private final MetricsService metricsService;
    private final Duration window;
    private final Scheduler scheduler;

    private final Map<Key, Pending> pending = new ConcurrentHashMap<>();

    public SettingsDebouncer(CommandOrchestrator orchestrator, MetricsService metricsService, Duration window) {
        this(orchestrator, metricsService, window, Schedulers.parallel());
    }

    public SettingsDebouncer(CommandOrchestrator orchestrator,
                             MetricsService metricsService,
                             Duration window,
                             Scheduler scheduler) {
        this.orchestrator = orchestrator;
        this.metricsService = metricsService;
        this.window = window;
        this.scheduler = scheduler;
    }

    /**
     * Records an edit. The command is sent when no newer edit for the same key arrives within the
     * window.
     *
     * @throws ApiException INVALID_REQUEST when the payload does not fit the command type
     */
    public void submit(String deviceId, CommandType type, Object payload) {
        Command command = Command.single(type, deviceId, payload);
        Key key = new Key(deviceId, type);
        pending.compute(key, (k, previous) -> {
            if (previous != null) {
                previous.timer.dispose();
                metricsService.recordCoalesced();
                log.debug("Superseded pending {} for {}", type.wireName(), deviceId);
            }
            Pending next = new Pending(command);
            next.timer = scheduler.schedule(() -> fire(k, next), window.toMillis(), TimeUnit.MILLISECONDS);
            return next;
        });
    }

    /**
     * Number of keys with an edit waiting for its window to elapse.
     */
    public int pendingCount() {
        return pending.size();
    }

    /**
     * Drops every pending edit without sending it.
     */
    public void cancelAll() {
        pending.values().forEach(p -> p.timer.dispose());
        pending.clear();
    }

    private void fire(Key key, Pending due) {
        // a newer edit replaced this one while the timer was firing
        if (!pending.remove(key, due)) {
            return;
        }
        orchestrator.execute(key.deviceId(), due.command)
                .subscribe(
                        null,
                        err -> log.warn("Debounced {} to {} failed: {}",
                                key.type().wireName(), key.deviceId(), ApiException.summarize(err)),
                        () -> log.debug("Debounced {} sent to {}", key.type().wireName(), key.deviceId()));
    }

    private record Key(String deviceId, CommandType type) {
    }

    private static final class Pending {
        final Command command;
        volatile Disposable timer;

        Pending(Command command) {
            this.command = command;
        }
    }
}
