package com.camfleet.console.metrics;

import com.camfleet.core.metrics.MetricsNames;
import com.camfleet.core.metrics.MetricsTags;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics service for the fleet console.
 */
public class MetricsService {
    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_FAILURE = "failure";

    private final MeterRegistry registry;

    private final Counter groupSuccess;
    private final Counter groupFailure;
    private final Counter debounceCoalesced;

    public MetricsService(MeterRegistry registry) {
        this.registry = registry;

        new ProcessorMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);

        groupSuccess = Counter.builder(MetricsNames.CONSOLE_GROUP_RESULTS_TOTAL)
                .tag(MetricsTags.OUTCOME, OUTCOME_SUCCESS)
                .description("Per-device entries of group operations that succeeded")
                .register(registry);

        groupFailure = Counter.builder(MetricsNames.CONSOLE_GROUP_RESULTS_TOTAL)
                .tag(MetricsTags.OUTCOME, OUTCOME_FAILURE)
                .description("Per-device entries of group operations that failed")
                .register(registry);

        debounceCoalesced = Counter.builder(MetricsNames.CONSOLE_DEBOUNCE_COALESCED_TOTAL)
                .description("Settings edits superseded inside the debounce window")
                .register(registry);
    }

    /**
     * Registers a gauge of claimed devices in the given liveness state.
     */
    public void registerDeviceGauge(String liveness, Supplier<Number> count) {
        Gauge.builder(MetricsNames.CONSOLE_DEVICES, count)
                .tag(MetricsTags.LIVENESS, liveness)
                .description("Claimed devices by liveness")
                .register(registry);
    }

    public void recordDeviceCall(String op, String outcome, Duration latency) {
        Timer.builder(MetricsNames.CONSOLE_DEVICE_CALL_LATENCY)
                .tag(MetricsTags.OP, op)
                .tag(MetricsTags.OUTCOME, outcome)
                .register(registry)
                .record(latency);
    }

    public void recordGroupResult(boolean success) {
        if (success) {
            groupSuccess.increment();
        } else {
            groupFailure.increment();
        }
    }

    public void recordCoalesced() {
        debounceCoalesced.increment();
    }

    public double coalescedCount() {
        return debounceCoalesced.count();
    }
}
