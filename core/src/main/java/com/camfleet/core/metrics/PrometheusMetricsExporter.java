package com.camfleet.core.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prometheus metrics exporter.
 * <p>
 * Meters are registered on a composite registry; the Prometheus registry is attached to it
 * so that {@link #scrape()} renders everything in text exposition format.
 * </p>
 */
public class PrometheusMetricsExporter {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    @Getter
    private final MeterRegistry registry;
    private final PrometheusMeterRegistry prometheusRegistry;

    public PrometheusMetricsExporter(String instanceTagKey, String instanceId) {
        CompositeMeterRegistry composite = new CompositeMeterRegistry();
        this.prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        composite.add(prometheusRegistry);
        composite.config().commonTags(instanceTagKey, instanceId);
        this.registry = composite;
        log.info("Metrics exporter initialized for {}={}", instanceTagKey, instanceId);
    }

    public String scrape() {
        return prometheusRegistry.scrape();
    }
}
