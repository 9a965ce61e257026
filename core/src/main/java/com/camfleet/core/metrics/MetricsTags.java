package com.camfleet.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    public static final String DEVICE_ID = "device_id";
    public static final String CONSOLE_ID = "console_id";

    public static final String STATUS = "status";

    public static final String SOURCE = "source";

    /**
     * Tag key for failure/drop reason.
     */
    public static final String REASON = "reason";

    /**
     * Tag key for the command operation tag (start-stream, stop-stream, ...).
     */
    public static final String OP = "op";

    public static final String OUTCOME = "outcome";

    public static final String LIVENESS = "liveness";
}
