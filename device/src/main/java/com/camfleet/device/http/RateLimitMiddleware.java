package com.camfleet.device.http;

import com.camfleet.core.error.ApiException;
import com.camfleet.device.metrics.MetricsService;
import reactor.core.publisher.Mono;

import java.util.OptionalLong;
import java.util.function.Predicate;

/**
 * Applies a {@link RateLimiter} to requests whose path matches a predicate; everything else
 * passes straight through.
 */
public class RateLimitMiddleware implements Middleware {
    /**
     * Settings-mutation paths: {@code /api/v1/camera} and everything below it.
     */
    public static final Predicate<String> CAMERA_PATHS = path -> path.contains("/camera");

    private final Predicate<String> pathPredicate;
    private final RateLimiter limiter;
    private final MetricsService metricsService;

    public RateLimitMiddleware(Predicate<String> pathPredicate, RateLimiter limiter, MetricsService metricsService) {
        this.pathPredicate = pathPredicate;
        this.limiter = limiter;
        this.metricsService = metricsService;
    }

    @Override
    public Mono<HttpResult> process(HttpRequest request, RouteHandler next) {
        if (!pathPredicate.test(request.getPath())) {
            return next.handle(request);
        }
        OptionalLong waitMs = limiter.tryAcquire();
        if (waitMs.isPresent()) {
            metricsService.recordRateLimited(MetricsService.SOURCE_REST);
            return Mono.error(ApiException.rateLimited(waitMs.getAsLong()));
        }
        return next.handle(request);
    }
}
