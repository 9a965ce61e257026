package com.camfleet.device.http;

import reactor.core.publisher.Mono;

/**
 * One stage of the request pipeline. A middleware either short-circuits with its own result or
 * error, or passes the request on to {@code next}.
 */
@FunctionalInterface
public interface Middleware {
    Mono<HttpResult> process(HttpRequest request, RouteHandler next);
}
