package com.camfleet.device.http;

import reactor.core.publisher.Mono;

@FunctionalInterface
public interface RouteHandler {
    /**
     * Handles a request. Failures are signalled as {@link com.camfleet.core.error.ApiException}
     * error signals and turned into {@code {code, message}} bodies by the {@link Router}.
     */
    Mono<HttpResult> handle(HttpRequest request);
}
