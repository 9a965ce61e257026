package com.camfleet.device.http;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Runs middlewares in registration order, then the final handler.
 */
public class MiddlewareChain {
    private final List<Middleware> middlewares;

    public MiddlewareChain(List<Middleware> middlewares) {
        this.middlewares = List.copyOf(middlewares);
    }

    public Mono<HttpResult> execute(HttpRequest request, RouteHandler finalHandler) {
        return next(0, finalHandler).handle(request);
    }

    private RouteHandler next(int index, RouteHandler finalHandler) {
        if (index >= middlewares.size()) {
            return finalHandler;
        }
        Middleware middleware = middlewares.get(index);
        // Mono.defer keeps a middleware that throws synchronously inside the reactive error path
        return request -> Mono.defer(() -> middleware.process(request, next(index + 1, finalHandler)));
    }
}
