package com.camfleet.device.http;

import com.camfleet.core.error.ApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Exact-match router: a route is selected only when both method and path are equal to the
 * registered ones. There are no path parameters or wildcards.
 */
public class Router {
    private static final Logger log = LoggerFactory.getLogger(Router.class);

    private final Map<String, RouteHandler> routes = new HashMap<>();
    private final MiddlewareChain middlewareChain;

    public Router(List<Middleware> middlewares) {
        this.middlewareChain = new MiddlewareChain(middlewares);
    }

    public Router register(HttpMethod method, String path, RouteHandler handler) {
        if (routes.putIfAbsent(key(method, path), handler) != null) {
            throw new IllegalStateException("Duplicate route " + method + " " + path);
        }
        return this;
    }

    public Router get(String path, RouteHandler handler) {
        return register(HttpMethod.GET, path, handler);
    }

    public Router post(String path, RouteHandler handler) {
        return register(HttpMethod.POST, path, handler);
    }

    public Router put(String path, RouteHandler handler) {
        return register(HttpMethod.PUT, path, handler);
    }

    public Router delete(String path, RouteHandler handler) {
        return register(HttpMethod.DELETE, path, handler);
    }

    /**
     * Runs the request through the middleware chain and the matching handler. Never errors:
     * every failure becomes a {@code {code, message}} result.
     */
    public Mono<HttpResult> route(HttpRequest request) {
        return middlewareChain.execute(request, this::dispatch)
                .onErrorResume(ApiException.class, e -> {
                    log.warn("{} {} -> {} {}", request.getMethod(), request.getPath(),
                            e.getErrorCode().code(), e.getMessage());
                    return Mono.just(HttpResult.error(e));
                })
                .onErrorResume(e -> {
                    log.error("Unhandled error for {} {}", request.getMethod(), request.getPath(), e);
                    return Mono.just(HttpResult.error(ApiException.internal(e)));
                });
    }

    private Mono<HttpResult> dispatch(HttpRequest request) {
        RouteHandler handler = routes.get(key(request.getMethod(), request.getPath()));
        if (handler == null) {
            return Mono.error(ApiException.notFound(
                    "Endpoint not found: " + request.getMethod() + " " + request.getPath()));
        }
        return Mono.defer(() -> handler.handle(request));
    }

    private static String key(HttpMethod method, String path) {
        return method.name() + " " + path;
    }
}
